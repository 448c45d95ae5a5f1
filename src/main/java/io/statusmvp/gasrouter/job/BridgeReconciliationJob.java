package io.statusmvp.gasrouter.job;

import io.statusmvp.gasrouter.service.SwapOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.jobs.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeReconciliationJob {
  private static final Logger log = LoggerFactory.getLogger(BridgeReconciliationJob.class);

  private final SwapOrchestrator orchestrator;

  public BridgeReconciliationJob(SwapOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Scheduled(
      fixedDelayString = "${app.jobs.reconcileMs:60000}",
      initialDelayString = "${app.jobs.initialDelayMs:5000}")
  public void runScheduled() {
    int changed = orchestrator.reconcileActive();
    if (changed > 0) log.info("bridge reconciliation advanced {} swap(s)", changed);
  }
}
