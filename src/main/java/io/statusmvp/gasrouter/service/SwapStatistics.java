package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.model.SwapStats;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Global and per-destination-chain counters, updated once per committed transition. */
@Component
public class SwapStatistics {
  private final Counters global = new Counters();
  private final Map<Long, Counters> byChain = new ConcurrentHashMap<>();

  public void initiated(long destinationChainId) {
    global.initiated();
    chain(destinationChainId).initiated();
  }

  public void completed(long destinationChainId, long executionTimeSeconds, BigDecimal savingsUsd) {
    global.completed(executionTimeSeconds, savingsUsd);
    chain(destinationChainId).completed(executionTimeSeconds, savingsUsd);
  }

  public void failed(long destinationChainId) {
    global.failed();
    chain(destinationChainId).failed();
  }

  public void recovered(long destinationChainId) {
    global.recovered();
    chain(destinationChainId).recovered();
  }

  public SwapStats global() {
    return global.snapshot();
  }

  public SwapStats forChain(long chainId) {
    Counters c = byChain.get(chainId);
    return c == null ? SwapStats.empty() : c.snapshot();
  }

  private Counters chain(long chainId) {
    return byChain.computeIfAbsent(chainId, id -> new Counters());
  }

  private static final class Counters {
    private long total;
    private long successful;
    private long failed;
    private long recovered;
    private long totalExecutionSeconds;
    private BigDecimal totalSavingsUsd = BigDecimal.ZERO;

    synchronized void initiated() {
      total++;
    }

    synchronized void completed(long executionTimeSeconds, BigDecimal savingsUsd) {
      successful++;
      totalExecutionSeconds += Math.max(0, executionTimeSeconds);
      if (savingsUsd != null) totalSavingsUsd = totalSavingsUsd.add(savingsUsd);
    }

    synchronized void failed() {
      failed++;
    }

    synchronized void recovered() {
      recovered++;
    }

    synchronized SwapStats snapshot() {
      long avg = successful == 0 ? 0 : totalExecutionSeconds / successful;
      return new SwapStats(total, successful, failed, recovered, avg, totalSavingsUsd);
    }
  }
}
