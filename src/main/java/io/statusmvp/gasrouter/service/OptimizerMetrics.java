package io.statusmvp.gasrouter.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.statusmvp.gasrouter.model.SwapStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class OptimizerMetrics {
  private final MeterRegistry meterRegistry;
  private final boolean enabled;

  public OptimizerMetrics(
      MeterRegistry meterRegistry, @Value("${app.metrics.enabled:true}") boolean enabled) {
    this.meterRegistry = meterRegistry;
    this.enabled = enabled;
  }

  public void quote(boolean shouldOptimize, String reason) {
    if (!enabled) return;
    meterRegistry
        .counter("optimizer.quote", "optimize", String.valueOf(shouldOptimize), "reason", reason)
        .increment();
  }

  public void gasPriceUpdated(long chainId) {
    if (!enabled) return;
    meterRegistry.counter("optimizer.gas.update", "chain", String.valueOf(chainId)).increment();
  }

  public void stalePrice(long chainId) {
    if (!enabled) return;
    meterRegistry.counter("optimizer.gas.stale", "chain", String.valueOf(chainId)).increment();
  }

  public void transition(SwapStatus to) {
    if (!enabled) return;
    meterRegistry.counter("optimizer.swap.transition", "to", to.name()).increment();
  }

  public void bridgeFailure(String operation, String reason) {
    if (!enabled) return;
    meterRegistry
        .counter("optimizer.bridge.failure", "operation", operation, "reason", reason)
        .increment();
  }
}
