package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.auth.AccessControl;
import io.statusmvp.gasrouter.auth.Caller;
import io.statusmvp.gasrouter.config.OptimizerProperties;
import io.statusmvp.gasrouter.error.OptimizerErrorCode;
import io.statusmvp.gasrouter.error.OptimizerException;
import io.statusmvp.gasrouter.model.OptimizerSettings;
import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Global thresholds, bridge fee schedule and the pause switch. Readers take one snapshot per
 * evaluation so a concurrent admin change applies to the next evaluation only.
 */
@Service
public class OptimizerSettingsService {
  private static final Logger log = LoggerFactory.getLogger(OptimizerSettingsService.class);

  private final AtomicReference<OptimizerSettings> current;
  private final AccessControl access;

  public OptimizerSettingsService(OptimizerProperties properties, AccessControl access) {
    this.access = access;
    OptimizerProperties.Thresholds t = properties.getThresholds();
    OptimizerProperties.BridgeFee f = properties.getBridgeFee();
    this.current =
        new AtomicReference<>(
            new OptimizerSettings(
                t.getMinSavingsBps(),
                t.getMinAbsoluteSavingsUsd(),
                t.getMaxBridgeTimeSeconds(),
                f.getBaseFeeUsd(),
                f.getFeeBps(),
                false));
  }

  public OptimizerSettings snapshot() {
    return current.get();
  }

  public boolean isPaused() {
    return current.get().paused();
  }

  public OptimizerSettings updateThresholds(
      Caller caller, int minSavingsBps, BigDecimal minAbsoluteSavingsUsd, long maxBridgeTimeSeconds) {
    access.requireAdmin(caller);
    if (minSavingsBps < 0 || minSavingsBps > 10_000) {
      throw invalid("minSavingsBps must be within [0, 10000]");
    }
    if (minAbsoluteSavingsUsd == null || minAbsoluteSavingsUsd.signum() < 0) {
      throw invalid("minAbsoluteSavingsUsd must not be negative");
    }
    if (maxBridgeTimeSeconds <= 0) throw invalid("maxBridgeTimeSeconds must be positive");
    OptimizerSettings updated =
        current.updateAndGet(
            s -> s.withThresholds(minSavingsBps, minAbsoluteSavingsUsd, maxBridgeTimeSeconds));
    log.info(
        "thresholds updated by {}: minSavingsBps={} minAbsoluteSavingsUsd={} maxBridgeTimeSeconds={}",
        caller.id(),
        minSavingsBps,
        minAbsoluteSavingsUsd,
        maxBridgeTimeSeconds);
    return updated;
  }

  public OptimizerSettings updateBridgeFee(Caller caller, BigDecimal baseFeeUsd, int feeBps) {
    access.requireAdmin(caller);
    if (baseFeeUsd == null || baseFeeUsd.signum() < 0) throw invalid("baseFeeUsd must not be negative");
    if (feeBps < 0 || feeBps > 10_000) throw invalid("feeBps must be within [0, 10000]");
    OptimizerSettings updated = current.updateAndGet(s -> s.withBridgeFee(baseFeeUsd, feeBps));
    log.info("bridge fee schedule updated by {}: base={} bps={}", caller.id(), baseFeeUsd, feeBps);
    return updated;
  }

  public OptimizerSettings setPaused(Caller caller, boolean paused) {
    access.requireAdmin(caller);
    OptimizerSettings updated = current.updateAndGet(s -> s.withPaused(paused));
    log.info("operations {} by {}", paused ? "paused" : "unpaused", caller.id());
    return updated;
  }

  private static OptimizerException invalid(String message) {
    return new OptimizerException(OptimizerErrorCode.INVALID_ARGUMENT, message);
  }
}
