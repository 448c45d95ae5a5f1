package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

/** Admin-controlled global thresholds, bridge fee schedule and pause switch. */
public record OptimizerSettings(
    int minSavingsBps,
    BigDecimal minAbsoluteSavingsUsd,
    long maxBridgeTimeSeconds,
    BigDecimal baseBridgeFeeUsd,
    int bridgeFeeBps,
    boolean paused) {

  public OptimizerSettings withThresholds(
      int savingsBps, BigDecimal absoluteSavingsUsd, long bridgeTimeSeconds) {
    return new OptimizerSettings(
        savingsBps, absoluteSavingsUsd, bridgeTimeSeconds, baseBridgeFeeUsd, bridgeFeeBps, paused);
  }

  public OptimizerSettings withBridgeFee(BigDecimal baseFeeUsd, int feeBps) {
    return new OptimizerSettings(
        minSavingsBps, minAbsoluteSavingsUsd, maxBridgeTimeSeconds, baseFeeUsd, feeBps, paused);
  }

  public OptimizerSettings withPaused(boolean value) {
    return new OptimizerSettings(
        minSavingsBps,
        minAbsoluteSavingsUsd,
        maxBridgeTimeSeconds,
        baseBridgeFeeUsd,
        bridgeFeeBps,
        value);
  }
}
