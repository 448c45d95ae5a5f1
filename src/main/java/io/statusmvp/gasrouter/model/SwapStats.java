package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

public record SwapStats(
    long totalSwaps,
    long successfulSwaps,
    long failedSwaps,
    long recoveredSwaps,
    long averageExecutionTimeSeconds,
    BigDecimal totalSavingsUsd) {

  public static SwapStats empty() {
    return new SwapStats(0, 0, 0, 0, 0, BigDecimal.ZERO);
  }
}
