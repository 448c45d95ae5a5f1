package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;

/**
 * Outcome of an optimal chain search. When no candidate clears the savings thresholds the
 * baseline chain is returned with zero savings.
 */
public record OptimalChain(
    long chainId,
    BigDecimal expectedSavingsUsd,
    CostBreakdown baseline,
    CostBreakdown selected,
    OptimizationOutcome outcome) {

  public boolean optimized() {
    return outcome == OptimizationOutcome.OPTIMIZED;
  }
}
