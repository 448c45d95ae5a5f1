package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;
import java.util.Set;

/** Dual savings bar plus the candidate filters applied by the optimal chain search. */
public record SavingsCriteria(
    int minSavingsBps,
    BigDecimal minAbsoluteSavingsUsd,
    long maxBridgeTimeSeconds,
    Set<Long> excludedChainIds) {

  public boolean excludes(long chainId) {
    return excludedChainIds != null && excludedChainIds.contains(chainId);
  }
}
