package io.statusmvp.gasrouter.model;

import java.math.BigDecimal;
import java.util.Set;

/** Per-user overrides; null fields fall back to the global settings. */
public record UserPreferences(
    String user,
    Integer minSavingsBps,
    BigDecimal minAbsoluteSavingsUsd,
    Long maxBridgeTimeSeconds,
    Boolean optimizationEnabled,
    Set<Long> excludedChainIds) {

  public static UserPreferences defaults(String user) {
    return new UserPreferences(user, null, null, null, null, Set.of());
  }

  public boolean allowsOptimization() {
    return optimizationEnabled == null || optimizationEnabled;
  }

  public Set<Long> excludedChainIdsOrEmpty() {
    return excludedChainIds == null ? Set.of() : excludedChainIds;
  }
}
