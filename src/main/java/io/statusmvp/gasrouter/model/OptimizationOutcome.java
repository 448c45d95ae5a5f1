package io.statusmvp.gasrouter.model;

public enum OptimizationOutcome {
  OPTIMIZED,
  BELOW_THRESHOLD,
  NO_CHEAPER_CHAIN
}
