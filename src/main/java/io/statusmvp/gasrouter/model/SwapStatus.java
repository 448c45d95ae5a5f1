package io.statusmvp.gasrouter.model;

public enum SwapStatus {
  INITIATED,
  BRIDGING,
  SWAPPING,
  BRIDGING_BACK,
  COMPLETED,
  FAILED,
  RECOVERED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == RECOVERED;
  }
}
