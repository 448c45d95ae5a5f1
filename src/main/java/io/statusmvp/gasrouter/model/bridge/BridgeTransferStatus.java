package io.statusmvp.gasrouter.model.bridge;

import java.math.BigInteger;

public record BridgeTransferStatus(boolean completed, boolean failed, BigInteger filledAmount) {

  public boolean pending() {
    return !completed && !failed;
  }
}
