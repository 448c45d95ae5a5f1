package io.statusmvp.gasrouter.client;

public class BridgeException extends RuntimeException {
  public enum Reason {
    UNSUPPORTED_CHAIN,
    AMOUNT_OUT_OF_BOUNDS,
    TRANSPORT
  }

  private final Reason reason;

  public BridgeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public BridgeException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
