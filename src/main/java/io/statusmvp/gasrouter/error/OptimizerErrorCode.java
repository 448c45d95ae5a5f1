package io.statusmvp.gasrouter.error;

public enum OptimizerErrorCode {
  UNKNOWN_CHAIN(ErrorCategory.VALIDATION, 400),
  INVALID_DESTINATION_CHAIN(ErrorCategory.VALIDATION, 400),
  GAS_PRICE_OUT_OF_BOUNDS(ErrorCategory.VALIDATION, 400),
  INVALID_USER(ErrorCategory.VALIDATION, 400),
  INVALID_AMOUNT(ErrorCategory.VALIDATION, 400),
  DEADLINE_EXPIRED(ErrorCategory.VALIDATION, 400),
  INVALID_ARGUMENT(ErrorCategory.VALIDATION, 400),
  OPERATIONS_PAUSED(ErrorCategory.VALIDATION, 503),
  STALE_PRICE(ErrorCategory.STALENESS, 503),
  PRICE_FEED_UNAVAILABLE(ErrorCategory.STALENESS, 503),
  INVALID_STATE_TRANSITION(ErrorCategory.STATE_MACHINE, 409),
  SWAP_NOT_ACTIVE(ErrorCategory.STATE_MACHINE, 409),
  DUPLICATE_SWAP(ErrorCategory.STATE_MACHINE, 409),
  RECOVERY_TIMEOUT_NOT_REACHED(ErrorCategory.STATE_MACHINE, 409),
  SWAP_NOT_FOUND(ErrorCategory.NOT_FOUND, 404),
  UNAUTHORIZED(ErrorCategory.AUTHORIZATION, 403),
  UNAUTHENTICATED(ErrorCategory.AUTHORIZATION, 401),
  BRIDGE_FAILURE(ErrorCategory.EXTERNAL, 502);

  private final ErrorCategory category;
  private final int httpStatus;

  OptimizerErrorCode(ErrorCategory category, int httpStatus) {
    this.category = category;
    this.httpStatus = httpStatus;
  }

  public ErrorCategory category() {
    return category;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
