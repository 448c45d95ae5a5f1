package io.statusmvp.gasrouter.error;

import java.util.Map;

public class OptimizerException extends RuntimeException {
  private final OptimizerErrorCode code;
  private final Map<String, Object> details;

  public OptimizerException(OptimizerErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public OptimizerException(OptimizerErrorCode code, String message, Map<String, Object> details) {
    this(code, message, details, null);
  }

  public OptimizerException(
      OptimizerErrorCode code, String message, Map<String, Object> details, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.details = details == null ? Map.of() : details;
  }

  public OptimizerErrorCode getCode() {
    return code;
  }

  public ErrorCategory getCategory() {
    return code.category();
  }

  public int getHttpStatus() {
    return code.httpStatus();
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public boolean isStaleness() {
    return code.category() == ErrorCategory.STALENESS;
  }
}
