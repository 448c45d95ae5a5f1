package io.statusmvp.gasrouter.error;

public enum ErrorCategory {
  VALIDATION,
  STALENESS,
  STATE_MACHINE,
  AUTHORIZATION,
  EXTERNAL,
  NOT_FOUND
}
