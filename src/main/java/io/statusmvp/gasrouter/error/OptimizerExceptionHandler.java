package io.statusmvp.gasrouter.error;

import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice(basePackages = "io.statusmvp.gasrouter.controller")
public class OptimizerExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(OptimizerExceptionHandler.class);

  @ExceptionHandler(OptimizerException.class)
  public ResponseEntity<Map<String, Object>> onOptimizerError(OptimizerException e) {
    Map<String, Object> body =
        Map.of(
            "ok", false,
            "code", e.getCode().name(),
            "category", e.getCategory().name(),
            "message", e.getMessage() == null ? e.getCode().name() : e.getMessage(),
            "details", e.getDetails(),
            "timestamp", Instant.now().toEpochMilli());
    return ResponseEntity.status(e.getHttpStatus()).body(body);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    BindException.class,
    WebExchangeBindException.class,
    ServerWebInputException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
    return ResponseEntity.badRequest()
        .body(
            Map.of(
                "ok", false,
                "code", OptimizerErrorCode.INVALID_ARGUMENT.name(),
                "category", ErrorCategory.VALIDATION.name(),
                "message", e.getMessage() == null ? "Invalid request" : e.getMessage(),
                "timestamp", Instant.now().toEpochMilli()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> onUnknown(Exception e) {
    log.error("optimizer internal error", e);
    return ResponseEntity.status(500)
        .body(
            Map.of(
                "ok", false,
                "code", "INTERNAL_ERROR",
                "message", "Internal server error",
                "timestamp", Instant.now().toEpochMilli()));
  }
}
