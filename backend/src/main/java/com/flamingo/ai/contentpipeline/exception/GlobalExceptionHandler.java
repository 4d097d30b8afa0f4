package com.flamingo.ai.contentpipeline.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<ApiError> handleRunNotFound(
      RunNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("run_not_found");
    String errorId = generateErrorId();
    log.warn("Run not found [{}]: {}", errorId, ex.getRunId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.RUN_NOT_FOUND, "Run not found", request);
  }

  @ExceptionHandler(RunNotResumableException.class)
  public ResponseEntity<ApiError> handleRunNotResumable(
      RunNotResumableException ex, HttpServletRequest request) {

    incrementErrorCounter("run_not_resumable");
    String errorId = generateErrorId();
    log.warn("Run not resumable [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.CONFLICT, errorId, ApiError.RUN_NOT_RESUMABLE, ex.getMessage(), request);
  }

  @ExceptionHandler(IngestionException.class)
  public ResponseEntity<ApiError> handleIngestion(
      IngestionException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion");
    String errorId = generateErrorId();
    log.error("Ingestion error [{}] for {}: {}", errorId, ex.getSourcePath(), ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.INGESTION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(FatalCapabilityException.class)
  public ResponseEntity<ApiError> handleCapability(
      FatalCapabilityException ex, HttpServletRequest request) {

    incrementErrorCounter("capability_error");
    String errorId = generateErrorId();
    log.error("Capability error [{}] ({}): {}", errorId, ex.getCapability(), ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.CAPABILITY_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
