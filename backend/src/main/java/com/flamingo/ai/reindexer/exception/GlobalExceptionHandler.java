package com.flamingo.ai.reindexer.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(BuildInProgressException.class)
  public ResponseEntity<ApiError> handleBuildInProgress(
      BuildInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("build_in_progress");
    String errorId = generateErrorId();
    log.warn("Build rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.BUILD_IN_PROGRESS, ex.getMessage(), request);
  }

  @ExceptionHandler(RevisionStateException.class)
  public ResponseEntity<ApiError> handleRevisionState(
      RevisionStateException ex, HttpServletRequest request) {

    incrementErrorCounter("revision_state");
    String errorId = generateErrorId();
    log.warn("Revision state error [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.CONFLICT, errorId, ApiError.REVISION_STATE, ex.getMessage(), request);
  }

  @ExceptionHandler(DimensionNotFoundException.class)
  public ResponseEntity<ApiError> handleDimensionNotFound(
      DimensionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("dimension_not_found");
    String errorId = generateErrorId();
    log.warn("Dimension not found [{}]: {}", errorId, ex.getDimension());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DIMENSION_NOT_FOUND, "Dimension not found", request);
  }

  @ExceptionHandler(IndexNotFoundException.class)
  public ResponseEntity<ApiError> handleIndexNotFound(
      IndexNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("index_not_found");
    String errorId = generateErrorId();
    log.warn("Index not found [{}]: {}", errorId, ex.getIndexId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.INDEX_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(ContentSourceException.class)
  public ResponseEntity<ApiError> handleContentSource(
      ContentSourceException ex, HttpServletRequest request) {

    incrementErrorCounter("content_source");
    String errorId = generateErrorId();
    log.error("Content source error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.CONTENT_SOURCE_ERROR,
        "Content server request failed",
        request);
  }

  @ExceptionHandler(BackingStoreException.class)
  public ResponseEntity<ApiError> handleBackingStore(
      BackingStoreException ex, HttpServletRequest request) {

    incrementErrorCounter("backing_store");
    String errorId = generateErrorId();
    log.error("Backing store error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.BACKING_STORE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("circuit_open");
    String errorId = generateErrorId();
    log.warn("Circuit open [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.CIRCUIT_OPEN,
        "Search backend is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(
      ConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("configuration");
    String errorId = generateErrorId();
    log.error("Configuration error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.CONFIGURATION_ERROR,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class
  })
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
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
