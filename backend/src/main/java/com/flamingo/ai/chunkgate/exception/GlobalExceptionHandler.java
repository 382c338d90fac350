package com.flamingo.ai.chunkgate.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_argument");
    String errorId = generateErrorId();
    log.warn("Invalid argument [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_ARGUMENT, ex.getMessage(), request);
  }

  @ExceptionHandler(CancellationException.class)
  public ResponseEntity<ApiError> handleCancellation(
      CancellationException ex, HttpServletRequest request) {

    incrementErrorCounter("filter_cancelled");
    String errorId = generateErrorId();
    log.info("Filtering cancelled [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.FILTER_CANCELLED,
        "Chunk filtering was cancelled",
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
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

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_request");
    String errorId = generateErrorId();
    log.warn("Malformed request body [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.MALFORMED_REQUEST,
        "Request body could not be read",
        request);
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
