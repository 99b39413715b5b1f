package com.flamingo.ai.studybuddy.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(EngineNotFoundException.class)
  public ResponseEntity<ApiError> handleEngineNotFound(
      EngineNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("engine_not_found");
    String errorId = generateErrorId();
    log.warn("Engine not found [{}]: {}", errorId, ex.getEngineId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.ENGINE_NOT_FOUND,
        "Engine not found",
        null,
        request);
  }

  @ExceptionHandler(EngineLifecycleException.class)
  public ResponseEntity<ApiError> handleLifecycle(
      EngineLifecycleException ex, HttpServletRequest request) {

    incrementErrorCounter(
        ex instanceof GenerationInProgressException ? "generation_in_progress" : "engine_state");
    String errorId = generateErrorId();
    log.warn("Engine state conflict [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.ENGINE_STATE_CONFLICT,
        ex.getMessage(),
        ex.getPhase() != null ? ex.getPhase().name() : null,
        request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<ApiError> handleInvalidParameter(
      InvalidParameterException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_parameter");
    String errorId = generateErrorId();
    log.warn("Invalid parameter [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_PARAMETER,
        ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(ModelLoadException.class)
  public ResponseEntity<ApiError> handleModelLoad(
      ModelLoadException ex, HttpServletRequest request) {

    incrementErrorCounter("model_load");
    String errorId = generateErrorId();
    log.warn("Model load failed [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.MODEL_LOAD_FAILED,
        ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(GenerationFailedException.class)
  public ResponseEntity<ApiError> handleGenerationFailed(
      GenerationFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("generation_failed");
    String errorId = generateErrorId();
    log.error(
        "Generation {} failed [{}]: {}", ex.getGenerationId(), errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.GENERATION_FAILED,
        "Generation failed: " + ex.getMessage(),
        null,
        request);
  }

  @ExceptionHandler(ResourceLeakException.class)
  public ResponseEntity<ApiError> handleResourceLeak(
      ResourceLeakException ex, HttpServletRequest request) {

    incrementErrorCounter("resource_leak");
    String errorId = generateErrorId();
    log.error("Resource leak [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.RESOURCE_LEAK,
        "Engine was closed but some generation tasks did not stop in time",
        null,
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

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for " + mismatch.getName() + ": " + mismatch.getValue()
            : "Malformed request body";

    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
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
        null,
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      String phase,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .phase(phase)
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
