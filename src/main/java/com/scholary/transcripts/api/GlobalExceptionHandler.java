package com.scholary.transcripts.api;

import com.scholary.transcripts.service.TranscriptTooShortException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps exceptions escaping the controllers to JSON error responses. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    Map<String, String> errors = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      errors.put(error.getField(), error.getDefaultMessage());
    }
    LOGGER.warn("Validation failed: {}", errors);
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("validation_failed", "Validation failed", errors));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("bad_request", "Request body is not valid JSON"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(TranscriptTooShortException.class)
  public ResponseEntity<ErrorResponse> handleTooShort(TranscriptTooShortException ex) {
    LOGGER.info("Rejected short transcript: length={}", ex.getLength());
    return ResponseEntity.unprocessableEntity()
        .body(ErrorResponse.of("transcript_too_short", ex.getMessage()));
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Acquisition queue full: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of("queue_full", "Too many acquisitions in progress, retry later"));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Void> handleNoResource(NoResourceFoundException ex) {
    LOGGER.debug("Resource not found: {}", ex.getResourcePath());
    return ResponseEntity.notFound().build();
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("internal_error", "An unexpected error occurred"));
  }
}
