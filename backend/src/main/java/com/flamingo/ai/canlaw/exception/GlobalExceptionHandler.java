package com.flamingo.ai.canlaw.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(StatuteNotFoundException.class)
  public ResponseEntity<ApiError> handleStatuteNotFound(
      StatuteNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("statute_not_found");
    String errorId = generateErrorId();
    log.warn("Statute not found [{}]: {}", errorId, ex.getActCode());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.STATUTE_NOT_FOUND, "Statute not found", request);
  }

  @ExceptionHandler(StatuteNodeNotFoundException.class)
  public ResponseEntity<ApiError> handleStatuteNodeNotFound(
      StatuteNodeNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("statute_node_not_found");
    String errorId = generateErrorId();
    log.warn(
        "Statute node not found [{}]: act={}, reference={}",
        errorId,
        ex.getActCode(),
        ex.getReference());

    return error(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.STATUTE_NODE_NOT_FOUND,
        "Statute provision not found",
        request);
  }

  @ExceptionHandler(StatuteParsingException.class)
  public ResponseEntity<ApiError> handleStatuteParsing(
      StatuteParsingException ex, HttpServletRequest request) {

    incrementErrorCounter("statute_parse_error");
    String errorId = generateErrorId();
    log.error("Statute parsing error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.STATUTE_PARSE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StatuteExportException.class)
  public ResponseEntity<ApiError> handleStatuteExport(
      StatuteExportException ex, HttpServletRequest request) {

    incrementErrorCounter("statute_export_error");
    String errorId = generateErrorId();
    log.error("Statute export error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STATUTE_EXPORT_ERROR,
        "Failed to write statute hierarchy",
        request);
  }

  @ExceptionHandler(CorpusDownloadException.class)
  public ResponseEntity<ApiError> handleCorpusDownload(
      CorpusDownloadException ex, HttpServletRequest request) {

    incrementErrorCounter("corpus_download_error");
    String errorId = generateErrorId();
    log.error("Corpus download error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.CORPUS_DOWNLOAD_ERROR,
        "Corpus download failed",
        request);
  }

  @ExceptionHandler({
    InvalidStatuteQueryException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
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
