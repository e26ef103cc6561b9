package com.flamingo.ai.canlaw.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String STATUTE_NOT_FOUND = "STATUTE_001";
  public static final String STATUTE_NODE_NOT_FOUND = "STATUTE_002";
  public static final String STATUTE_PARSE_ERROR = "STATUTE_003";
  public static final String STATUTE_EXPORT_ERROR = "STATUTE_004";
  public static final String CORPUS_DOWNLOAD_ERROR = "CORPUS_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
