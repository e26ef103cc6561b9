package com.flamingo.ai.canlaw.exception;

/**
 * Exception thrown when a statute document cannot be turned into a hierarchy at all, e.g. because
 * it is not well-formed XML or has no {@code Body} element.
 */
public class StatuteParsingException extends RuntimeException {

  private final String actCode;
  private final String userMessage;

  public StatuteParsingException(String actCode, String message) {
    super(message);
    this.actCode = actCode;
    this.userMessage = "Failed to parse statute";
  }

  public StatuteParsingException(String actCode, String message, Throwable cause) {
    super(message, cause);
    this.actCode = actCode;
    this.userMessage = "Failed to parse statute";
  }

  public String getActCode() {
    return actCode;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
