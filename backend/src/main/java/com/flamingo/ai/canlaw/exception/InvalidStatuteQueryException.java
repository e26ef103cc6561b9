package com.flamingo.ai.canlaw.exception;

/** Exception thrown when a statute query parameter has a value the API does not accept. */
public class InvalidStatuteQueryException extends RuntimeException {

  private final String parameter;
  private final String value;

  public InvalidStatuteQueryException(String parameter, String value, Throwable cause) {
    super("Invalid value for '" + parameter + "': " + value, cause);
    this.parameter = parameter;
    this.value = value;
  }

  public String getParameter() {
    return parameter;
  }

  public String getValue() {
    return value;
  }
}
