package com.flamingo.ai.canlaw.exception;

/** Exception thrown when no hierarchy has been loaded for an act code. */
public class StatuteNotFoundException extends RuntimeException {

  private final String actCode;

  public StatuteNotFoundException(String actCode) {
    super("Statute not found: " + actCode);
    this.actCode = actCode;
  }

  public String getActCode() {
    return actCode;
  }
}
