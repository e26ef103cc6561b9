package com.flamingo.ai.canlaw.exception;

/** Exception thrown when a node id or citation does not resolve within a loaded statute. */
public class StatuteNodeNotFoundException extends RuntimeException {

  private final String actCode;
  private final String reference;

  public StatuteNodeNotFoundException(String actCode, String reference) {
    super("Statute node not found in " + actCode + ": " + reference);
    this.actCode = actCode;
    this.reference = reference;
  }

  public String getActCode() {
    return actCode;
  }

  public String getReference() {
    return reference;
  }
}
