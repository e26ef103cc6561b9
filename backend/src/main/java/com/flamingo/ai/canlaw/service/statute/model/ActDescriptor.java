package com.flamingo.ai.canlaw.service.statute.model;

import java.util.Locale;

/**
 * Identity of the Act being parsed.
 *
 * @param actCode short lower-case code used as identifier prefix, e.g. {@code cbca}
 * @param actName full name of the Act, e.g. {@code Canada Business Corporations Act}
 * @param consolidatedNumber chapter number of the consolidation, e.g. {@code C-44}
 */
public record ActDescriptor(String actCode, String actName, String consolidatedNumber) {

  /** Upper-case act code that starts every citation, e.g. {@code CBCA}. */
  public String citationPrefix() {
    return actCode.toUpperCase(Locale.ROOT);
  }
}
