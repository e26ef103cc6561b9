package com.flamingo.ai.canlaw.service.statute.parsing;

/**
 * Attachment point carried across the top-level elements of one document walk: the most recent
 * Part and the most recent sub-heading inside it.
 */
final class WalkerContext {

  private String partId;
  private String partLabel = "";
  private String headingId;

  /** A new Part replaces the active one and clears any sub-heading. */
  void enterPart(String id, String label) {
    this.partId = id;
    this.partLabel = label;
    this.headingId = null;
  }

  void enterHeading(String id) {
    this.headingId = id;
  }

  boolean hasPart() {
    return partId != null;
  }

  String partId() {
    return partId;
  }

  String partLabel() {
    return partLabel;
  }

  /** Parent for the next section: the active heading, else the active Part, else the root. */
  String sectionParent(String rootId) {
    if (headingId != null) {
      return headingId;
    }
    return partId != null ? partId : rootId;
  }
}
