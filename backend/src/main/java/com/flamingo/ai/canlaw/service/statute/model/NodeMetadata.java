package com.flamingo.ai.canlaw.service.statute.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Role-specific facts attached to a {@link StatuteNode}.
 *
 * <p>One variant per {@link NodeKind}. Each variant serializes as a flat JSON object whose keys
 * match the downstream index schema (e.g. {@code {"has_subsections": true, "part": "PART X"}}).
 */
public sealed interface NodeMetadata {

  /**
   * Facts about the Act itself, read from its {@code Identification} block.
   *
   * @param shortTitle {@code ShortTitle} text, empty when absent
   * @param longTitle {@code LongTitle} text, empty when absent
   * @param consolidatedNumber chapter number of the consolidation, e.g. {@code C-44}
   */
  record Act(
      @JsonProperty("short_title") String shortTitle,
      @JsonProperty("long_title") String longTitle,
      @JsonProperty("consolidated_number") String consolidatedNumber)
      implements NodeMetadata {}

  /** @param partNumber token after the Part marker, e.g. {@code X} */
  record Part(@JsonProperty("part_number") String partNumber) implements NodeMetadata {}

  /** @param level value of the heading's {@code level} attribute, 0 when absent or not numeric */
  record Heading(@JsonProperty("level") int level) implements NodeMetadata {}

  /**
   * @param hasSubsections whether the section contains {@code Subsection} elements
   * @param part label of the enclosing Part, empty if the section precedes every Part
   */
  record Section(
      @JsonProperty("has_subsections") boolean hasSubsections, @JsonProperty("part") String part)
      implements NodeMetadata {}

  /** @param section label of the containing section */
  record Subsection(@JsonProperty("section") String section) implements NodeMetadata {}

  /**
   * @param section label of the containing section
   * @param subsection label of the containing subsection, empty when attached to the section
   */
  record Paragraph(
      @JsonProperty("section") String section, @JsonProperty("subsection") String subsection)
      implements NodeMetadata {}

  /**
   * @param section label of the containing section
   * @param subsection label of the containing subsection, empty when there is none
   * @param paragraph label of the containing paragraph
   */
  record Subparagraph(
      @JsonProperty("section") String section,
      @JsonProperty("subsection") String subsection,
      @JsonProperty("paragraph") String paragraph)
      implements NodeMetadata {}
}
