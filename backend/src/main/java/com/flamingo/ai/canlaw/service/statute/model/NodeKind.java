package com.flamingo.ai.canlaw.service.statute.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Structural role of a {@link StatuteNode} within an Act. */
public enum NodeKind {
  ACT,
  PART,
  HEADING,
  SECTION,
  SUBSECTION,
  PARAGRAPH,
  SUBPARAGRAPH;

  /** Lower-case name used in serialized output and query parameters, e.g. {@code "section"}. */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Key under which this kind is counted in summary statistics, e.g. {@code "sections"}. */
  public String statisticsKey() {
    return wireName() + "s";
  }

  /**
   * Resolves a kind from its wire name, ignoring case.
   *
   * @throws IllegalArgumentException if the name does not denote a kind
   */
  public static NodeKind fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Node kind must not be blank");
    }
    for (NodeKind kind : values()) {
      if (kind.wireName().equalsIgnoreCase(value.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown node kind: " + value);
  }
}
