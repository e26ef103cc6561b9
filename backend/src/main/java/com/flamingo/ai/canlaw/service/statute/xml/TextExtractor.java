package com.flamingo.ai.canlaw.service.statute.xml;

import java.util.Optional;
import java.util.regex.Pattern;
import org.w3c.dom.Element;

/** Flattens element content into single-line plain text. */
public final class TextExtractor {

  private static final Pattern WHITESPACE_RUNS =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private TextExtractor() {}

  /**
   * Concatenates the text of {@code element} and all its descendants in document order, collapses
   * whitespace runs to one space and trims the result. Inline markup such as emphasis or
   * cross-references is dropped; only its text survives.
   *
   * @return the flattened text, or an empty string when {@code element} is null
   */
  public static String flattenText(Element element) {
    if (element == null) {
      return "";
    }
    String raw = element.getTextContent();
    if (raw == null) {
      return "";
    }
    return WHITESPACE_RUNS.matcher(raw).replaceAll(" ").strip();
  }

  public static String flattenText(Optional<Element> element) {
    return flattenText(element.orElse(null));
  }
}
