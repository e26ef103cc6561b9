package com.flamingo.ai.canlaw.service.statute.citation;

import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.NodeIdentity;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives canonical node identifiers and legal citations from a node's role and the labels of its
 * ancestors.
 *
 * <p>Every method is a pure function of its arguments: the same ancestry always yields the same
 * {@link NodeIdentity}. Nested units chain onto their parent's identity, so a paragraph under
 * {@code cbca_s122_1 / CBCA s. 122(1)} labelled {@code (a)} becomes {@code cbca_s122_1_a / CBCA s.
 * 122(1)(a)}, while one directly under {@code cbca_s122} becomes {@code cbca_s122_a / CBCA s.
 * 122(a)}.
 */
public final class CitationBuilder {

  public static final String PART_MARKER = "PART";

  private static final Pattern PART_TOKEN = Pattern.compile("^PART\\s+([IVXLC]+(?:\\.\\d+)?)");
  private static final Pattern NON_ALPHANUMERIC_RUNS = Pattern.compile("[^a-z0-9]+");
  private static final int SLUG_MAX_LENGTH = 30;

  private CitationBuilder() {}

  public static NodeIdentity act(ActDescriptor act) {
    return new NodeIdentity(act.actCode() + "_root", act.citationPrefix());
  }

  /**
   * Part identity from a label such as {@code PART IV}.
   *
   * @return {@code cbca_part_iv} / {@code CBCA PART IV}
   */
  public static NodeIdentity part(ActDescriptor act, String partLabel) {
    String token = partToken(partLabel);
    return new NodeIdentity(
        act.actCode() + "_part_" + token.toLowerCase(Locale.ROOT),
        act.citationPrefix() + " " + partLabel);
  }

  /**
   * Roman numeral following the Part marker, with its decimal suffix if any, or the label minus its
   * {@code "PART "} prefix when no numeral is present ({@code PART XIV.1} yields {@code XIV.1},
   * {@code PART A} yields {@code A}).
   */
  public static String partToken(String partLabel) {
    Matcher matcher = PART_TOKEN.matcher(partLabel);
    if (matcher.find()) {
      return matcher.group(1);
    }
    return partLabel.replace(PART_MARKER + " ", "");
  }

  /**
   * Candidate identity for a sub-heading under a Part. The id may collide with an earlier heading
   * of the same slug; callers disambiguate it against the tree.
   */
  public static NodeIdentity heading(
      ActDescriptor act, String partId, String partLabel, String title) {
    return new NodeIdentity(
        partId + "_heading_" + slug(title), act.citationPrefix() + " " + partLabel + " - " + title);
  }

  /** Lower-cases, replaces each non-alphanumeric run with {@code _} and keeps 30 characters. */
  public static String slug(String title) {
    String slug = NON_ALPHANUMERIC_RUNS.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("_");
    return slug.length() > SLUG_MAX_LENGTH ? slug.substring(0, SLUG_MAX_LENGTH) : slug;
  }

  /** {@code cbca_s122} / {@code CBCA s. 122}. */
  public static NodeIdentity section(ActDescriptor act, String sectionNumber) {
    return new NodeIdentity(
        act.actCode() + "_s" + sectionNumber, act.citationPrefix() + " s. " + sectionNumber);
  }

  /** Subsection {@code (1)} of a section: {@code cbca_s122_1} / {@code CBCA s. 122(1)}. */
  public static NodeIdentity subsection(NodeIdentity section, String subsectionLabel) {
    return chain(section, subsectionLabel);
  }

  /**
   * Paragraph under either a subsection or, when the section has no subsections, the section
   * itself.
   */
  public static NodeIdentity paragraph(NodeIdentity parent, String paragraphLabel) {
    return chain(parent, paragraphLabel);
  }

  public static NodeIdentity subparagraph(NodeIdentity paragraph, String subparagraphLabel) {
    return chain(paragraph, subparagraphLabel);
  }

  /** Strips every leading and trailing parenthesis: {@code (1.1)} becomes {@code 1.1}. */
  public static String cleanLabel(String label) {
    int start = 0;
    int end = label.length();
    while (start < end && isParenthesis(label.charAt(start))) {
      start++;
    }
    while (end > start && isParenthesis(label.charAt(end - 1))) {
      end--;
    }
    return label.substring(start, end);
  }

  private static NodeIdentity chain(NodeIdentity parent, String label) {
    return new NodeIdentity(parent.id() + "_" + cleanLabel(label), parent.citation() + label);
  }

  private static boolean isParenthesis(char c) {
    return c == '(' || c == ')';
  }
}
