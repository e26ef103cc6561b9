package com.flamingo.ai.canlaw.service.statute.parsing;

import com.flamingo.ai.canlaw.exception.StatuteParsingException;
import com.flamingo.ai.canlaw.service.statute.citation.CitationBuilder;
import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.NodeIdentity;
import com.flamingo.ai.canlaw.service.statute.model.NodeKind;
import com.flamingo.ai.canlaw.service.statute.model.NodeMetadata;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import com.flamingo.ai.canlaw.service.statute.model.StatuteNode;
import com.flamingo.ai.canlaw.service.statute.xml.TagResolver;
import com.flamingo.ai.canlaw.service.statute.xml.TextExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

/**
 * Single-use, single-threaded walk over one Act document.
 *
 * <p>Top-level {@code Body} children are consumed left to right. {@code Heading} elements move the
 * {@link WalkerContext} (a level-1 {@code PART …} heading opens a Part, other level-1 and level-2
 * headings open a sub-heading inside it) and {@code Section} elements are attached to the current
 * context, then descended into depth first: subsections, or paragraphs directly when a section has
 * no subsections, then subparagraphs. Every other top-level element is ignored.
 *
 * <p>Structural elements without a {@code Label} are skipped together with their subtree. The only
 * failure that escapes is a document without a {@code Body}.
 */
@Slf4j
class HierarchicalWalker {

  static final String BODY = "Body";
  static final String IDENTIFICATION = "Identification";
  static final String SHORT_TITLE = "ShortTitle";
  static final String LONG_TITLE = "LongTitle";
  static final String HEADING = "Heading";
  static final String SECTION = "Section";
  static final String SUBSECTION = "Subsection";
  static final String PARAGRAPH = "Paragraph";
  static final String SUBPARAGRAPH = "Subparagraph";
  static final String LABEL = "Label";
  static final String TITLE_TEXT = "TitleText";
  static final String MARGINAL_NOTE = "MarginalNote";
  static final String TEXT = "Text";
  static final String LEVEL_ATTRIBUTE = "level";

  private final ActDescriptor act;
  private final String namespaceUri;
  private final MeterRegistry meterRegistry;
  private final WalkerContext context = new WalkerContext();
  private StatuteHierarchy hierarchy;

  HierarchicalWalker(ActDescriptor act, String namespaceUri, MeterRegistry meterRegistry) {
    this.act = act;
    this.namespaceUri = namespaceUri;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Builds the complete hierarchy for a document.
   *
   * @param documentElement the document's root element
   * @return the sealed hierarchy
   * @throws StatuteParsingException if the document has no {@code Body}
   */
  StatuteHierarchy walk(Element documentElement) {
    if (hierarchy != null) {
      throw new IllegalStateException("Walker for " + act.actCode() + " has already been used");
    }
    hierarchy = new StatuteHierarchy(act, rootNode(documentElement));

    Element body =
        TagResolver.findTolerant(documentElement, namespaceUri, BODY)
            .orElseThrow(
                () ->
                    new StatuteParsingException(
                        act.actCode(), "Could not find Body element in statute XML"));

    for (Element element : TagResolver.childElements(body)) {
      String tag = TagResolver.localTag(element);
      if (HEADING.equals(tag)) {
        visitHeading(element);
      } else if (SECTION.equals(tag)) {
        visitSection(element);
      } else {
        log.trace("Ignoring top-level <{}> in {}", tag, act.actCode());
      }
    }

    hierarchy.complete();
    return hierarchy;
  }

  private StatuteNode rootNode(Element documentElement) {
    Optional<Element> identification =
        TagResolver.findTolerant(documentElement, namespaceUri, IDENTIFICATION);
    String shortTitle =
        TextExtractor.flattenText(
            identification.flatMap(e -> TagResolver.findTolerant(e, namespaceUri, SHORT_TITLE)));
    String longTitle =
        TextExtractor.flattenText(
            identification.flatMap(e -> TagResolver.findTolerant(e, namespaceUri, LONG_TITLE)));

    NodeIdentity identity = CitationBuilder.act(act);
    return StatuteNode.builder()
        .id(identity.id())
        .kind(NodeKind.ACT)
        .actName(act.actName())
        .label(act.citationPrefix())
        .title(shortTitle.isEmpty() ? act.actName() : shortTitle)
        .text(longTitle)
        .citation(identity.citation())
        .metadata(new NodeMetadata.Act(shortTitle, longTitle, act.consolidatedNumber()))
        .build();
  }

  private void visitHeading(Element heading) {
    String level = heading.getAttribute(LEVEL_ATTRIBUTE);
    String label = childText(heading, LABEL);
    String title = childText(heading, TITLE_TEXT);
    boolean partMarker = label.startsWith(CitationBuilder.PART_MARKER);

    if ("1".equals(level) && partMarker) {
      openPart(label, title);
    } else if ("2".equals(level) || "1".equals(level)) {
      openHeading(label, title, level);
    } else {
      log.debug("Ignoring heading '{}' at level '{}'", label.isEmpty() ? title : label, level);
    }
  }

  private void openPart(String label, String title) {
    NodeIdentity identity = CitationBuilder.part(act, label);
    if (hierarchy.contains(identity.id())) {
      // Re-opening a Part keeps later sections with it instead of the previous Part.
      skip("duplicate_id", HEADING, identity.id());
      context.enterPart(identity.id(), label);
      return;
    }
    attach(
        StatuteNode.builder()
            .id(identity.id())
            .kind(NodeKind.PART)
            .parentId(hierarchy.getRootId())
            .label(label)
            .title(title)
            .citation(identity.citation())
            .metadata(new NodeMetadata.Part(CitationBuilder.partToken(label))));
    context.enterPart(identity.id(), label);
  }

  private void openHeading(String label, String title, String level) {
    if (!context.hasPart()) {
      skip("no_active_part", HEADING, title);
      return;
    }
    NodeIdentity candidate =
        CitationBuilder.heading(act, context.partId(), context.partLabel(), title);
    String id = hierarchy.uniqueId(candidate.id());
    attach(
        StatuteNode.builder()
            .id(id)
            .kind(NodeKind.HEADING)
            .parentId(context.partId())
            .label(label)
            .title(title)
            .citation(candidate.citation())
            .metadata(new NodeMetadata.Heading(parseLevel(level))));
    context.enterHeading(id);
  }

  private void visitSection(Element section) {
    Optional<Element> labelElement = TagResolver.firstChild(section, LABEL);
    if (labelElement.isEmpty()) {
      skip("missing_label", SECTION, context.sectionParent(hierarchy.getRootId()));
      return;
    }
    String sectionNumber = TextExtractor.flattenText(labelElement);
    NodeIdentity identity = CitationBuilder.section(act, sectionNumber);
    if (hierarchy.contains(identity.id())) {
      skip("duplicate_id", SECTION, identity.id());
      return;
    }
    List<Element> subsections = TagResolver.childElements(section, SUBSECTION);

    attach(
        StatuteNode.builder()
            .id(identity.id())
            .kind(NodeKind.SECTION)
            .parentId(context.sectionParent(hierarchy.getRootId()))
            .label(sectionNumber)
            .title(childText(section, MARGINAL_NOTE))
            .text(childText(section, TEXT))
            .citation(identity.citation())
            .metadata(new NodeMetadata.Section(!subsections.isEmpty(), context.partLabel())));

    if (!subsections.isEmpty()) {
      for (Element subsection : subsections) {
        visitSubsection(subsection, identity, sectionNumber);
      }
    } else {
      for (Element paragraph : TagResolver.childElements(section, PARAGRAPH)) {
        visitParagraph(paragraph, identity, sectionNumber, "");
      }
    }
  }

  private void visitSubsection(Element subsection, NodeIdentity section, String sectionNumber) {
    Optional<Element> labelElement = TagResolver.firstChild(subsection, LABEL);
    if (labelElement.isEmpty()) {
      skip("missing_label", SUBSECTION, section.id());
      return;
    }
    String label = TextExtractor.flattenText(labelElement);
    NodeIdentity identity = CitationBuilder.subsection(section, label);
    if (hierarchy.contains(identity.id())) {
      skip("duplicate_id", SUBSECTION, identity.id());
      return;
    }

    attach(
        StatuteNode.builder()
            .id(identity.id())
            .kind(NodeKind.SUBSECTION)
            .parentId(section.id())
            .label(label)
            .title(childText(subsection, MARGINAL_NOTE))
            .text(childText(subsection, TEXT))
            .citation(identity.citation())
            .metadata(new NodeMetadata.Subsection(sectionNumber)));

    for (Element paragraph : TagResolver.childElements(subsection, PARAGRAPH)) {
      visitParagraph(paragraph, identity, sectionNumber, label);
    }
  }

  private void visitParagraph(
      Element paragraph, NodeIdentity parent, String sectionNumber, String subsectionLabel) {
    Optional<Element> labelElement = TagResolver.firstChild(paragraph, LABEL);
    if (labelElement.isEmpty()) {
      skip("missing_label", PARAGRAPH, parent.id());
      return;
    }
    String label = TextExtractor.flattenText(labelElement);
    NodeIdentity identity = CitationBuilder.paragraph(parent, label);
    if (hierarchy.contains(identity.id())) {
      skip("duplicate_id", PARAGRAPH, identity.id());
      return;
    }

    attach(
        StatuteNode.builder()
            .id(identity.id())
            .kind(NodeKind.PARAGRAPH)
            .parentId(parent.id())
            .label(label)
            .text(childText(paragraph, TEXT))
            .citation(identity.citation())
            .metadata(new NodeMetadata.Paragraph(sectionNumber, subsectionLabel)));

    for (Element subparagraph : TagResolver.childElements(paragraph, SUBPARAGRAPH)) {
      visitSubparagraph(subparagraph, identity, sectionNumber, subsectionLabel, label);
    }
  }

  private void visitSubparagraph(
      Element subparagraph,
      NodeIdentity paragraph,
      String sectionNumber,
      String subsectionLabel,
      String paragraphLabel) {
    Optional<Element> labelElement = TagResolver.firstChild(subparagraph, LABEL);
    if (labelElement.isEmpty()) {
      skip("missing_label", SUBPARAGRAPH, paragraph.id());
      return;
    }
    String label = TextExtractor.flattenText(labelElement);
    NodeIdentity identity = CitationBuilder.subparagraph(paragraph, label);
    if (hierarchy.contains(identity.id())) {
      skip("duplicate_id", SUBPARAGRAPH, identity.id());
      return;
    }

    attach(
        StatuteNode.builder()
            .id(identity.id())
            .kind(NodeKind.SUBPARAGRAPH)
            .parentId(paragraph.id())
            .label(label)
            .text(childText(subparagraph, TEXT))
            .citation(identity.citation())
            .metadata(
                new NodeMetadata.Subparagraph(sectionNumber, subsectionLabel, paragraphLabel)));
  }

  private void attach(StatuteNode.StatuteNodeBuilder builder) {
    StatuteNode node = builder.actName(act.actName()).build();
    hierarchy.attach(node);
    meterRegistry.counter("statute.nodes.created", "kind", node.getKind().wireName()).increment();
  }

  private void skip(String reason, String element, String near) {
    meterRegistry.counter("statute.elements.skipped", "reason", reason).increment();
    if ("duplicate_id".equals(reason)) {
      log.warn("Skipping <{}> in {}: id {} already exists", element, act.actCode(), near);
    } else {
      log.debug("Skipping <{}> in {} near {}: {}", element, act.actCode(), near, reason);
    }
  }

  private static String childText(Element parent, String localName) {
    return TextExtractor.flattenText(TagResolver.firstChild(parent, localName));
  }

  private static int parseLevel(String level) {
    try {
      return Integer.parseInt(level.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
