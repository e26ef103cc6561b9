package com.flamingo.ai.canlaw.service.statute.parsing;

import com.flamingo.ai.canlaw.config.CanLawConfig;
import com.flamingo.ai.canlaw.exception.StatuteParsingException;
import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * {@link StatuteParser} for the federal Act markup dialect ({@code Identification}, {@code Body},
 * {@code Heading}, {@code Section}, {@code Subsection}, {@code Paragraph}, {@code Subparagraph}).
 *
 * <p>Loads the whole document into a namespace-aware DOM, then hands it to a fresh {@link
 * HierarchicalWalker}. External DTDs are never fetched, so parsing performs no network access.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActXmlStatuteParser implements StatuteParser {

  static final String PARSE_TIMER = "statute.parse";

  private final CanLawConfig canLawConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public StatuteHierarchy parse(InputStream inputStream, ActDescriptor act) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Document dom = load(inputStream, act);
      log.info(
          "Building {} hierarchy from <{}>", act.actCode(), dom.getDocumentElement().getTagName());

      HierarchicalWalker walker =
          new HierarchicalWalker(act, canLawConfig.getStatute().getNamespaceUri(), meterRegistry);
      StatuteHierarchy hierarchy = walker.walk(dom.getDocumentElement());

      log.info("Parsed {} nodes for {}", hierarchy.size(), act.actCode());
      return hierarchy;
    } finally {
      sample.stop(meterRegistry.timer(PARSE_TIMER));
    }
  }

  @Override
  public StatuteHierarchy parse(Path xmlPath, ActDescriptor act) {
    log.info("Parsing {}...", xmlPath);
    try (InputStream in = Files.newInputStream(xmlPath)) {
      return parse(in, act);
    } catch (IOException e) {
      throw new StatuteParsingException(
          act.actCode(), "Failed to read statute file " + xmlPath + ": " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private Document load(InputStream inputStream, ActDescriptor act) {
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setNamespaceAware(true);
      dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
      dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      dbf.setExpandEntityReferences(false);
      Document dom = dbf.newDocumentBuilder().parse(inputStream);
      dom.getDocumentElement().normalize();
      return dom;
    } catch (ParserConfigurationException | SAXException | IOException e) {
      log.error("Statute XML for {} could not be loaded: {}", act.actCode(), e.getMessage());
      throw new StatuteParsingException(
          act.actCode(), "Malformed statute XML: " + e.getMessage(), e);
    }
  }
}
