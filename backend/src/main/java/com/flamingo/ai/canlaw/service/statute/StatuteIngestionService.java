package com.flamingo.ai.canlaw.service.statute;

import com.flamingo.ai.canlaw.config.CanLawConfig;
import com.flamingo.ai.canlaw.service.statute.model.ActDescriptor;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import com.flamingo.ai.canlaw.service.statute.parsing.StatuteParser;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Path;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates statute ingestion: parse the Act XML, write the hierarchy JSON, and publish the tree
 * for citation lookup.
 *
 * <p>The hierarchy is only written and registered after the parse has completed; a failed parse
 * leaves both the output file and the registry untouched.
 *
 * <p>Each public entry point is timed as {@code statute.ingest}; the parse itself is timed by the
 * parser as {@code statute.parse}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatuteIngestionService {

  /** Section whose path is logged after each run as a quick sanity check. */
  static final String SAMPLE_SECTION = "122";

  private final StatuteParser statuteParser;
  private final StatuteHierarchyWriter hierarchyWriter;
  private final StatuteRegistry statuteRegistry;
  private final CanLawConfig canLawConfig;

  /** Ingests the configured Act from the configured input to the configured output. */
  @Timed(value = "statute.ingest", description = "Time to parse, write and register a statute")
  public StatuteHierarchy ingestConfigured() {
    CanLawConfig.Statute statute = canLawConfig.getStatute();
    return ingest(Path.of(statute.getInputPath()), Path.of(statute.getOutputPath()));
  }

  /** Ingests the configured Act from {@code input} to {@code output}. */
  @Timed(value = "statute.ingest", description = "Time to parse, write and register a statute")
  public StatuteHierarchy ingest(Path input, Path output) {
    return ingest(canLawConfig.getStatute().toActDescriptor(), input, output);
  }

  /**
   * Parses {@code input}, writes the result to {@code output} and registers it.
   *
   * @return the completed hierarchy
   */
  @Timed(value = "statute.ingest", description = "Time to parse, write and register a statute")
  public StatuteHierarchy ingest(ActDescriptor act, Path input, Path output) {
    StatuteHierarchy hierarchy = statuteParser.parse(input, act);
    hierarchyWriter.write(hierarchy, output);
    statuteRegistry.register(hierarchy);
    logSummary(hierarchy);
    return hierarchy;
  }

  private void logSummary(StatuteHierarchy hierarchy) {
    Map<String, Integer> stats = hierarchy.summaryStatistics();
    log.info(
        "Parsing summary for {}: total={}, parts={}, headings={}, sections={}, subsections={},"
            + " paragraphs={}, subparagraphs={}",
        hierarchy.getAct().actCode(),
        stats.get("total_nodes"),
        stats.get("parts"),
        stats.get("headings"),
        stats.get("sections"),
        stats.get("subsections"),
        stats.get("paragraphs"),
        stats.get("subparagraphs"));

    String sampleId = hierarchy.getAct().actCode() + "_s" + SAMPLE_SECTION;
    hierarchy
        .node(sampleId)
        .ifPresent(
            sample ->
                log.info(
                    "Sample s. {} '{}': citation={}, children={}, path={}",
                    SAMPLE_SECTION,
                    sample.getTitle(),
                    sample.getCitation(),
                    sample.getChildren().size(),
                    String.join(" > ", hierarchy.ancestorPath(sampleId))));
  }
}
