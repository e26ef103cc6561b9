package com.flamingo.ai.canlaw.service.statute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.canlaw.exception.StatuteExportException;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import com.flamingo.ai.canlaw.service.statute.model.StatuteNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders a completed {@link StatuteHierarchy} as the JSON document consumed by the retrieval
 * indexer.
 *
 * <p>The top-level key set and order ({@code act_code}, {@code act_name}, {@code root_id}, {@code
 * nodes}, {@code stats}) and the per-node field names are part of the indexing contract and must
 * not change.
 *
 * <p>{@code stats} always carries {@code total_nodes} followed by one count per node kind: {@code
 * acts}, {@code parts}, {@code headings}, {@code sections}, {@code subsections}, {@code
 * paragraphs}, {@code subparagraphs}. Kinds absent from the Act are reported as 0.
 */
@Component
@Slf4j
public class StatuteHierarchyWriter {

  private final ObjectMapper mapper =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  /**
   * Writes the hierarchy to {@code outputPath} as UTF-8, creating parent directories as needed.
   *
   * @throws StatuteExportException if the file cannot be written
   */
  public void write(StatuteHierarchy hierarchy, Path outputPath) {
    try {
      Path parent = outputPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
        mapper.writeValue(writer, toDocument(hierarchy));
      }
      log.info("Saved {} hierarchy to {}", hierarchy.getAct().actCode(), outputPath);
    } catch (IOException e) {
      throw new StatuteExportException(outputPath, e);
    }
  }

  public String toJson(StatuteHierarchy hierarchy) {
    try {
      return mapper.writeValueAsString(toDocument(hierarchy));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  HierarchyDocument toDocument(StatuteHierarchy hierarchy) {
    if (!hierarchy.isComplete()) {
      throw new IllegalStateException(
          "Hierarchy for " + hierarchy.getAct().actCode() + " is still being built");
    }
    return new HierarchyDocument(
        hierarchy.getAct().actCode(),
        hierarchy.getAct().actName(),
        hierarchy.getRootId(),
        hierarchy.nodes(),
        hierarchy.summaryStatistics());
  }

  @JsonPropertyOrder({"act_code", "act_name", "root_id", "nodes", "stats"})
  record HierarchyDocument(
      @JsonProperty("act_code") String actCode,
      @JsonProperty("act_name") String actName,
      @JsonProperty("root_id") String rootId,
      @JsonProperty("nodes") Map<String, StatuteNode> nodes,
      @JsonProperty("stats") Map<String, Integer> stats) {}
}
