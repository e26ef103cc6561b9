package com.flamingo.ai.canlaw.service.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.canlaw.config.CanLawConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the Hugging Face dataset viewer {@code /rows} endpoint. Encapsulates all
 * WebClient communication with the remote dataset service.
 */
@Component
@Slf4j
public class HuggingFaceDatasetClient {

  private final WebClient webClient;
  private final int readTimeoutMs;

  public HuggingFaceDatasetClient(CanLawConfig canLawConfig) {
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    this.readTimeoutMs = corpus.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(corpus.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
            .build();
    log.info("Dataset client initialized: baseUrl={}", corpus.getBaseUrl());
  }

  /**
   * Fetches one page of rows.
   *
   * @param dataset dataset name, e.g. {@code refugee-law-lab/canadian-legal-data}
   * @param config dataset configuration, e.g. {@code SCC}
   * @param split split name, e.g. {@code train}
   * @param offset index of the first row
   * @param length number of rows to return
   * @return the page, with the total row count of the split
   */
  public RowsPage fetchRows(String dataset, String config, String split, int offset, int length) {
    return webClient
        .get()
        .uri(
            builder ->
                builder
                    .path("/rows")
                    .queryParam("dataset", dataset)
                    .queryParam("config", config)
                    .queryParam("split", split)
                    .queryParam("offset", offset)
                    .queryParam("length", length)
                    .build())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(RowsPage.class)
        .timeout(Duration.ofMillis(readTimeoutMs))
        .block();
  }

  /** {@code /rows} response; {@code numRowsTotal} is null when the server omits it. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RowsPage(
      @JsonProperty("rows") List<RowEntry> rows,
      @JsonProperty("num_rows_total") Long numRowsTotal) {}

  /** One row with its position in the split. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RowEntry(@JsonProperty("row_idx") long rowIdx, @JsonProperty("row") JsonNode row) {}
}
