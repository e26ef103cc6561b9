package com.flamingo.ai.canlaw.service.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.canlaw.config.CanLawConfig;
import com.flamingo.ai.canlaw.exception.CorpusDownloadException;
import com.flamingo.ai.canlaw.service.corpus.HuggingFaceDatasetClient.RowEntry;
import com.flamingo.ai.canlaw.service.corpus.HuggingFaceDatasetClient.RowsPage;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CorpusDownloadService Tests")
class CorpusDownloadServiceTest {

  private static final String DATASET = "refugee-law-lab/canadian-legal-data";

  @Mock private HuggingFaceDatasetClient datasetClient;

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private CanLawConfig canLawConfig;
  private SimpleMeterRegistry meterRegistry;
  private CorpusDownloadService service;

  @BeforeEach
  void setUp() {
    canLawConfig = new CanLawConfig();
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    corpus.setBaseDir(tempDir.resolve("cases").toString());
    corpus.setPageSize(2);
    corpus.setMaxAttempts(3);
    corpus.setRetryWaitMs(1);
    meterRegistry = new SimpleMeterRegistry();
    service =
        new CorpusDownloadService(
            datasetClient, canLawConfig, RetryRegistry.ofDefaults(), objectMapper, meterRegistry);
  }

  private RowEntry row(long index, String name) throws Exception {
    return new RowEntry(
        index, objectMapper.readTree("{\"citation\":\"" + name + "\",\"year\":2020}"));
  }

  private double attempts(String outcome) {
    return meterRegistry.counter("corpus.download.attempts", "outcome", outcome).count();
  }

  @Nested
  @DisplayName("Single configuration")
  class SingleConfiguration {

    @Test
    @DisplayName("should page through the split and write one JSON line per row")
    void shouldWriteAllPages() throws Exception {
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 0, 2))
          .thenReturn(new RowsPage(List.of(row(0, "2020 SCC 1"), row(1, "2020 SCC 2")), 3L));
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 2, 2))
          .thenReturn(new RowsPage(List.of(row(2, "2020 SCC 3")), 3L));

      Path written = service.download("SCC");

      assertThat(written).isEqualTo(tempDir.resolve("cases/scc/train.jsonl"));
      List<String> lines = Files.readAllLines(written);
      assertThat(lines).hasSize(3);
      assertThat(objectMapper.readTree(lines.get(2)).get("citation").asText())
          .isEqualTo("2020 SCC 3");
      assertThat(written.resolveSibling("train.jsonl.part")).doesNotExist();
      assertThat(attempts("success")).isEqualTo(1.0);
      assertThat(meterRegistry.get("corpus.download").tag("config", "SCC").timer().count())
          .isEqualTo(1L);
    }

    @Test
    @DisplayName("should read until an empty page when the total row count is missing")
    void shouldReadUntilEmptyPage_whenTotalMissing() throws Exception {
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 0, 2))
          .thenReturn(new RowsPage(List.of(row(0, "2020 SCC 1"), row(1, "2020 SCC 2")), null));
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 2, 2))
          .thenReturn(new RowsPage(List.of(row(2, "2020 SCC 3")), null));
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 3, 2))
          .thenReturn(new RowsPage(List.of(), null));

      Path written = service.download("SCC");

      assertThat(Files.readAllLines(written)).hasSize(3);
      verify(datasetClient).fetchRows(DATASET, "SCC", "train", 3, 2);
    }

    @Test
    @DisplayName("should stop at an empty page even when the total is larger")
    void shouldStop_whenPageEmpty() throws Exception {
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 0, 2))
          .thenReturn(new RowsPage(List.of(row(0, "2020 SCC 1")), 10L));
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 1, 2))
          .thenReturn(new RowsPage(List.of(), 10L));

      Path written = service.download("SCC");

      assertThat(Files.readAllLines(written)).hasSize(1);
    }

    @Test
    @DisplayName("should retry from the first page after a failed attempt")
    void shouldRetry_whenFetchFails() throws Exception {
      when(datasetClient.fetchRows(DATASET, "SCC", "train", 0, 2))
          .thenThrow(new IllegalStateException("503 Service Unavailable"))
          .thenReturn(new RowsPage(List.of(row(0, "2020 SCC 1")), 1L));

      Path written = service.download("SCC");

      assertThat(Files.readAllLines(written)).hasSize(1);
      verify(datasetClient, times(2)).fetchRows(DATASET, "SCC", "train", 0, 2);
      assertThat(attempts("retry")).isEqualTo(1.0);
      assertThat(attempts("success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should give up after the configured attempts without a destination file")
    void shouldThrow_whenAttemptsExhausted() {
      when(datasetClient.fetchRows(anyString(), anyString(), anyString(), anyInt(), anyInt()))
          .thenThrow(new IllegalStateException("connection refused"));

      assertThatThrownBy(() -> service.download("SCC"))
          .isInstanceOf(CorpusDownloadException.class)
          .hasMessageContaining("SCC")
          .hasMessageContaining("3 attempts")
          .hasRootCauseMessage("connection refused");

      verify(datasetClient, times(3))
          .fetchRows(anyString(), eq("SCC"), anyString(), anyInt(), anyInt());
      assertThat(tempDir.resolve("cases/scc/train.jsonl")).doesNotExist();
      assertThat(tempDir.resolve("cases/scc/train.jsonl.part")).doesNotExist();
      assertThat(attempts("failure")).isEqualTo(1.0);
      assertThat(meterRegistry.get("corpus.download").tag("config", "SCC").timer().count())
          .isEqualTo(1L);
    }

    @Test
    @DisplayName("should lower-case the configuration in the destination path")
    void shouldLowerCaseDestination() {
      canLawConfig.getCorpus().setSplit("test");

      assertThat(service.destinationFor("FC"))
          .isEqualTo(tempDir.resolve("cases").resolve("fc").resolve("test.jsonl"));
    }
  }

  @Nested
  @DisplayName("All configurations")
  class AllConfigurations {

    @Test
    @DisplayName("should continue with the remaining configurations after a failure")
    void shouldContinue_whenOneConfigurationFails() throws Exception {
      canLawConfig.getCorpus().setConfigs(List.of("SCC", "FC"));
      when(datasetClient.fetchRows(anyString(), eq("SCC"), anyString(), anyInt(), anyInt()))
          .thenThrow(new IllegalStateException("timeout"));
      when(datasetClient.fetchRows(anyString(), eq("FC"), anyString(), anyInt(), anyInt()))
          .thenReturn(new RowsPage(List.of(row(0, "2021 FC 7")), 1L));

      Map<String, Path> downloaded = service.downloadAll();

      assertThat(downloaded).containsOnlyKeys("FC");
      assertThat(downloaded.get("FC")).exists();
      assertThat(tempDir.resolve("cases/scc/train.jsonl")).doesNotExist();
    }
  }
}
