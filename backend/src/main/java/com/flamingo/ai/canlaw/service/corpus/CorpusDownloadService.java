package com.flamingo.ai.canlaw.service.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.canlaw.config.CanLawConfig;
import com.flamingo.ai.canlaw.exception.CorpusDownloadException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Materializes remote legal case corpora on local storage before any parsing happens.
 *
 * <p>Each dataset configuration is fetched page by page and written as JSON Lines to {@code
 * {base-dir}/{config}/{split}.jsonl}. A failed fetch is retried from the first page up to the
 * configured number of attempts with a fixed delay; rows go to a {@code .part} file that only
 * replaces the destination once the whole split has been read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusDownloadService {

  static final String DOWNLOAD_TIMER = "corpus.download";

  private final HuggingFaceDatasetClient datasetClient;
  private final CanLawConfig canLawConfig;
  private final RetryRegistry retryRegistry;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Downloads every configured dataset configuration. A configuration that fails is logged and
   * left out of the result; the remaining ones are still fetched.
   *
   * @return destination file per successfully downloaded configuration, in configured order
   */
  @Timed(value = "corpus.download.all", description = "Time to download every configured corpus")
  public Map<String, Path> downloadAll() {
    List<String> configs = canLawConfig.getCorpus().getConfigs();
    log.info("Starting download of {} corpus configuration(s): {}", configs.size(), configs);

    Map<String, Path> downloaded = new LinkedHashMap<>();
    for (String config : configs) {
      try {
        downloaded.put(config, download(config));
      } catch (CorpusDownloadException e) {
        log.error("Giving up on corpus {}: {}", config, e.getMessage());
      }
    }
    log.info("Corpus download finished: {}/{} succeeded", downloaded.size(), configs.size());
    return downloaded;
  }

  /**
   * Downloads one dataset configuration with retries.
   *
   * @param datasetConfig configuration name, e.g. {@code SCC}
   * @return path of the written JSON Lines file
   * @throws CorpusDownloadException when every attempt failed
   */
  public Path download(String datasetConfig) {
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    Path destination = destinationFor(datasetConfig);
    Retry retry = retryFor(datasetConfig);

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Path written = retry.executeCallable(() -> fetchAndStore(datasetConfig, destination));
      meterRegistry.counter("corpus.download.attempts", "outcome", "success").increment();
      return written;
    } catch (Exception e) {
      meterRegistry.counter("corpus.download.attempts", "outcome", "failure").increment();
      throw new CorpusDownloadException(datasetConfig, corpus.getMaxAttempts(), e);
    } finally {
      sample.stop(meterRegistry.timer(DOWNLOAD_TIMER, "config", datasetConfig));
    }
  }

  Path destinationFor(String datasetConfig) {
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    return Path.of(corpus.getBaseDir(), datasetConfig.toLowerCase(Locale.ROOT))
        .resolve(corpus.getSplit() + ".jsonl");
  }

  // ---- private helpers ----

  private Retry retryFor(String datasetConfig) {
    String name = "corpus-" + datasetConfig.toLowerCase(Locale.ROOT);
    return retryRegistry
        .find(name)
        .orElseGet(
            () -> {
              CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
              RetryConfig config =
                  RetryConfig.custom()
                      .maxAttempts(corpus.getMaxAttempts())
                      .waitDuration(Duration.ofMillis(corpus.getRetryWaitMs()))
                      .build();
              Retry retry = retryRegistry.retry(name, config);
              retry
                  .getEventPublisher()
                  .onRetry(
                      event -> {
                        meterRegistry
                            .counter("corpus.download.attempts", "outcome", "retry")
                            .increment();
                        log.warn(
                            "Attempt {} to download {} failed: {}. Waiting {} before retrying...",
                            event.getNumberOfRetryAttempts(),
                            datasetConfig,
                            event.getLastThrowable() != null
                                ? event.getLastThrowable().getMessage()
                                : "unknown error",
                            event.getWaitInterval());
                      });
              return retry;
            });
  }

  private Path fetchAndStore(String datasetConfig, Path destination) throws IOException {
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    Files.createDirectories(destination.toAbsolutePath().getParent());
    Path partial = destination.resolveSibling(destination.getFileName() + ".part");

    log.info("Downloading {}-{} to {}", corpus.getDataset(), datasetConfig, destination);
    long written;
    try {
      written = writeRows(datasetConfig, partial);
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(partial);
      throw e;
    }

    Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
    log.info("Saved {} rows of {} to {}", written, datasetConfig, destination);
    return destination;
  }

  private long writeRows(String datasetConfig, Path partial) throws IOException {
    CanLawConfig.Corpus corpus = canLawConfig.getCorpus();
    long written = 0;
    try (BufferedWriter writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
      int offset = 0;
      while (true) {
        HuggingFaceDatasetClient.RowsPage page =
            datasetClient.fetchRows(
                corpus.getDataset(),
                datasetConfig,
                corpus.getSplit(),
                offset,
                corpus.getPageSize());
        if (page == null || page.rows() == null || page.rows().isEmpty()) {
          break;
        }
        for (HuggingFaceDatasetClient.RowEntry entry : page.rows()) {
          writer.write(objectMapper.writeValueAsString(entry.row()));
          writer.newLine();
          written++;
        }
        offset += page.rows().size();
        // Without a total the split ends at the first empty page.
        if (page.numRowsTotal() != null && offset >= page.numRowsTotal()) {
          break;
        }
      }
    }
    return written;
  }
}
