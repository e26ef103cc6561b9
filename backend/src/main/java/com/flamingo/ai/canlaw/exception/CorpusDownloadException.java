package com.flamingo.ai.canlaw.exception;

/** Exception thrown when a legal corpus could not be fetched within the configured attempts. */
public class CorpusDownloadException extends RuntimeException {

  private final String datasetConfig;
  private final int attempts;

  public CorpusDownloadException(String datasetConfig, int attempts, Throwable cause) {
    super(
        "Failed to download corpus "
            + datasetConfig
            + " after "
            + attempts
            + " attempts: "
            + cause.getMessage(),
        cause);
    this.datasetConfig = datasetConfig;
    this.attempts = attempts;
  }

  public String getDatasetConfig() {
    return datasetConfig;
  }

  public int getAttempts() {
    return attempts;
  }
}
