package com.flamingo.ai.canlaw.exception;

import java.nio.file.Path;

/** Exception thrown when a parsed hierarchy cannot be written to its JSON sink. */
public class StatuteExportException extends RuntimeException {

  private final Path outputPath;

  public StatuteExportException(Path outputPath, Throwable cause) {
    super("Failed to write statute hierarchy to " + outputPath + ": " + cause.getMessage(), cause);
    this.outputPath = outputPath;
  }

  public Path getOutputPath() {
    return outputPath;
  }
}
