package com.flamingo.ai.canlaw.service.statute;

import com.flamingo.ai.canlaw.config.CanLawConfig;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Parses the configured Act once the application has started.
 *
 * <p>{@code --input=<xml>} and {@code --output=<json>} override the configured paths.
 */
@Component
@ConditionalOnProperty(name = "canlaw.statute.parse-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StatuteParsingRunner implements ApplicationRunner {

  private final StatuteIngestionService ingestionService;
  private final CanLawConfig canLawConfig;

  @Override
  public void run(ApplicationArguments args) {
    CanLawConfig.Statute statute = canLawConfig.getStatute();
    Path input = Path.of(option(args, "input", statute.getInputPath()));
    Path output = Path.of(option(args, "output", statute.getOutputPath()));
    log.info("Startup ingestion of {}: {} -> {}", statute.getActCode(), input, output);
    ingestionService.ingest(statute.toActDescriptor(), input, output);
  }

  private static String option(ApplicationArguments args, String name, String fallback) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? fallback : values.get(values.size() - 1);
  }
}
