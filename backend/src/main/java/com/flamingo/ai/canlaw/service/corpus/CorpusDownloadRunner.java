package com.flamingo.ai.canlaw.service.corpus;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fetches the configured case-law corpora when the application starts. */
@Component
@Order(0)
@ConditionalOnProperty(name = "canlaw.corpus.download-on-startup", havingValue = "true")
@RequiredArgsConstructor
public class CorpusDownloadRunner implements ApplicationRunner {

  private final CorpusDownloadService corpusDownloadService;

  @Override
  public void run(ApplicationArguments args) {
    corpusDownloadService.downloadAll();
  }
}
