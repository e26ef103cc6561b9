package com.flamingo.ai.canlaw.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for parser and ingestion metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation used on the ingestion and bulk download entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the configured act code so several Acts can share one registry. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> actCodeTag(CanLawConfig canLawConfig) {
    return registry ->
        registry.config().commonTags("act_code", canLawConfig.getStatute().getActCode());
  }
}
