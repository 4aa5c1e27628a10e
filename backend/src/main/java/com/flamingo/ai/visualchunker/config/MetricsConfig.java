package com.flamingo.ai.visualchunker.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring for the chunking pipeline.
 *
 * <p>Every {@code chunking.*} meter carries an {@code application} tag.
 */
@Configuration
public class MetricsConfig {

  /**
   * Backs the {@code @Timed} annotations on {@code chunkDocument}.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect chunkingTimedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Tags chunking meters with the application name.
   *
   * @param applicationName value of {@code spring.application.name}
   * @return the registry customizer
   */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> chunkingCommonTags(
      @Value("${spring.application.name}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
