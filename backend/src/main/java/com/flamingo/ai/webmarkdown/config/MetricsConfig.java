package com.flamingo.ai.webmarkdown.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for conversion metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Registry used when the embedding application does not provide one (no actuator on the
   * classpath).
   *
   * @return an in-memory meter registry
   */
  @Bean
  @ConditionalOnMissingBean(MeterRegistry.class)
  public MeterRegistry simpleMeterRegistry() {
    return new SimpleMeterRegistry();
  }
}
