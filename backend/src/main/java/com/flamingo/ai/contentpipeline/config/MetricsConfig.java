package com.flamingo.ai.contentpipeline.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the capability and retrieval services.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every pipeline and corpus meter with the application name. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer() {
    return registry -> registry.config().commonTags("application", "content-pipeline");
  }
}
