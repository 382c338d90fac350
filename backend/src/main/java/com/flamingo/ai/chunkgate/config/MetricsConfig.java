package com.flamingo.ai.chunkgate.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the aspect behind the filtering timers. {@code chunk_filter.filter} and {@code
 * chunk_filter.assess} are recorded from {@code @Timed} on the filtering service; the pass, reject
 * and fallback counters are incremented directly.
 */
@Configuration
public class MetricsConfig {

  /** Aspect that turns {@code @Timed} methods into timers on the shared registry. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
