package ca.gc.cra.logbridge.config;

import ca.gc.cra.logbridge.pipeline.LoggerConfiguration;
import org.springframework.context.ApplicationContext;

/**
 * Callback that configures a pipeline with access to the container, e.g. to read the
 * {@link org.springframework.core.env.Environment} or resolve application beans.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LoggerConfigurer {
  /**
   * Applies sinks, levels and enrichers to {@code configuration}.
   *
   * @param services the container being resolved
   * @param configuration builder for the pipeline
   */
  void configure(ApplicationContext services, LoggerConfiguration configuration);
}
