package ca.gc.cra.logbridge.provider;

import ch.qos.logback.classic.spi.ILoggingEvent;

/**
 * <strong>What:</strong> Secondary log destination that receives events already accepted by a pipeline.
 * <p><strong>Why:</strong> Lets applications keep non-Logback destinations registered in the container while the
 * pipeline's own appenders stay the primary sinks.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@link Slf4jLoggerProvider}; collected by
 * {@link LoggerProviderCollection}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent {@link #log(ILoggingEvent)} calls.</p>
 *
 * @implNote {@link #close()} may be called twice, once by the container and once by the collection that forwards to
 *     it; implementations must tolerate that.
 * @since 0.1.0
 */
public interface LoggerProvider extends AutoCloseable {
  /**
   * Receives one event after the pipeline's level checks and enrichment.
   *
   * @param event immutable Logback event; never {@code null}
   */
  void log(ILoggingEvent event);

  /**
   * Releases resources held by the provider. Default is a no-op.
   */
  @Override
  default void close() {}
}
