package ca.gc.cra.logbridge.provider;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.util.Objects;

/**
 * Logback appender that hands every event to the providers of a {@link LoggerProviderCollection}.
 *
 * <p>Stopping the appender closes the collection, so providers are released together with the pipeline that owns
 * the appender.</p>
 *
 * @since 0.1.0
 */
public final class ProviderForwardingAppender extends AppenderBase<ILoggingEvent> {
  /** Name under which the appender is attached to a pipeline's root logger. */
  public static final String NAME = "providers";

  private final LoggerProviderCollection providers;

  /**
   * Creates an appender over {@code providers}.
   *
   * @param providers target collection; must not be {@code null}
   * @throws NullPointerException if {@code providers} is {@code null}
   */
  public ProviderForwardingAppender(LoggerProviderCollection providers) {
    this.providers = Objects.requireNonNull(providers, "providers");
    setName(NAME);
  }

  @Override
  protected void append(ILoggingEvent event) {
    providers.dispatch(event);
  }

  @Override
  public void stop() {
    boolean wasStarted = isStarted();
    super.stop();
    if (wasStarted) {
      providers.close();
    }
  }
}
