package ca.gc.cra.logbridge.provider;

import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered set of {@link LoggerProvider}s that a pipeline forwards events to.
 * <p><strong>Why:</strong> Providers are discovered in the container only after the pipeline is built, so the
 * pipeline holds this collection and the logger factory fills it later.</p>
 * <p><strong>Role:</strong> Shared between {@code LoggerConfiguration#writeToProviders} and
 * {@code PipelineLoggerFactory#addProvider}.</p>
 * <p><strong>Thread-safety:</strong> Copy-on-write; additions are rare, dispatch is lock-free.</p>
 *
 * @since 0.1.0
 * @see ProviderForwardingAppender
 */
public final class LoggerProviderCollection implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LoggerProviderCollection.class);

  private final List<LoggerProvider> providers = new CopyOnWriteArrayList<>();

  /**
   * Appends a provider; it receives every event dispatched after this call.
   *
   * @param provider provider to add; must not be {@code null}
   * @throws NullPointerException if {@code provider} is {@code null}
   */
  public void addProvider(LoggerProvider provider) {
    providers.add(Objects.requireNonNull(provider, "provider"));
  }

  /**
   * Returns the providers in insertion order.
   *
   * @return immutable snapshot
   */
  public List<LoggerProvider> providers() {
    return List.copyOf(providers);
  }

  void dispatch(ILoggingEvent event) {
    for (LoggerProvider provider : providers) {
      provider.log(event);
    }
  }

  /**
   * Closes every provider in insertion order. A failing provider does not prevent the others from closing.
   */
  @Override
  public void close() {
    for (LoggerProvider provider : providers) {
      try {
        provider.close();
      } catch (RuntimeException ex) {
        log.warn("Logger provider {} failed to close", provider.getClass().getName(), ex);
      }
    }
  }
}
