package ca.gc.cra.logbridge.provider;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.List;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * <strong>What:</strong> {@link LoggerProvider} that replays pipeline events into another SLF4J backend.
 * <p><strong>Why:</strong> Any {@link ILoggerFactory} (a second Logback context, a test double, a vendor binding) can
 * then act as a secondary destination without a dedicated appender.</p>
 * <p><strong>Mapping:</strong> logger name, level, formatted message, markers, key/value pairs and the original
 * throwable are carried over; the target applies its own level checks.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jLoggerProvider implements LoggerProvider {
  private final ILoggerFactory target;

  /**
   * Creates a provider writing to {@code target}.
   *
   * @param target SLF4J factory receiving the replayed events; must not be {@code null}
   * @throws NullPointerException if {@code target} is {@code null}
   */
  public Slf4jLoggerProvider(ILoggerFactory target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void log(ILoggingEvent event) {
    LoggingEventBuilder builder = target.getLogger(event.getLoggerName())
        .atLevel(toSlf4jLevel(event.getLevel()))
        .setMessage(event.getFormattedMessage());
    List<Marker> markers = event.getMarkerList();
    if (markers != null) {
      for (Marker marker : markers) {
        builder = builder.addMarker(marker);
      }
    }
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        builder = builder.addKeyValue(pair.key, pair.value);
      }
    }
    IThrowableProxy proxy = event.getThrowableProxy();
    if (proxy instanceof ThrowableProxy throwableProxy) {
      builder = builder.setCause(throwableProxy.getThrowable());
    }
    builder.log();
  }

  static org.slf4j.event.Level toSlf4jLevel(Level level) {
    int value = level.toInt();
    if (value >= Level.ERROR_INT) {
      return org.slf4j.event.Level.ERROR;
    }
    if (value >= Level.WARN_INT) {
      return org.slf4j.event.Level.WARN;
    }
    if (value >= Level.INFO_INT) {
      return org.slf4j.event.Level.INFO;
    }
    if (value >= Level.DEBUG_INT) {
      return org.slf4j.event.Level.DEBUG;
    }
    return org.slf4j.event.Level.TRACE;
  }
}
