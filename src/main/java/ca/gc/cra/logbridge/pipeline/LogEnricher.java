package ca.gc.cra.logbridge.pipeline;

import java.util.Objects;
import org.slf4j.event.DefaultLoggingEvent;

/**
 * Adds contextual key/value properties to an event before it reaches the pipeline's appenders.
 *
 * <p>Enrichers run on the emitting thread, in the order they were attached, against a private copy of the event.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogEnricher {
  /**
   * Adds properties to {@code event}, typically through {@link DefaultLoggingEvent#addKeyValue(String, Object)}.
   *
   * @param event mutable copy of the event being logged
   */
  void enrich(DefaultLoggingEvent event);

  /**
   * Enricher that adds {@code key=value} unless the event already carries {@code key}.
   *
   * @param key property name; must not be {@code null}
   * @param value property value; may be {@code null}
   * @return enricher adding the property
   * @throws NullPointerException if {@code key} is {@code null}
   */
  static LogEnricher property(String key, Object value) {
    Objects.requireNonNull(key, "key");
    return event -> {
      if (!LoggingEvents.hasKey(event, key)) {
        event.addKeyValue(key, value);
      }
    };
  }
}
