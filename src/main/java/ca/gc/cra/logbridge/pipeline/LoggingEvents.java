package ca.gc.cra.logbridge.pipeline;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.Marker;
import org.slf4j.event.DefaultLoggingEvent;
import org.slf4j.event.KeyValuePair;
import org.slf4j.event.Level;
import org.slf4j.event.LoggingEvent;

/**
 * Helpers for building and copying SLF4J {@link LoggingEvent}s on their way into a pipeline.
 *
 * @since 0.1.0
 */
public final class LoggingEvents {

  private LoggingEvents() {
    // Utility
  }

  /**
   * Builds an event from the arguments of a classic (non-fluent) SLF4J call.
   *
   * @param level event level
   * @param logger logger the event is attributed to
   * @param callerBoundary fully qualified name of the last logging-framework class on the stack
   * @param marker optional marker
   * @param pattern message pattern using {@code {}} placeholders
   * @param arguments optional placeholder arguments
   * @param throwable optional cause
   * @return a new mutable event
   */
  public static DefaultLoggingEvent create(
      Level level,
      Logger logger,
      String callerBoundary,
      Marker marker,
      String pattern,
      Object[] arguments,
      Throwable throwable) {
    DefaultLoggingEvent event = new DefaultLoggingEvent(level, logger);
    event.setCallerBoundary(callerBoundary);
    event.setMessage(pattern);
    if (marker != null) {
      event.addMarker(marker);
    }
    if (arguments != null && arguments.length > 0) {
      event.addArguments(arguments);
    }
    if (throwable != null) {
      event.setThrowable(throwable);
    }
    return event;
  }

  /**
   * Copies {@code source} so that enrichment never mutates an event owned by the caller.
   *
   * @param source event to copy
   * @param logger logger the copy is attributed to
   * @return a new mutable event with the same level, message, arguments, markers, properties and cause
   */
  public static DefaultLoggingEvent copyOf(LoggingEvent source, Logger logger) {
    DefaultLoggingEvent copy = new DefaultLoggingEvent(source.getLevel(), logger);
    copy.setCallerBoundary(source.getCallerBoundary());
    copy.setMessage(source.getMessage());
    if (source.getTimeStamp() != 0L) {
      copy.setTimeStamp(source.getTimeStamp());
    }
    List<Marker> markers = source.getMarkers();
    if (markers != null) {
      markers.forEach(copy::addMarker);
    }
    Object[] arguments = source.getArgumentArray();
    if (arguments != null && arguments.length > 0) {
      copy.addArguments(arguments);
    }
    List<KeyValuePair> pairs = source.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        copy.addKeyValue(pair.key, pair.value);
      }
    }
    if (source.getThrowable() != null) {
      copy.setThrowable(source.getThrowable());
    }
    return copy;
  }

  /**
   * Reports whether {@code event} already carries a property named {@code key}.
   *
   * @param event event to inspect
   * @param key property name
   * @return {@code true} when a key/value pair with that key is present
   */
  public static boolean hasKey(LoggingEvent event, String key) {
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs == null) {
      return false;
    }
    for (KeyValuePair pair : pairs) {
      if (key.equals(pair.key)) {
        return true;
      }
    }
    return false;
  }
}
