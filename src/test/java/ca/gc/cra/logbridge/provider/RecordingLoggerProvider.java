package ca.gc.cra.logbridge.provider;

import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test provider that records every event and counts close calls.
 */
public final class RecordingLoggerProvider implements LoggerProvider {
  private final List<ILoggingEvent> events = new CopyOnWriteArrayList<>();
  private final AtomicInteger closeCount = new AtomicInteger();

  @Override
  public void log(ILoggingEvent event) {
    events.add(event);
  }

  @Override
  public void close() {
    closeCount.incrementAndGet();
  }

  public List<ILoggingEvent> events() {
    return events;
  }

  public List<String> messages() {
    return events.stream().map(ILoggingEvent::getFormattedMessage).toList();
  }

  public int closeCount() {
    return closeCount.get();
  }
}
