package ca.gc.cra.logbridge.slf4j;

import ca.gc.cra.logbridge.pipeline.LoggingEvents;
import ca.gc.cra.logbridge.pipeline.PipelineLogger;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.event.LoggingEvent;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.spi.LoggingEventAware;

/**
 * SLF4J logger handed out by {@link PipelineLoggerFactory}. Resolves its pipeline logger on every call, so a factory
 * bound to the global slot follows later reassignments of {@link ca.gc.cra.logbridge.pipeline.Log}.
 *
 * <p>{@code source} must already return a logger named after this category.</p>
 */
final class CategoryLogger extends LegacyAbstractLogger implements LoggingEventAware {
  private static final long serialVersionUID = 1L;

  private final transient Supplier<PipelineLogger> source;

  CategoryLogger(String name, Supplier<PipelineLogger> source) {
    this.name = Objects.requireNonNull(name, "name");
    this.source = Objects.requireNonNull(source, "source");
  }

  private PipelineLogger target() {
    return source.get();
  }

  @Override
  public void log(LoggingEvent event) {
    target().log(event);
  }

  @Override
  public boolean isTraceEnabled() {
    return target().isTraceEnabled();
  }

  @Override
  public boolean isDebugEnabled() {
    return target().isDebugEnabled();
  }

  @Override
  public boolean isInfoEnabled() {
    return target().isInfoEnabled();
  }

  @Override
  public boolean isWarnEnabled() {
    return target().isWarnEnabled();
  }

  @Override
  public boolean isErrorEnabled() {
    return target().isErrorEnabled();
  }

  @Override
  protected String getFullyQualifiedCallerName() {
    return AbstractLogger.class.getName();
  }

  @Override
  protected void handleNormalizedLoggingCall(
      Level level, Marker marker, String messagePattern, Object[] arguments, Throwable throwable) {
    log(LoggingEvents.create(
        level, this, getFullyQualifiedCallerName(), marker, messagePattern, arguments, throwable));
  }
}
