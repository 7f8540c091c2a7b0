package ca.gc.cra.logbridge.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Marker;
import org.slf4j.event.DefaultLoggingEvent;
import org.slf4j.event.Level;
import org.slf4j.event.LoggingEvent;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.spi.LoggingEventAware;

/**
 * <strong>What:</strong> Handle on a structured logging pipeline built by {@link LoggerConfiguration}.
 * <p><strong>Why:</strong> Gives application code a plain SLF4J {@link org.slf4j.Logger} while keeping the pipeline's
 * lifetime under explicit control.</p>
 * <p><strong>Ownership:</strong> only the handle returned by {@link LoggerConfiguration#createLogger()} owns the
 * pipeline. Loggers derived through {@link #forContext(LogEnricher)} or {@link #forCategory(String)} share its
 * appenders, and their {@link #close()} does nothing.</p>
 * <p><strong>Structure:</strong> key/value pairs added through the fluent API ({@code atInfo().addKeyValue(..)}) and
 * by enrichers reach Logback as {@code ILoggingEvent#getKeyValuePairs()}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; events are copied before enrichment.</p>
 * <p><strong>After close:</strong> every level check answers {@code false} and events are dropped silently.</p>
 *
 * @since 0.1.0
 * @see Log
 */
public final class PipelineLogger extends LegacyAbstractLogger implements LoggingEventAware, AutoCloseable {
  private static final long serialVersionUID = 1L;
  private static final PipelineLogger NONE = silent(Pipeline.silent());

  private final transient Pipeline pipeline;
  private final transient ch.qos.logback.classic.Logger target;
  private final transient List<LogEnricher> enrichers;
  private final boolean owner;

  private PipelineLogger(
      Pipeline pipeline,
      ch.qos.logback.classic.Logger target,
      List<LogEnricher> enrichers,
      boolean owner) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.target = Objects.requireNonNull(target, "target");
    this.enrichers = List.copyOf(enrichers);
    this.owner = owner;
    this.name = target.getName();
  }

  static PipelineLogger owning(Pipeline pipeline, List<LogEnricher> enrichers) {
    return new PipelineLogger(pipeline, pipeline.root(), enrichers, true);
  }

  private static PipelineLogger silent(Pipeline pipeline) {
    return new PipelineLogger(pipeline, pipeline.root(), List.of(), false);
  }

  /**
   * Returns the shared silent logger: every level is disabled and {@link #close()} does nothing.
   *
   * @return the no-op logger
   */
  public static PipelineLogger none() {
    return NONE;
  }

  /**
   * Derives a logger that applies {@code enricher} after this logger's own enrichers.
   *
   * @param enricher enricher to append; must not be {@code null}
   * @return a distinct, non-owning logger over the same pipeline
   * @throws NullPointerException if {@code enricher} is {@code null}
   */
  public PipelineLogger forContext(LogEnricher enricher) {
    Objects.requireNonNull(enricher, "enricher");
    List<LogEnricher> combined = new ArrayList<>(enrichers);
    combined.add(enricher);
    return new PipelineLogger(pipeline, target, combined, false);
  }

  /**
   * Derives a logger that tags every event with {@code key=value}.
   *
   * @param key property name; must not be {@code null}
   * @param value property value
   * @return a distinct, non-owning logger over the same pipeline
   */
  public PipelineLogger forContext(String key, Object value) {
    return forContext(LogEnricher.property(key, value));
  }

  /**
   * Derives a logger named {@code category}. Level overrides configured for the category (or a parent of it) apply,
   * and emitted events carry the category as their logger name.
   *
   * @param category dotted logger name; must not be {@code null}
   * @return a distinct, non-owning logger over the same pipeline
   */
  public PipelineLogger forCategory(String category) {
    Objects.requireNonNull(category, "category");
    return new PipelineLogger(pipeline, pipeline.logger(category), enrichers, false);
  }

  /**
   * Reports whether this handle closes the pipeline when closed.
   *
   * @return {@code true} for the handle created by {@link LoggerConfiguration#createLogger()}
   */
  public boolean ownsPipeline() {
    return owner;
  }

  /**
   * Reports whether the underlying pipeline has been closed.
   *
   * @return {@code true} once the owning handle was closed, and always for {@link #none()}
   */
  public boolean isClosed() {
    return !pipeline.isOpen();
  }

  /**
   * Reports whether this logger shares its pipeline with {@code other}.
   *
   * @param other logger to compare with
   * @return {@code true} when both write through the same appenders
   */
  public boolean sharesPipelineWith(PipelineLogger other) {
    return other != null && other.pipeline == pipeline;
  }

  @Override
  public void log(LoggingEvent event) {
    // Logback skips its own level check for pre-built events.
    if (!pipeline.isOpen() || !isEnabledForLevel(event.getLevel())) {
      return;
    }
    DefaultLoggingEvent copy = LoggingEvents.copyOf(event, this);
    for (LogEnricher enricher : enrichers) {
      enricher.enrich(copy);
    }
    target.log(copy);
  }

  /**
   * Closes the pipeline when this handle owns it; otherwise does nothing. Idempotent.
   */
  @Override
  public void close() {
    if (owner) {
      pipeline.close();
    }
  }

  @Override
  public boolean isTraceEnabled() {
    return pipeline.isOpen() && target.isTraceEnabled();
  }

  @Override
  public boolean isDebugEnabled() {
    return pipeline.isOpen() && target.isDebugEnabled();
  }

  @Override
  public boolean isInfoEnabled() {
    return pipeline.isOpen() && target.isInfoEnabled();
  }

  @Override
  public boolean isWarnEnabled() {
    return pipeline.isOpen() && target.isWarnEnabled();
  }

  @Override
  public boolean isErrorEnabled() {
    return pipeline.isOpen() && target.isErrorEnabled();
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
