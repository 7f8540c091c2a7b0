package ca.gc.cra.logbridge.pipeline;

import ca.gc.cra.logbridge.provider.LoggerProviderCollection;
import ca.gc.cra.logbridge.provider.ProviderForwardingAppender;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fluent builder for a structured logging pipeline.
 * <p><strong>Why:</strong> Collects sinks, level rules and enrichers without touching the process-wide Logback
 * configuration; {@link #createLogger()} materialises them in a private {@link LoggerContext}.</p>
 * <p><strong>Defaults:</strong> minimum level {@link Level#INFO}, no sinks, no enrichers.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; configure on one thread, then call {@link #createLogger()}
 * once.</p>
 *
 * <pre>{@code
 * PipelineLogger logger = new LoggerConfiguration()
 *     .minimumLevel(Level.DEBUG)
 *     .minimumLevelOverride("org.springframework", Level.WARN)
 *     .enrichWithProperty("app", "billing")
 *     .writeToConsole()
 *     .createLogger();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LoggerConfiguration {
  /** Pattern used by console and file sinks when none is given. */
  public static final String DEFAULT_PATTERN =
      "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg %kvp%n";

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final List<Function<LoggerContext, Appender<ILoggingEvent>>> sinks = new ArrayList<>();
  private final List<LogEnricher> enrichers = new ArrayList<>();
  private final Map<String, Level> overrides = new LinkedHashMap<>();
  private Level minimumLevel = Level.INFO;
  private boolean created;

  /**
   * Sets the level below which events are discarded.
   *
   * @param level minimum level; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration minimumLevel(Level level) {
    this.minimumLevel = Objects.requireNonNull(level, "level");
    return this;
  }

  /**
   * Overrides the minimum level for {@code category} and its child categories.
   *
   * @param category dotted logger name prefix; must not be {@code null}
   * @param level level applied to the category; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration minimumLevelOverride(String category, Level level) {
    overrides.put(Objects.requireNonNull(category, "category"), Objects.requireNonNull(level, "level"));
    return this;
  }

  /**
   * Adds an appender. An appender without a context is bound to the pipeline's context, and started if needed.
   *
   * @param appender Logback appender; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration writeTo(Appender<ILoggingEvent> appender) {
    Objects.requireNonNull(appender, "appender");
    sinks.add(context -> appender);
    return this;
  }

  /**
   * Adds a console sink using {@link #DEFAULT_PATTERN}.
   *
   * @return this configuration
   */
  public LoggerConfiguration writeToConsole() {
    return writeToConsole(DEFAULT_PATTERN);
  }

  /**
   * Adds a console sink.
   *
   * @param pattern Logback layout pattern; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration writeToConsole(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    sinks.add(context -> {
      ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
      appender.setName("console");
      appender.setContext(context);
      appender.setEncoder(encoder(context, pattern));
      return appender;
    });
    return this;
  }

  /**
   * Adds an appending file sink.
   *
   * @param file target file; parent directories are created by Logback
   * @param pattern Logback layout pattern; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration writeToFile(Path file, String pattern) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(pattern, "pattern");
    sinks.add(context -> {
      FileAppender<ILoggingEvent> appender = new FileAppender<>();
      appender.setName("file");
      appender.setContext(context);
      appender.setFile(file.toString());
      appender.setAppend(true);
      appender.setEncoder(encoder(context, pattern));
      return appender;
    });
    return this;
  }

  /**
   * Forwards every accepted event to the providers of {@code providers}, including providers added after the
   * pipeline was built. Closing the pipeline closes the collection.
   *
   * @param providers provider collection; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration writeToProviders(LoggerProviderCollection providers) {
    Objects.requireNonNull(providers, "providers");
    sinks.add(context -> new ProviderForwardingAppender(providers));
    return this;
  }

  /**
   * Adds an enricher applied to every event.
   *
   * @param enricher enricher; must not be {@code null}
   * @return this configuration
   */
  public LoggerConfiguration enrichWith(LogEnricher enricher) {
    enrichers.add(Objects.requireNonNull(enricher, "enricher"));
    return this;
  }

  /**
   * Tags every event with {@code key=value} unless the event already carries {@code key}.
   *
   * @param key property name; must not be {@code null}
   * @param value property value
   * @return this configuration
   */
  public LoggerConfiguration enrichWithProperty(String key, Object value) {
    return enrichWith(LogEnricher.property(key, value));
  }

  /**
   * Builds the pipeline and returns its owning handle.
   *
   * @return owning logger; closing it stops every sink
   * @throws IllegalStateException if this configuration already created a logger
   */
  public PipelineLogger createLogger() {
    if (created) {
      throw new IllegalStateException("createLogger() may only be called once per configuration");
    }
    created = true;

    LoggerContext context = new LoggerContext();
    context.setName("pipeline-" + SEQUENCE.incrementAndGet());
    if (context.getMDCAdapter() == null) {
      context.setMDCAdapter(MDC.getMDCAdapter());
    }
    context.start();

    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(minimumLevel);
    overrides.forEach((category, level) -> context.getLogger(category).setLevel(level));
    for (Function<LoggerContext, Appender<ILoggingEvent>> sink : sinks) {
      Appender<ILoggingEvent> appender = sink.apply(context);
      if (appender.getContext() == null) {
        appender.setContext(context);
      }
      if (!appender.isStarted()) {
        appender.start();
      }
      root.addAppender(appender);
    }
    return PipelineLogger.owning(new Pipeline(context), enrichers);
  }

  private static PatternLayoutEncoder encoder(LoggerContext context, String pattern) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(pattern);
    encoder.start();
    return encoder;
  }
}
