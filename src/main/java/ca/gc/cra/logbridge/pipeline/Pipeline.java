package ca.gc.cra.logbridge.pipeline;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.LoggerFactory;

/**
 * A private Logback {@link LoggerContext} shared by one owning {@link PipelineLogger} and all loggers derived from
 * it. Closes at most once.
 */
final class Pipeline {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Pipeline.class);

  private final LoggerContext context;
  private final AtomicBoolean closed;

  Pipeline(LoggerContext context) {
    this(context, false);
  }

  private Pipeline(LoggerContext context, boolean closed) {
    this.context = Objects.requireNonNull(context, "context");
    this.closed = new AtomicBoolean(closed);
  }

  static Pipeline silent() {
    LoggerContext context = new LoggerContext();
    context.setName("silent");
    context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.OFF);
    return new Pipeline(context, true);
  }

  Logger root() {
    return context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  }

  Logger logger(String name) {
    return context.getLogger(name);
  }

  boolean isOpen() {
    return !closed.get();
  }

  void close() {
    if (closed.compareAndSet(false, true)) {
      // Stopping the context flushes and stops every attached appender.
      context.stop();
      log.debug("Closed logging pipeline {}", context.getName());
    }
  }
}
