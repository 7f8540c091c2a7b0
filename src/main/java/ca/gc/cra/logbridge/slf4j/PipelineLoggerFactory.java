package ca.gc.cra.logbridge.slf4j;

import ca.gc.cra.logbridge.pipeline.Log;
import ca.gc.cra.logbridge.pipeline.PipelineLogger;
import ca.gc.cra.logbridge.provider.LoggerProvider;
import ca.gc.cra.logbridge.provider.LoggerProviderCollection;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> SLF4J {@link ILoggerFactory} whose loggers write into a structured logging pipeline.
 * <p><strong>Why:</strong> Application code depends on SLF4J only; the container decides which pipeline backs it and
 * who closes that pipeline.</p>
 * <p><strong>Source:</strong> with a {@link PipelineLogger}, loggers write to it; with {@code null}, each call resolves
 * {@link Log#getLogger()}, so the factory follows later reassignments of the global slot.</p>
 * <p><strong>Disposal:</strong> when {@code dispose} is set, {@link #close()} closes the given logger, or calls
 * {@link Log#closeAndFlush()} when no logger was given. Without {@code dispose}, closing the factory leaves every
 * pipeline running.</p>
 * <p><strong>Providers:</strong> {@link #addProvider(LoggerProvider)} only has an effect when a
 * {@link LoggerProviderCollection} was supplied; that collection must be wired into the pipeline with
 * {@code LoggerConfiguration#writeToProviders}.</p>
 * <p><strong>Thread-safety:</strong> Loggers are cached in a concurrent map; closing is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class PipelineLoggerFactory implements ILoggerFactory, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineLoggerFactory.class);

  private final PipelineLogger logger;
  private final boolean dispose;
  private final LoggerProviderCollection providers;
  private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a factory over the global slot that never closes it.
   */
  public PipelineLoggerFactory() {
    this(null, false, null);
  }

  /**
   * Creates a factory without provider support.
   *
   * @param logger pipeline logger, or {@code null} for the global slot
   * @param dispose whether {@link #close()} releases the logger (or the global slot)
   */
  public PipelineLoggerFactory(PipelineLogger logger, boolean dispose) {
    this(logger, dispose, null);
  }

  /**
   * Creates a factory.
   *
   * @param logger pipeline logger, or {@code null} for the global slot
   * @param dispose whether {@link #close()} releases the logger (or the global slot)
   * @param providers collection receiving providers passed to {@link #addProvider(LoggerProvider)}; may be
   *     {@code null}
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The factory shares the caller's pipeline handle and provider collection on purpose.")
  public PipelineLoggerFactory(PipelineLogger logger, boolean dispose, LoggerProviderCollection providers) {
    this.logger = logger;
    this.dispose = dispose;
    this.providers = providers;
  }

  @Override
  public Logger getLogger(String name) {
    return loggers.computeIfAbsent(Objects.requireNonNull(name, "name"), this::newLogger);
  }

  private Logger newLogger(String name) {
    Supplier<PipelineLogger> source;
    if (logger != null) {
      PipelineLogger category = logger.forCategory(name);
      source = () -> category;
    } else {
      source = new GlobalCategorySource(name);
    }
    return new CategoryLogger(name, source);
  }

  /**
   * Adds a secondary provider to the provider collection.
   *
   * @param provider provider to add; must not be {@code null}
   * @throws NullPointerException if {@code provider} is {@code null}
   */
  public void addProvider(LoggerProvider provider) {
    Objects.requireNonNull(provider, "provider");
    if (providers == null) {
      log.warn("Ignoring logger provider {}; no provider collection was configured",
          provider.getClass().getName());
      return;
    }
    providers.addProvider(provider);
  }

  /**
   * Releases the pipeline when this factory was created with {@code dispose}. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true) || !dispose) {
      return;
    }
    if (logger != null) {
      logger.close();
    } else {
      Log.closeAndFlush();
    }
  }

  /**
   * Derives the category logger from the global slot, re-deriving only when the slot holds a different logger.
   */
  static final class GlobalCategorySource implements Supplier<PipelineLogger> {
    private final String category;
    private final AtomicReference<Derived> current = new AtomicReference<>();

    GlobalCategorySource(String category) {
      this.category = category;
    }

    @Override
    public PipelineLogger get() {
      PipelineLogger global = Log.getLogger();
      Derived derived = current.get();
      if (derived == null || derived.source() != global) {
        derived = new Derived(global, global.forCategory(category));
        current.set(derived);
      }
      return derived.logger();
    }

    private record Derived(PipelineLogger source, PipelineLogger logger) {}
  }
}
