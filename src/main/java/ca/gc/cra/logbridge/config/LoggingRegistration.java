package ca.gc.cra.logbridge.config;

import ca.gc.cra.logbridge.pipeline.Log;
import ca.gc.cra.logbridge.pipeline.LogEnricher;
import ca.gc.cra.logbridge.pipeline.LoggerConfiguration;
import ca.gc.cra.logbridge.pipeline.PipelineLogger;
import ca.gc.cra.logbridge.provider.LoggerProvider;
import ca.gc.cra.logbridge.provider.LoggerProviderCollection;
import ca.gc.cra.logbridge.slf4j.PipelineLoggerFactory;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.DefaultLoggingEvent;
import org.springframework.beans.factory.config.BeanDefinitionCustomizer;
import org.springframework.context.support.GenericApplicationContext;

/**
 * <strong>What:</strong> Registers a structured logging pipeline as the SLF4J {@link ILoggerFactory} of a Spring
 * container.
 * <p><strong>Why:</strong> The container closes every {@link AutoCloseable} singleton it built. A pipeline handle
 * registered directly would be closed by the container even when the caller, or the global {@link Log} slot, is
 * meant to own it. The registrations below decide explicitly which single party closes the pipeline.</p>
 * <p><strong>Entry points:</strong>
 * <ul>
 *   <li>{@link #usePipelineLogging(GenericApplicationContext, PipelineLogger, boolean, LoggerProviderCollection)}:
 *       wrap an existing logger (or the global slot).</li>
 *   <li>{@link #usePipelineLogging(GenericApplicationContext, Consumer, boolean, boolean)}: build the pipeline from a
 *       configuration callback.</li>
 *   <li>{@link #usePipelineLogging(GenericApplicationContext, LoggerConfigurer, boolean, boolean)}: same, with the
 *       container passed to the callback.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> registration only adds lazy bean definitions; the pipeline is built on the first
 * lookup of the logger factory (or of {@link PipelineLogger}) and closed when the container closes.</p>
 * <p><strong>Thread-safety:</strong> Call once per container on the composition thread, before
 * {@code refresh()}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingRegistration {
  /** Bean name of the registered {@link ILoggerFactory}; registering again replaces the previous definition. */
  public static final String LOGGER_FACTORY_BEAN = "pipelineLoggerFactory";

  private static final Logger log = LoggerFactory.getLogger(LoggingRegistration.class);
  private static final BeanDefinitionCustomizer LAZY = definition -> definition.setLazyInit(true);

  private LoggingRegistration() {
    // Utility
  }

  /**
   * Registers a logger factory over the global slot that leaves the slot open on container close.
   *
   * @param context container to register into; must not be {@code null}
   * @return {@code context}
   * @throws NullPointerException if {@code context} is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(GenericApplicationContext context) {
    return usePipelineLogging(context, null, false, null);
  }

  /**
   * Registers a logger factory over an existing logger.
   *
   * @param context container to register into; must not be {@code null}
   * @param logger pipeline logger, or {@code null} to read the global slot on every call
   * @param dispose whether closing the container closes {@code logger} (or the global slot when it is {@code null})
   * @return {@code context}
   * @throws NullPointerException if {@code context} is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context, PipelineLogger logger, boolean dispose) {
    return usePipelineLogging(context, logger, dispose, null);
  }

  /**
   * Registers a logger factory over an existing logger, optionally forwarding events to container providers.
   *
   * <p>When {@code providers} is given, every {@link LoggerProvider} bean is added to it as the factory is built;
   * {@code providers} must already be wired into {@code logger}'s pipeline with
   * {@link LoggerConfiguration#writeToProviders(LoggerProviderCollection)}.</p>
   *
   * @param context container to register into; must not be {@code null}
   * @param logger pipeline logger, or {@code null} to read the global slot on every call
   * @param dispose whether closing the container closes {@code logger} (or the global slot when it is {@code null})
   * @param providers collection receiving the container's providers; may be {@code null}
   * @return {@code context}
   * @throws NullPointerException if {@code context} is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context,
      PipelineLogger logger,
      boolean dispose,
      LoggerProviderCollection providers) {
    Objects.requireNonNull(context, "context");
    context.registerBean(LOGGER_FACTORY_BEAN, ILoggerFactory.class, () -> {
      PipelineLoggerFactory factory = new PipelineLoggerFactory(logger, dispose, providers);
      if (providers != null) {
        addContainerProviders(context, factory);
      }
      return factory;
    }, LAZY);
    return context;
  }

  /**
   * Registers a pipeline built from {@code configureLogger}, replacing the global slot and closing it with the
   * container.
   *
   * @param context container to register into; must not be {@code null}
   * @param configureLogger pipeline configuration callback; must not be {@code null}
   * @return {@code context}
   * @throws NullPointerException if an argument is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context, Consumer<LoggerConfiguration> configureLogger) {
    return usePipelineLogging(context, configureLogger, false, false);
  }

  /**
   * Registers a pipeline built from {@code configureLogger}.
   *
   * @param context container to register into; must not be {@code null}
   * @param configureLogger pipeline configuration callback; must not be {@code null}
   * @param preserveGlobalLogger keep the global slot untouched instead of assigning the new pipeline to it
   * @param writeToProviders also forward events to every {@link LoggerProvider} bean
   * @return {@code context}
   * @throws NullPointerException if an argument is {@code null}
   * @see #usePipelineLogging(GenericApplicationContext, LoggerConfigurer, boolean, boolean)
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context,
      Consumer<LoggerConfiguration> configureLogger,
      boolean preserveGlobalLogger,
      boolean writeToProviders) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(configureLogger, "configureLogger");
    return usePipelineLogging(
        context,
        (services, configuration) -> configureLogger.accept(configuration),
        preserveGlobalLogger,
        writeToProviders);
  }

  /**
   * Registers a pipeline built from {@code configureLogger} with container access, replacing the global slot and
   * closing it with the container.
   *
   * @param context container to register into; must not be {@code null}
   * @param configureLogger pipeline configuration callback; must not be {@code null}
   * @return {@code context}
   * @throws NullPointerException if an argument is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context, LoggerConfigurer configureLogger) {
    return usePipelineLogging(context, configureLogger, false, false);
  }

  /**
   * Registers a pipeline built from {@code configureLogger} with container access.
   *
   * <p>Three singletons are registered, all built on first lookup:
   * <ol>
   *   <li>a private holder of the pipeline's owning handle, invisible to the container's close handling;</li>
   *   <li>a {@link PipelineLogger} for injection: a distinct, non-owning logger over the same pipeline;</li>
   *   <li>the {@link ILoggerFactory} under {@link #LOGGER_FACTORY_BEAN}, the single owner of the pipeline.</li>
   * </ol>
   * <p>With {@code preserveGlobalLogger == false} the pipeline is assigned to {@link Log} and the factory closes it
   * through {@link Log#closeAndFlush()}, which also resets the slot to {@link PipelineLogger#none()}. With
   * {@code preserveGlobalLogger == true} the factory closes the handle directly and the slot is never touched.</p>
   *
   * @param context container to register into; must not be {@code null}
   * @param configureLogger pipeline configuration callback, invoked at most once per container; must not be
   *     {@code null}
   * @param preserveGlobalLogger keep the global slot untouched instead of assigning the new pipeline to it
   * @param writeToProviders also forward events to every {@link LoggerProvider} bean
   * @return {@code context}
   * @throws NullPointerException if an argument is {@code null}
   */
  public static GenericApplicationContext usePipelineLogging(
      GenericApplicationContext context,
      LoggerConfigurer configureLogger,
      boolean preserveGlobalLogger,
      boolean writeToProviders) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(configureLogger, "configureLogger");

    LoggerProviderCollection loggerProviders = writeToProviders ? new LoggerProviderCollection() : null;

    context.registerBean(RegisteredLogger.class, () -> {
      LoggerConfiguration configuration = new LoggerConfiguration();
      if (loggerProviders != null) {
        configuration.writeToProviders(loggerProviders);
      }
      configureLogger.configure(context, configuration);
      return new RegisteredLogger(configuration.createLogger());
    }, LAZY);

    // Derived through NullEnricher so the injected instance does not own the pipeline.
    context.registerBean(PipelineLogger.class,
        () -> context.getBean(RegisteredLogger.class).logger().forContext(NullEnricher.INSTANCE),
        LAZY);

    context.registerBean(LOGGER_FACTORY_BEAN, ILoggerFactory.class, () -> {
      PipelineLogger logger = context.getBean(RegisteredLogger.class).logger();

      PipelineLogger registeredLogger = null;
      if (preserveGlobalLogger) {
        registeredLogger = logger;
      } else {
        // A null logger makes the factory close through Log.closeAndFlush(), which also resets the slot.
        Log.setLogger(logger);
      }

      PipelineLoggerFactory factory = new PipelineLoggerFactory(registeredLogger, true, loggerProviders);
      if (writeToProviders) {
        addContainerProviders(context, factory);
      }
      log.debug("Pipeline logger factory built (preserveGlobalLogger={}, writeToProviders={})",
          preserveGlobalLogger, writeToProviders);
      return factory;
    }, LAZY);

    return context;
  }

  private static void addContainerProviders(GenericApplicationContext context, PipelineLoggerFactory factory) {
    context.getBeanProvider(LoggerProvider.class).orderedStream().forEach(factory::addProvider);
  }

  /** Holds the owning handle. Must never implement {@link AutoCloseable}. */
  private record RegisteredLogger(PipelineLogger logger) {}

  private static final class NullEnricher implements LogEnricher {
    private static final NullEnricher INSTANCE = new NullEnricher();

    @Override
    public void enrich(DefaultLoggingEvent event) {
      // no-op
    }
  }
}
