package ca.gc.cra.logbridge.pipeline;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <strong>What:</strong> Process-wide slot holding the "current" {@link PipelineLogger}.
 * <p><strong>Why:</strong> Code that cannot be handed a logger (static helpers, legacy classes) still needs to reach
 * the pipeline configured by the composition root.</p>
 * <p><strong>Lifecycle:</strong> starts as {@link PipelineLogger#none()}; {@link #setLogger(PipelineLogger)} assigns on
 * configuration; {@link #closeAndFlush()} closes the current logger and resets the slot to the no-op logger.</p>
 * <p><strong>Thread-safety:</strong> Reads and swaps are atomic.</p>
 *
 * @since 0.1.0
 */
public final class Log {
  private static final AtomicReference<PipelineLogger> LOGGER =
      new AtomicReference<>(PipelineLogger.none());

  private Log() {
    // Utility
  }

  /**
   * Returns the current global logger.
   *
   * @return the assigned logger, or {@link PipelineLogger#none()}
   */
  public static PipelineLogger getLogger() {
    return LOGGER.get();
  }

  /**
   * Replaces the global logger. The previous logger is not closed.
   *
   * @param logger new global logger; must not be {@code null}
   * @throws NullPointerException if {@code logger} is {@code null}
   */
  public static void setLogger(PipelineLogger logger) {
    LOGGER.set(Objects.requireNonNull(logger, "logger"));
  }

  /**
   * Resets the slot to {@link PipelineLogger#none()} and closes the logger it held. Closing a non-owning logger
   * leaves its pipeline running.
   */
  public static void closeAndFlush() {
    LOGGER.getAndSet(PipelineLogger.none()).close();
  }
}
