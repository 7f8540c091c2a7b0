/**
 * <strong>Purpose:</strong> SLF4J facade over structured logging pipelines.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.logbridge.slf4j.PipelineLoggerFactory} is the
 * {@link org.slf4j.ILoggerFactory} applications resolve from the container.
 * <p><strong>Concurrency:</strong> Factories and their loggers are thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logbridge.slf4j;
