/**
 * <strong>Purpose:</strong> Structured logging pipelines built on private Logback contexts.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.logbridge.pipeline.LoggerConfiguration} builds a pipeline,
 * {@link ca.gc.cra.logbridge.pipeline.PipelineLogger} is its handle and
 * {@link ca.gc.cra.logbridge.pipeline.Log} is the process-wide slot for the current one.
 * <p><strong>Concurrency:</strong> Handles are thread-safe; builders are not.
 * <p><strong>Observability:</strong> Pipelines never modify the process-wide Logback configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logbridge.pipeline;
