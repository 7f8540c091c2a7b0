/**
 * <strong>Purpose:</strong> Secondary destinations that receive pipeline events in addition to Logback appenders.
 * <p><strong>Pipeline role:</strong> Attached through {@code LoggerConfiguration#writeToProviders} and populated by
 * the SLF4J logger factory from container-registered {@link ca.gc.cra.logbridge.provider.LoggerProvider} beans.
 * <p><strong>Concurrency:</strong> Collections are copy-on-write; dispatch runs on the logging thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logbridge.provider;
