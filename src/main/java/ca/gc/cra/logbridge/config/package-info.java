/**
 * Container registration of structured logging pipelines.
 * <p><strong>Role:</strong> Composition-root layer binding the pipeline and its SLF4J factory into a Spring
 * {@link org.springframework.context.support.GenericApplicationContext}.</p>
 * <p><strong>Concurrency:</strong> Registration runs once on the composition thread.</p>
 */
package ca.gc.cra.logbridge.config;
