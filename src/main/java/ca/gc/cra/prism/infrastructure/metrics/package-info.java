/**
 * Metrics adapters that bridge the PRISM {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for Netty worker threads.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code http.*} and {@code startup.*} namespaces.</p>
 */
package ca.gc.cra.prism.infrastructure.metrics;
