/**
 * <strong>Purpose:</strong> Metrics adapters behind {@link ca.gc.cra.metawriter.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; writers of several acquisitions share one instance.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.infrastructure.metrics;
