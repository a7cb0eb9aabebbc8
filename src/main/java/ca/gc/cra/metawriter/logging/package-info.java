/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound payloads before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.logging;
