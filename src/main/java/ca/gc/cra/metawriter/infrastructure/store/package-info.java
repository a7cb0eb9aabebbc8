/**
 * <strong>Purpose:</strong> MDS1 journal store: file adapter for the writer and a reader for follow-along tools.
 * <p><strong>Concurrency:</strong> One writer per file; any number of readers may replay it concurrently.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.infrastructure.store;
