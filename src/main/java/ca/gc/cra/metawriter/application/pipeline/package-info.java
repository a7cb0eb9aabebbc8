/**
 * <strong>Purpose:</strong> Batch use cases that drive the listener from a message source.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.application.pipeline;
