/**
 * <strong>Purpose:</strong> Decoded metadata message model shared by sources and the writer.
 * <p><strong>Concurrency:</strong> Immutable values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.domain.msg;
