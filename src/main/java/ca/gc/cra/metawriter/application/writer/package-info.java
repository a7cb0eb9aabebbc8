/**
 * <strong>Purpose:</strong> The per-acquisition writer: lifecycle state machine, flush policy, and side channel.
 * <p><strong>Concurrency:</strong> Single-threaded; the listener serializes access.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.application.writer;
