/**
 * <strong>Purpose:</strong> Decoding of JSON message envelopes and newline-delimited message files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.infrastructure.message;
