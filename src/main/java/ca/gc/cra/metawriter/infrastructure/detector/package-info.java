/**
 * Detector-specific capabilities plugged into the acquisition writer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.infrastructure.detector;
