/**
 * <strong>Purpose:</strong> Cached datasets bound to store arrays and the registry addressing them by name.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.application.dataset;
