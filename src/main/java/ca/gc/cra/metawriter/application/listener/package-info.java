/**
 * Routes messages from many acquisitions to their writers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.application.listener;
