/**
 * <strong>Purpose:</strong> Ports separating the acquisition writer from the persistent store, metrics backend,
 * clock, and detector-specific behaviour.
 * <p><strong>Concurrency:</strong> Store ports are single-writer; metrics ports must tolerate concurrent use.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.application.port;
