/**
 * <strong>Purpose:</strong> Command-line entry points: the {@code metawriter} dispatcher and its
 * {@code replay} and {@code inspect} commands.
 * <p><strong>Error handling:</strong> Every command returns an {@link ca.gc.cra.metawriter.api.ExitCode}; only
 * {@link ca.gc.cra.metawriter.api.Main#main(String[])} exits the JVM.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.api;
