/**
 * <strong>Purpose:</strong> Argument validation shared by configuration parsing and CLI entry points.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} naming the offending setting.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.validation;
