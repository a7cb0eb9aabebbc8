/**
 * <strong>Purpose:</strong> Process configuration: YAML loading, embedded defaults, precedence merging, and the
 * typed records the CLIs build from the merged map.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.config;
