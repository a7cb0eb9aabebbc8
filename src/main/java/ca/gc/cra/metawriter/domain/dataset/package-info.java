/**
 * <strong>Purpose:</strong> Static dataset descriptions and element types.
 * <p><strong>Pipeline role:</strong> Declared by the writer and detector extensions before a store exists.
 *
 * @since 0.1.0
 */
package ca.gc.cra.metawriter.domain.dataset;
