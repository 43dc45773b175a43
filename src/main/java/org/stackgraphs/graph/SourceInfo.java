package org.stackgraphs.graph;

/**
 * Source location attached to a node for tooling.
 *
 * @param span       where the syntax element appears
 * @param syntaxType optional free-form syntax type (e.g. "function"), may be {@code null}
 */
public record SourceInfo(SourceSpan span, String syntaxType) {
}
