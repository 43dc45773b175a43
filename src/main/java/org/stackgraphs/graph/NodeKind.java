package org.stackgraphs.graph;

/**
 * Discriminator of the node variants of a stack graph.
 */
public enum NodeKind {
    ROOT,
    JUMP_TO,
    SCOPE,
    PUSH_SYMBOL,
    POP_SYMBOL,
    PUSH_SCOPED_SYMBOL,
    POP_SCOPED_SYMBOL,
    DROP_SCOPES
}
