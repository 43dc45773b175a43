package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Pushes a symbol together with a scope stack consisting of the exported scope {@code scope}
 * on top of the current scope stack.
 *
 * @param scope identity of the exported scope node; resolved when a path traverses this node
 */
public record PushScopedSymbolNode(NodeId id, Handle<Symbol> symbol, NodeId scope, boolean reference)
    implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.PUSH_SCOPED_SYMBOL;
    }

    @Override
    public boolean isReference() {
        return reference;
    }

    @Override
    public String toString() {
        return "[push scoped " + symbol + " " + id + " scope " + scope + (reference ? " reference]" : "]");
    }
}
