package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Pushes a symbol onto the symbol stack. Marked as a reference when it is the start of a
 * name lookup.
 */
public record PushSymbolNode(NodeId id, Handle<Symbol> symbol, boolean reference) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.PUSH_SYMBOL;
    }

    @Override
    public boolean isReference() {
        return reference;
    }

    @Override
    public String toString() {
        return "[push " + symbol + " " + id + (reference ? " reference]" : "]");
    }
}
