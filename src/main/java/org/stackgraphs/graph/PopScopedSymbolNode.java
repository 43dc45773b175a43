package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Pops a symbol that carries a scope stack; the carried stack replaces the current scope stack.
 */
public record PopScopedSymbolNode(NodeId id, Handle<Symbol> symbol, boolean definition) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.POP_SCOPED_SYMBOL;
    }

    @Override
    public boolean isDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return "[pop scoped " + symbol + " " + id + (definition ? " definition]" : "]");
    }
}
