package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Pops a symbol off the symbol stack; the top must be this symbol without an attached scope
 * stack. Marked as a definition when it is the end of a name lookup.
 */
public record PopSymbolNode(NodeId id, Handle<Symbol> symbol, boolean definition) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.POP_SYMBOL;
    }

    @Override
    public boolean isDefinition() {
        return definition;
    }

    @Override
    public String toString() {
        return "[pop " + symbol + " " + id + (definition ? " definition]" : "]");
    }
}
