package org.stackgraphs.partial;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.graph.Symbol;

import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * Entry of a symbol stack: a symbol, optionally carrying the scope stack that was current when
 * it was pushed by a scoped push.
 *
 * @param symbol the symbol
 * @param scopes attached scope stack, or {@code null} for a plain symbol
 */
public record ScopedSymbol(Handle<Symbol> symbol, PartialScopeStack scopes) {

    public static ScopedSymbol plain(Handle<Symbol> symbol) {
        return new ScopedSymbol(symbol, null);
    }

    public boolean hasScopes() {
        return scopes != null;
    }

    int size() {
        return 1 + (scopes == null ? 0 : scopes.length());
    }

    ScopedSymbol applyBindings(ScopeStackBindings bindings) {
        if (scopes == null) {
            return this;
        }
        PartialScopeStack applied = scopes.applyBindings(bindings);
        return applied == scopes ? this : new ScopedSymbol(symbol, applied);
    }

    ScopedSymbol mapScopeVariables(IntUnaryOperator mapping) {
        return scopes == null ? this : new ScopedSymbol(symbol, scopes.mapVariables(mapping));
    }

    void forEachScopeVariable(IntConsumer consumer) {
        if (scopes != null) {
            scopes.forEachVariable(consumer);
        }
    }

    public String display(StackGraph graph) {
        String name = graph.symbolName(symbol);
        return scopes == null ? name : name + "/" + scopes.display(graph);
    }
}
