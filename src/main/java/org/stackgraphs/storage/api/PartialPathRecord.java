package org.stackgraphs.storage.api;

import java.util.List;

/**
 * Persisted form of a partial path. Nodes are identified by {@link NodeKey} and symbols by their
 * text, so a record can be decoded into any graph that contains the referenced files.
 *
 * @param file       the file whose analysis produced the path
 * @param ordinal    position of the path in the finder's output for that file
 * @param start      first node
 * @param end        last node
 * @param symbolPre  symbol stack precondition
 * @param symbolPost symbol stack postcondition
 * @param scopePre   scope stack precondition
 * @param scopePost  scope stack postcondition
 * @param edges      traversed edges in order
 */
public record PartialPathRecord(String file, int ordinal, NodeKey start, NodeKey end,
                                SymbolStack symbolPre, SymbolStack symbolPost,
                                ScopeStack scopePre, ScopeStack scopePost,
                                List<EdgeRef> edges) {

    /**
     * Scope stack condition; {@code variable == 0} means closed.
     */
    public record ScopeStack(List<NodeKey> scopes, int variable) {
    }

    /**
     * Symbol stack entry; {@code scopes} is {@code null} for a plain symbol.
     */
    public record ScopedSymbol(String symbol, ScopeStack scopes) {
    }

    /**
     * Symbol stack condition; {@code variable == 0} means closed.
     */
    public record SymbolStack(List<ScopedSymbol> symbols, int variable) {
    }

    public record EdgeRef(NodeKey source, NodeKey sink, int precedence) {
    }

    /**
     * Symbol on top of the precondition, used to index paths leaving the root.
     *
     * @return the symbol text, or {@code null} if the precondition has no concrete entry
     */
    public String preconditionHeadSymbol() {
        return symbolPre.symbols().isEmpty() ? null : symbolPre.symbols().get(0).symbol();
    }

    /**
     * Symbol on top of the postcondition, used to index paths arriving at the root.
     */
    public String postconditionHeadSymbol() {
        return symbolPost.symbols().isEmpty() ? null : symbolPost.symbols().get(0).symbol();
    }
}
