package org.stackgraphs.storage;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.NodeId;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PartialScopeStack;
import org.stackgraphs.partial.PartialSymbolStack;
import org.stackgraphs.partial.ScopedSymbol;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.stackgraphs.storage.api.StorageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts partial paths between their in-graph form (handles) and their persisted form
 * ({@link NodeKey}s and symbol text).
 */
public final class PathRecordCodec {

    /**
     * Maps a stored node identity to a node of the target graph.
     */
    @FunctionalInterface
    public interface NodeResolver {

        /**
         * @return the node, or {@code null} if it is not available (e.g. its file is not stored)
         * @throws StorageException if loading the node failed
         */
        Handle<Node> resolve(NodeKey key) throws StorageException;
    }

    private PathRecordCodec() {
    }

    public static NodeKey nodeKey(StackGraph graph, Handle<Node> node) {
        NodeId id = graph.node(node).id();
        if (id.isGlobal()) {
            return new NodeKey(NodeKey.GLOBAL_FILE, id.localId());
        }
        return new NodeKey(graph.fileName(id.file()), id.localId());
    }

    public static PartialPathRecord encode(StackGraph graph, String file, int ordinal, PartialPath path) {
        List<PartialPathRecord.EdgeRef> edges = new ArrayList<>(path.edgeCount());
        for (Edge edge : path.edges()) {
            edges.add(new PartialPathRecord.EdgeRef(
                nodeKey(graph, edge.source()), nodeKey(graph, edge.sink()), edge.precedence()));
        }
        return new PartialPathRecord(file, ordinal,
            nodeKey(graph, path.startNode()), nodeKey(graph, path.endNode()),
            encodeSymbols(graph, path.symbolPrecondition()), encodeSymbols(graph, path.symbolPostcondition()),
            encodeScopes(graph, path.scopePrecondition()), encodeScopes(graph, path.scopePostcondition()),
            edges);
    }

    /**
     * Rebuilds a partial path inside {@code graph}. Symbols are interned as needed.
     *
     * @return the path, or empty if one of its nodes could not be resolved
     */
    public static Optional<PartialPath> decode(StackGraph graph, PartialPathRecord record, NodeResolver resolver)
        throws StorageException {
        Handle<Node> start = resolver.resolve(record.start());
        Handle<Node> end = resolver.resolve(record.end());
        if (start == null || end == null) {
            return Optional.empty();
        }
        List<Edge> edges = new ArrayList<>(record.edges().size());
        for (PartialPathRecord.EdgeRef ref : record.edges()) {
            Handle<Node> source = resolver.resolve(ref.source());
            Handle<Node> sink = resolver.resolve(ref.sink());
            if (source == null || sink == null) {
                return Optional.empty();
            }
            edges.add(new Edge(source, sink, ref.precedence()));
        }
        PartialSymbolStack symbolPre = decodeSymbols(graph, record.symbolPre(), resolver);
        PartialSymbolStack symbolPost = decodeSymbols(graph, record.symbolPost(), resolver);
        PartialScopeStack scopePre = decodeScopes(record.scopePre(), resolver);
        PartialScopeStack scopePost = decodeScopes(record.scopePost(), resolver);
        if (symbolPre == null || symbolPost == null || scopePre == null || scopePost == null) {
            return Optional.empty();
        }
        return Optional.of(new PartialPath(start, end, symbolPre, symbolPost, scopePre, scopePost, edges));
    }

    private static PartialPathRecord.SymbolStack encodeSymbols(StackGraph graph, PartialSymbolStack stack) {
        List<PartialPathRecord.ScopedSymbol> symbols = new ArrayList<>(stack.length());
        for (ScopedSymbol symbol : stack.symbols()) {
            symbols.add(new PartialPathRecord.ScopedSymbol(graph.symbolName(symbol.symbol()),
                symbol.hasScopes() ? encodeScopes(graph, symbol.scopes()) : null));
        }
        return new PartialPathRecord.SymbolStack(symbols, stack.variable());
    }

    private static PartialPathRecord.ScopeStack encodeScopes(StackGraph graph, PartialScopeStack stack) {
        List<NodeKey> scopes = new ArrayList<>(stack.length());
        for (Handle<Node> scope : stack.scopes()) {
            scopes.add(nodeKey(graph, scope));
        }
        return new PartialPathRecord.ScopeStack(scopes, stack.variable());
    }

    private static PartialSymbolStack decodeSymbols(StackGraph graph, PartialPathRecord.SymbolStack stored,
                                                    NodeResolver resolver) throws StorageException {
        List<ScopedSymbol> symbols = new ArrayList<>(stored.symbols().size());
        for (PartialPathRecord.ScopedSymbol entry : stored.symbols()) {
            PartialScopeStack scopes = null;
            if (entry.scopes() != null) {
                scopes = decodeScopes(entry.scopes(), resolver);
                if (scopes == null) {
                    return null;
                }
            }
            symbols.add(new ScopedSymbol(graph.addSymbol(entry.symbol()), scopes));
        }
        return PartialSymbolStack.of(symbols, stored.variable());
    }

    private static PartialScopeStack decodeScopes(PartialPathRecord.ScopeStack stored, NodeResolver resolver)
        throws StorageException {
        List<Handle<Node>> scopes = new ArrayList<>(stored.scopes().size());
        for (NodeKey key : stored.scopes()) {
            Handle<Node> scope = resolver.resolve(key);
            if (scope == null) {
                return null;
            }
            scopes.add(scope);
        }
        return PartialScopeStack.of(scopes, stored.variable());
    }
}
