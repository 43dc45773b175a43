package org.stackgraphs.graph;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.stackgraphs.arena.Arena;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.arena.InterningArena;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only graph of name-binding facts for a set of files.
 * <p>
 * The graph owns all of its symbols, files and nodes in arenas and hands out typed
 * {@link Handle}s. Handles carry the identity of the graph that issued them; passing a handle
 * of another graph instance is rejected. Nothing is ever removed: re-analysing a file means
 * building a new graph (or fragment) for it.
 * <p>
 * Two global nodes exist in every graph: the root (arena index 0), the only junction between
 * files, and the jump-to node (arena index 1), which continues at the scope on top of the scope
 * stack. Neither belongs to a file.
 * <p>
 * Construction is single-threaded. Once built, a graph may be read from several threads.
 */
public class StackGraph {

    public static final int ROOT_LOCAL_ID = 1;
    public static final int JUMP_TO_LOCAL_ID = 2;

    private static final AtomicInteger NEXT_GRAPH_ID = new AtomicInteger(1);

    private final int graphId;
    private final InterningArena<Symbol> symbols;
    private final InterningArena<SourceFile> files;
    private final Arena<Node> nodes;

    private final Map<NodeId, Handle<Node>> nodesById = new HashMap<>();
    private final Int2ObjectOpenHashMap<List<Edge>> outgoing = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<List<Edge>> incoming = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<IntArrayList> nodesByFile = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<SourceInfo> sourceInfos = new Int2ObjectOpenHashMap<>();

    private final Handle<Node> root;
    private final Handle<Node> jumpTo;
    private int edgeCount;

    public StackGraph() {
        this.graphId = NEXT_GRAPH_ID.getAndIncrement();
        this.symbols = new InterningArena<>(graphId);
        this.files = new InterningArena<>(graphId);
        this.nodes = new Arena<>(graphId);

        NodeId rootId = new NodeId(null, ROOT_LOCAL_ID);
        NodeId jumpToId = new NodeId(null, JUMP_TO_LOCAL_ID);
        this.root = nodes.add(new RootNode(rootId));
        this.jumpTo = nodes.add(new JumpToNode(jumpToId));
        nodesById.put(rootId, root);
        nodesById.put(jumpToId, jumpTo);
    }

    // ==================== Symbols and files ====================

    /**
     * Interns a symbol. Adding the same name twice returns the same handle.
     */
    public Handle<Symbol> addSymbol(String name) {
        return symbols.add(new Symbol(name));
    }

    public Optional<Handle<Symbol>> lookupSymbol(String name) {
        return symbols.lookup(new Symbol(name));
    }

    public Symbol symbol(Handle<Symbol> handle) {
        return symbols.get(handle);
    }

    public String symbolName(Handle<Symbol> handle) {
        return symbols.get(handle).name();
    }

    public Handle<SourceFile> getOrCreateFile(String name) {
        return files.add(new SourceFile(name));
    }

    public Optional<Handle<SourceFile>> getFile(String name) {
        return files.lookup(new SourceFile(name));
    }

    public SourceFile file(Handle<SourceFile> handle) {
        return files.get(handle);
    }

    public String fileName(Handle<SourceFile> handle) {
        return files.get(handle).name();
    }

    public Iterable<Handle<SourceFile>> files() {
        return files;
    }

    // ==================== Nodes ====================

    public Handle<Node> root() {
        return root;
    }

    public Handle<Node> jumpTo() {
        return jumpTo;
    }

    public Node node(Handle<Node> handle) {
        return nodes.get(handle);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public Optional<Handle<Node>> nodeForId(NodeId id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * Looks a node up by file name and local identifier.
     */
    public Optional<Handle<Node>> nodeForId(String fileName, int localId) {
        return getFile(fileName).map(file -> nodesById.get(new NodeId(file, localId)));
    }

    public Handle<Node> addScopeNode(Handle<SourceFile> file, int localId, boolean exported) {
        NodeId id = newNodeId(file, localId);
        return register(new ScopeNode(id, exported));
    }

    public Handle<Node> addPushSymbolNode(Handle<SourceFile> file, int localId, Handle<Symbol> symbol,
                                          boolean reference) {
        NodeId id = newNodeId(file, localId);
        symbols.checkOwned(symbol);
        return register(new PushSymbolNode(id, symbol, reference));
    }

    public Handle<Node> addPopSymbolNode(Handle<SourceFile> file, int localId, Handle<Symbol> symbol,
                                         boolean definition) {
        NodeId id = newNodeId(file, localId);
        symbols.checkOwned(symbol);
        return register(new PopSymbolNode(id, symbol, definition));
    }

    /**
     * Adds a node pushing {@code symbol} with the exported scope {@code scope} attached.
     * The scope may be declared later or live in another file; it is resolved on traversal.
     */
    public Handle<Node> addPushScopedSymbolNode(Handle<SourceFile> file, int localId, Handle<Symbol> symbol,
                                                NodeId scope, boolean reference) {
        NodeId id = newNodeId(file, localId);
        symbols.checkOwned(symbol);
        if (scope == null || scope.isGlobal() || !files.owns(scope.file())) {
            throw new UnknownFileException("Attached scope " + scope + " of node " + id
                + " does not refer to a file of this graph");
        }
        return register(new PushScopedSymbolNode(id, symbol, scope, reference));
    }

    public Handle<Node> addPopScopedSymbolNode(Handle<SourceFile> file, int localId, Handle<Symbol> symbol,
                                               boolean definition) {
        NodeId id = newNodeId(file, localId);
        symbols.checkOwned(symbol);
        return register(new PopScopedSymbolNode(id, symbol, definition));
    }

    public Handle<Node> addDropScopesNode(Handle<SourceFile> file, int localId) {
        NodeId id = newNodeId(file, localId);
        return register(new DropScopesNode(id));
    }

    /**
     * Returns the nodes of a file in creation order. The returned iterable may be iterated any
     * number of times; each iteration covers the nodes that existed when it started.
     */
    public Iterable<Handle<Node>> nodesForFile(Handle<SourceFile> file) {
        files.checkOwned(file);
        final IntArrayList indices = nodesByFile.get(file.index());
        if (indices == null) {
            return Collections.emptyList();
        }
        return () -> new Iterator<>() {
            private final int limit = indices.size();
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < limit;
            }

            @Override
            public Handle<Node> next() {
                if (next >= limit) {
                    throw new NoSuchElementException();
                }
                return nodes.handleAt(indices.getInt(next++));
            }
        };
    }

    public void setSourceInfo(Handle<Node> node, SourceInfo info) {
        nodes.checkOwned(node);
        sourceInfos.put(node.index(), info);
    }

    public Optional<SourceInfo> sourceInfo(Handle<Node> node) {
        nodes.checkOwned(node);
        return Optional.ofNullable(sourceInfos.get(node.index()));
    }

    // ==================== Edges ====================

    /**
     * Adds an edge. Adding an identical {@code (source, sink, precedence)} triple again has no
     * effect.
     *
     * @return {@code true} if the edge was new
     */
    public boolean addEdge(Handle<Node> source, Handle<Node> sink, int precedence) {
        nodes.checkOwned(source);
        nodes.checkOwned(sink);
        List<Edge> out = outgoing.get(source.index());
        if (out == null) {
            out = new ArrayList<>();
            outgoing.put(source.index(), out);
        }
        for (Edge existing : out) {
            if (existing.sink().equals(sink) && existing.precedence() == precedence) {
                return false;
            }
        }
        Edge edge = new Edge(source, sink, precedence);
        insertOrdered(out, edge);

        List<Edge> in = incoming.get(sink.index());
        if (in == null) {
            in = new ArrayList<>();
            incoming.put(sink.index(), in);
        }
        insertOrdered(in, edge);
        edgeCount++;
        return true;
    }

    /**
     * Outgoing edges of a node in exploration order: ascending precedence, insertion order
     * among equal precedences.
     */
    public List<Edge> outgoingEdges(Handle<Node> node) {
        nodes.checkOwned(node);
        List<Edge> out = outgoing.get(node.index());
        return out == null ? List.of() : Collections.unmodifiableList(out);
    }

    /**
     * Incoming edges of a node, ordered like {@link #outgoingEdges}.
     */
    public List<Edge> incomingEdges(Handle<Node> node) {
        nodes.checkOwned(node);
        List<Edge> in = incoming.get(node.index());
        return in == null ? List.of() : Collections.unmodifiableList(in);
    }

    // ==================== Internals ====================

    private NodeId newNodeId(Handle<SourceFile> file, int localId) {
        if (file == null || !files.owns(file)) {
            throw new UnknownFileException("File " + file + " is not registered with this graph");
        }
        NodeId id = new NodeId(file, localId);
        if (nodesById.containsKey(id)) {
            throw new DuplicateNodeException(id,
                "Node " + localId + " already exists in file '" + fileName(file) + "'");
        }
        return id;
    }

    private Handle<Node> register(Node node) {
        Handle<Node> handle = nodes.add(node);
        nodesById.put(node.id(), handle);
        int fileIndex = node.id().file().index();
        IntArrayList indices = nodesByFile.get(fileIndex);
        if (indices == null) {
            indices = new IntArrayList();
            nodesByFile.put(fileIndex, indices);
        }
        indices.add(handle.index());
        return handle;
    }

    private static void insertOrdered(List<Edge> edges, Edge edge) {
        int position = edges.size();
        while (position > 0 && edges.get(position - 1).precedence() > edge.precedence()) {
            position--;
        }
        edges.add(position, edge);
    }

    @Override
    public String toString() {
        return "StackGraph{id=" + graphId + ", files=" + files.size() + ", nodes=" + nodes.size()
            + ", edges=" + edgeCount + "}";
    }
}
