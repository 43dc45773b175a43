package org.stackgraphs.storage;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.NodeId;
import org.stackgraphs.graph.PushScopedSymbolNode;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.SourceInfo;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.storage.api.GraphFragment;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.stackgraphs.storage.api.StorageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts one file's part of a stack graph and loads it into another graph.
 */
public final class GraphFragmentCodec {

    private GraphFragmentCodec() {
    }

    public static GraphFragment encode(StackGraph graph, Handle<SourceFile> file) {
        List<GraphFragment.NodeRecord> nodes = new ArrayList<>();
        List<PartialPathRecord.EdgeRef> edges = new ArrayList<>();
        for (Edge edge : graph.outgoingEdges(graph.root())) {
            if (graph.node(edge.sink()).isInFile(file)) {
                edges.add(encodeEdge(graph, edge));
            }
        }
        for (Handle<Node> handle : graph.nodesForFile(file)) {
            Node node = graph.node(handle);
            NodeKey attached = null;
            if (node instanceof PushScopedSymbolNode push) {
                attached = new NodeKey(graph.fileName(push.scope().file()), push.scope().localId());
            }
            boolean flag = node.isExportedScope() || node.isReference() || node.isDefinition();
            Optional<SourceInfo> info = graph.sourceInfo(handle);
            nodes.add(new GraphFragment.NodeRecord(node.id().localId(), node.kind(),
                node.symbol() == null ? null : graph.symbolName(node.symbol()),
                attached, flag,
                info.map(SourceInfo::span).orElse(null),
                info.map(SourceInfo::syntaxType).orElse(null)));
            for (Edge edge : graph.outgoingEdges(handle)) {
                edges.add(encodeEdge(graph, edge));
            }
        }
        return new GraphFragment(graph.fileName(file), nodes, edges);
    }

    /**
     * Adds the fragment's nodes to {@code graph}, together with those edges whose endpoints are
     * both present. Edges into files that are not loaded are skipped.
     *
     * @throws StorageException if the fragment is inconsistent
     */
    public static Handle<SourceFile> decodeInto(StackGraph graph, GraphFragment fragment) throws StorageException {
        Handle<SourceFile> file = graph.getOrCreateFile(fragment.file());
        for (GraphFragment.NodeRecord record : fragment.nodes()) {
            Handle<Node> handle = switch (record.kind()) {
                case SCOPE -> graph.addScopeNode(file, record.localId(), record.flag());
                case PUSH_SYMBOL -> graph.addPushSymbolNode(file, record.localId(),
                    graph.addSymbol(requireSymbol(fragment, record)), record.flag());
                case POP_SYMBOL -> graph.addPopSymbolNode(file, record.localId(),
                    graph.addSymbol(requireSymbol(fragment, record)), record.flag());
                case PUSH_SCOPED_SYMBOL -> graph.addPushScopedSymbolNode(file, record.localId(),
                    graph.addSymbol(requireSymbol(fragment, record)), attachedScope(graph, fragment, record),
                    record.flag());
                case POP_SCOPED_SYMBOL -> graph.addPopScopedSymbolNode(file, record.localId(),
                    graph.addSymbol(requireSymbol(fragment, record)), record.flag());
                case DROP_SCOPES -> graph.addDropScopesNode(file, record.localId());
                case ROOT, JUMP_TO -> throw new StorageException(
                    "Fragment of '" + fragment.file() + "' contains global node " + record.kind());
            };
            if (record.span() != null) {
                graph.setSourceInfo(handle, new SourceInfo(record.span(), record.syntaxType()));
            }
        }
        for (PartialPathRecord.EdgeRef edge : fragment.edges()) {
            Optional<Handle<Node>> source = lookup(graph, edge.source());
            Optional<Handle<Node>> sink = lookup(graph, edge.sink());
            if (source.isPresent() && sink.isPresent()) {
                graph.addEdge(source.get(), sink.get(), edge.precedence());
            }
        }
        return file;
    }

    /**
     * Finds an already loaded node of {@code graph}.
     */
    public static Optional<Handle<Node>> lookup(StackGraph graph, NodeKey key) {
        if (key.isGlobal()) {
            if (key.localId() == StackGraph.ROOT_LOCAL_ID) {
                return Optional.of(graph.root());
            }
            if (key.localId() == StackGraph.JUMP_TO_LOCAL_ID) {
                return Optional.of(graph.jumpTo());
            }
            return Optional.empty();
        }
        return graph.nodeForId(key.file(), key.localId());
    }

    private static PartialPathRecord.EdgeRef encodeEdge(StackGraph graph, Edge edge) {
        return new PartialPathRecord.EdgeRef(
            PathRecordCodec.nodeKey(graph, edge.source()), PathRecordCodec.nodeKey(graph, edge.sink()),
            edge.precedence());
    }

    private static String requireSymbol(GraphFragment fragment, GraphFragment.NodeRecord record)
        throws StorageException {
        if (record.symbol() == null) {
            throw new StorageException("Node " + record.localId() + " of '" + fragment.file()
                + "' (" + record.kind() + ") has no symbol");
        }
        return record.symbol();
    }

    private static NodeId attachedScope(StackGraph graph, GraphFragment fragment, GraphFragment.NodeRecord record)
        throws StorageException {
        NodeKey scope = record.attachedScope();
        if (scope == null || scope.isGlobal()) {
            throw new StorageException("Scoped push " + record.localId() + " of '" + fragment.file()
                + "' has no attached scope");
        }
        return new NodeId(graph.getOrCreateFile(scope.file()), scope.localId());
    }
}
