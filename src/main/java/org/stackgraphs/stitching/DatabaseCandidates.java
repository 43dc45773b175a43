package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.NodeKind;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathExtension;
import org.stackgraphs.partial.PathResolutionException;
import org.stackgraphs.partial.ScopedSymbol;
import org.stackgraphs.storage.GraphFragmentCodec;
import org.stackgraphs.storage.PathRecordCodec;
import org.stackgraphs.storage.api.GraphFragment;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.stackgraphs.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Candidates read lazily from a path database.
 * <p>
 * Owns a session graph into which the fragments of the files touched by a query are loaded on
 * demand. Stored paths are only joined at nodes without an action of their own (root, scopes,
 * jump-to); at the root, lookups are narrowed to paths whose stack condition starts with the
 * symbol on top of the frontier path.
 * <p>
 * Files referenced by stored paths but absent from the database are collected in
 * {@link #missingFiles()}; the paths that need them are skipped. Storage errors propagate.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe; use one instance per query.
 */
public class DatabaseCandidates implements IPathCandidates {

    private static final Logger log = LoggerFactory.getLogger(DatabaseCandidates.class);

    private final IPartialPathStore store;
    private final StackGraph graph = new StackGraph();
    private final Set<String> loadedFiles = new HashSet<>();
    private final Set<String> missingFiles = new TreeSet<>();
    private final Map<Lookup, List<PathExtension>> cache = new HashMap<>();

    public DatabaseCandidates(IPartialPathStore store) {
        this.store = store;
    }

    @Override
    public StackGraph graph() {
        return graph;
    }

    @Override
    public Set<String> missingFiles() {
        return Set.copyOf(missingFiles);
    }

    /**
     * Loads the fragment of {@code file} into the session graph if it has not been loaded yet.
     *
     * @return {@code false} if the file is not stored
     */
    public boolean ensureFileLoaded(String file) throws StorageException {
        if (loadedFiles.contains(file)) {
            return true;
        }
        if (missingFiles.contains(file)) {
            return false;
        }
        Optional<GraphFragment> fragment = store.loadGraphFragment(file);
        if (fragment.isEmpty()) {
            log.debug("File '{}' is not in the path database", file);
            missingFiles.add(file);
            return false;
        }
        GraphFragmentCodec.decodeInto(graph, fragment.get());
        loadedFiles.add(file);
        log.trace("Loaded fragment of '{}' ({} nodes)", file, fragment.get().nodes().size());
        return true;
    }

    /**
     * Resolves a stored node identity into the session graph, loading its file if necessary.
     */
    public Optional<Handle<Node>> resolveNode(NodeKey key) throws StorageException {
        return Optional.ofNullable(resolveOrNull(key));
    }

    public NodeKey keyOf(Handle<Node> node) {
        return PathRecordCodec.nodeKey(graph, node);
    }

    /**
     * Stored paths that start at {@code node}, in storage order.
     */
    public List<PartialPath> pathsStartingAt(Handle<Node> node) throws StorageException {
        return decodeAll(store.findPathsByStartNode(keyOf(node)));
    }

    /**
     * Stored paths that end at {@code node}, in storage order.
     */
    public List<PartialPath> pathsEndingAt(Handle<Node> node) throws StorageException {
        return decodeAll(store.findPathsByEndNode(keyOf(node)));
    }

    @Override
    public void loadCandidates(PartialPath path, Direction direction, CancellationFlag cancellation)
        throws StorageException, CancelledException {
        Lookup lookup = lookupFor(path, direction);
        if (lookup == null || cache.containsKey(lookup)) {
            return;
        }
        cancellation.check("loading candidates at " + keyOf(lookup.junction()));
        List<Candidate> found = new ArrayList<>();
        Node junction = graph.node(lookup.junction());
        if (direction == Direction.FORWARD) {
            List<PartialPathRecord> records;
            if (junction.isRoot()) {
                records = lookup.symbol() != null || !lookup.open()
                    ? store.findRootPathsByPreconditionSymbol(lookup.symbol())
                    : store.findPathsByStartNode(NodeKey.ROOT);
            } else {
                records = store.findPathsByStartNode(keyOf(lookup.junction()));
            }
            decodeCandidates(records, found, null);
        } else {
            List<PartialPathRecord> records;
            if (junction.isRoot()) {
                records = lookup.symbol() != null || !lookup.open()
                    ? store.findRootPathsByPostconditionSymbol(lookup.symbol())
                    : store.findPathsByEndNode(NodeKey.ROOT);
            } else {
                records = store.findPathsByEndNode(keyOf(lookup.junction()));
            }
            decodeCandidates(records, found, null);
            if (junction.isExportedScope()) {
                decodeCandidates(store.findPathsByEndNode(NodeKey.JUMP_TO), found,
                    PartialPath.jumpSegment(graph, lookup.junction()));
            }
        }
        found.sort(Comparator.comparing(Candidate::path, PartialPath.PRECEDENCE_ORDER)
            .thenComparing(Candidate::file)
            .thenComparingInt(Candidate::ordinal));
        List<PathExtension> extensions = new ArrayList<>(found.size());
        for (Candidate candidate : found) {
            extensions.add(candidate.path());
        }
        cache.put(lookup, List.copyOf(extensions));
    }

    @Override
    public List<PathExtension> candidates(PartialPath path, Direction direction) {
        Lookup lookup = lookupFor(path, direction);
        if (lookup == null) {
            return List.of();
        }
        return cache.getOrDefault(lookup, List.of());
    }

    private Lookup lookupFor(PartialPath path, Direction direction) {
        Handle<Node> junction = direction == Direction.FORWARD ? path.endNode() : path.startNode();
        Node node = graph.node(junction);
        if (!node.isRoot() && !node.isJumpTo() && node.kind() != NodeKind.SCOPE) {
            return null;
        }
        if (node.isJumpTo() && direction == Direction.FORWARD) {
            // an unresolved jump can only continue once the caller supplies a scope
            return null;
        }
        if (!node.isRoot()) {
            return new Lookup(junction, null, false);
        }
        if (direction == Direction.FORWARD) {
            ScopedSymbol top = path.symbolPostcondition().peek();
            return new Lookup(junction, top == null ? null : graph.symbolName(top.symbol()),
                path.symbolPostcondition().hasVariable());
        }
        ScopedSymbol top = path.symbolPrecondition().peek();
        return new Lookup(junction, top == null ? null : graph.symbolName(top.symbol()),
            path.symbolPrecondition().hasVariable());
    }

    private void decodeCandidates(List<PartialPathRecord> records, List<Candidate> into, PartialPath jumpSegment)
        throws StorageException {
        for (PartialPathRecord record : records) {
            Optional<PartialPath> decoded = PathRecordCodec.decode(graph, record, this::resolveOrNull);
            if (decoded.isEmpty()) {
                log.debug("Skipping stored path {}#{}: some of its nodes are unavailable",
                    record.file(), record.ordinal());
                continue;
            }
            PartialPath path = decoded.get();
            if (jumpSegment != null) {
                try {
                    path = path.concatenate(graph, jumpSegment);
                } catch (PathResolutionException e) {
                    continue;
                }
            }
            into.add(new Candidate(path, record.file(), record.ordinal()));
        }
    }

    private List<PartialPath> decodeAll(List<PartialPathRecord> records) throws StorageException {
        List<Candidate> decoded = new ArrayList<>(records.size());
        decodeCandidates(records, decoded, null);
        List<PartialPath> paths = new ArrayList<>(decoded.size());
        for (Candidate candidate : decoded) {
            paths.add(candidate.path());
        }
        return paths;
    }

    private Handle<Node> resolveOrNull(NodeKey key) throws StorageException {
        if (key.isGlobal()) {
            return GraphFragmentCodec.lookup(graph, key).orElse(null);
        }
        if (!ensureFileLoaded(key.file())) {
            return null;
        }
        return GraphFragmentCodec.lookup(graph, key).orElse(null);
    }

    private record Lookup(Handle<Node> junction, String symbol, boolean open) {
    }

    private record Candidate(PartialPath path, String file, int ordinal) {
    }
}
