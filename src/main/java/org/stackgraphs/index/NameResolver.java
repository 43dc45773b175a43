package org.stackgraphs.index;

import com.typesafe.config.Config;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.NodeKind;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathResolutionException;
import org.stackgraphs.stitching.DatabaseCandidates;
import org.stackgraphs.stitching.Direction;
import org.stackgraphs.stitching.PathStitcher;
import org.stackgraphs.stitching.StitcherConfig;
import org.stackgraphs.stitching.StitchingResult;
import org.stackgraphs.storage.api.GraphFragment;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers find-definition and find-references queries from a path database.
 * <p>
 * Each query opens its own session over the store: the fragments of the files it touches are
 * loaded into a private graph and stored partial paths are stitched together. The store is only
 * read. Queries for a node whose file is not stored report the file as missing; a node that is
 * not a reference (resp. definition) is rejected with {@link IllegalArgumentException}.
 * <p>
 * With {@code filterShadowedPaths} set, bindings whose path is shadowed by another binding of the
 * same query (a lower precedence taken at the first edge where both diverge) are dropped.
 */
public class NameResolver {

    private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

    private final IPartialPathStore store;
    private final StitcherConfig config;
    private final boolean filterShadowed;

    public NameResolver(IPartialPathStore store) {
        this(store, StitcherConfig.DEFAULT, false);
    }

    public NameResolver(IPartialPathStore store, StitcherConfig config, boolean filterShadowed) {
        this.store = store;
        this.config = config;
        this.filterShadowed = filterShadowed;
    }

    /**
     * Creates a resolver from the {@code stack-graphs.stitcher} block.
     */
    public static NameResolver fromConfig(IPartialPathStore store, Config stitcherOptions) {
        boolean filterShadowed = stitcherOptions.hasPath("filterShadowedPaths")
            && stitcherOptions.getBoolean("filterShadowedPaths");
        return new NameResolver(store, StitcherConfig.fromConfig(stitcherOptions), filterShadowed);
    }

    // ==================== Eager queries ====================

    /**
     * All definitions the reference at {@code reference} binds to.
     *
     * @throws StorageException if the store cannot be read
     */
    public ResolutionResult findDefinitions(NodeKey reference, CancellationFlag cancellation)
        throws StorageException {
        DatabaseCandidates session = new DatabaseCandidates(store);
        Optional<Handle<Node>> node = session.resolveNode(reference);
        if (node.isEmpty()) {
            return unavailable(reference, session);
        }
        requireKind(session, node.get(), reference, true);
        PathStitcher stitcher = forwardStitcher(session, node.get());
        return collect(reference, session, PathStitcher.findAllCompletePaths(stitcher, cancellation, null));
    }

    /**
     * All references that bind to the definition at {@code definition}.
     *
     * @throws StorageException if the store cannot be read
     */
    public ResolutionResult findReferences(NodeKey definition, CancellationFlag cancellation)
        throws StorageException {
        DatabaseCandidates session = new DatabaseCandidates(store);
        Optional<Handle<Node>> node = session.resolveNode(definition);
        if (node.isEmpty()) {
            return unavailable(definition, session);
        }
        requireKind(session, node.get(), definition, false);
        PathStitcher stitcher = backwardStitcher(session, node.get());
        return collect(definition, session, PathStitcher.findAllCompletePaths(stitcher, cancellation, null));
    }

    // ==================== Lazy queries ====================

    /**
     * Lazy form of {@link #findDefinitions}. A reference whose file is not stored yields nothing
     * and the cursor reports {@link StitchingResult.Status#INCOMPLETE_PATHS}.
     */
    public ResolutionQuery definitionsOf(NodeKey reference, CancellationFlag cancellation) {
        return new ResolutionQuery("definitions of " + reference, () -> {
            DatabaseCandidates session = new DatabaseCandidates(store);
            Optional<Handle<Node>> node = session.resolveNode(reference);
            if (node.isEmpty()) {
                requireMissingFile(reference, session);
                return new PathStitcher(session, Direction.FORWARD, List.of(), config);
            }
            requireKind(session, node.get(), reference, true);
            return forwardStitcher(session, node.get());
        }, cancellation);
    }

    public ResolutionQuery referencesOf(NodeKey definition, CancellationFlag cancellation) {
        return new ResolutionQuery("references of " + definition, () -> {
            DatabaseCandidates session = new DatabaseCandidates(store);
            Optional<Handle<Node>> node = session.resolveNode(definition);
            if (node.isEmpty()) {
                requireMissingFile(definition, session);
                return new PathStitcher(session, Direction.BACKWARD, List.of(), config);
            }
            requireKind(session, node.get(), definition, false);
            return backwardStitcher(session, node.get());
        }, cancellation);
    }

    // ==================== Line ranges ====================

    /**
     * Resolves every reference of {@code file} whose source span intersects the lines
     * {@code lineStart..lineEnd} (inclusive). References without source information are ignored.
     */
    public LineRangeLookup lookupDefinitions(String file, int lineStart, int lineEnd, CancellationFlag cancellation)
        throws StorageException {
        if (lineEnd < lineStart) {
            throw new IllegalArgumentException("Invalid line range " + lineStart + ".." + lineEnd);
        }
        Map<NodeKey, ResolutionResult> results = new LinkedHashMap<>();
        Optional<GraphFragment> fragment = store.loadGraphFragment(file);
        if (fragment.isEmpty()) {
            log.warn("File '{}' is not indexed", file);
            return new LineRangeLookup(file, lineStart, lineEnd, Map.of());
        }
        for (GraphFragment.NodeRecord record : fragment.get().nodes()) {
            boolean reference = record.flag()
                && (record.kind() == NodeKind.PUSH_SYMBOL || record.kind() == NodeKind.PUSH_SCOPED_SYMBOL);
            if (!reference || record.span() == null || !record.span().intersectsLines(lineStart, lineEnd)) {
                continue;
            }
            NodeKey key = new NodeKey(file, record.localId());
            results.put(key, findDefinitions(key, cancellation));
        }
        LineRangeLookup lookup = new LineRangeLookup(file, lineStart, lineEnd, Collections.unmodifiableMap(results));
        log.debug("Lines {}..{} of '{}': {} references, {} definitions, {} unresolved", lineStart, lineEnd, file,
            lookup.referencesFound(), lookup.definitionsFound(), lookup.unresolvedReferences().size());
        return lookup;
    }

    // ==================== Internals ====================

    private PathStitcher forwardStitcher(DatabaseCandidates session, Handle<Node> reference) throws StorageException {
        List<PartialPath> seeds = new ArrayList<>();
        for (PartialPath path : session.pathsStartingAt(reference)) {
            try {
                seeds.add(path.eliminatePreconditionVariables());
            } catch (PathResolutionException e) {
                log.trace("Stored path {} cannot start with empty stacks: {}", path, e.getMessage());
            }
        }
        return new PathStitcher(session, Direction.FORWARD, seeds, config);
    }

    private PathStitcher backwardStitcher(DatabaseCandidates session, Handle<Node> definition)
        throws StorageException {
        List<PartialPath> seeds = new ArrayList<>();
        for (PartialPath path : session.pathsEndingAt(definition)) {
            try {
                seeds.add(path.eliminateSymbolPostconditionVariable());
            } catch (PathResolutionException e) {
                log.trace("Stored path {} cannot end with an empty symbol stack: {}", path, e.getMessage());
            }
        }
        return new PathStitcher(session, Direction.BACKWARD, seeds, config);
    }

    private static void requireKind(DatabaseCandidates session, Handle<Node> node, NodeKey key, boolean reference) {
        Node resolved = session.graph().node(node);
        if (reference && !resolved.isReference()) {
            throw new IllegalArgumentException("Node " + key + " is not a reference");
        }
        if (!reference && !resolved.isDefinition()) {
            throw new IllegalArgumentException("Node " + key + " is not a definition");
        }
    }

    private ResolutionResult unavailable(NodeKey query, DatabaseCandidates session) {
        requireMissingFile(query, session);
        log.warn("Cannot resolve {}: file '{}' is not indexed", query, query.file());
        return new ResolutionResult(query, List.of(), StitchingResult.Status.INCOMPLETE_PATHS,
            session.missingFiles());
    }

    private static void requireMissingFile(NodeKey query, DatabaseCandidates session) {
        if (session.missingFiles().isEmpty()) {
            throw new IllegalArgumentException("Unknown node " + query);
        }
    }

    private ResolutionResult collect(NodeKey query, DatabaseCandidates session, StitchingResult result) {
        List<PartialPath> paths = result.paths();
        if (filterShadowed) {
            paths = withoutShadowed(paths);
        }
        List<Binding> bindings = new ArrayList<>(paths.size());
        for (PartialPath path : paths) {
            bindings.add(new Binding(session.keyOf(path.startNode()), session.keyOf(path.endNode()), path));
        }
        if (result.status() == StitchingResult.Status.INCOMPLETE_PATHS) {
            log.warn("Resolution of {} is incomplete, missing files: {}", query, result.missingFiles());
        } else if (result.status() == StitchingResult.Status.CANCELLED) {
            log.warn("Resolution of {} was cancelled with {} bindings found", query, bindings.size());
        }
        return new ResolutionResult(query, List.copyOf(bindings), result.status(), result.missingFiles());
    }

    private static List<PartialPath> withoutShadowed(List<PartialPath> paths) {
        List<PartialPath> kept = new ArrayList<>(paths.size());
        for (PartialPath path : paths) {
            boolean shadowed = false;
            for (PartialPath other : paths) {
                if (other != path && other.shadows(path)) {
                    shadowed = true;
                    break;
                }
            }
            if (!shadowed) {
                kept.add(path);
            }
        }
        return kept;
    }
}
