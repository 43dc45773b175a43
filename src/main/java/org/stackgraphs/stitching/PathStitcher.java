package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.CycleDetector;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathExtension;
import org.stackgraphs.partial.PathResolutionException;
import org.stackgraphs.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Breadth-first stitching of partial paths, one phase at a time.
 * <p>
 * Each phase extends every path of the current frontier with every compatible candidate from an
 * {@link IPathCandidates} source; the extended paths form the next frontier. Callers inspect
 * {@link #previousPhasePaths()} between phases, which makes the search resumable and lets
 * cancellation take effect between units of work.
 * <p>
 * A forward stitcher extends paths at their end and is seeded with paths starting at references;
 * a backward stitcher extends paths at their start and is seeded with paths ending at definitions.
 * Revisits of a node on the same branch are pruned through {@link CycleDetector}. With similar-path
 * detection enabled, a frontier path replaced by a preferred equivalent path is not extended.
 */
public final class PathStitcher {

    private static final Logger log = LoggerFactory.getLogger(PathStitcher.class);

    private final IPathCandidates candidates;
    private final StackGraph graph;
    private final Direction direction;
    private final StitcherConfig config;
    private final SimilarPathDetector similarPaths;
    private final StitchingStats stats;

    private final Deque<Frame> queue = new ArrayDeque<>();
    private List<PartialPath> previousPhase;
    private int phase;

    /**
     * @param initialPaths seed paths; forward seeds are taken as they are, jump-to endings resolved
     */
    public PathStitcher(IPathCandidates candidates, Direction direction, List<PartialPath> initialPaths,
                        StitcherConfig config) {
        this.candidates = candidates;
        this.graph = candidates.graph();
        this.direction = direction;
        this.config = config;
        this.similarPaths = config.detectSimilarPaths() ? new SimilarPathDetector() : null;
        this.stats = config.collectStats() ? new StitchingStats() : null;

        List<PartialPath> seeds = new ArrayList<>(initialPaths.size());
        for (PartialPath initial : initialPaths) {
            PartialPath seed = initial;
            if (direction == Direction.FORWARD) {
                try {
                    seed = initial.resolveJumpTo(graph);
                } catch (PathResolutionException e) {
                    log.debug("Dropping seed path {}: {}", initial, e.getMessage());
                    continue;
                }
            }
            if (similarPaths != null && !similarPaths.add(seed)) {
                continue;
            }
            seeds.add(seed);
            queue.addLast(new Frame(seed, null));
        }
        this.previousPhase = List.copyOf(seeds);
    }

    // ==================== Seeding ====================

    /**
     * Forward stitcher over single edges, seeded with the zero-length paths of {@code startNodes}
     * entered with empty stacks.
     */
    public static PathStitcher forwardFromNodes(IPathCandidates candidates, Iterable<Handle<Node>> startNodes,
                                                StitcherConfig config) {
        List<PartialPath> seeds = new ArrayList<>();
        for (Handle<Node> start : startNodes) {
            try {
                seeds.add(PartialPath.fromNode(candidates.graph(), start).eliminatePreconditionVariables());
            } catch (PathResolutionException e) {
                log.debug("Node {} cannot start a path: {}", start, e.getMessage());
            }
        }
        return new PathStitcher(candidates, Direction.FORWARD, seeds, config);
    }

    /**
     * Backward stitcher over single edges, seeded with the zero-length paths of {@code endNodes}
     * leaving nothing on the symbol stack.
     */
    public static PathStitcher backwardFromNodes(IPathCandidates candidates, Iterable<Handle<Node>> endNodes,
                                                 StitcherConfig config) {
        List<PartialPath> seeds = new ArrayList<>();
        for (Handle<Node> end : endNodes) {
            try {
                seeds.add(PartialPath.fromNode(candidates.graph(), end).eliminateSymbolPostconditionVariable());
            } catch (PathResolutionException e) {
                log.debug("Node {} cannot end a path: {}", end, e.getMessage());
            }
        }
        return new PathStitcher(candidates, Direction.BACKWARD, seeds, config);
    }

    // ==================== Phases ====================

    public Direction direction() {
        return direction;
    }

    /**
     * Paths produced by the most recent phase (the seeds before the first phase).
     */
    public List<PartialPath> previousPhasePaths() {
        return previousPhase;
    }

    public boolean isComplete() {
        return queue.isEmpty();
    }

    public int phase() {
        return phase;
    }

    /**
     * Statistics, or {@code null} when collection is disabled.
     */
    public StitchingStats stats() {
        return stats;
    }

    /**
     * Files that were needed so far but are not available to the candidate source.
     */
    public Set<String> missingFiles() {
        return candidates.missingFiles();
    }

    /**
     * Extends the current frontier by one step. With {@code maxWorkPerPhase} set, only that many
     * frontier paths are extended; the rest are carried over to the next phase.
     *
     * @throws CancelledException if the flag is raised; the frontier is left consistent
     * @throws StorageException   if candidates cannot be read
     */
    public void processNextPhase(CancellationFlag cancellation) throws CancelledException, StorageException {
        int budget = config.maxWorkPerPhase() > 0 ? config.maxWorkPerPhase() : queue.size();
        int work = Math.min(budget, queue.size());
        if (stats != null) {
            stats.recordPhase(queue.size());
        }
        List<Frame> produced = new ArrayList<>();
        List<PartialPath> phasePaths = new ArrayList<>();
        for (int i = 0; i < work; i++) {
            cancellation.check("stitching phase " + (phase + 1));
            Frame frame = queue.pollFirst();
            if (similarPaths != null && similarPaths.isSuperseded(frame.path())) {
                if (stats != null) {
                    stats.recordSimilar();
                }
                continue;
            }
            extend(frame, produced, phasePaths, cancellation);
        }
        for (Frame frame : produced) {
            queue.addLast(frame);
        }
        previousPhase = List.copyOf(phasePaths);
        phase++;
        log.trace("Phase {} produced {} paths, {} queued", phase, phasePaths.size(), queue.size());
    }

    private void extend(Frame frame, List<Frame> produced, List<PartialPath> phasePaths,
                        CancellationFlag cancellation) throws CancelledException, StorageException {
        PartialPath path = frame.path();
        candidates.loadCandidates(path, direction, cancellation);
        List<PathExtension> extensions = candidates.candidates(path, direction);
        int accepted = 0;
        for (PathExtension extension : extensions) {
            PartialPath extended;
            try {
                if (direction == Direction.FORWARD) {
                    extended = extension.appendTo(graph, path).resolveJumpTo(graph);
                } else {
                    extended = extension.prependTo(graph, path);
                }
            } catch (PathResolutionException e) {
                if (stats != null) {
                    stats.recordRejected();
                }
                continue;
            }
            if (revisitsDivergently(frame, extended)) {
                if (stats != null) {
                    stats.recordCycle();
                }
                continue;
            }
            if (similarPaths != null && !similarPaths.add(extended)) {
                if (stats != null) {
                    stats.recordSimilar();
                }
                continue;
            }
            produced.add(new Frame(extended, frame));
            phasePaths.add(extended);
            accepted++;
        }
        if (stats != null) {
            stats.recordPath(extensions.size(), accepted);
        }
    }

    private boolean revisitsDivergently(Frame parent, PartialPath extended) {
        Handle<Node> junction = junctionOf(extended);
        for (Frame f = parent; f != null; f = f.parent()) {
            if (!junctionOf(f.path()).equals(junction)) {
                continue;
            }
            boolean divergent = direction == Direction.FORWARD
                ? CycleDetector.isDivergentForward(f.path(), extended)
                : CycleDetector.isDivergentBackward(f.path(), extended);
            if (divergent) {
                return true;
            }
        }
        return false;
    }

    private Handle<Node> junctionOf(PartialPath path) {
        return direction == Direction.FORWARD ? path.endNode() : path.startNode();
    }

    // ==================== Complete paths ====================

    /**
     * Runs {@code stitcher} until no extensions remain and reports every complete path found.
     * A cancelled run returns the paths found so far with status {@link StitchingResult.Status#CANCELLED}.
     * <p>
     * The result lists complete paths in {@link PartialPath#PRECEDENCE_ORDER}, ties in discovery
     * order; with similar-path detection, only the preferred one of equivalent paths is listed.
     * {@code visitor} sees every complete path as soon as it is found.
     *
     * @throws StorageException if candidates cannot be read
     */
    public static StitchingResult findAllCompletePaths(PathStitcher stitcher, CancellationFlag cancellation,
                                                       Consumer<PartialPath> visitor) throws StorageException {
        List<PartialPath> complete = new ArrayList<>();
        Consumer<PartialPath> collector = complete::add;
        Consumer<PartialPath> sink = visitor == null ? collector : collector.andThen(visitor);
        try {
            stitcher.reportComplete(stitcher.previousPhasePaths(), sink);
            while (!stitcher.isComplete()) {
                stitcher.processNextPhase(cancellation);
                stitcher.reportComplete(stitcher.previousPhasePaths(), sink);
            }
        } catch (CancelledException e) {
            log.debug("Stitching cancelled after {} phases with {} complete paths", stitcher.phase(), complete.size());
            return new StitchingResult(stitcher.inPrecedenceOrder(complete), StitchingResult.Status.CANCELLED,
                stitcher.candidates.missingFiles(), stitcher.stats);
        }
        Set<String> missing = stitcher.candidates.missingFiles();
        StitchingResult.Status status = missing.isEmpty()
            ? StitchingResult.Status.COMPLETE
            : StitchingResult.Status.INCOMPLETE_PATHS;
        log.debug("Stitching finished after {} phases with {} complete paths ({})",
            stitcher.phase(), complete.size(), status);
        return new StitchingResult(stitcher.inPrecedenceOrder(complete), status, missing, stitcher.stats);
    }

    /**
     * Sorts complete paths by {@link PartialPath#PRECEDENCE_ORDER}; the sort is stable, so
     * paths with equal precedences stay in the order they were found.
     */
    public List<PartialPath> inPrecedenceOrder(List<PartialPath> complete) {
        List<PartialPath> ordered = similarPaths != null
            ? SimilarPathDetector.keepPreferred(complete)
            : new ArrayList<>(complete);
        ordered.sort(PartialPath.PRECEDENCE_ORDER);
        return List.copyOf(ordered);
    }

    /**
     * The complete form of a path produced by this stitcher, or {@code null} if it does not bind
     * a reference to a definition. Backward paths are closed by entering them with empty stacks;
     * an open scope postcondition is closed by leaving with an empty scope stack.
     */
    public PartialPath completeForm(PartialPath path) {
        if (!graph.node(path.startNode()).isReference() || !graph.node(path.endNode()).isDefinition()) {
            return null;
        }
        PartialPath candidate = path;
        try {
            if (direction == Direction.BACKWARD) {
                candidate = candidate.eliminatePreconditionVariables();
            }
            candidate = candidate.eliminateScopePostconditionVariable();
        } catch (PathResolutionException e) {
            return null;
        }
        return candidate.isComplete(graph) ? candidate : null;
    }

    private void reportComplete(List<PartialPath> paths, Consumer<PartialPath> sink) {
        for (PartialPath path : paths) {
            PartialPath complete = completeForm(path);
            if (complete != null) {
                sink.accept(complete);
            }
        }
    }

    private record Frame(PartialPath path, Frame parent) {
    }
}
