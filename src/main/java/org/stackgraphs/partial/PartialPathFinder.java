package org.stackgraphs.partial;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.StackGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Computes the partial paths of one file by symbolic depth-first search.
 * <p>
 * Search starts at the root and at every reference and exported scope of the file. A path is
 * reported and not extended further when it reaches the root, an exported scope, a node outside
 * the file (including the jump-to node when the target scope is not known yet) or a node without
 * outgoing edges. Paths reaching a definition are reported and extended further.
 * <p>
 * Only the file's own nodes and the root are traversed, so the result depends on nothing but
 * the file's part of the graph. Edges are explored by ascending precedence, in insertion order
 * among equal precedences, and paths are reported in that order.
 */
public class PartialPathFinder {

    private static final Logger log = LoggerFactory.getLogger(PartialPathFinder.class);

    private final StackGraph graph;

    public PartialPathFinder(StackGraph graph) {
        this.graph = graph;
    }

    /**
     * Root, references and exported scopes of {@code file}, in that order.
     */
    public List<Handle<Node>> defaultStartNodes(Handle<SourceFile> file) {
        List<Handle<Node>> starts = new ArrayList<>();
        starts.add(graph.root());
        for (Handle<Node> handle : graph.nodesForFile(file)) {
            Node node = graph.node(handle);
            if (node.isReference() || node.isExportedScope()) {
                starts.add(handle);
            }
        }
        return starts;
    }

    /**
     * Collects all partial paths of {@code file}.
     *
     * @throws CancelledException if the flag was raised; no partial result is returned
     */
    public List<PartialPath> findAllPartialPathsInFile(Handle<SourceFile> file, CancellationFlag cancellation)
        throws CancelledException {
        List<PartialPath> paths = new ArrayList<>();
        findPartialPaths(file, defaultStartNodes(file), cancellation, paths::add);
        return paths;
    }

    /**
     * Reports every partial path of {@code file} that starts at one of {@code startNodes}.
     */
    public void findPartialPaths(Handle<SourceFile> file, Iterable<Handle<Node>> startNodes,
                                 CancellationFlag cancellation, Consumer<PartialPath> visitor)
        throws CancelledException {
        String fileName = graph.fileName(file);
        int[] found = {0};
        Consumer<PartialPath> counting = path -> {
            found[0]++;
            visitor.accept(path);
        };
        for (Handle<Node> start : startNodes) {
            cancellation.check("partial path finding in " + fileName);
            PartialPath seed;
            try {
                seed = PartialPath.fromNode(graph, start);
            } catch (PathResolutionException e) {
                log.trace("Start node {} of '{}' rejected: {}", graph.node(start), fileName, e.getReason());
                continue;
            }
            explore(file, fileName, seed, cancellation, counting);
        }
        log.debug("Found {} partial paths in '{}'", found[0], fileName);
    }

    private void explore(Handle<SourceFile> file, String fileName, PartialPath seed,
                         CancellationFlag cancellation, Consumer<PartialPath> visitor) throws CancelledException {
        boolean fromRoot = graph.node(seed.startNode()).isRoot();
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(seed, null));

        while (!pending.isEmpty()) {
            cancellation.check("partial path finding in " + fileName);
            Frame frame = pending.pop();
            PartialPath path = frame.path();
            Node end = graph.node(path.endNode());

            if (path.edgeCount() > 0) {
                if (isBoundary(end, file)) {
                    visitor.accept(path);
                    continue;
                }
                if (end.isDefinition()) {
                    visitor.accept(path);
                }
            }

            List<Edge> edges = graph.outgoingEdges(path.endNode());
            if (edges.isEmpty()) {
                if (path.edgeCount() > 0 && !end.isDefinition()) {
                    visitor.accept(path);
                }
                continue;
            }

            List<Frame> children = new ArrayList<>(edges.size());
            for (Edge edge : edges) {
                if (fromRoot && path.edgeCount() == 0 && !graph.node(edge.sink()).isInFile(file)) {
                    continue;
                }
                PartialPath next;
                try {
                    next = path.append(graph, edge).resolveJumpTo(graph);
                } catch (PathResolutionException e) {
                    continue;
                }
                if (isDivergentRevisit(frame, next)) {
                    continue;
                }
                children.add(new Frame(next, frame));
            }
            // push in reverse so that the lowest precedence is explored first
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private boolean isBoundary(Node node, Handle<SourceFile> file) {
        return node.isRoot() || node.isExportedScope() || !node.isInFile(file);
    }

    private static boolean isDivergentRevisit(Frame frame, PartialPath next) {
        for (Frame ancestor = frame; ancestor != null; ancestor = ancestor.parent()) {
            if (ancestor.path().endNode().equals(next.endNode())
                && CycleDetector.isDivergentForward(ancestor.path(), next)) {
                return true;
            }
        }
        return false;
    }

    private record Frame(PartialPath path, Frame parent) {
    }
}
