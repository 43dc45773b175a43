package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathExtension;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidates taken directly from the edges of an in-memory graph, one edge at a time.
 * <p>
 * Stitching with these candidates explores the whole graph without any precomputed partial
 * paths. Backward stitching treats every exported scope as reachable from the jump-to node.
 */
public class GraphEdgeCandidates implements IPathCandidates {

    private final StackGraph graph;

    public GraphEdgeCandidates(StackGraph graph) {
        this.graph = graph;
    }

    @Override
    public StackGraph graph() {
        return graph;
    }

    @Override
    public List<PathExtension> candidates(PartialPath path, Direction direction) {
        List<PathExtension> extensions = new ArrayList<>();
        if (direction == Direction.FORWARD) {
            for (Edge edge : graph.outgoingEdges(path.endNode())) {
                extensions.add(new EdgeExtension(edge));
            }
            return extensions;
        }
        Handle<Node> start = path.startNode();
        for (Edge edge : graph.incomingEdges(start)) {
            extensions.add(new EdgeExtension(edge));
        }
        if (graph.node(start).isExportedScope()) {
            extensions.add(PartialPath.jumpSegment(graph, start));
        }
        return extensions;
    }
}
