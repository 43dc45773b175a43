package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathExtension;
import org.stackgraphs.partial.PathResolutionException;

/**
 * A single graph edge used as a path extension.
 */
public record EdgeExtension(Edge edge) implements PathExtension {

    @Override
    public Handle<Node> startNode() {
        return edge.source();
    }

    @Override
    public Handle<Node> endNode() {
        return edge.sink();
    }

    @Override
    public PartialPath appendTo(StackGraph graph, PartialPath path) throws PathResolutionException {
        return path.append(graph, edge);
    }

    @Override
    public PartialPath prependTo(StackGraph graph, PartialPath path) throws PathResolutionException {
        return path.prependEdge(graph, edge);
    }
}
