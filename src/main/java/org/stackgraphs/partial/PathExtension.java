package org.stackgraphs.partial;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;

/**
 * Something that can extend a partial path at one of its ends: a single edge, or another
 * partial path sharing the junction node.
 */
public interface PathExtension {

    Handle<Node> startNode();

    Handle<Node> endNode();

    /**
     * Extends {@code path} forward; {@code path} must end where this extension starts.
     */
    PartialPath appendTo(StackGraph graph, PartialPath path) throws PathResolutionException;

    /**
     * Extends {@code path} backward; {@code path} must start where this extension ends.
     */
    PartialPath prependTo(StackGraph graph, PartialPath path) throws PathResolutionException;
}
