package org.stackgraphs.graph;

/**
 * Thrown when a node is added with a {@link NodeId} that already exists.
 */
public class DuplicateNodeException extends GraphConstructionException {

    private final NodeId nodeId;

    public DuplicateNodeException(NodeId nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public NodeId getNodeId() {
        return nodeId;
    }
}
