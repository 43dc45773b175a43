package org.stackgraphs.graph;

public record RootNode(NodeId id) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.ROOT;
    }

    @Override
    public String toString() {
        return "[root]";
    }
}
