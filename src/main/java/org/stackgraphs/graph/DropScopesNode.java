package org.stackgraphs.graph;

public record DropScopesNode(NodeId id) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.DROP_SCOPES;
    }

    @Override
    public String toString() {
        return "[drop scopes " + id + "]";
    }
}
