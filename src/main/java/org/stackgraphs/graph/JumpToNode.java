package org.stackgraphs.graph;

public record JumpToNode(NodeId id) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.JUMP_TO;
    }

    @Override
    public String toString() {
        return "[jump to scope]";
    }
}
