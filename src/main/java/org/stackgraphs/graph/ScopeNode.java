package org.stackgraphs.graph;

/**
 * Junction node. Exported scopes may be referenced from other files and are the points where
 * partial paths are cut and later stitched together.
 */
public record ScopeNode(NodeId id, boolean exported) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.SCOPE;
    }

    @Override
    public boolean isExportedScope() {
        return exported;
    }

    @Override
    public String toString() {
        return (exported ? "[exported scope " : "[scope ") + id + "]";
    }
}
