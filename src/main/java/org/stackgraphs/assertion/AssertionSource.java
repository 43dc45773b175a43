package org.stackgraphs.assertion;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.Position;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.SourceInfo;
import org.stackgraphs.graph.StackGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The position an assertion talks about.
 */
public record AssertionSource(Handle<SourceFile> file, Position position) {

    /**
     * Definition nodes of the file whose source span contains the position.
     */
    public List<Handle<Node>> definitions(StackGraph graph) {
        return nodesAt(graph, Node::isDefinition);
    }

    /**
     * Reference nodes of the file whose source span contains the position.
     */
    public List<Handle<Node>> references(StackGraph graph) {
        return nodesAt(graph, Node::isReference);
    }

    /**
     * {@code file:line:column}, one-based.
     */
    public String display(StackGraph graph) {
        return graph.fileName(file) + ":" + (position.line() + 1) + ":" + (position.column() + 1);
    }

    private List<Handle<Node>> nodesAt(StackGraph graph, Predicate<Node> kind) {
        List<Handle<Node>> found = new ArrayList<>();
        for (Handle<Node> handle : graph.nodesForFile(file)) {
            if (!kind.test(graph.node(handle))) {
                continue;
            }
            Optional<SourceInfo> info = graph.sourceInfo(handle);
            if (info.isPresent() && info.get().span().contains(position)) {
                found.add(handle);
            }
        }
        return found;
    }
}
