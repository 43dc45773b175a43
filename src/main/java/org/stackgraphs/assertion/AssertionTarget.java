package org.stackgraphs.assertion;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.SourceInfo;
import org.stackgraphs.graph.StackGraph;

import java.util.Optional;

/**
 * An expected definition location: a zero-based line of a file.
 */
public record AssertionTarget(Handle<SourceFile> file, int line) {

    /**
     * Whether {@code node} lies in the target file and its span covers the target line.
     */
    public boolean matches(StackGraph graph, Handle<Node> node) {
        if (!graph.node(node).isInFile(file)) {
            return false;
        }
        Optional<SourceInfo> info = graph.sourceInfo(node);
        return info.isPresent()
            && info.get().span().start().line() <= line
            && line <= info.get().span().end().line();
    }

    public String display(StackGraph graph) {
        return graph.fileName(file) + ":" + (line + 1);
    }
}
