package org.stackgraphs.storage.api;

import org.stackgraphs.graph.NodeKind;
import org.stackgraphs.graph.SourceSpan;

import java.util.List;

/**
 * The nodes and edges contributed by one file: its own nodes, the edges leaving them and the
 * edges from the root into the file.
 *
 * @param file  the file name
 * @param nodes node descriptions in creation order
 * @param edges edges in per-source exploration order
 */
public record GraphFragment(String file, List<NodeRecord> nodes, List<PartialPathRecord.EdgeRef> edges) {

    /**
     * @param localId       identifier within the file
     * @param kind          node variant
     * @param symbol        pushed or popped symbol, {@code null} for other kinds
     * @param attachedScope scope attached by a scoped push, {@code null} otherwise
     * @param flag          exported / reference / definition flag, depending on the kind
     * @param span          optional source span
     * @param syntaxType    optional syntax type
     */
    public record NodeRecord(int localId, NodeKind kind, String symbol, NodeKey attachedScope, boolean flag,
                             SourceSpan span, String syntaxType) {
    }
}
