package org.stackgraphs.index;

import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.storage.api.NodeKey;

/**
 * A reference bound to a definition by a complete path.
 */
public record Binding(NodeKey reference, NodeKey definition, PartialPath path) {
}
