package org.stackgraphs.index;

import org.stackgraphs.storage.api.NodeKey;

import java.util.List;
import java.util.Map;

/**
 * Definitions of every reference of a file whose source span touches a line range.
 *
 * @param results resolution per reference, in node order
 */
public record LineRangeLookup(String file, int lineStart, int lineEnd, Map<NodeKey, ResolutionResult> results) {

    public int referencesFound() {
        return results.size();
    }

    public int definitionsFound() {
        int total = 0;
        for (ResolutionResult result : results.values()) {
            total += result.definitions().size();
        }
        return total;
    }

    public List<NodeKey> unresolvedReferences() {
        return results.entrySet().stream()
            .filter(e -> e.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();
    }
}
