package org.stackgraphs.index;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link StackGraphIndexer#indexAll}: the files that were indexed, in submission
 * order, and the files that failed with the reason of the failure.
 */
public record BatchIndexResult(List<FileIndexResult> indexed, Map<String, String> failed) {

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    public int totalPaths() {
        int total = 0;
        for (FileIndexResult result : indexed) {
            total += result.pathCount();
        }
        return total;
    }
}
