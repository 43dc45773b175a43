package org.stackgraphs.stitching;

import org.stackgraphs.partial.PartialPath;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a stitching run.
 *
 * @param paths        complete paths found, in precedence order
 * @param status       how the run ended
 * @param missingFiles files that were needed but not stored (non-empty iff {@link Status#INCOMPLETE_PATHS})
 * @param stats        collected statistics, or {@code null} if collection was disabled
 */
public record StitchingResult(List<PartialPath> paths, Status status, Set<String> missingFiles,
                              StitchingStats stats) {

    public enum Status {
        /** Every reachable candidate was explored. */
        COMPLETE,
        /** Exploration finished but some needed files were not available. */
        INCOMPLETE_PATHS,
        /** The cancellation flag stopped exploration; {@code paths} holds what was found so far. */
        CANCELLED
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }
}
