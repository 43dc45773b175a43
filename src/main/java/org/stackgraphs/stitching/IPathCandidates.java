package org.stackgraphs.stitching;

import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PathExtension;
import org.stackgraphs.storage.api.StorageException;

import java.util.List;
import java.util.Set;

/**
 * Source of extensions for the frontier paths of a {@link PathStitcher}.
 * <p>
 * Implementations only read; a stitcher never writes through its candidates.
 */
public interface IPathCandidates {

    /**
     * Graph in which candidate paths and frontier paths live.
     */
    StackGraph graph();

    /**
     * Makes the candidates for {@code path} available, loading them from storage if needed.
     */
    default void loadCandidates(PartialPath path, Direction direction, CancellationFlag cancellation)
        throws StorageException, CancelledException {
    }

    /**
     * Extensions that may be joined to {@code path} at its end ({@link Direction#FORWARD}) or start
     * ({@link Direction#BACKWARD}), in the order in which they should be tried.
     */
    List<PathExtension> candidates(PartialPath path, Direction direction);

    /**
     * Files that were needed during stitching but are not available.
     */
    default Set<String> missingFiles() {
        return Set.of();
    }
}
