package org.stackgraphs.index;

import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.stitching.PathStitcher;
import org.stackgraphs.stitching.StitchingResult;
import org.stackgraphs.storage.api.StorageException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Complete paths of one query, produced lazily.
 * <p>
 * Every call to {@link #iterator()} starts a fresh stitching session and runs only as many
 * phases as needed to yield the next path. Paths found in the same phase are yielded in
 * {@link PartialPath#PRECEDENCE_ORDER}; across phases they come in the order they were found,
 * so callers that need the preferred binding first use {@link NameResolver#findDefinitions}.
 * <p>
 * Iteration ends when the search is exhausted or the cancellation flag is raised; the
 * {@link Cursor} then tells which of the two happened and which files were missing.
 * Storage failures surface as {@link ResolutionFailedException}.
 */
public final class ResolutionQuery implements Iterable<PartialPath> {

    /**
     * Opens a new stitching session for one iteration.
     */
    @FunctionalInterface
    interface SessionFactory {
        PathStitcher open() throws StorageException;
    }

    private final String description;
    private final SessionFactory sessions;
    private final CancellationFlag cancellation;

    ResolutionQuery(String description, SessionFactory sessions, CancellationFlag cancellation) {
        this.description = description;
        this.sessions = sessions;
        this.cancellation = cancellation;
    }

    @Override
    public Cursor iterator() {
        return new Cursor();
    }

    @Override
    public String toString() {
        return "ResolutionQuery{" + description + "}";
    }

    /**
     * One pass over the query's complete paths.
     */
    public final class Cursor implements Iterator<PartialPath> {

        private PathStitcher stitcher;
        private boolean cancelled;
        private final Deque<PartialPath> ready = new ArrayDeque<>();

        private Cursor() {
        }

        @Override
        public boolean hasNext() {
            if (cancelled) {
                return !ready.isEmpty();
            }
            try {
                if (stitcher == null) {
                    stitcher = sessions.open();
                    collect();
                }
                while (ready.isEmpty() && !stitcher.isComplete()) {
                    stitcher.processNextPhase(cancellation);
                    collect();
                }
            } catch (CancelledException e) {
                cancelled = true;
            } catch (StorageException e) {
                throw new ResolutionFailedException("Failed to resolve " + description, e);
            }
            return !ready.isEmpty();
        }

        @Override
        public PartialPath next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.pollFirst();
        }

        /**
         * How the search ended: {@link StitchingResult.Status#CANCELLED} once the flag stopped it,
         * {@link StitchingResult.Status#INCOMPLETE_PATHS} if files were missing, otherwise
         * {@link StitchingResult.Status#COMPLETE}.
         *
         * @throws IllegalStateException if the search has neither been exhausted nor cancelled yet
         */
        public StitchingResult.Status status() {
            if (cancelled) {
                return StitchingResult.Status.CANCELLED;
            }
            if (stitcher == null || !stitcher.isComplete()) {
                throw new IllegalStateException("Query " + description + " has not finished yet");
            }
            return stitcher.missingFiles().isEmpty()
                ? StitchingResult.Status.COMPLETE
                : StitchingResult.Status.INCOMPLETE_PATHS;
        }

        /**
         * Files needed so far that are not stored.
         */
        public Set<String> missingFiles() {
            return stitcher == null ? Set.of() : Set.copyOf(stitcher.missingFiles());
        }

        private void collect() {
            List<PartialPath> found = new ArrayList<>();
            for (PartialPath path : stitcher.previousPhasePaths()) {
                PartialPath complete = stitcher.completeForm(path);
                if (complete != null) {
                    found.add(complete);
                }
            }
            ready.addAll(stitcher.inPrecedenceOrder(found));
        }
    }
}
