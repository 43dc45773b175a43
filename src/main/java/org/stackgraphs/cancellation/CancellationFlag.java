package org.stackgraphs.cancellation;

/**
 * Cooperative cancellation predicate polled by long-running algorithms.
 * <p>
 * Algorithms call {@link #check(String)} at every unit of work; once the flag reports
 * cancellation they stop and report a cancelled outcome instead of a partial result.
 */
@FunctionalInterface
public interface CancellationFlag {

    /**
     * Returns whether the caller requested the current operation to stop.
     */
    boolean isCancelled();

    /**
     * Throws if cancellation was requested.
     *
     * @param location short description of the work in progress, included in the exception
     * @throws CancelledException if {@link #isCancelled()} is true
     */
    default void check(String location) throws CancelledException {
        if (isCancelled()) {
            throw new CancelledException(location);
        }
    }
}
