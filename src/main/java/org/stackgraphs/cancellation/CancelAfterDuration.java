package org.stackgraphs.cancellation;

import java.time.Duration;

/**
 * Flag that cancels once a time limit has elapsed since construction.
 */
public final class CancelAfterDuration implements CancellationFlag {

    private final long deadlineNanos;

    public CancelAfterDuration(Duration limit) {
        this.deadlineNanos = System.nanoTime() + limit.toNanos();
    }

    @Override
    public boolean isCancelled() {
        return System.nanoTime() - deadlineNanos >= 0;
    }
}
