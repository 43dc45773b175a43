package org.stackgraphs.cancellation;

/**
 * Flag that never cancels.
 */
public final class NoCancellation implements CancellationFlag {

    public static final NoCancellation INSTANCE = new NoCancellation();

    private NoCancellation() {
    }

    @Override
    public boolean isCancelled() {
        return false;
    }
}
