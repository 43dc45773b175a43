package org.stackgraphs.cancellation;

/**
 * Raised when an operation stopped because its {@link CancellationFlag} was set.
 * <p>
 * This is a normal outcome rather than a failure; callers decide whether to retry, report
 * or discard the work.
 */
public class CancelledException extends Exception {

    private final String location;

    public CancelledException(String location) {
        super("Cancelled at " + location);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
