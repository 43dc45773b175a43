package org.stackgraphs.partial;

/**
 * Signals that a path cannot be extended because a stack operation failed.
 * <p>
 * Path search uses this exception to prune a branch; it never leaves the search algorithms.
 * It is raised on hot paths and therefore carries no stack trace.
 */
public class PathResolutionException extends Exception {

    /**
     * Why a path was rejected.
     */
    public enum Reason {
        /** A node required a scope but the scope stack is empty. */
        EMPTY_SCOPE_STACK,
        /** A pop was attempted on an empty, closed symbol stack. */
        EMPTY_SYMBOL_STACK,
        /** The popped symbol differs from the symbol of the pop node. */
        INCORRECT_POPPED_SYMBOL,
        /** A scoped pop found a symbol without an attached scope stack. */
        MISSING_ATTACHED_SCOPE_LIST,
        /** A plain pop found a symbol carrying an attached scope stack. */
        UNEXPECTED_ATTACHED_SCOPE_LIST,
        /** The scope attached by a scoped push does not exist or is not exported. */
        UNKNOWN_ATTACHED_SCOPE,
        /** An edge does not start at the end of the path it is appended to. */
        INCORRECT_SOURCE_NODE,
        /** Two scope stack conditions cannot be unified. */
        SCOPE_STACK_UNSATISFIED,
        /** Two symbol stack conditions cannot be unified. */
        SYMBOL_STACK_UNSATISFIED
    }

    private final Reason reason;

    public PathResolutionException(Reason reason) {
        super(reason.name(), null, false, false);
        this.reason = reason;
    }

    public PathResolutionException(Reason reason, String message) {
        super(reason.name() + ": " + message, null, false, false);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
