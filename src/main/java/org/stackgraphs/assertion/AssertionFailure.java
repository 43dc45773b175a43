package org.stackgraphs.assertion;

import org.stackgraphs.partial.PartialPath;

import java.util.List;

/**
 * Thrown when an {@link Assertion} does not hold.
 * <p>
 * The message is ready for display; the accessors expose the discrepancy for programmatic use.
 * Lists that do not apply to the {@link Kind} are empty.
 */
public class AssertionFailure extends Exception {

    public enum Kind {
        /** The source position holds no reference. */
        NO_REFERENCES,
        /** References resolve to other definitions than expected. */
        INCORRECTLY_DEFINED,
        /** The source position defines other symbols than expected. */
        INCORRECT_DEFINITIONS,
        /** The source position references other symbols than expected. */
        INCORRECT_REFERENCES,
        /** Resolution was cancelled before the assertion could be decided. */
        CANCELLED
    }

    private final Kind kind;
    private final List<AssertionTarget> missingTargets;
    private final List<PartialPath> unexpectedPaths;
    private final List<String> missingSymbols;
    private final List<String> unexpectedSymbols;

    AssertionFailure(Kind kind, String message) {
        this(kind, message, List.of(), List.of(), List.of(), List.of());
    }

    AssertionFailure(Kind kind, String message, List<AssertionTarget> missingTargets,
                     List<PartialPath> unexpectedPaths, List<String> missingSymbols,
                     List<String> unexpectedSymbols) {
        super(message);
        this.kind = kind;
        this.missingTargets = List.copyOf(missingTargets);
        this.unexpectedPaths = List.copyOf(unexpectedPaths);
        this.missingSymbols = List.copyOf(missingSymbols);
        this.unexpectedSymbols = List.copyOf(unexpectedSymbols);
    }

    public Kind getKind() {
        return kind;
    }

    public List<AssertionTarget> getMissingTargets() {
        return missingTargets;
    }

    public List<PartialPath> getUnexpectedPaths() {
        return unexpectedPaths;
    }

    public List<String> getMissingSymbols() {
        return missingSymbols;
    }

    public List<String> getUnexpectedSymbols() {
        return unexpectedSymbols;
    }
}
