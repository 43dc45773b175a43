package org.stackgraphs.partial;

/**
 * Decides whether revisiting a node on the same search branch can only repeat forever.
 * <p>
 * {@code earlier} and {@code later} are two versions of one growing path that arrived at the
 * same node, {@code later} after going round a cycle. The revisit is pruned when
 * <ul>
 *   <li>the stacks at the node are identical to the earlier visit (nothing new can be found),</li>
 *   <li>the cycle consumed stack entries that were not known yet, so every further round would
 *       demand even more of the caller, or</li>
 *   <li>the cycle only grew the stacks, so it could be taken any number of times.</li>
 * </ul>
 * A cycle that rewrites stack entries without growing them is kept; it either stops matching
 * or runs into an identical state.
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    /**
     * Revisit check for paths growing at their end; both paths end at the same node.
     */
    public static boolean isDivergentForward(PartialPath earlier, PartialPath later) {
        if (later.symbolPostcondition().equals(earlier.symbolPostcondition())
            && later.scopePostcondition().equals(earlier.scopePostcondition())) {
            return true;
        }
        if (!later.symbolPrecondition().equals(earlier.symbolPrecondition())
            || !later.scopePrecondition().equals(earlier.scopePrecondition())) {
            return true;
        }
        return grows(later.symbolPostcondition().size() - earlier.symbolPostcondition().size(),
            later.scopePostcondition().length() - earlier.scopePostcondition().length());
    }

    /**
     * Revisit check for paths growing at their start; both paths start at the same node.
     */
    public static boolean isDivergentBackward(PartialPath earlier, PartialPath later) {
        if (later.symbolPrecondition().equals(earlier.symbolPrecondition())
            && later.scopePrecondition().equals(earlier.scopePrecondition())) {
            return true;
        }
        if (!later.symbolPostcondition().equals(earlier.symbolPostcondition())
            || !later.scopePostcondition().equals(earlier.scopePostcondition())) {
            return true;
        }
        return grows(later.symbolPrecondition().size() - earlier.symbolPrecondition().size(),
            later.scopePrecondition().length() - earlier.scopePrecondition().length());
    }

    private static boolean grows(int symbolDelta, int scopeDelta) {
        return symbolDelta >= 0 && scopeDelta >= 0 && (symbolDelta > 0 || scopeDelta > 0);
    }
}
