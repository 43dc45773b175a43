package org.stackgraphs.partial;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Values assigned to scope stack variables during unification.
 */
public final class ScopeStackBindings {

    private final Int2ObjectOpenHashMap<PartialScopeStack> bindings = new Int2ObjectOpenHashMap<>();

    public PartialScopeStack get(int variable) {
        return bindings.get(variable);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * Binds {@code variable} to {@code value}. A variable that is already bound is unified with
     * the new value instead.
     *
     * @throws PathResolutionException if the binding is unsatisfiable
     */
    public void add(int variable, PartialScopeStack value) throws PathResolutionException {
        PartialScopeStack resolved = value.applyBindings(this);
        PartialScopeStack existing = bindings.get(variable);
        if (existing != null) {
            PartialScopeStack.unify(existing, resolved, this);
            return;
        }
        if (resolved.variable() == variable) {
            if (resolved.hasScopes()) {
                // $v = [s..., $v] has no finite solution
                throw new PathResolutionException(PathResolutionException.Reason.SCOPE_STACK_UNSATISFIED,
                    "scope variable $" + variable + " would contain itself");
            }
            return;
        }
        bindings.put(variable, resolved);
    }
}
