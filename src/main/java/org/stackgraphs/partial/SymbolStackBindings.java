package org.stackgraphs.partial;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Values assigned to symbol stack variables during unification.
 */
public final class SymbolStackBindings {

    private final Int2ObjectOpenHashMap<PartialSymbolStack> bindings = new Int2ObjectOpenHashMap<>();

    public PartialSymbolStack get(int variable) {
        return bindings.get(variable);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * Binds {@code variable} to {@code value}, unifying with any existing binding.
     *
     * @throws PathResolutionException if the binding is unsatisfiable
     */
    public void add(int variable, PartialSymbolStack value, ScopeStackBindings scopeBindings)
        throws PathResolutionException {
        PartialSymbolStack resolved = value.applyBindings(this, scopeBindings);
        PartialSymbolStack existing = bindings.get(variable);
        if (existing != null) {
            PartialSymbolStack.unify(existing, resolved, this, scopeBindings);
            return;
        }
        if (resolved.variable() == variable) {
            if (resolved.hasSymbols()) {
                throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED,
                    "symbol variable $" + variable + " would contain itself");
            }
            return;
        }
        bindings.put(variable, resolved);
    }
}
