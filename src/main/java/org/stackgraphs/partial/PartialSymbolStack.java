package org.stackgraphs.partial;

import org.stackgraphs.graph.StackGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * Symbolic symbol stack: concrete {@link ScopedSymbol}s (top first), optionally followed by an
 * open variable. Variable {@code 0} means "no variable". Instances are immutable.
 */
public final class PartialSymbolStack {

    private static final PartialSymbolStack EMPTY = new PartialSymbolStack(List.of(), 0);

    private final List<ScopedSymbol> symbols;
    private final int variable;

    private PartialSymbolStack(List<ScopedSymbol> symbols, int variable) {
        this.symbols = symbols;
        this.variable = variable;
    }

    public static PartialSymbolStack empty() {
        return EMPTY;
    }

    public static PartialSymbolStack fromVariable(int variable) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Symbol stack variable must be positive: " + variable);
        }
        return new PartialSymbolStack(List.of(), variable);
    }

    /**
     * @param symbols  concrete entries, top first
     * @param variable tail variable or {@code 0}
     */
    public static PartialSymbolStack of(List<ScopedSymbol> symbols, int variable) {
        if (variable < 0) {
            throw new IllegalArgumentException("Symbol stack variable must not be negative: " + variable);
        }
        if (symbols.isEmpty() && variable == 0) {
            return EMPTY;
        }
        return new PartialSymbolStack(List.copyOf(symbols), variable);
    }

    public List<ScopedSymbol> symbols() {
        return symbols;
    }

    public int variable() {
        return variable;
    }

    public boolean hasVariable() {
        return variable != 0;
    }

    public boolean hasSymbols() {
        return !symbols.isEmpty();
    }

    public boolean isEmpty() {
        return symbols.isEmpty() && variable == 0;
    }

    public int length() {
        return symbols.size();
    }

    /**
     * Number of entries including the scopes attached to them; used to detect growth.
     */
    public int size() {
        int size = 0;
        for (ScopedSymbol symbol : symbols) {
            size += symbol.size();
        }
        return size;
    }

    public ScopedSymbol peek() {
        return symbols.isEmpty() ? null : symbols.get(0);
    }

    public PartialSymbolStack push(ScopedSymbol symbol) {
        List<ScopedSymbol> pushed = new ArrayList<>(symbols.size() + 1);
        pushed.add(symbol);
        pushed.addAll(symbols);
        return new PartialSymbolStack(List.copyOf(pushed), variable);
    }

    public PartialSymbolStack pop() {
        if (symbols.isEmpty()) {
            throw new IllegalStateException("No concrete symbol to pop");
        }
        return of(symbols.subList(1, symbols.size()), variable);
    }

    /**
     * Adds an entry below the concrete entries, in front of the tail variable. Used when a pop
     * reaches past the known part of the stack and the precondition has to require more.
     */
    public PartialSymbolStack pushBottom(ScopedSymbol symbol) {
        List<ScopedSymbol> extended = new ArrayList<>(symbols.size() + 1);
        extended.addAll(symbols);
        extended.add(symbol);
        return new PartialSymbolStack(List.copyOf(extended), variable);
    }

    public PartialSymbolStack mapVariables(IntUnaryOperator symbolMapping, IntUnaryOperator scopeMapping) {
        List<ScopedSymbol> mapped = new ArrayList<>(symbols.size());
        for (ScopedSymbol symbol : symbols) {
            mapped.add(symbol.mapScopeVariables(scopeMapping));
        }
        return of(mapped, variable == 0 ? 0 : symbolMapping.applyAsInt(variable));
    }

    public void forEachVariable(IntConsumer symbolConsumer, IntConsumer scopeConsumer) {
        for (ScopedSymbol symbol : symbols) {
            symbol.forEachScopeVariable(scopeConsumer);
        }
        if (variable != 0) {
            symbolConsumer.accept(variable);
        }
    }

    /**
     * Substitutes bound variables: the tail variable by its symbol binding, and variables of
     * attached scope stacks by their scope bindings.
     */
    public PartialSymbolStack applyBindings(SymbolStackBindings symbolBindings, ScopeStackBindings scopeBindings) {
        List<ScopedSymbol> applied = new ArrayList<>(symbols.size());
        for (ScopedSymbol symbol : symbols) {
            applied.add(symbol.applyBindings(scopeBindings));
        }
        int tailVariable = variable;
        if (variable != 0) {
            PartialSymbolStack bound = symbolBindings.get(variable);
            if (bound != null) {
                PartialSymbolStack tail = bound.applyBindings(symbolBindings, scopeBindings);
                applied.addAll(tail.symbols);
                tailVariable = tail.variable;
            }
        }
        return of(applied, tailVariable);
    }

    /**
     * Unifies two symbol stack conditions entry by entry. Symbols must be equal; attached scope
     * stacks must be present on both sides or on neither, and are unified. An open variable
     * absorbs the excess of the other side; two open variables are bound left to right.
     *
     * @throws PathResolutionException if the conditions are incompatible
     */
    public static PartialSymbolStack unify(PartialSymbolStack lhs, PartialSymbolStack rhs,
                                           SymbolStackBindings symbolBindings, ScopeStackBindings scopeBindings)
        throws PathResolutionException {
        PartialSymbolStack left = lhs.applyBindings(symbolBindings, scopeBindings);
        PartialSymbolStack right = rhs.applyBindings(symbolBindings, scopeBindings);
        int common = Math.min(left.symbols.size(), right.symbols.size());
        for (int i = 0; i < common; i++) {
            ScopedSymbol l = left.symbols.get(i);
            ScopedSymbol r = right.symbols.get(i);
            if (!l.symbol().equals(r.symbol())) {
                throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED);
            }
            if (l.hasScopes() && r.hasScopes()) {
                PartialScopeStack.unify(l.scopes(), r.scopes(), scopeBindings);
            } else if (l.hasScopes() || r.hasScopes()) {
                throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED,
                    "attached scope stack present on one side only");
            }
        }
        if (left.symbols.size() > common) {
            if (!right.hasVariable()) {
                throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED);
            }
            symbolBindings.add(right.variable, of(left.symbols.subList(common, left.symbols.size()), left.variable),
                scopeBindings);
            return left;
        }
        if (right.symbols.size() > common) {
            if (!left.hasVariable()) {
                throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED);
            }
            symbolBindings.add(left.variable, of(right.symbols.subList(common, right.symbols.size()), right.variable),
                scopeBindings);
            return right;
        }
        if (left.hasVariable() && right.hasVariable()) {
            if (left.variable != right.variable) {
                symbolBindings.add(left.variable, fromVariable(right.variable), scopeBindings);
            }
            return right;
        }
        if (left.hasVariable()) {
            symbolBindings.add(left.variable, EMPTY, scopeBindings);
        } else if (right.hasVariable()) {
            symbolBindings.add(right.variable, EMPTY, scopeBindings);
        }
        return left.hasVariable() ? right : left;
    }

    public String display(StackGraph graph) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < symbols.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(symbols.get(i).display(graph));
        }
        if (variable != 0) {
            if (!symbols.isEmpty()) {
                sb.append(", ");
            }
            sb.append('$').append(variable);
        }
        return sb.append(']').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartialSymbolStack other)) {
            return false;
        }
        return variable == other.variable && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, variable);
    }

    @Override
    public String toString() {
        return "PartialSymbolStack" + symbols + (variable == 0 ? "" : " $" + variable);
    }
}
