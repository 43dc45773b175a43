package org.stackgraphs.partial;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * Symbolic scope stack: a sequence of concrete scopes (top first), optionally followed by an
 * open variable standing for an unknown remainder.
 * <p>
 * A stack without scopes and without a variable is exactly empty. Variable {@code 0} means
 * "no variable"; real variables are positive. Instances are immutable.
 */
public final class PartialScopeStack {

    private static final PartialScopeStack EMPTY = new PartialScopeStack(List.of(), 0);

    private final List<Handle<Node>> scopes;
    private final int variable;

    private PartialScopeStack(List<Handle<Node>> scopes, int variable) {
        this.scopes = scopes;
        this.variable = variable;
    }

    public static PartialScopeStack empty() {
        return EMPTY;
    }

    public static PartialScopeStack fromVariable(int variable) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Scope stack variable must be positive: " + variable);
        }
        return new PartialScopeStack(List.of(), variable);
    }

    /**
     * @param scopes   concrete scopes, top first
     * @param variable tail variable or {@code 0}
     */
    public static PartialScopeStack of(List<Handle<Node>> scopes, int variable) {
        if (variable < 0) {
            throw new IllegalArgumentException("Scope stack variable must not be negative: " + variable);
        }
        if (scopes.isEmpty() && variable == 0) {
            return EMPTY;
        }
        return new PartialScopeStack(List.copyOf(scopes), variable);
    }

    public List<Handle<Node>> scopes() {
        return scopes;
    }

    public int variable() {
        return variable;
    }

    public boolean hasVariable() {
        return variable != 0;
    }

    public boolean hasScopes() {
        return !scopes.isEmpty();
    }

    /**
     * True iff the stack is exactly empty (no scopes, no open remainder).
     */
    public boolean isEmpty() {
        return scopes.isEmpty() && variable == 0;
    }

    public int length() {
        return scopes.size();
    }

    public PartialScopeStack push(Handle<Node> scope) {
        List<Handle<Node>> pushed = new ArrayList<>(scopes.size() + 1);
        pushed.add(scope);
        pushed.addAll(scopes);
        return new PartialScopeStack(List.copyOf(pushed), variable);
    }

    /**
     * Top concrete scope, or {@code null} when no concrete scope is known.
     */
    public Handle<Node> peek() {
        return scopes.isEmpty() ? null : scopes.get(0);
    }

    /**
     * The stack without its top concrete scope.
     */
    public PartialScopeStack pop() {
        if (scopes.isEmpty()) {
            throw new IllegalStateException("No concrete scope to pop");
        }
        return of(scopes.subList(1, scopes.size()), variable);
    }

    public PartialScopeStack mapVariables(IntUnaryOperator mapping) {
        if (variable == 0) {
            return this;
        }
        return new PartialScopeStack(scopes, mapping.applyAsInt(variable));
    }

    public void forEachVariable(IntConsumer consumer) {
        if (variable != 0) {
            consumer.accept(variable);
        }
    }

    /**
     * Substitutes a bound tail variable by its value.
     */
    public PartialScopeStack applyBindings(ScopeStackBindings bindings) {
        if (variable == 0) {
            return this;
        }
        PartialScopeStack bound = bindings.get(variable);
        if (bound == null) {
            return this;
        }
        PartialScopeStack tail = bound.applyBindings(bindings);
        if (scopes.isEmpty()) {
            return tail;
        }
        List<Handle<Node>> joined = new ArrayList<>(scopes.size() + tail.scopes.size());
        joined.addAll(scopes);
        joined.addAll(tail.scopes);
        return of(joined, tail.variable);
    }

    /**
     * Unifies two scope stack conditions. Concrete prefixes must match scope for scope; an
     * open variable absorbs the excess of the other side. When both sides end in different
     * variables after matching, the left variable is bound to the right one.
     *
     * @return the unified condition (before applying the recorded bindings)
     * @throws PathResolutionException if the conditions are incompatible
     */
    public static PartialScopeStack unify(PartialScopeStack lhs, PartialScopeStack rhs, ScopeStackBindings bindings)
        throws PathResolutionException {
        PartialScopeStack left = lhs.applyBindings(bindings);
        PartialScopeStack right = rhs.applyBindings(bindings);
        int common = Math.min(left.scopes.size(), right.scopes.size());
        for (int i = 0; i < common; i++) {
            if (!left.scopes.get(i).equals(right.scopes.get(i))) {
                throw new PathResolutionException(PathResolutionException.Reason.SCOPE_STACK_UNSATISFIED);
            }
        }
        if (left.scopes.size() > common) {
            if (!right.hasVariable()) {
                throw new PathResolutionException(PathResolutionException.Reason.SCOPE_STACK_UNSATISFIED);
            }
            bindings.add(right.variable, of(left.scopes.subList(common, left.scopes.size()), left.variable));
            return left;
        }
        if (right.scopes.size() > common) {
            if (!left.hasVariable()) {
                throw new PathResolutionException(PathResolutionException.Reason.SCOPE_STACK_UNSATISFIED);
            }
            bindings.add(left.variable, of(right.scopes.subList(common, right.scopes.size()), right.variable));
            return right;
        }
        if (left.hasVariable() && right.hasVariable()) {
            if (left.variable != right.variable) {
                bindings.add(left.variable, fromVariable(right.variable));
            }
            return right;
        }
        if (left.hasVariable()) {
            bindings.add(left.variable, EMPTY);
        } else if (right.hasVariable()) {
            bindings.add(right.variable, EMPTY);
        }
        return left.hasVariable() ? right : left;
    }

    /**
     * Renders the stack with node ids, e.g. {@code [scope a.py:3, $1]}.
     */
    public String display(StackGraph graph) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < scopes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(graph.node(scopes.get(i)).id());
        }
        if (variable != 0) {
            if (!scopes.isEmpty()) {
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
        if (!(o instanceof PartialScopeStack other)) {
            return false;
        }
        return variable == other.variable && scopes.equals(other.scopes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scopes, variable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < scopes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(scopes.get(i));
        }
        if (variable != 0) {
            if (!scopes.isEmpty()) {
                sb.append(", ");
            }
            sb.append('$').append(variable);
        }
        return sb.append(']').toString();
    }
}
