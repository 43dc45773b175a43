package org.stackgraphs.partial;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.graph.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unification of symbolic stack conditions.
 */
@Tag("unit")
class UnificationTest {

    private StackGraph graph;
    private ScopedSymbol x;
    private ScopedSymbol y;
    private Handle<Node> s1;
    private Handle<Node> s2;

    @BeforeEach
    void setUp() {
        graph = new StackGraph();
        Handle<Symbol> xs = graph.addSymbol("x");
        Handle<Symbol> ys = graph.addSymbol("y");
        x = ScopedSymbol.plain(xs);
        y = ScopedSymbol.plain(ys);
        var file = graph.getOrCreateFile("a.py");
        s1 = graph.addScopeNode(file, 1, true);
        s2 = graph.addScopeNode(file, 2, true);
    }

    @Test
    void openVariableAbsorbsExcess() throws Exception {
        SymbolStackBindings symbols = new SymbolStackBindings();
        ScopeStackBindings scopes = new ScopeStackBindings();

        PartialSymbolStack.unify(PartialSymbolStack.of(List.of(x, y), 0), PartialSymbolStack.of(List.of(x), 1),
            symbols, scopes);

        assertThat(symbols.get(1)).isEqualTo(PartialSymbolStack.of(List.of(y), 0));
    }

    @Test
    void concreteMismatchFails() {
        assertThatThrownBy(() -> PartialSymbolStack.unify(PartialSymbolStack.of(List.of(x), 1),
            PartialSymbolStack.of(List.of(y), 2), new SymbolStackBindings(), new ScopeStackBindings()))
            .isInstanceOf(PathResolutionException.class)
            .satisfies(e -> assertThat(((PathResolutionException) e).getReason())
                .isEqualTo(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED));
    }

    @Test
    void closedStacksMustHaveEqualLength() {
        assertThatThrownBy(() -> PartialSymbolStack.unify(PartialSymbolStack.of(List.of(x, y), 0),
            PartialSymbolStack.of(List.of(x), 0), new SymbolStackBindings(), new ScopeStackBindings()))
            .isInstanceOf(PathResolutionException.class);
    }

    @Test
    void bothOpenBindsLeftToRight() throws Exception {
        SymbolStackBindings symbols = new SymbolStackBindings();

        PartialSymbolStack unified = PartialSymbolStack.unify(PartialSymbolStack.of(List.of(x), 1),
            PartialSymbolStack.of(List.of(x), 2), symbols, new ScopeStackBindings());

        assertThat(symbols.get(1)).isEqualTo(PartialSymbolStack.fromVariable(2));
        assertThat(symbols.get(2)).isNull();
        assertThat(unified.variable()).isEqualTo(2);
    }

    @Test
    void openVariableAgainstClosedStackBecomesEmpty() throws Exception {
        ScopeStackBindings scopes = new ScopeStackBindings();

        PartialScopeStack.unify(PartialScopeStack.of(List.of(s1), 3), PartialScopeStack.of(List.of(s1), 0), scopes);

        assertThat(scopes.get(3)).isEqualTo(PartialScopeStack.empty());
    }

    @Test
    void attachedScopesAreUnified() throws Exception {
        SymbolStackBindings symbols = new SymbolStackBindings();
        ScopeStackBindings scopes = new ScopeStackBindings();
        ScopedSymbol concrete = new ScopedSymbol(x.symbol(), PartialScopeStack.of(List.of(s1, s2), 0));
        ScopedSymbol symbolic = new ScopedSymbol(x.symbol(), PartialScopeStack.of(List.of(s1), 4));

        PartialSymbolStack.unify(PartialSymbolStack.of(List.of(concrete), 0),
            PartialSymbolStack.of(List.of(symbolic), 0), symbols, scopes);

        assertThat(scopes.get(4)).isEqualTo(PartialScopeStack.of(List.of(s2), 0));
    }

    @Test
    void attachedScopesOnOneSideOnlyFail() {
        ScopedSymbol scoped = new ScopedSymbol(x.symbol(), PartialScopeStack.fromVariable(1));

        assertThatThrownBy(() -> PartialSymbolStack.unify(PartialSymbolStack.of(List.of(scoped), 0),
            PartialSymbolStack.of(List.of(x), 0), new SymbolStackBindings(), new ScopeStackBindings()))
            .isInstanceOf(PathResolutionException.class);
    }

    @Test
    void selfContainingBindingIsRejected() {
        ScopeStackBindings scopes = new ScopeStackBindings();

        assertThatThrownBy(() -> scopes.add(1, PartialScopeStack.of(List.of(s1), 1)))
            .isInstanceOf(PathResolutionException.class);
    }

    @Test
    void bindingsApplyTransitively() throws Exception {
        ScopeStackBindings scopes = new ScopeStackBindings();
        scopes.add(1, PartialScopeStack.of(List.of(s1), 2));
        scopes.add(2, PartialScopeStack.of(List.of(s2), 0));

        assertThat(PartialScopeStack.fromVariable(1).applyBindings(scopes))
            .isEqualTo(PartialScopeStack.of(List.of(s1, s2), 0));
    }

    @Test
    void rebindingUnifiesWithPreviousValue() throws Exception {
        ScopeStackBindings scopes = new ScopeStackBindings();
        scopes.add(1, PartialScopeStack.of(List.of(s1), 2));

        assertThatThrownBy(() -> scopes.add(1, PartialScopeStack.of(List.of(s2), 0)))
            .isInstanceOf(PathResolutionException.class);
    }
}
