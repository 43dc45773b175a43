package org.stackgraphs.partial;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.PushScopedSymbolNode;
import org.stackgraphs.graph.StackGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * A path through a stack graph together with the symbolic stack conditions under which it is
 * valid: the {@code pre}conditions describe what the stacks must contain when the path is
 * entered, the {@code post}conditions what they contain when it is left.
 * <p>
 * Every node action on the path is reflected in the conditions, including the action of the
 * start node. Paths are immutable; all extension operations return new instances and signal
 * failed stack operations with {@link PathResolutionException}.
 */
public final class PartialPath implements PathExtension {

    /**
     * Orders paths by the precedences of their edges, compared lexicographically. A path whose
     * edge sequence is a prefix of another sorts first.
     */
    public static final Comparator<PartialPath> PRECEDENCE_ORDER = (a, b) -> {
        int common = Math.min(a.edges.size(), b.edges.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(a.edges.get(i).precedence(), b.edges.get(i).precedence());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.edges.size(), b.edges.size());
    };

    private final Handle<Node> startNode;
    private final Handle<Node> endNode;
    private final PartialSymbolStack symbolPre;
    private final PartialSymbolStack symbolPost;
    private final PartialScopeStack scopePre;
    private final PartialScopeStack scopePost;
    private final List<Edge> edges;

    public PartialPath(Handle<Node> startNode, Handle<Node> endNode,
                       PartialSymbolStack symbolPre, PartialSymbolStack symbolPost,
                       PartialScopeStack scopePre, PartialScopeStack scopePost,
                       List<Edge> edges) {
        this.startNode = Objects.requireNonNull(startNode);
        this.endNode = Objects.requireNonNull(endNode);
        this.symbolPre = symbolPre;
        this.symbolPost = symbolPost;
        this.scopePre = scopePre;
        this.scopePost = scopePost;
        this.edges = List.copyOf(edges);
    }

    /**
     * Creates the zero-length path at {@code node}: both stacks start as open variables and the
     * node's own action is applied.
     *
     * @throws PathResolutionException if the node's action cannot be applied
     */
    public static PartialPath fromNode(StackGraph graph, Handle<Node> node) throws PathResolutionException {
        PartialPath seed = new PartialPath(node, node,
            PartialSymbolStack.fromVariable(1), PartialSymbolStack.fromVariable(1),
            PartialScopeStack.fromVariable(1), PartialScopeStack.fromVariable(1),
            List.of());
        return seed.applyNodeAction(graph, node);
    }

    /**
     * The path that leaves the jump-to node towards {@code scope}: it requires {@code scope} on top
     * of the scope stack and removes it.
     */
    public static PartialPath jumpSegment(StackGraph graph, Handle<Node> scope) {
        Handle<Node> jumpTo = graph.jumpTo();
        return new PartialPath(jumpTo, scope,
            PartialSymbolStack.fromVariable(1), PartialSymbolStack.fromVariable(1),
            PartialScopeStack.of(List.of(scope), 1), PartialScopeStack.fromVariable(1),
            List.of(new Edge(jumpTo, scope, 0)));
    }

    // ==================== Accessors ====================

    @Override
    public Handle<Node> startNode() {
        return startNode;
    }

    @Override
    public Handle<Node> endNode() {
        return endNode;
    }

    public PartialSymbolStack symbolPrecondition() {
        return symbolPre;
    }

    public PartialSymbolStack symbolPostcondition() {
        return symbolPost;
    }

    public PartialScopeStack scopePrecondition() {
        return scopePre;
    }

    public PartialScopeStack scopePostcondition() {
        return scopePost;
    }

    public List<Edge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * A complete path binds a reference to a definition; both stacks are exactly empty when it is
     * entered and when it is left.
     */
    public boolean isComplete(StackGraph graph) {
        return graph.node(startNode).isReference()
            && graph.node(endNode).isDefinition()
            && symbolPre.isEmpty()
            && symbolPost.isEmpty()
            && scopePre.isEmpty()
            && scopePost.isEmpty();
    }

    // ==================== Extension ====================

    /**
     * Follows {@code edge} from the end of this path and applies the sink's action.
     */
    public PartialPath append(StackGraph graph, Edge edge) throws PathResolutionException {
        if (!edge.source().equals(endNode)) {
            throw new PathResolutionException(PathResolutionException.Reason.INCORRECT_SOURCE_NODE);
        }
        PartialPath moved = new PartialPath(startNode, edge.sink(), symbolPre, symbolPost, scopePre, scopePost,
            withEdge(edges, edge));
        return moved.applyNodeAction(graph, edge.sink());
    }

    /**
     * Follows {@code edge} into the start of this path. The source's action is applied in front
     * of this path's conditions.
     */
    public PartialPath prependEdge(StackGraph graph, Edge edge) throws PathResolutionException {
        if (!edge.sink().equals(startNode)) {
            throw new PathResolutionException(PathResolutionException.Reason.INCORRECT_SOURCE_NODE);
        }
        PartialPath head = fromNode(graph, edge.source());
        PartialPath bridged = new PartialPath(head.startNode, startNode, head.symbolPre, head.symbolPost,
            head.scopePre, head.scopePost, List.of(edge));
        return bridged.concatenate(graph, this);
    }

    /**
     * If this path ends at the jump-to node and the top of the scope postcondition is a known
     * scope, continues at that scope. Returns this path unchanged when it does not end at the
     * jump-to node or only an open variable is left.
     *
     * @throws PathResolutionException if the scope postcondition is exactly empty
     */
    public PartialPath resolveJumpTo(StackGraph graph) throws PathResolutionException {
        if (!graph.node(endNode).isJumpTo()) {
            return this;
        }
        Handle<Node> target = scopePost.peek();
        if (target == null) {
            if (scopePost.hasVariable()) {
                return this;
            }
            throw new PathResolutionException(PathResolutionException.Reason.EMPTY_SCOPE_STACK);
        }
        return new PartialPath(startNode, target, symbolPre, symbolPost, scopePre, scopePost.pop(),
            withEdge(edges, new Edge(endNode, target, 0)));
    }

    /**
     * Joins {@code rhs} to the end of this path. The paths must share the junction node, which
     * must not have an action of its own. Variables of {@code rhs} are renamed apart, the
     * postcondition of this path is unified with the precondition of {@code rhs}, and the
     * resulting bindings are applied to the outer conditions.
     */
    public PartialPath concatenate(StackGraph graph, PartialPath rhs) throws PathResolutionException {
        if (!endNode.equals(rhs.startNode)) {
            throw new PathResolutionException(PathResolutionException.Reason.INCORRECT_SOURCE_NODE);
        }
        PartialPath right = rhs.offsetVariables(largestSymbolVariable(), largestScopeVariable());
        SymbolStackBindings symbolBindings = new SymbolStackBindings();
        ScopeStackBindings scopeBindings = new ScopeStackBindings();
        PartialSymbolStack.unify(symbolPost, right.symbolPre, symbolBindings, scopeBindings);
        PartialScopeStack.unify(scopePost, right.scopePre, scopeBindings);

        List<Edge> joined = new ArrayList<>(edges.size() + right.edges.size());
        joined.addAll(edges);
        joined.addAll(right.edges);
        return new PartialPath(startNode, right.endNode,
            symbolPre.applyBindings(symbolBindings, scopeBindings),
            right.symbolPost.applyBindings(symbolBindings, scopeBindings),
            scopePre.applyBindings(scopeBindings),
            right.scopePost.applyBindings(scopeBindings),
            joined).normalizeVariables();
    }

    @Override
    public PartialPath appendTo(StackGraph graph, PartialPath path) throws PathResolutionException {
        return path.concatenate(graph, this);
    }

    @Override
    public PartialPath prependTo(StackGraph graph, PartialPath path) throws PathResolutionException {
        return concatenate(graph, path);
    }

    /**
     * Binds every variable of the preconditions to the empty stack: the path is entered with
     * empty stacks.
     */
    public PartialPath eliminatePreconditionVariables() throws PathResolutionException {
        IntArrayList symbolVariables = new IntArrayList();
        IntArrayList scopeVariables = new IntArrayList();
        symbolPre.forEachVariable(symbolVariables::add, scopeVariables::add);
        scopePre.forEachVariable(scopeVariables::add);
        return bindToEmpty(symbolVariables, scopeVariables);
    }

    /**
     * Binds the symbol postcondition variable to the empty stack: nothing is left on the symbol
     * stack when the path is left. Scope variables stay open.
     */
    public PartialPath eliminateSymbolPostconditionVariable() throws PathResolutionException {
        IntArrayList symbolVariables = new IntArrayList();
        if (symbolPost.hasVariable()) {
            symbolVariables.add(symbolPost.variable());
        }
        return bindToEmpty(symbolVariables, new IntArrayList());
    }

    /**
     * Binds an open scope postcondition variable to the empty stack. Concrete scopes left behind
     * are kept.
     */
    public PartialPath eliminateScopePostconditionVariable() throws PathResolutionException {
        IntArrayList scopeVariables = new IntArrayList();
        if (scopePost.hasVariable()) {
            scopeVariables.add(scopePost.variable());
        }
        return bindToEmpty(new IntArrayList(), scopeVariables);
    }

    // ==================== Comparison ====================

    /**
     * Whether this path is preferred over {@code other}: at the first edge where both paths leave
     * the same node with different precedences, this path uses the lower one.
     */
    public boolean shadows(PartialPath other) {
        int common = Math.min(edges.size(), other.edges.size());
        for (int i = 0; i < common; i++) {
            Edge mine = edges.get(i);
            Edge theirs = other.edges.get(i);
            if (!mine.source().equals(theirs.source())) {
                return false;
            }
            if (mine.precedence() != theirs.precedence()) {
                return mine.precedence() < theirs.precedence();
            }
        }
        return false;
    }

    /**
     * Whether both paths connect the same nodes under identical conditions, regardless of the
     * edges taken.
     */
    public boolean hasSameConditions(PartialPath other) {
        return startNode.equals(other.startNode)
            && endNode.equals(other.endNode)
            && symbolPre.equals(other.symbolPre)
            && symbolPost.equals(other.symbolPost)
            && scopePre.equals(other.scopePre)
            && scopePost.equals(other.scopePost);
    }

    // ==================== Variables ====================

    public int largestSymbolVariable() {
        int[] max = {0};
        symbolPre.forEachVariable(v -> max[0] = Math.max(max[0], v), v -> { });
        symbolPost.forEachVariable(v -> max[0] = Math.max(max[0], v), v -> { });
        return max[0];
    }

    public int largestScopeVariable() {
        int[] max = {0};
        symbolPre.forEachVariable(v -> { }, v -> max[0] = Math.max(max[0], v));
        symbolPost.forEachVariable(v -> { }, v -> max[0] = Math.max(max[0], v));
        scopePre.forEachVariable(v -> max[0] = Math.max(max[0], v));
        scopePost.forEachVariable(v -> max[0] = Math.max(max[0], v));
        return max[0];
    }

    PartialPath offsetVariables(int symbolOffset, int scopeOffset) {
        if (symbolOffset == 0 && scopeOffset == 0) {
            return this;
        }
        return new PartialPath(startNode, endNode,
            symbolPre.mapVariables(v -> v + symbolOffset, v -> v + scopeOffset),
            symbolPost.mapVariables(v -> v + symbolOffset, v -> v + scopeOffset),
            scopePre.mapVariables(v -> v + scopeOffset),
            scopePost.mapVariables(v -> v + scopeOffset),
            edges);
    }

    /**
     * Renumbers variables in order of first appearance so that paths with the same shape have
     * equal conditions.
     */
    public PartialPath normalizeVariables() {
        Int2IntOpenHashMap symbolMapping = new Int2IntOpenHashMap();
        Int2IntOpenHashMap scopeMapping = new Int2IntOpenHashMap();
        IntConsumer symbolCollector = v -> symbolMapping.putIfAbsent(v, symbolMapping.size() + 1);
        IntConsumer scopeCollector = v -> scopeMapping.putIfAbsent(v, scopeMapping.size() + 1);
        symbolPre.forEachVariable(symbolCollector, scopeCollector);
        scopePre.forEachVariable(scopeCollector);
        symbolPost.forEachVariable(symbolCollector, scopeCollector);
        scopePost.forEachVariable(scopeCollector);
        return new PartialPath(startNode, endNode,
            symbolPre.mapVariables(symbolMapping::get, scopeMapping::get),
            symbolPost.mapVariables(symbolMapping::get, scopeMapping::get),
            scopePre.mapVariables(scopeMapping::get),
            scopePost.mapVariables(scopeMapping::get),
            edges);
    }

    // ==================== Internals ====================

    private PartialPath applyNodeAction(StackGraph graph, Handle<Node> handle) throws PathResolutionException {
        Node node = graph.node(handle);
        switch (node.kind()) {
            case PUSH_SYMBOL -> {
                return withConditions(symbolPre, symbolPost.push(ScopedSymbol.plain(node.symbol())), scopePost);
            }
            case PUSH_SCOPED_SYMBOL -> {
                PushScopedSymbolNode push = (PushScopedSymbolNode) node;
                Handle<Node> scope = graph.nodeForId(push.scope())
                    .orElseThrow(() -> new PathResolutionException(
                        PathResolutionException.Reason.UNKNOWN_ATTACHED_SCOPE, String.valueOf(push.scope())));
                if (!graph.node(scope).isExportedScope()) {
                    throw new PathResolutionException(PathResolutionException.Reason.UNKNOWN_ATTACHED_SCOPE,
                        "attached scope " + push.scope() + " is not exported");
                }
                ScopedSymbol pushed = new ScopedSymbol(node.symbol(), scopePost.push(scope));
                return withConditions(symbolPre, symbolPost.push(pushed), scopePost);
            }
            case POP_SYMBOL -> {
                ScopedSymbol top = symbolPost.peek();
                if (top != null) {
                    if (!top.symbol().equals(node.symbol())) {
                        throw new PathResolutionException(PathResolutionException.Reason.INCORRECT_POPPED_SYMBOL);
                    }
                    if (top.hasScopes()) {
                        throw new PathResolutionException(
                            PathResolutionException.Reason.UNEXPECTED_ATTACHED_SCOPE_LIST);
                    }
                    return withConditions(symbolPre, symbolPost.pop(), scopePost);
                }
                return withConditions(requireInPrecondition(ScopedSymbol.plain(node.symbol())), symbolPost, scopePost);
            }
            case POP_SCOPED_SYMBOL -> {
                ScopedSymbol top = symbolPost.peek();
                if (top != null) {
                    if (!top.symbol().equals(node.symbol())) {
                        throw new PathResolutionException(PathResolutionException.Reason.INCORRECT_POPPED_SYMBOL);
                    }
                    if (!top.hasScopes()) {
                        throw new PathResolutionException(PathResolutionException.Reason.MISSING_ATTACHED_SCOPE_LIST);
                    }
                    return withConditions(symbolPre, symbolPost.pop(), top.scopes());
                }
                PartialScopeStack fresh = PartialScopeStack.fromVariable(largestScopeVariable() + 1);
                return withConditions(requireInPrecondition(new ScopedSymbol(node.symbol(), fresh)), symbolPost, fresh);
            }
            case DROP_SCOPES -> {
                return withConditions(symbolPre, symbolPost, PartialScopeStack.empty());
            }
            default -> {
                return this;
            }
        }
    }

    /**
     * A pop found no concrete entry: the unknown part of the stack must start with {@code entry},
     * which becomes part of the precondition.
     */
    private PartialSymbolStack requireInPrecondition(ScopedSymbol entry) throws PathResolutionException {
        if (!symbolPost.hasVariable()) {
            throw new PathResolutionException(PathResolutionException.Reason.EMPTY_SYMBOL_STACK);
        }
        if (symbolPre.variable() != symbolPost.variable()) {
            throw new PathResolutionException(PathResolutionException.Reason.SYMBOL_STACK_UNSATISFIED,
                "postcondition variable is not bound by the precondition");
        }
        return symbolPre.pushBottom(entry);
    }

    private PartialPath withConditions(PartialSymbolStack newSymbolPre, PartialSymbolStack newSymbolPost,
                                       PartialScopeStack newScopePost) {
        return new PartialPath(startNode, endNode, newSymbolPre, newSymbolPost, scopePre, newScopePost, edges);
    }

    private PartialPath bindToEmpty(IntArrayList symbolVariables, IntArrayList scopeVariables)
        throws PathResolutionException {
        if (symbolVariables.isEmpty() && scopeVariables.isEmpty()) {
            return this;
        }
        SymbolStackBindings symbolBindings = new SymbolStackBindings();
        ScopeStackBindings scopeBindings = new ScopeStackBindings();
        for (int i = 0; i < symbolVariables.size(); i++) {
            symbolBindings.add(symbolVariables.getInt(i), PartialSymbolStack.empty(), scopeBindings);
        }
        for (int i = 0; i < scopeVariables.size(); i++) {
            scopeBindings.add(scopeVariables.getInt(i), PartialScopeStack.empty());
        }
        return new PartialPath(startNode, endNode,
            symbolPre.applyBindings(symbolBindings, scopeBindings),
            symbolPost.applyBindings(symbolBindings, scopeBindings),
            scopePre.applyBindings(scopeBindings),
            scopePost.applyBindings(scopeBindings),
            edges).normalizeVariables();
    }

    private static List<Edge> withEdge(List<Edge> edges, Edge edge) {
        List<Edge> extended = new ArrayList<>(edges.size() + 1);
        extended.addAll(edges);
        extended.add(edge);
        return extended;
    }

    public String display(StackGraph graph) {
        return "<" + symbolPre.display(graph) + "> (" + scopePre.display(graph) + ") "
            + graph.node(startNode).id() + " -> " + graph.node(endNode).id()
            + " <" + symbolPost.display(graph) + "> (" + scopePost.display(graph) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartialPath other)) {
            return false;
        }
        return hasSameConditions(other) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startNode, endNode, symbolPre, symbolPost, scopePre, scopePost, edges);
    }

    @Override
    public String toString() {
        return "PartialPath{" + startNode + " -> " + endNode + ", pre=" + symbolPre + " " + scopePre
            + ", post=" + symbolPost + " " + scopePost + ", edges=" + edges.size() + "}";
    }
}
