package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * A node of a stack graph. Each variant describes one action of the two-stack automaton that
 * is applied when a path arrives at the node.
 * <p>
 * Variants:
 * <ul>
 *   <li>{@link RootNode}: global junction connecting files</li>
 *   <li>{@link JumpToNode}: continues at the scope on top of the scope stack</li>
 *   <li>{@link ScopeNode}: plain junction, optionally exported to other files</li>
 *   <li>{@link PushSymbolNode} / {@link PopSymbolNode}: symbol stack operations, marking
 *       references and definitions respectively</li>
 *   <li>{@link PushScopedSymbolNode} / {@link PopScopedSymbolNode}: symbol stack operations that
 *       also carry a scope stack</li>
 *   <li>{@link DropScopesNode}: clears the scope stack</li>
 * </ul>
 */
public sealed interface Node
    permits RootNode, JumpToNode, ScopeNode, PushSymbolNode, PopSymbolNode,
            PushScopedSymbolNode, PopScopedSymbolNode, DropScopesNode {

    NodeId id();

    NodeKind kind();

    /**
     * The symbol pushed or popped by this node, or {@code null} for nodes without a symbol.
     */
    default Handle<Symbol> symbol() {
        return null;
    }

    default boolean isDefinition() {
        return false;
    }

    default boolean isReference() {
        return false;
    }

    default boolean isExportedScope() {
        return false;
    }

    default boolean isRoot() {
        return kind() == NodeKind.ROOT;
    }

    default boolean isJumpTo() {
        return kind() == NodeKind.JUMP_TO;
    }

    default boolean isInFile(Handle<SourceFile> file) {
        return id().isInFile(file);
    }
}
