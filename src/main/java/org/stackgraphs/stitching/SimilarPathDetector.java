package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Node;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PartialScopeStack;
import org.stackgraphs.partial.PartialSymbolStack;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one path per combination of endpoints and conditions. Equivalent paths can only produce
 * the same extensions, so only the one that sorts first in {@link PartialPath#PRECEDENCE_ORDER}
 * is kept; a later equivalent path with lower precedences replaces the one recorded before.
 */
public final class SimilarPathDetector {

    private final Map<PathKey, PartialPath> kept = new HashMap<>();

    /**
     * Records {@code path}.
     *
     * @return {@code false} if an equivalent path recorded before is preferred over {@code path}
     */
    public boolean add(PartialPath path) {
        PathKey key = keyOf(path);
        PartialPath previous = kept.get(key);
        if (previous != null && PartialPath.PRECEDENCE_ORDER.compare(path, previous) >= 0) {
            return false;
        }
        kept.put(key, path);
        return true;
    }

    /**
     * Whether {@code path} was accepted earlier and has since been replaced by a preferred
     * equivalent path.
     */
    public boolean isSuperseded(PartialPath path) {
        PartialPath current = kept.get(keyOf(path));
        return current != null && current != path;
    }

    public int size() {
        return kept.size();
    }

    /**
     * Reduces {@code paths} to the preferred path of every group of equivalent paths, in the
     * order in which the groups first appear.
     */
    public static List<PartialPath> keepPreferred(List<PartialPath> paths) {
        Map<PathKey, PartialPath> preferred = new LinkedHashMap<>();
        for (PartialPath path : paths) {
            preferred.merge(keyOf(path), path,
                (previous, later) -> PartialPath.PRECEDENCE_ORDER.compare(later, previous) < 0 ? later : previous);
        }
        return new ArrayList<>(preferred.values());
    }

    private static PathKey keyOf(PartialPath path) {
        return new PathKey(path.startNode(), path.endNode(),
            path.symbolPrecondition(), path.symbolPostcondition(),
            path.scopePrecondition(), path.scopePostcondition());
    }

    private record PathKey(Handle<Node> start, Handle<Node> end,
                           PartialSymbolStack symbolPre, PartialSymbolStack symbolPost,
                           PartialScopeStack scopePre, PartialScopeStack scopePost) {
    }
}
