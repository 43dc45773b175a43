package org.stackgraphs.index;

import org.stackgraphs.stitching.StitchingResult;
import org.stackgraphs.storage.api.NodeKey;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bindings found for one queried node.
 * <p>
 * An empty, {@link StitchingResult.Status#COMPLETE} result is a valid answer ("no definition").
 * With {@link StitchingResult.Status#INCOMPLETE_PATHS} the bindings are those reachable without
 * the files in {@link #missingFiles()}; with {@link StitchingResult.Status#CANCELLED} they are
 * the ones found before cancellation.
 */
public record ResolutionResult(NodeKey query, List<Binding> bindings, StitchingResult.Status status,
                               Set<String> missingFiles) {

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public boolean isComplete() {
        return status == StitchingResult.Status.COMPLETE;
    }

    /**
     * Distinct definitions of all bindings, in binding order.
     */
    public List<NodeKey> definitions() {
        Set<NodeKey> distinct = new LinkedHashSet<>();
        for (Binding binding : bindings) {
            distinct.add(binding.definition());
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Distinct references of all bindings, in binding order.
     */
    public List<NodeKey> references() {
        Set<NodeKey> distinct = new LinkedHashSet<>();
        for (Binding binding : bindings) {
            distinct.add(binding.reference());
        }
        return new ArrayList<>(distinct);
    }
}
