package org.stackgraphs.assertion;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.stitching.IPathCandidates;
import org.stackgraphs.stitching.PathStitcher;
import org.stackgraphs.stitching.StitcherConfig;
import org.stackgraphs.stitching.StitchingResult;
import org.stackgraphs.storage.api.StorageException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A checkable statement about name binding at a source position, as written in test annotations
 * next to the code under test:
 * <ul>
 *   <li>{@link Defined}: the references at the position resolve exactly to the given lines</li>
 *   <li>{@link Defines}: the position defines exactly the given symbols</li>
 *   <li>{@link Refers}: the position references exactly the given symbols</li>
 * </ul>
 */
public sealed interface Assertion permits Assertion.Defined, Assertion.Defines, Assertion.Refers {

    AssertionSource source();

    /**
     * Checks the assertion against the graph of {@code candidates}.
     *
     * @throws AssertionFailure if the assertion does not hold or could not be decided
     * @throws StorageException if the candidates cannot be read
     */
    void run(IPathCandidates candidates, StitcherConfig config, CancellationFlag cancellation)
        throws AssertionFailure, StorageException;

    record Defined(AssertionSource source, List<AssertionTarget> targets) implements Assertion {

        @Override
        public void run(IPathCandidates candidates, StitcherConfig config, CancellationFlag cancellation)
            throws AssertionFailure, StorageException {
            StackGraph graph = candidates.graph();
            List<Handle<Node>> references = source.references(graph);
            if (references.isEmpty()) {
                throw new AssertionFailure(AssertionFailure.Kind.NO_REFERENCES,
                    source.display(graph) + ": no references found");
            }

            List<PartialPath> actual = new ArrayList<>();
            for (Handle<Node> reference : references) {
                PathStitcher stitcher = PathStitcher.forwardFromNodes(candidates, List.of(reference), config);
                StitchingResult result = PathStitcher.findAllCompletePaths(stitcher, cancellation, null);
                if (result.status() == StitchingResult.Status.CANCELLED) {
                    throw new AssertionFailure(AssertionFailure.Kind.CANCELLED,
                        source.display(graph) + ": resolution cancelled");
                }
                for (PartialPath path : result.paths()) {
                    if (result.paths().stream().noneMatch(other -> other.shadows(path))) {
                        actual.add(path);
                    }
                }
            }

            Set<AssertionTarget> missing = new LinkedHashSet<>();
            for (AssertionTarget target : targets) {
                if (actual.stream().noneMatch(p -> target.matches(graph, p.endNode()))) {
                    missing.add(target);
                }
            }
            List<PartialPath> unexpected = new ArrayList<>();
            for (PartialPath path : actual) {
                if (targets.stream().noneMatch(t -> t.matches(graph, path.endNode()))) {
                    unexpected.add(path);
                }
            }
            if (missing.isEmpty() && unexpected.isEmpty()) {
                return;
            }

            StringBuilder message = new StringBuilder(source.display(graph)).append(": incorrect definitions");
            for (AssertionTarget target : missing) {
                message.append("\n  missing: ").append(target.display(graph));
            }
            for (PartialPath path : unexpected) {
                message.append("\n  unexpected: ").append(path.display(graph));
            }
            throw new AssertionFailure(AssertionFailure.Kind.INCORRECTLY_DEFINED, message.toString(),
                new ArrayList<>(missing), unexpected, List.of(), List.of());
        }
    }

    record Defines(AssertionSource source, List<String> symbols) implements Assertion {

        @Override
        public void run(IPathCandidates candidates, StitcherConfig config, CancellationFlag cancellation)
            throws AssertionFailure {
            StackGraph graph = candidates.graph();
            List<String> actual = symbolsOf(graph, source.definitions(graph));
            compareSymbols(graph, source, symbols, actual, AssertionFailure.Kind.INCORRECT_DEFINITIONS, "defines");
        }
    }

    record Refers(AssertionSource source, List<String> symbols) implements Assertion {

        @Override
        public void run(IPathCandidates candidates, StitcherConfig config, CancellationFlag cancellation)
            throws AssertionFailure {
            StackGraph graph = candidates.graph();
            List<String> actual = symbolsOf(graph, source.references(graph));
            compareSymbols(graph, source, symbols, actual, AssertionFailure.Kind.INCORRECT_REFERENCES, "refers");
        }
    }

    private static List<String> symbolsOf(StackGraph graph, List<Handle<Node>> nodes) {
        List<String> names = new ArrayList<>();
        for (Handle<Node> node : nodes) {
            Node resolved = graph.node(node);
            if (resolved.symbol() != null) {
                names.add(graph.symbolName(resolved.symbol()));
            }
        }
        return names;
    }

    private static void compareSymbols(StackGraph graph, AssertionSource source, List<String> expected,
                                       List<String> actual, AssertionFailure.Kind kind, String verb)
        throws AssertionFailure {
        Set<String> missing = new LinkedHashSet<>();
        for (String symbol : expected) {
            if (!actual.contains(symbol)) {
                missing.add(symbol);
            }
        }
        Set<String> unexpected = new LinkedHashSet<>();
        for (String symbol : actual) {
            if (!expected.contains(symbol)) {
                unexpected.add(symbol);
            }
        }
        if (missing.isEmpty() && unexpected.isEmpty()) {
            return;
        }
        throw new AssertionFailure(kind,
            source.display(graph) + ": " + verb + " " + actual + ", expected " + expected,
            List.of(), List.of(), new ArrayList<>(missing), new ArrayList<>(unexpected));
    }
}
