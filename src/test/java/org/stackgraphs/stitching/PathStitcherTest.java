package org.stackgraphs.stitching;

import org.stackgraphs.TestGraphs;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.NoCancellation;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.NodeId;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stitching over single graph edges.
 */
@Tag("unit")
class PathStitcherTest {

    @Test
    @DisplayName("Cross-file reference resolves to its definition")
    void forward_resolvesCrossFileReference() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_GREET_REF);
        Handle<Node> def = TestGraphs.node(graph, TestGraphs.FILE_B, TestGraphs.B_GREET_DEF);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.COMPLETE);
        assertThat(result.paths()).hasSize(1);
        PartialPath path = result.paths().get(0);
        assertThat(path.startNode()).isEqualTo(ref);
        assertThat(path.endNode()).isEqualTo(def);
        assertThat(path.isComplete(graph)).isTrue();
    }

    @Test
    @DisplayName("Unresolvable reference yields an empty, complete result")
    void forward_unresolvableReferenceIsEmptyNotError() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_MISSING_REF);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.status()).isEqualTo(StitchingResult.Status.COMPLETE);
        assertThat(result.missingFiles()).isEmpty();
    }

    @Test
    @DisplayName("Lower precedence is reported first, every time")
    void forward_reportsLowerPrecedenceFirst() throws Exception {
        StackGraph graph = TestGraphs.shadowing();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_REF);
        Handle<Node> preferred = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_DEF_HIGH);
        Handle<Node> other = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_DEF_LOW);

        for (int run = 0; run < 3; run++) {
            StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);
            assertThat(result.paths()).extracting(PartialPath::endNode).containsExactly(preferred, other);
        }
    }

    @Test
    @DisplayName("Preferred definition comes first even when it needs more phases")
    void forward_ordersByPrecedenceNotByPhase() throws Exception {
        StackGraph graph = TestGraphs.shadowingThroughExportedScope();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_REF);
        Handle<Node> preferred = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_DEF_HIGH);
        Handle<Node> other = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_DEF_LOW);
        List<PartialPath> visited = new ArrayList<>();
        PathStitcher stitcher = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), List.of(ref),
            StitcherConfig.DEFAULT);

        StitchingResult result = PathStitcher.findAllCompletePaths(stitcher, NoCancellation.INSTANCE, visited::add);

        assertThat(visited).extracting(PartialPath::endNode).containsExactly(other, preferred);
        assertThat(result.paths()).extracting(PartialPath::endNode).containsExactly(preferred, other);
        assertThat(result.paths().get(0).edgeCount()).isGreaterThan(result.paths().get(1).edgeCount());
    }

    @Test
    void scopesLeftOnTheStackDoNotCompleteAPath() throws Exception {
        StackGraph graph = new StackGraph();
        Handle<SourceFile> file = graph.getOrCreateFile(TestGraphs.FILE_A);
        graph.addScopeNode(file, 5, true);
        Handle<Node> ref = graph.addPushScopedSymbolNode(file, 1, graph.addSymbol("f"), new NodeId(file, 5), true);
        Handle<Node> def = graph.addPopScopedSymbolNode(file, 2, graph.addSymbol("f"), true);
        graph.addEdge(ref, def, 0);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.COMPLETE);
        assertThat(result.paths()).isEmpty();
    }

    @Test
    void forward_followsScopedSymbolThroughJump() throws Exception {
        StackGraph graph = TestGraphs.memberAccess();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, 10);
        Handle<Node> methodDef = TestGraphs.node(graph, TestGraphs.FILE_B, 6);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.paths()).extracting(PartialPath::endNode).containsExactly(methodDef);
        assertThat(result.paths()).allSatisfy(p -> assertThat(TestGraphs.replaysOnEmptyStacks(graph, p)).isTrue());
        assertThat(result.paths()).allSatisfy(p -> assertThat(p.scopePostcondition().isEmpty()).isTrue());
    }

    @Test
    void backward_findsReferencesOfDefinition() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> def = TestGraphs.node(graph, TestGraphs.FILE_B, TestGraphs.B_GREET_DEF);
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_GREET_REF);

        PathStitcher stitcher = PathStitcher.backwardFromNodes(new GraphEdgeCandidates(graph), List.of(def),
            StitcherConfig.DEFAULT);
        StitchingResult result = PathStitcher.findAllCompletePaths(stitcher, NoCancellation.INSTANCE, null);

        assertThat(result.paths()).hasSize(1);
        assertThat(result.paths().get(0).startNode()).isEqualTo(ref);
        assertThat(result.paths().get(0).endNode()).isEqualTo(def);
        assertThat(TestGraphs.replaysOnEmptyStacks(graph, result.paths().get(0))).isTrue();
    }

    @Test
    @DisplayName("Complete paths follow connected edges and respect stack discipline")
    void completePathsAreConnectedAndBalanced() throws Exception {
        StackGraph graph = TestGraphs.shadowing();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_REF);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.paths()).isNotEmpty();
        for (PartialPath path : result.paths()) {
            List<Edge> edges = path.edges();
            assertThat(edges.get(0).source()).isEqualTo(path.startNode());
            assertThat(edges.get(edges.size() - 1).sink()).isEqualTo(path.endNode());
            for (int i = 1; i < edges.size(); i++) {
                assertThat(edges.get(i).source()).isEqualTo(edges.get(i - 1).sink());
            }
            assertThat(TestGraphs.replaysOnEmptyStacks(graph, path)).isTrue();
            assertThat(path.symbolPrecondition().isEmpty()).isTrue();
            assertThat(path.symbolPostcondition().isEmpty()).isTrue();
            assertThat(path.scopePrecondition().isEmpty()).isTrue();
            assertThat(path.scopePostcondition().isEmpty()).isTrue();
        }
    }

    @Test
    void phasesExposeIntermediatePaths() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_GREET_REF);
        Handle<Node> aModule = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_MODULE);
        PathStitcher stitcher = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), List.of(ref),
            StitcherConfig.DEFAULT);

        assertThat(stitcher.previousPhasePaths()).extracting(PartialPath::endNode).containsExactly(ref);
        stitcher.processNextPhase(NoCancellation.INSTANCE);
        assertThat(stitcher.previousPhasePaths()).extracting(PartialPath::endNode).containsExactly(aModule);
        stitcher.processNextPhase(NoCancellation.INSTANCE);
        assertThat(stitcher.previousPhasePaths()).extracting(PartialPath::endNode).containsExactly(graph.root());
        assertThat(stitcher.phase()).isEqualTo(2);
        assertThat(stitcher.isComplete()).isFalse();
    }

    @Test
    void maxWorkPerPhaseSpreadsWorkWithoutLosingPaths() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        List<Handle<Node>> refs = List.of(
            TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_GREET_REF),
            TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_MISSING_REF));
        PathStitcher limited = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), refs,
            new StitcherConfig(true, false, 1));
        PathStitcher unlimited = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), refs,
            StitcherConfig.DEFAULT);

        StitchingResult limitedResult = PathStitcher.findAllCompletePaths(limited, NoCancellation.INSTANCE, null);
        StitchingResult unlimitedResult = PathStitcher.findAllCompletePaths(unlimited, NoCancellation.INSTANCE, null);

        assertThat(limitedResult.paths()).hasSameSizeAs(unlimitedResult.paths()).hasSize(1);
        assertThat(limited.phase()).isGreaterThan(unlimited.phase());
    }

    @Test
    void cancellationReturnsPathsFoundSoFar() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_GREET_REF);
        PathStitcher stitcher = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), List.of(ref),
            StitcherConfig.DEFAULT);

        StitchingResult result = PathStitcher.findAllCompletePaths(stitcher, () -> true, null);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.CANCELLED);
        assertThat(result.paths()).isEmpty();
    }

    @Test
    void visitorSeesEveryCompletePath() throws Exception {
        StackGraph graph = TestGraphs.shadowing();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_C, TestGraphs.C_REF);
        List<PartialPath> visited = new ArrayList<>();
        PathStitcher stitcher = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), List.of(ref),
            StitcherConfig.DEFAULT);

        StitchingResult result = PathStitcher.findAllCompletePaths(stitcher, NoCancellation.INSTANCE, visited::add);

        assertThat(visited).isEqualTo(result.paths());
    }

    @Test
    void statsAreCollectedWhenEnabled() throws Exception {
        StackGraph graph = TestGraphs.crossFileGreet();
        Handle<Node> ref = TestGraphs.node(graph, TestGraphs.FILE_A, TestGraphs.A_MISSING_REF);

        StitchingResult result = findDefinitions(graph, ref, new StitcherConfig(true, true, 0));

        assertThat(result.stats()).isNotNull();
        assertThat(result.stats().frontierPerPhase().total()).isPositive();
        assertThat(result.stats().rejectedExtensions()).isEqualTo(1);
        assertThat(findDefinitions(graph, ref, StitcherConfig.DEFAULT).stats()).isNull();
    }

    @Test
    void pushCycleTerminates() throws Exception {
        StackGraph graph = new StackGraph();
        var file = graph.getOrCreateFile("loop.py");
        Handle<Node> ref = graph.addPushSymbolNode(file, 1, graph.addSymbol("x"), true);
        Handle<Node> scope = graph.addScopeNode(file, 2, false);
        Handle<Node> pushAgain = graph.addPushSymbolNode(file, 3, graph.addSymbol("y"), false);
        Handle<Node> def = graph.addPopSymbolNode(file, 4, graph.addSymbol("x"), true);
        graph.addEdge(ref, scope, 0);
        graph.addEdge(scope, pushAgain, 0);
        graph.addEdge(pushAgain, scope, 0);
        graph.addEdge(scope, def, 1);

        StitchingResult result = findDefinitions(graph, ref, StitcherConfig.DEFAULT);

        assertThat(result.paths()).extracting(PartialPath::endNode).containsExactly(def);
    }

    private static StitchingResult findDefinitions(StackGraph graph, Handle<Node> ref, StitcherConfig config)
        throws Exception {
        PathStitcher stitcher = PathStitcher.forwardFromNodes(new GraphEdgeCandidates(graph), List.of(ref), config);
        return PathStitcher.findAllCompletePaths(stitcher, NoCancellation.INSTANCE, null);
    }
}
