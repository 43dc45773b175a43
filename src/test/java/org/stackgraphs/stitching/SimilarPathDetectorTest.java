package org.stackgraphs.stitching;

import org.stackgraphs.arena.Handle;
import org.stackgraphs.graph.Edge;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SimilarPathDetectorTest {

    private StackGraph graph;
    private PartialPath direct;
    private PartialPath detour;

    @BeforeEach
    void setUp() throws Exception {
        graph = new StackGraph();
        Handle<SourceFile> file = graph.getOrCreateFile("s.py");
        Handle<Node> from = graph.addScopeNode(file, 1, false);
        Handle<Node> via = graph.addScopeNode(file, 2, false);
        Handle<Node> to = graph.addScopeNode(file, 3, false);
        graph.addEdge(from, to, 10);
        graph.addEdge(from, via, 5);
        graph.addEdge(via, to, 0);

        direct = PartialPath.fromNode(graph, from).append(graph, new Edge(from, to, 10));
        detour = PartialPath.fromNode(graph, from)
            .append(graph, new Edge(from, via, 5))
            .append(graph, new Edge(via, to, 0));
    }

    @Test
    void laterPreferredPathReplacesEquivalentPath() {
        SimilarPathDetector detector = new SimilarPathDetector();

        assertThat(detector.add(direct)).isTrue();
        assertThat(detector.add(detour)).isTrue();

        assertThat(detector.isSuperseded(direct)).isTrue();
        assertThat(detector.isSuperseded(detour)).isFalse();
        assertThat(detector.size()).isEqualTo(1);
    }

    @Test
    void laterEquivalentPathWithHigherPrecedenceIsDropped() {
        SimilarPathDetector detector = new SimilarPathDetector();

        assertThat(detector.add(detour)).isTrue();
        assertThat(detector.add(direct)).isFalse();
        assertThat(detector.add(detour)).isFalse();

        assertThat(detector.isSuperseded(detour)).isFalse();
    }

    @Test
    void keepPreferred_keepsLowestPrecedenceOfEachGroup() {
        assertThat(SimilarPathDetector.keepPreferred(List.of(direct, detour))).containsExactly(detour);
        assertThat(SimilarPathDetector.keepPreferred(List.of(detour, direct))).containsExactly(detour);
    }
}
