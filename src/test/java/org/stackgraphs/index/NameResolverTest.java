package org.stackgraphs.index;

import org.stackgraphs.TestGraphs;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.NoCancellation;
import org.stackgraphs.graph.Node;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.stitching.StitcherConfig;
import org.stackgraphs.stitching.StitchingResult;
import org.stackgraphs.storage.InMemoryPartialPathStore;
import org.stackgraphs.storage.api.FileIndex;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Queries against a path database filled by {@link StackGraphIndexer}.
 */
@Tag("unit")
class NameResolverTest {

    private static final NodeKey GREET_REF = new NodeKey(TestGraphs.FILE_A, TestGraphs.A_GREET_REF);
    private static final NodeKey MISSING_REF = new NodeKey(TestGraphs.FILE_A, TestGraphs.A_MISSING_REF);
    private static final NodeKey GREET_DEF = new NodeKey(TestGraphs.FILE_B, TestGraphs.B_GREET_DEF);

    private InMemoryPartialPathStore store;
    private StackGraphIndexer indexer;
    private NameResolver resolver;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryPartialPathStore());
        indexer = new StackGraphIndexer(store);
        resolver = new NameResolver(store);
    }

    @Test
    @DisplayName("Reference in one file resolves to a definition in another")
    void findDefinitions_crossFile() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        ResolutionResult result = resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.definitions()).containsExactly(GREET_DEF);
        assertThat(result.bindings()).singleElement()
            .satisfies(b -> assertThat(b.reference()).isEqualTo(GREET_REF));
    }

    @Test
    void findDefinitions_unresolvableReferenceIsEmpty() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        ResolutionResult result = resolver.findDefinitions(MISSING_REF, NoCancellation.INSTANCE);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.status()).isEqualTo(StitchingResult.Status.COMPLETE);
    }

    @Test
    void findReferences_crossFile() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        ResolutionResult result = resolver.findReferences(GREET_DEF, NoCancellation.INSTANCE);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.references()).containsExactly(GREET_REF);
    }

    @Test
    void findDefinitions_memberAccessThroughScopedSymbol() throws Exception {
        indexAll(TestGraphs.memberAccess());

        ResolutionResult result = resolver.findDefinitions(new NodeKey(TestGraphs.FILE_A, 10), NoCancellation.INSTANCE);

        assertThat(result.definitions()).containsExactly(new NodeKey(TestGraphs.FILE_B, 6));
    }

    @Test
    @DisplayName("Repeated queries give the same definitions in the same order")
    void findDefinitions_isDeterministic() throws Exception {
        indexAll(TestGraphs.shadowing());
        NodeKey ref = new NodeKey(TestGraphs.FILE_C, TestGraphs.C_REF);

        List<NodeKey> first = resolver.findDefinitions(ref, NoCancellation.INSTANCE).definitions();
        List<NodeKey> second = resolver.findDefinitions(ref, NoCancellation.INSTANCE).definitions();

        assertThat(first).containsExactly(
            new NodeKey(TestGraphs.FILE_C, TestGraphs.C_DEF_HIGH),
            new NodeKey(TestGraphs.FILE_C, TestGraphs.C_DEF_LOW));
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Preferred definition comes first even when it is stitched from more stored paths")
    void findDefinitions_ordersByPrecedence() throws Exception {
        indexAll(TestGraphs.shadowingThroughExportedScope());

        ResolutionResult result = resolver.findDefinitions(new NodeKey(TestGraphs.FILE_C, TestGraphs.C_REF),
            NoCancellation.INSTANCE);

        assertThat(result.definitions()).containsExactly(
            new NodeKey(TestGraphs.FILE_C, TestGraphs.C_DEF_HIGH),
            new NodeKey(TestGraphs.FILE_C, TestGraphs.C_DEF_LOW));
        assertThat(result.bindings()).allSatisfy(b -> assertThat(b.path().scopePostcondition().isEmpty()).isTrue());
    }

    @Test
    void filterShadowed_keepsOnlyPreferredDefinition() throws Exception {
        indexAll(TestGraphs.shadowing());
        NameResolver filtering = new NameResolver(store, StitcherConfig.DEFAULT, true);

        ResolutionResult result = filtering.findDefinitions(new NodeKey(TestGraphs.FILE_C, TestGraphs.C_REF),
            NoCancellation.INSTANCE);

        assertThat(result.definitions()).containsExactly(new NodeKey(TestGraphs.FILE_C, TestGraphs.C_DEF_HIGH));
    }

    @Test
    @DisplayName("A file dropped from the database is reported as missing")
    void findDefinitions_missingFileMakesResultIncomplete() throws Exception {
        indexAll(directCrossFileEdge());

        assertThat(resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE).definitions())
            .containsExactly(GREET_DEF);

        indexer.invalidate(TestGraphs.FILE_B);
        ResolutionResult result = resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.INCOMPLETE_PATHS);
        assertThat(result.missingFiles()).containsExactly(TestGraphs.FILE_B);
        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void findDefinitions_terminatesOnMutuallyExportingFiles() throws Exception {
        StackGraph graph = new StackGraph();
        Handle<SourceFile> a = graph.getOrCreateFile(TestGraphs.FILE_A);
        Handle<SourceFile> b = graph.getOrCreateFile(TestGraphs.FILE_B);
        Handle<Node> aScope = graph.addScopeNode(a, 1, true);
        Handle<Node> ref = graph.addPushSymbolNode(a, TestGraphs.A_GREET_REF, graph.addSymbol("greet"), true);
        Handle<Node> bScope = graph.addScopeNode(b, 1, true);
        Handle<Node> def = graph.addPopSymbolNode(b, TestGraphs.B_GREET_DEF, graph.addSymbol("greet"), true);
        graph.addEdge(ref, aScope, 0);
        graph.addEdge(graph.root(), aScope, 0);
        graph.addEdge(aScope, graph.root(), 0);
        graph.addEdge(graph.root(), bScope, 0);
        graph.addEdge(bScope, graph.root(), 0);
        graph.addEdge(bScope, def, 0);
        indexAll(graph);

        ResolutionResult result = resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.definitions()).containsExactly(GREET_DEF);
    }

    @Test
    void findDefinitions_ofUnindexedFileIsIncomplete() throws Exception {
        ResolutionResult result = resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.INCOMPLETE_PATHS);
        assertThat(result.missingFiles()).containsExactly(TestGraphs.FILE_A);
    }

    @Test
    void queriesRejectNodesOfTheWrongKind() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        assertThatThrownBy(() -> resolver.findDefinitions(GREET_DEF, NoCancellation.INSTANCE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a reference");
        assertThatThrownBy(() -> resolver.findReferences(GREET_REF, NoCancellation.INSTANCE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a definition");
        assertThatThrownBy(() -> resolver.findDefinitions(new NodeKey(TestGraphs.FILE_A, 99), NoCancellation.INSTANCE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown node");
    }

    @Test
    void cancelledQueryReportsCancellation() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        ResolutionResult result = resolver.findDefinitions(GREET_REF, () -> true);

        assertThat(result.status()).isEqualTo(StitchingResult.Status.CANCELLED);
        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void queriesNeverWriteToTheStore() throws Exception {
        indexAll(TestGraphs.crossFileGreet());
        clearInvocations(store);

        resolver.findDefinitions(GREET_REF, NoCancellation.INSTANCE);
        resolver.findReferences(GREET_DEF, NoCancellation.INSTANCE);
        resolver.lookupDefinitions(TestGraphs.FILE_A, 0, 10, NoCancellation.INSTANCE);

        verify(store, never()).storeFile(any(FileIndex.class));
        verify(store, never()).deleteFile(anyString());
    }

    @Test
    void definitionsOf_isLazyAndRestartable() throws Exception {
        indexAll(TestGraphs.crossFileGreet());
        clearInvocations(store);

        ResolutionQuery query = resolver.definitionsOf(GREET_REF, NoCancellation.INSTANCE);
        verifyNoInteractions(store);

        List<PartialPath> first = new ArrayList<>();
        query.forEach(first::add);
        List<PartialPath> second = new ArrayList<>();
        query.forEach(second::add);

        assertThat(first).hasSize(1);
        assertThat(second).hasSize(1);
        assertThat(second.get(0).edgeCount()).isEqualTo(first.get(0).edgeCount());
    }

    @Test
    void referencesOf_yieldsReferencingPaths() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        List<PartialPath> paths = new ArrayList<>();
        resolver.referencesOf(GREET_DEF, NoCancellation.INSTANCE).forEach(paths::add);

        assertThat(paths).hasSize(1);
    }

    @Test
    void definitionsOf_reportsCompleteSearch() throws Exception {
        indexAll(TestGraphs.crossFileGreet());
        ResolutionQuery.Cursor cursor = resolver.definitionsOf(GREET_REF, NoCancellation.INSTANCE).iterator();

        assertThatThrownBy(cursor::status).isInstanceOf(IllegalStateException.class);
        assertThat(cursor.hasNext()).isTrue();
        cursor.next();

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.status()).isEqualTo(StitchingResult.Status.COMPLETE);
        assertThat(cursor.missingFiles()).isEmpty();
    }

    @Test
    void definitionsOf_reportsUnstoredFileOfQueriedNode() {
        ResolutionQuery.Cursor cursor = resolver.definitionsOf(new NodeKey("gone.py", 1), NoCancellation.INSTANCE)
            .iterator();

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.status()).isEqualTo(StitchingResult.Status.INCOMPLETE_PATHS);
        assertThat(cursor.missingFiles()).containsExactly("gone.py");
    }

    @Test
    void definitionsOf_reportsFilesMissingDuringSearch() throws Exception {
        indexAll(directCrossFileEdge());
        indexer.invalidate(TestGraphs.FILE_B);
        ResolutionQuery.Cursor cursor = resolver.definitionsOf(GREET_REF, NoCancellation.INSTANCE).iterator();

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.status()).isEqualTo(StitchingResult.Status.INCOMPLETE_PATHS);
        assertThat(cursor.missingFiles()).containsExactly(TestGraphs.FILE_B);
    }

    @Test
    void definitionsOf_reportsCancellation() throws Exception {
        indexAll(TestGraphs.crossFileGreet());
        ResolutionQuery.Cursor cursor = resolver.definitionsOf(GREET_REF, () -> true).iterator();

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.status()).isEqualTo(StitchingResult.Status.CANCELLED);
    }

    @Test
    void lazyQueriesRejectUnknownNodesOfStoredFiles() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        assertThatThrownBy(() -> resolver.definitionsOf(new NodeKey(TestGraphs.FILE_A, 99), NoCancellation.INSTANCE)
            .iterator().hasNext())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown node");
    }

    @Test
    void lazyQuerySurfacesStorageFailures() throws Exception {
        IPartialPathStore broken = mock(IPartialPathStore.class);
        when(broken.loadGraphFragment(anyString())).thenThrow(new StorageException("connection lost"));
        ResolutionQuery query = new NameResolver(broken).definitionsOf(GREET_REF, NoCancellation.INSTANCE);

        assertThatThrownBy(() -> query.iterator().hasNext())
            .isInstanceOf(ResolutionFailedException.class)
            .hasCauseInstanceOf(StorageException.class);
    }

    @Test
    void lookupDefinitions_resolvesReferencesOnLines() throws Exception {
        indexAll(TestGraphs.crossFileGreet());

        LineRangeLookup both = resolver.lookupDefinitions(TestGraphs.FILE_A, 3, 4, NoCancellation.INSTANCE);
        LineRangeLookup firstLine = resolver.lookupDefinitions(TestGraphs.FILE_A, 3, 3, NoCancellation.INSTANCE);

        assertThat(both.referencesFound()).isEqualTo(2);
        assertThat(both.definitionsFound()).isEqualTo(1);
        assertThat(both.unresolvedReferences()).containsExactly(MISSING_REF);
        assertThat(firstLine.results()).containsOnlyKeys(GREET_REF);
    }

    @Test
    void lookupDefinitions_unindexedFileIsEmpty() throws Exception {
        LineRangeLookup lookup = resolver.lookupDefinitions("unknown.py", 0, 100, NoCancellation.INSTANCE);

        assertThat(lookup.referencesFound()).isZero();
        assertThatThrownBy(() -> resolver.lookupDefinitions(TestGraphs.FILE_A, 5, 4, NoCancellation.INSTANCE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * {@code a.py}'s scope has an edge straight into {@code b.py}'s exported scope, so a.py's
     * stored paths cannot be decoded without b.py.
     */
    private static StackGraph directCrossFileEdge() {
        StackGraph graph = new StackGraph();
        Handle<SourceFile> a = graph.getOrCreateFile(TestGraphs.FILE_A);
        Handle<SourceFile> b = graph.getOrCreateFile(TestGraphs.FILE_B);
        Handle<Node> ref = graph.addPushSymbolNode(a, TestGraphs.A_GREET_REF, graph.addSymbol("greet"), true);
        Handle<Node> scope = graph.addScopeNode(a, 1, false);
        Handle<Node> exported = graph.addScopeNode(b, 1, true);
        Handle<Node> def = graph.addPopSymbolNode(b, TestGraphs.B_GREET_DEF, graph.addSymbol("greet"), true);
        graph.addEdge(ref, scope, 0);
        graph.addEdge(scope, exported, 0);
        graph.addEdge(exported, def, 0);
        return graph;
    }

    private void indexAll(StackGraph graph) throws Exception {
        for (Handle<SourceFile> file : graph.files()) {
            indexer.index(graph, file, "v1", NoCancellation.INSTANCE);
        }
    }
}
