package com.lineagescope.core.lineage;

import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.FlowType;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.SystemType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link FlowInferenceEngine}.
 */
class FlowInferenceEngineTest {

    private static final Process P1 = process("p1");
    private static final Process P2 = process("p2");

    private final FlowInferenceEngine engine = new FlowInferenceEngine();

    @Test
    void infer_withProducerAndConsumer_emitsSingleDatasetMatch() {
        // Given
        Component reader = component("reader", "Reader", ComponentRole.SOURCE, "p1", List.of(), List.of("orders"));
        Component writer = component("writer", "Writer", ComponentRole.SINK, "p1", List.of("orders"), List.of());

        // When
        FlowInferenceResult result = engine.infer(List.of(P1), List.of(reader, writer));

        // Then
        assertThat(result.flows()).singleElement().satisfies(flow -> {
            assertThat(flow.sourceComponentId()).isEqualTo("reader");
            assertThat(flow.targetComponentId()).isEqualTo("writer");
            assertThat(flow.datasetName()).isEqualTo("orders");
            assertThat(flow.provenance()).isEqualTo(FlowProvenance.DATASET_MATCH);
        });
    }

    @Test
    void infer_withoutEvidence_chainsRolesHeuristically() {
        // Given
        List<Component> components = List.of(
            component("s", "S", ComponentRole.SOURCE, "p1"),
            component("t1", "T1", ComponentRole.TRANSFORM, "p1"),
            component("t2", "T2", ComponentRole.TRANSFORM, "p1"),
            component("o", "O", ComponentRole.SINK, "p1"));

        // When
        FlowInferenceResult result = engine.infer(List.of(P1), components);

        // Then
        assertThat(result.flows())
            .extracting(DataFlow::sourceComponentId, DataFlow::targetComponentId, DataFlow::provenance)
            .containsExactly(
                tuple("s", "t1", FlowProvenance.ROLE_HEURISTIC),
                tuple("t1", "t2", FlowProvenance.ROLE_HEURISTIC),
                tuple("t2", "o", FlowProvenance.ROLE_HEURISTIC));
    }

    @Test
    void infer_withSeveralSinks_connectsLastTransformToEverySink() {
        List<Component> components = List.of(
            component("s1", "S1", ComponentRole.SOURCE, "p1"),
            component("s2", "S2", ComponentRole.SOURCE, "p1"),
            component("j", "J", ComponentRole.JOIN, "p1"),
            component("o1", "O1", ComponentRole.SINK, "p1"),
            component("o2", "O2", ComponentRole.SINK, "p1"));

        FlowInferenceResult result = engine.infer(List.of(P1), components);

        assertThat(result.flows())
            .extracting(DataFlow::sourceComponentId, DataFlow::targetComponentId)
            .containsExactly(tuple("s1", "j"), tuple("j", "o1"), tuple("j", "o2"));
    }

    @Test
    void infer_withExplicitAndHeuristicForSamePair_keepsExplicit() {
        // Given
        Component source = component("s", "S", ComponentRole.SOURCE, "p1");
        Component transform = component("t", "T", ComponentRole.TRANSFORM, "p1");
        Map<String, List<ExplicitFlowTuple>> explicit = Map.of("p1",
            List.of(new ExplicitFlowTuple("S", "T", "raw", "data")));

        // When
        FlowInferenceResult result = engine.infer(List.of(P1), List.of(source, transform), explicit);

        // Then
        assertThat(result.flows()).singleElement().satisfies(flow -> {
            assertThat(flow.provenance()).isEqualTo(FlowProvenance.EXPLICIT);
            assertThat(flow.datasetName()).isEqualTo("raw");
        });
    }

    @Test
    void infer_withAllThreePassesForSamePair_keepsOnlyExplicit() {
        // Given
        Component source = component("s", "S", ComponentRole.SOURCE, "p1", List.of(), List.of("staged"));
        Component transform = component("t", "T", ComponentRole.TRANSFORM, "p1", List.of("staged"), List.of());
        Map<String, List<ExplicitFlowTuple>> explicit = Map.of("p1",
            List.of(new ExplicitFlowTuple("S", "T", "declared", "data")));

        // When
        FlowInferenceResult result = engine.infer(List.of(P1), List.of(source, transform), explicit);

        // Then
        assertThat(result.flows()).singleElement().satisfies(flow -> {
            assertThat(flow.sourceComponentId()).isEqualTo("s");
            assertThat(flow.targetComponentId()).isEqualTo("t");
            assertThat(flow.provenance()).isEqualTo(FlowProvenance.EXPLICIT);
            assertThat(flow.datasetName()).isEqualTo("declared");
        });
    }

    @Test
    void infer_withTwoExplicitConnectionsForSamePair_keepsFirstDeclared() {
        Component a = component("a", "A", ComponentRole.UNKNOWN, "p1");
        Component b = component("b", "B", ComponentRole.UNKNOWN, "p1");
        Map<String, List<ExplicitFlowTuple>> explicit = Map.of("p1", List.of(
            new ExplicitFlowTuple("A", "B", "orders", "data"),
            new ExplicitFlowTuple("A", "B", "customers", "lookup")));

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(a, b), explicit);

        assertThat(result.flows()).singleElement()
            .extracting(DataFlow::datasetName, DataFlow::flowType)
            .containsExactly("orders", FlowType.DATA);
    }

    @Test
    void infer_withDatasetAndHeuristicForSamePair_keepsDatasetMatch() {
        Component source = component("s", "S", ComponentRole.SOURCE, "p1", List.of(), List.of("staged"));
        Component transform = component("t", "T", ComponentRole.TRANSFORM, "p1", List.of("staged"), List.of());

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(source, transform));

        assertThat(result.flows()).singleElement()
            .extracting(DataFlow::provenance).isEqualTo(FlowProvenance.DATASET_MATCH);
    }

    @Test
    void infer_withUnknownExplicitName_countsUnresolvedReference() {
        Component a = component("a", "A", ComponentRole.UNKNOWN, "p1");
        Component b = component("b", "B", ComponentRole.UNKNOWN, "p1");
        Map<String, List<ExplicitFlowTuple>> explicit = Map.of("p1", List.of(
            ExplicitFlowTuple.of("A", "B"),
            ExplicitFlowTuple.of("A", "Missing")));

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(a, b), explicit);

        assertThat(result.unresolvedReferences()).isEqualTo(1);
        assertThat(result.flows()).hasSize(1);
    }

    @Test
    void infer_withExplicitNameFromOtherProcess_doesNotResolve() {
        Component a = component("a", "A", ComponentRole.UNKNOWN, "p1");
        Component b = component("b", "B", ComponentRole.UNKNOWN, "p2");

        FlowInferenceResult result = engine.infer(List.of(P1, P2), List.of(a, b),
            Map.of("p1", List.of(ExplicitFlowTuple.of("A", "B"))));

        assertThat(result.flows()).isEmpty();
        assertThat(result.unresolvedReferences()).isEqualTo(1);
    }

    @Test
    void infer_withSelfReferencingComponent_keepsSelfLoop() {
        Component merge = component("m", "M", ComponentRole.UNKNOWN, "p1", List.of("state"), List.of("state"));

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(merge));

        assertThat(result.flows()).singleElement().satisfies(flow -> assertThat(flow.isSelfLoop()).isTrue());
    }

    @Test
    void infer_withSeveralWriters_usesLastWriterAsProducer() {
        Component first = component("w1", "W1", ComponentRole.UNKNOWN, "p1", List.of(), List.of("d"));
        Component second = component("w2", "W2", ComponentRole.UNKNOWN, "p1", List.of(), List.of("d"));
        Component reader = component("r", "R", ComponentRole.UNKNOWN, "p1", List.of("d"), List.of());

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(first, second, reader));

        assertThat(result.flows())
            .extracting(DataFlow::sourceComponentId, DataFlow::targetComponentId)
            .containsExactly(tuple("w2", "r"));
    }

    @Test
    void infer_withDatasetReadButNeverWritten_countsUnmatchedDataset() {
        Component reader = component("r", "R", ComponentRole.UNKNOWN, "p1", List.of("external"), List.of());

        FlowInferenceResult result = engine.infer(List.of(P1), List.of(reader));

        assertThat(result.flows()).isEmpty();
        assertThat(result.unmatchedDatasets()).isEqualTo(1);
    }

    @Test
    void infer_withSharedDatasetAcrossProcesses_matchesOnlyWhenCrossProcess() {
        // Given
        Component producer = component("w", "W", ComponentRole.UNKNOWN, "p1", List.of(), List.of("shared"));
        Component consumer = component("r", "R", ComponentRole.UNKNOWN, "p2", List.of("shared"), List.of());
        List<Process> processes = List.of(P1, P2);
        List<Component> components = List.of(producer, consumer);

        // When
        FlowInferenceResult scoped = engine.infer(processes, components);
        FlowInferenceEngine crossProcessEngine = new FlowInferenceEngine(true);
        FlowInferenceResult crossProcess = crossProcessEngine.infer(processes, components);

        // Then
        assertThat(engine.isCrossProcess()).isFalse();
        assertThat(crossProcessEngine.isCrossProcess()).isTrue();
        assertThat(scoped.flows()).isEmpty();
        assertThat(crossProcess.flows()).singleElement()
            .extracting(DataFlow::sourceComponentId, DataFlow::targetComponentId)
            .containsExactly("w", "r");
    }

    @Test
    void infer_withLookupMentionedByJoin_emitsLookupFlow() {
        // Given
        Component lookup = component("l", "Customers", ComponentRole.LOOKUP, "p1");
        Component join = new Component("j", "Enrich", ComponentRole.JOIN, List.of(), List.of(), null,
            "out.name :: lookup(\"Customers\", in.id).name;", "p1", Map.of(), Map.of());
        Component otherJoin = component("k", "Other", ComponentRole.JOIN, "p1");

        // When
        FlowInferenceResult result = engine.infer(List.of(P1), List.of(lookup, join, otherJoin));

        // Then
        assertThat(result.flows())
            .filteredOn(flow -> flow.flowType() == FlowType.LOOKUP)
            .extracting(DataFlow::sourceComponentId, DataFlow::targetComponentId)
            .containsExactly(tuple("l", "j"));
    }

    @Test
    void infer_withNoComponents_returnsEmptyResult() {
        FlowInferenceResult result = engine.infer(List.of(), List.of());

        assertThat(result.flows()).isEmpty();
        assertThat(result.droppedDanglingEdges()).isZero();
    }

    @Test
    void infer_everyEdgeReferencesKnownComponents() {
        List<Component> components = List.of(
            component("s", "S", ComponentRole.SOURCE, "p1", List.of(), List.of("a")),
            component("t", "T", ComponentRole.TRANSFORM, "p1", List.of("a"), List.of("b")),
            component("o", "O", ComponentRole.SINK, "p2", List.of("b"), List.of()));

        FlowInferenceResult result = new FlowInferenceEngine(true).infer(List.of(P1, P2), components);

        assertThat(result.flows()).allSatisfy(flow -> {
            assertThat(List.of("s", "t", "o")).contains(flow.sourceComponentId(), flow.targetComponentId());
        });
        assertThat(result.countBy(FlowProvenance.DATASET_MATCH)).isEqualTo(2);
    }

    private static Process process(String id) {
        return new Process(id, id, SystemType.ABINITIO, ProcessType.GRAPH, List.of(), Map.of(), null);
    }

    private static Component component(String id, String name, ComponentRole role, String processId) {
        return component(id, name, role, processId, List.of(), List.of());
    }

    private static Component component(String id, String name, ComponentRole role, String processId,
                                       List<String> inputs, List<String> outputs) {
        return new Component(id, name, role, inputs, outputs, null, null, processId, Map.of(), Map.of());
    }
}
