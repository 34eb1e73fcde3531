package com.lineagescope.core.lineage;

import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.FlowType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LineageGraphTest {

    private static final Component A = component("a");
    private static final Component B = component("b");
    private static final Component C = component("c");
    private static final Component D = component("d");

    @Test
    void upstreamAndDownstream_returnDirectNeighboursOnly() {
        LineageGraph graph = LineageGraph.build(List.of(A, B, C), List.of(flow("a", "b"), flow("b", "c")));

        assertThat(graph.downstream("a")).containsExactly("b");
        assertThat(graph.upstream("c")).containsExactly("b");
        assertThat(graph.upstream("a")).isEmpty();
        assertThat(graph.downstream("unknown")).isEmpty();
    }

    @Test
    void build_withCycle_keepsAllEdges() {
        LineageGraph graph = LineageGraph.build(List.of(A, B), List.of(flow("a", "b"), flow("b", "a")));

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.downstream("b")).containsExactly("a");
        assertThat(graph.roots(List.of(A, B))).isEmpty();
    }

    @Test
    void build_withEdgeToUnknownComponent_dropsEdge() {
        LineageGraph graph = LineageGraph.build(List.of(A), List.of(flow("a", "ghost")));

        assertThat(graph.flows()).isEmpty();
        assertThat(graph.contains("a")).isTrue();
        assertThat(graph.contains("ghost")).isFalse();
    }

    @Test
    void rootsAndLeaves_reportComponentsWithoutIncomingOrOutgoingEdges() {
        List<Component> components = List.of(A, B, C, D);
        LineageGraph graph = LineageGraph.build(components, List.of(flow("a", "b"), flow("a", "c")));

        assertThat(graph.roots(components)).containsExactly("a", "d");
        assertThat(graph.leaves(components)).containsExactly("b", "c", "d");
    }

    @Test
    void upstream_withParallelEdges_returnsDistinctIds() {
        DataFlow data = flow("a", "b");
        DataFlow lookup = new DataFlow("a", "b", "ref", FlowType.LOOKUP, FlowProvenance.EXPLICIT);

        LineageGraph graph = LineageGraph.build(List.of(A, B), List.of(data, lookup));

        assertThat(graph.upstream("b")).containsExactly("a");
        assertThat(graph.flowsTo("b")).hasSize(2);
    }

    @Test
    void empty_hasNoEdges() {
        assertThat(LineageGraph.empty().edgeCount()).isZero();
    }

    private static DataFlow flow(String source, String target) {
        return new DataFlow(source, target, null, FlowType.DATA, FlowProvenance.DATASET_MATCH);
    }

    private static Component component(String id) {
        return new Component(id, id.toUpperCase(), ComponentRole.UNKNOWN, List.of(), List.of(), null, null,
            "p", Map.of(), Map.of());
    }
}
