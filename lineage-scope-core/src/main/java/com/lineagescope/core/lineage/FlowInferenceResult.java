package com.lineagescope.core.lineage;

import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.FlowProvenance;

import java.util.List;

/**
 * Output of one {@link FlowInferenceEngine} run.
 *
 * @param flows deduplicated edges in emission order
 * @param unresolvedReferences declared connections naming a component that does not exist
 * @param unmatchedDatasets consumed datasets no component in scope produces
 * @param droppedDanglingEdges edges dropped because an endpoint was not a known component
 */
public record FlowInferenceResult(
    List<DataFlow> flows,
    int unresolvedReferences,
    int unmatchedDatasets,
    int droppedDanglingEdges
) {
    public FlowInferenceResult {
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    /**
     * Counts the kept edges with the given provenance.
     *
     * @param provenance provenance to count
     * @return number of edges
     */
    public long countBy(FlowProvenance provenance) {
        return flows.stream()
            .filter(flow -> flow.provenance() == provenance)
            .count();
    }
}
