package com.lineagescope.core.model;

import java.util.Objects;

/**
 * Directed lineage edge: data produced by the source component is consumed by the target.
 *
 * <p>Both endpoints reference components of the same extraction run. Self-loops
 * (source equals target) are valid and describe read-back patterns.
 *
 * @param sourceComponentId upstream component id
 * @param targetComponentId downstream component id
 * @param datasetName dataset carried by the edge, or null for role-heuristic edges
 * @param flowType kind of dependency
 * @param provenance evidence the edge is based on
 */
public record DataFlow(
    String sourceComponentId,
    String targetComponentId,
    String datasetName,
    FlowType flowType,
    FlowProvenance provenance
) {
    /**
     * Compact constructor with validation.
     */
    public DataFlow {
        Objects.requireNonNull(sourceComponentId, "sourceComponentId must not be null");
        Objects.requireNonNull(targetComponentId, "targetComponentId must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
        if (flowType == null) {
            flowType = FlowType.DATA;
        }
    }

    /**
     * Returns true if the edge starts and ends at the same component.
     *
     * @return true for self-loops
     */
    public boolean isSelfLoop() {
        return sourceComponentId.equals(targetComponentId);
    }
}
