package com.lineagescope.core.scanner;

import com.lineagescope.core.lineage.LineageGraph;
import com.lineagescope.core.model.LineageModel;

import java.util.Objects;

/**
 * Everything one scan produces.
 *
 * @param model processes, components and edges
 * @param graph queryable view of the edges
 * @param report per-file outcome
 */
public record ScanOutcome(
    LineageModel model,
    LineageGraph graph,
    ScanReport report
) {
    public ScanOutcome {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }
}
