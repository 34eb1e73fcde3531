package com.lineagescope.core.builder;

import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.Process;

import java.util.List;
import java.util.Objects;

/**
 * A process with the components built for it and its declared connections.
 *
 * @param process the process, listing its component ids
 * @param components components in encounter order
 * @param explicitFlows declared connections, still referencing components by name
 */
public record ProcessExtraction(
    Process process,
    List<Component> components,
    List<ExplicitFlowTuple> explicitFlows
) {
    public ProcessExtraction {
        Objects.requireNonNull(process, "process must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        explicitFlows = explicitFlows == null ? List.of() : List.copyOf(explicitFlows);
    }
}
