package com.lineagescope.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate of one extraction run: every process, component and lineage edge.
 *
 * <p>This is what downstream consumers (reporting, comparison tooling) read. The
 * edge list is owned by the model, not by either endpoint.
 *
 * @param scanName name of the scanned project
 * @param processes discovered processes
 * @param components discovered components
 * @param flows deduplicated lineage edges
 */
public record LineageModel(
    String scanName,
    List<Process> processes,
    List<Component> components,
    List<DataFlow> flows
) {
    /**
     * Compact constructor with validation.
     */
    public LineageModel {
        Objects.requireNonNull(scanName, "scanName must not be null");
        processes = processes == null ? List.of() : List.copyOf(processes);
        components = components == null ? List.of() : List.copyOf(components);
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    /**
     * Finds a component by id.
     *
     * @param componentId component id
     * @return component, or empty if not part of this model
     */
    public Optional<Component> findComponent(String componentId) {
        return components.stream()
            .filter(c -> c.id().equals(componentId))
            .findFirst();
    }

    /**
     * Finds every component with the given name, across processes.
     *
     * @param name component name
     * @return matching components in model order
     */
    public List<Component> findComponentsByName(String name) {
        return components.stream()
            .filter(c -> c.name().equals(name))
            .toList();
    }
}
