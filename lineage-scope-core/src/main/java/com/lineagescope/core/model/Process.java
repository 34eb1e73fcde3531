package com.lineagescope.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A logical pipeline or workflow unit (graph, workflow, notebook, ...).
 *
 * @param id content-derived id (scan identifier + name), stable across re-parses
 * @param name process name
 * @param system source technology
 * @param type kind of definition
 * @param componentIds ids of the components built for this process, in encounter order
 * @param parameters process-level parameters
 * @param sourcePath root-relative path of the definition, or null
 */
public record Process(
    String id,
    String name,
    SystemType system,
    ProcessType type,
    List<String> componentIds,
    Map<String, String> parameters,
    String sourcePath
) {
    /**
     * Compact constructor with validation.
     */
    public Process {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (system == null) {
            system = SystemType.UNKNOWN;
        }
        if (type == null) {
            type = ProcessType.UNKNOWN;
        }
        componentIds = componentIds == null ? List.of() : List.copyOf(componentIds);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Returns a copy with the given component id appended.
     *
     * <p>Appending an id that is already listed returns this process unchanged.
     *
     * @param componentId id to append
     * @return process listing the component
     */
    public Process withComponentId(String componentId) {
        if (componentIds.contains(componentId)) {
            return this;
        }
        List<String> ids = new ArrayList<>(componentIds);
        ids.add(componentId);
        return new Process(id, name, system, type, ids, parameters, sourcePath);
    }
}
