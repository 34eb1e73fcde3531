package com.lineagescope.core.model;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A processing node inside a {@link Process}.
 *
 * <p>The id is derived from the owning process id and the component name, so a
 * component with the same name under the same process always gets the same id.
 *
 * @param id content-derived id (process id + name)
 * @param name component name
 * @param role classified role
 * @param inputDatasetNames datasets the component reads, in declaration order
 * @param outputDatasetNames datasets the component writes, in declaration order
 * @param schema record layout, or null
 * @param transformationText free text describing the transformation, or null
 * @param processId id of the owning process (back-reference only)
 * @param parameters component parameters
 * @param metadata enrichment added after creation (hierarchy path, source type, ...)
 */
public record Component(
    String id,
    String name,
    ComponentRole role,
    List<String> inputDatasetNames,
    List<String> outputDatasetNames,
    Schema schema,
    String transformationText,
    String processId,
    Map<String, String> parameters,
    Map<String, String> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(processId, "processId must not be null");
        if (role == null) {
            role = ComponentRole.UNKNOWN;
        }
        inputDatasetNames = inputDatasetNames == null ? List.of() : List.copyOf(inputDatasetNames);
        outputDatasetNames = outputDatasetNames == null ? List.of() : List.copyOf(outputDatasetNames);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Returns a copy with one metadata entry added or replaced.
     *
     * @param key metadata key
     * @param value metadata value
     * @return enriched component
     */
    public Component withMetadata(String key, String value) {
        Map<String, String> enriched = new HashMap<>(metadata);
        enriched.put(key, value);
        return new Component(id, name, role, inputDatasetNames, outputDatasetNames,
            schema, transformationText, processId, parameters, enriched);
    }

    /**
     * Combines this definition with a later definition of the same component.
     *
     * <p>This definition keeps its name, role, transformation text, parameters and
     * metadata. The later one adds the datasets this one does not list, and fills in
     * the schema, an unknown role, missing transformation text and missing parameters.
     *
     * @param later another definition with the same id
     * @return combined component
     */
    public Component mergedWith(Component later) {
        Map<String, String> combinedParameters = new HashMap<>(later.parameters);
        combinedParameters.putAll(parameters);
        return new Component(
            id,
            name,
            role == ComponentRole.UNKNOWN ? later.role : role,
            union(inputDatasetNames, later.inputDatasetNames),
            union(outputDatasetNames, later.outputDatasetNames),
            schema != null ? schema : later.schema,
            transformationText != null ? transformationText : later.transformationText,
            processId,
            combinedParameters,
            metadata
        );
    }

    private static List<String> union(List<String> first, List<String> second) {
        LinkedHashSet<String> names = new LinkedHashSet<>(first);
        names.addAll(second);
        return List.copyOf(names);
    }
}
