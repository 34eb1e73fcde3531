package com.lineagescope.core.builder;

import com.lineagescope.core.model.Schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One processing node as extracted by a format adapter, before ids are assigned.
 *
 * @param name node name, unique within its process
 * @param roleHint adapter vocabulary for the node's role (e.g. {@code "Input_File"}, {@code "hive"})
 * @param inputDatasets datasets read, in declaration order
 * @param outputDatasets datasets written, in declaration order
 * @param schema record layout, or null
 * @param transformationText transformation logic or script text, or null
 * @param parameters node parameters
 */
public record NormalizedUnit(
    String name,
    String roleHint,
    List<String> inputDatasets,
    List<String> outputDatasets,
    Schema schema,
    String transformationText,
    Map<String, String> parameters
) {
    public NormalizedUnit {
        Objects.requireNonNull(name, "name must not be null");
        inputDatasets = inputDatasets == null ? List.of() : List.copyOf(inputDatasets);
        outputDatasets = outputDatasets == null ? List.of() : List.copyOf(outputDatasets);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
