package com.lineagescope.core.scanner.impl.databricks;

import com.fasterxml.jackson.databind.JsonNode;
import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.scanner.AdapterException;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.base.AbstractJacksonAdapter;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads Azure Data Factory pipeline definitions, the JSON that orchestrates
 * Databricks notebooks.
 *
 * <p>Every activity of {@code properties.activities} becomes a unit whose role hint
 * is the activity type. Copy activities read their first input dataset and write their
 * first output dataset; Lookup activities read their first input. Databricks
 * activities keep the notebook path (or jar class, or Python file) and base parameters.
 * {@code dependsOn} entries become control connections. Activities nested in
 * {@code ForEach}, {@code Until} and {@code IfCondition} containers are units of the
 * same pipeline, started by their container.
 */
public class AdfPipelineAdapter extends AbstractJacksonAdapter {

    public static final String ADAPTER_ID = "adf-pipeline";

    private static final List<String> NESTED_ACTIVITY_FIELDS =
        List.of("activities", "ifTrueActivities", "ifFalseActivities");

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Azure Data Factory Pipeline Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.DATABRICKS;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/pipeline*.json", "**/pipeline/*.json", "**/pipelines/*.json");
    }

    @Override
    public int getPriority() {
        return 70;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(
            "Copy", ComponentRole.TRANSFORM,
            "DatabricksNotebook", ComponentRole.TRANSFORM,
            "DatabricksSparkJar", ComponentRole.TRANSFORM,
            "DatabricksSparkPython", ComponentRole.TRANSFORM,
            "SqlServerStoredProcedure", ComponentRole.TRANSFORM,
            "ExecutePipeline", ComponentRole.TRANSFORM
        );
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        JsonNode root;
        try {
            root = parseJson(file);
        } catch (IOException e) {
            throw new AdapterException(file, "Malformed pipeline JSON: " + e.getMessage(), e);
        }

        JsonNode properties = root.path("properties");
        JsonNode activities = properties.get("activities");
        if (activities == null || !activities.isArray() || activities.isEmpty()) {
            log.debug("{} has no activities, not a Data Factory pipeline", file);
            return result(List.of(), List.of("Not a Data Factory pipeline: no activities"));
        }

        List<NormalizedUnit> units = new ArrayList<>();
        List<ExplicitFlowTuple> connections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        collectActivities(activities, null, units, connections, warnings);

        String name = root.path("name").asText(FileUtils.getBaseName(file));
        ScanUnit pipeline = new ScanUnit(
            scanIdentifier(context, file),
            name,
            SystemType.DATABRICKS,
            ProcessType.PIPELINE,
            pipelineParameters(properties),
            context.relativeName(file),
            units,
            connections
        );
        log.debug("Pipeline {}: {} activities, {} dependencies", name, units.size(), connections.size());
        return result(List.of(pipeline), warnings);
    }

    private void collectActivities(
            JsonNode activities,
            String container,
            List<NormalizedUnit> units,
            List<ExplicitFlowTuple> connections,
            List<String> warnings) {

        for (JsonNode activity : activities) {
            String name = activity.path("name").asText(null);
            if (name == null || name.isBlank()) {
                warnings.add("Skipped activity without a name");
                continue;
            }
            units.add(activityUnit(name, activity));

            JsonNode dependsOn = activity.get("dependsOn");
            boolean hasDependencies = false;
            if (dependsOn != null) {
                for (JsonNode dependency : dependsOn) {
                    String upstream = dependency.path("activity").asText(null);
                    if (upstream != null) {
                        connections.add(new ExplicitFlowTuple(upstream, name, null, "control"));
                        hasDependencies = true;
                    }
                }
            }
            if (container != null && !hasDependencies) {
                connections.add(new ExplicitFlowTuple(container, name, null, "control"));
            }

            JsonNode typeProperties = activity.path("typeProperties");
            for (String field : NESTED_ACTIVITY_FIELDS) {
                JsonNode nested = typeProperties.get(field);
                if (nested != null && nested.isArray()) {
                    collectActivities(nested, name, units, connections, warnings);
                }
            }
        }
    }

    private NormalizedUnit activityUnit(String name, JsonNode activity) {
        String type = activity.path("type").asText("unknown");
        JsonNode typeProperties = activity.path("typeProperties");
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("activity.type", type);

        switch (type) {
            case "Copy" -> {
                addReference(inputs, activity.path("inputs"));
                addReference(outputs, activity.path("outputs"));
                putIfPresent(parameters, "source.type", typeProperties.path("source").path("type"));
                putIfPresent(parameters, "sink.type", typeProperties.path("sink").path("type"));
            }
            case "Lookup" -> addReference(inputs, activity.path("inputs"));
            case "DatabricksNotebook" -> {
                putIfPresent(parameters, "notebook_path", typeProperties.path("notebookPath"));
                addBaseParameters(parameters, typeProperties.path("baseParameters"));
            }
            case "DatabricksSparkJar" -> putIfPresent(parameters, "main_class", typeProperties.path("mainClassName"));
            case "DatabricksSparkPython" -> putIfPresent(parameters, "python_file", typeProperties.path("pythonFile"));
            case "SqlServerStoredProcedure" ->
                putIfPresent(parameters, "stored_procedure", typeProperties.path("storedProcedureName"));
            case "ExecutePipeline" ->
                putIfPresent(parameters, "pipeline", typeProperties.path("pipeline").path("referenceName"));
            default -> log.trace("Activity {} of type {} carries no datasets", name, type);
        }
        putIfPresent(parameters, "linked_service", activity.path("linkedServiceName").path("referenceName"));

        return new NormalizedUnit(name, type, inputs, outputs, null, activity.toString(), parameters);
    }

    private Map<String, String> pipelineParameters(JsonNode properties) {
        Map<String, String> parameters = new LinkedHashMap<>();
        putIfPresent(parameters, "description", properties.path("description"));
        JsonNode annotations = properties.get("annotations");
        if (annotations != null && annotations.isArray() && !annotations.isEmpty()) {
            List<String> values = new ArrayList<>();
            annotations.forEach(annotation -> values.add(annotation.asText()));
            parameters.put("annotations", String.join(", ", values));
        }
        properties.path("parameters").fields().forEachRemaining(entry -> {
            JsonNode defaultValue = entry.getValue().get("defaultValue");
            if (defaultValue != null && !defaultValue.isNull()) {
                parameters.put("param." + entry.getKey(),
                    defaultValue.isValueNode() ? defaultValue.asText() : defaultValue.toString());
            }
        });
        return parameters;
    }

    private static void addReference(List<String> datasets, JsonNode references) {
        String reference = references.path(0).path("referenceName").asText("");
        if (!reference.isBlank()) {
            datasets.add(reference);
        }
    }

    private static void addBaseParameters(Map<String, String> parameters, JsonNode baseParameters) {
        baseParameters.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            // Expressions are objects: {"value": "@pipeline().parameters.runDate", "type": "Expression"}
            String text = value.isValueNode() ? value.asText() : value.path("value").asText(value.toString());
            parameters.put("param." + entry.getKey(), text);
        });
    }

    private static void putIfPresent(Map<String, String> parameters, String key, JsonNode value) {
        if (value != null && value.isValueNode() && !value.asText().isBlank()) {
            parameters.put(key, value.asText());
        }
    }
}
