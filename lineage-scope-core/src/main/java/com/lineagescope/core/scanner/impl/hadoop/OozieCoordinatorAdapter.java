package com.lineagescope.core.scanner.impl.hadoop;

import com.fasterxml.jackson.databind.JsonNode;
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
 * Reads Oozie coordinator definitions ({@code coordinator.xml}).
 *
 * <p>A coordinator becomes its own {@link ProcessType#COORDINATOR} process. Its
 * schedule ({@code frequency}, {@code start}, {@code end}, {@code timezone}) and the
 * workflow {@code app-path} become process parameters. The scheduled workflow becomes
 * one unit whose inputs and outputs are the URI templates of the datasets named by
 * {@code <data-in>} and {@code <data-out>} events, so dataset matching connects the
 * coordinator to the jobs producing and consuming those locations.
 */
public class OozieCoordinatorAdapter extends AbstractJacksonAdapter {

    public static final String ADAPTER_ID = "oozie-coordinator";

    static final String ROLE_HINT = "workflow";

    private static final List<String> SCHEDULE_ATTRIBUTES = List.of("frequency", "start", "end", "timezone");

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Oozie Coordinator Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.HADOOP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*coordinator*.xml");
    }

    @Override
    public int getPriority() {
        return 15;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(ROLE_HINT, ComponentRole.TRANSFORM);
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        JsonNode root;
        try {
            root = parseXml(file);
        } catch (IOException e) {
            throw new AdapterException(file, "Malformed coordinator XML: " + e.getMessage(), e);
        }

        JsonNode workflow = root.path("action").get("workflow");
        if (workflow == null && extractAttribute(root, "frequency") == null) {
            log.debug("{} has no frequency or workflow action, not an Oozie coordinator", file);
            return result(List.of(), List.of("Not an Oozie coordinator: no frequency or workflow action"));
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        for (String attribute : SCHEDULE_ATTRIBUTES) {
            String value = extractAttribute(root, attribute);
            if (value != null) {
                parameters.put(attribute, value);
            }
        }
        String appPath = extractText(workflow, "app-path");
        if (appPath != null) {
            parameters.put("app-path", appPath);
        }
        if (workflow != null) {
            for (JsonNode property : normalizeToArray(workflow.path("configuration").get("property"))) {
                String name = extractText(property, "name");
                String value = extractText(property, "value");
                if (name != null && value != null) {
                    parameters.put(name, value);
                }
            }
        }

        Map<String, String> uriTemplates = datasetTemplates(root.path("datasets").get("dataset"));
        List<String> warnings = new ArrayList<>();
        List<String> inputs = eventLocations(root.path("input-events").get("data-in"), uriTemplates, warnings);
        List<String> outputs = eventLocations(root.path("output-events").get("data-out"), uriTemplates, warnings);

        List<NormalizedUnit> units = new ArrayList<>();
        if (workflow != null) {
            units.add(new NormalizedUnit(
                workflowName(appPath),
                ROLE_HINT,
                inputs,
                outputs,
                null,
                appPath,
                appPath != null ? Map.of("app-path", appPath) : Map.of()
            ));
        }

        String name = extractAttribute(root, "name");
        ScanUnit coordinator = new ScanUnit(
            scanIdentifier(context, file),
            name != null ? name : FileUtils.getBaseName(file),
            SystemType.HADOOP,
            ProcessType.COORDINATOR,
            parameters,
            context.relativeName(file),
            units,
            List.of()
        );
        log.debug("Coordinator {}: every {}, reads {}, writes {}",
            coordinator.name(), parameters.get("frequency"), inputs, outputs);
        return result(List.of(coordinator), warnings);
    }

    private Map<String, String> datasetTemplates(JsonNode datasets) {
        Map<String, String> templates = new LinkedHashMap<>();
        for (JsonNode dataset : normalizeToArray(datasets)) {
            String name = extractAttribute(dataset, "name");
            String template = extractText(dataset, "uri-template");
            if (name != null) {
                templates.put(name, template != null ? template : name);
            }
        }
        return templates;
    }

    private List<String> eventLocations(JsonNode events, Map<String, String> uriTemplates, List<String> warnings) {
        List<String> locations = new ArrayList<>();
        for (JsonNode event : normalizeToArray(events)) {
            String dataset = extractAttribute(event, "dataset");
            if (dataset == null) {
                continue;
            }
            if (!uriTemplates.containsKey(dataset)) {
                warnings.add("Event '" + extractAttribute(event, "name") + "' references undeclared dataset '"
                    + dataset + "'");
            }
            String location = uriTemplates.getOrDefault(dataset, dataset);
            if (!locations.contains(location)) {
                locations.add(location);
            }
        }
        return locations;
    }

    /**
     * Names the scheduled workflow after the last literal segment of its app path.
     *
     * @param appPath e.g. {@code ${nameNode}/apps/daily_orders/workflow.xml}
     * @return e.g. {@code daily_orders}, or {@code workflow} if the path has no literal segment
     */
    static String workflowName(String appPath) {
        if (appPath == null) {
            return ROLE_HINT;
        }
        String[] segments = appPath.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i].trim();
            if (!segment.isEmpty() && !segment.endsWith(".xml") && !segment.contains("${")) {
                return segment;
            }
        }
        return ROLE_HINT;
    }
}
