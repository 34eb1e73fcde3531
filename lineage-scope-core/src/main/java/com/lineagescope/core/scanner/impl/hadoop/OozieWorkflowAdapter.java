package com.lineagescope.core.scanner.impl.hadoop;

import com.fasterxml.jackson.databind.JsonNode;
import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.FlowType;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.scanner.AdapterException;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.base.AbstractJacksonAdapter;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Reads Oozie workflow definitions ({@code workflow.xml}).
 *
 * <p>Every {@code <action>} becomes a unit whose role hint is the action type
 * ({@code hive}, {@code spark}, {@code shell}, ...). Datasets come from
 * {@code <param>}, {@code <argument>}/{@code <arg>} and configuration properties
 * whose key names an input or an output, e.g. {@code INPUT_TABLE=staging.orders} or
 * {@code --output /data/orders}.
 *
 * <p>The {@code ok} transitions are followed through fork, join and decision nodes;
 * each action-to-action hop becomes a {@link FlowType#CONTROL} connection. Error
 * transitions are ignored. Units are listed in transition order from {@code start},
 * followed by unreachable actions.
 *
 * <p>A {@code job.properties} file next to the workflow, or in its workflow
 * directory, supplies the process parameters.
 */
public class OozieWorkflowAdapter extends AbstractJacksonAdapter {

    public static final String ADAPTER_ID = "oozie-workflow";

    static final String JOB_PROPERTIES = "job.properties";

    private static final Set<String> ACTION_CONTROL_FIELDS = Set.of("name", "ok", "error", "retry-max", "retry-interval", "cred");
    private static final Set<String> DESCRIPTOR_FIELDS = Set.of("script", "exec", "main-class", "class", "jar", "name", "master", "mode");

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Oozie Workflow Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.HADOOP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*workflow*.xml");
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.ofEntries(
            Map.entry("hive", ComponentRole.TRANSFORM),
            Map.entry("hive2", ComponentRole.TRANSFORM),
            Map.entry("pig", ComponentRole.TRANSFORM),
            Map.entry("spark", ComponentRole.TRANSFORM),
            Map.entry("shell", ComponentRole.TRANSFORM),
            Map.entry("java", ComponentRole.TRANSFORM),
            Map.entry("map-reduce", ComponentRole.TRANSFORM),
            Map.entry("streaming", ComponentRole.TRANSFORM),
            Map.entry("sqoop", ComponentRole.TRANSFORM),
            Map.entry("distcp", ComponentRole.TRANSFORM)
        );
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        JsonNode root;
        try {
            root = parseXml(file);
        } catch (IOException e) {
            throw new AdapterException(file, "Malformed workflow XML: " + e.getMessage(), e);
        }

        Map<String, JsonNode> actions = indexByName(root.get("action"));
        if (actions.isEmpty() && root.get("start") == null) {
            log.debug("{} has no start node or actions, not an Oozie workflow", file);
            return result(List.of(), List.of("Not an Oozie workflow: no start node or actions"));
        }

        Graph graph = new Graph(actions, indexByName(root.get("fork")), indexByName(root.get("join")),
            indexByName(root.get("decision")));
        List<String> warnings = new ArrayList<>();

        List<NormalizedUnit> units = new ArrayList<>();
        for (String actionName : graph.actionOrder(extractAttribute(root.get("start"), "to"))) {
            units.add(toUnit(actionName, actions.get(actionName), warnings));
        }

        List<ExplicitFlowTuple> transitions = new ArrayList<>();
        for (Map.Entry<String, JsonNode> action : actions.entrySet()) {
            String okTarget = extractAttribute(action.getValue().get("ok"), "to");
            for (String next : graph.reachableActions(okTarget)) {
                transitions.add(new ExplicitFlowTuple(action.getKey(), next, null, FlowType.CONTROL.name()));
            }
        }

        Map<String, String> parameters = new LinkedHashMap<>(readJobProperties(file));
        String workflowName = extractAttribute(root, "name");
        if (workflowName != null) {
            parameters.put("workflow.name", workflowName);
        }

        ScanUnit workflow = new ScanUnit(
            WorkflowLayout.scanIdentifier(file, context),
            WorkflowLayout.workflowName(file, context),
            SystemType.HADOOP,
            ProcessType.WORKFLOW,
            parameters,
            WorkflowLayout.relativeDirectory(file, context),
            units,
            transitions
        );
        log.debug("Workflow {}: {} actions, {} transitions", workflow.name(), units.size(), transitions.size());
        return result(List.of(workflow), warnings);
    }

    // ==================== Actions ====================

    private NormalizedUnit toUnit(String actionName, JsonNode action, List<String> warnings) {
        String type = actionType(action);
        if (type == null) {
            warnings.add("Action '" + actionName + "' has no action body");
        }
        JsonNode body = type != null ? action.get(type) : null;

        Map<String, String> parameters = new LinkedHashMap<>();
        Set<String> inputs = new LinkedHashSet<>();
        Set<String> outputs = new LinkedHashSet<>();
        if (type != null) {
            parameters.put("action.type", type);
        }

        if (body != null && body.isObject()) {
            for (String field : DESCRIPTOR_FIELDS) {
                String value = extractText(body, field);
                if (value != null && !value.isEmpty()) {
                    parameters.put(field, value);
                }
            }
            for (String param : extractTexts(body, "param")) {
                addKeyValue(param, "param.", parameters, inputs, outputs);
            }
            for (JsonNode property : normalizeToArray(body.path("configuration").get("property"))) {
                String name = extractText(property, "name");
                String value = extractText(property, "value");
                if (name != null && value != null) {
                    parameters.put(name, value);
                    classify(name, value, inputs, outputs);
                }
            }
            List<String> arguments = new ArrayList<>(extractTexts(body, "argument"));
            arguments.addAll(extractTexts(body, "arg"));
            readArguments(arguments, parameters, inputs, outputs);
        }

        return new NormalizedUnit(
            actionName,
            type,
            new ArrayList<>(inputs),
            new ArrayList<>(outputs),
            null,
            describe(type, parameters),
            parameters
        );
    }

    private String actionType(JsonNode action) {
        Iterator<String> fields = action.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!ACTION_CONTROL_FIELDS.contains(field)) {
                return field;
            }
        }
        return null;
    }

    private static void readArguments(List<String> arguments, Map<String, String> parameters,
                                      Set<String> inputs, Set<String> outputs) {
        if (!arguments.isEmpty()) {
            parameters.put("arguments", String.join(" ", arguments));
        }
        for (int i = 0; i < arguments.size(); i++) {
            String argument = arguments.get(i);
            if (argument.contains("=")) {
                addKeyValue(argument, "arg.", parameters, inputs, outputs);
            } else if (argument.startsWith("-") && i + 1 < arguments.size() && !arguments.get(i + 1).startsWith("-")) {
                if (classify(argument, arguments.get(i + 1), inputs, outputs)) {
                    i++;
                }
            }
        }
    }

    private static void addKeyValue(String entry, String prefix, Map<String, String> parameters,
                                    Set<String> inputs, Set<String> outputs) {
        int equals = entry.indexOf('=');
        if (equals <= 0) {
            return;
        }
        String key = entry.substring(0, equals).trim();
        String value = entry.substring(equals + 1).trim();
        parameters.put(prefix + key.replaceFirst("^-+", ""), value);
        classify(key, value, inputs, outputs);
    }

    /**
     * Adds the value to the inputs or outputs if the key names one.
     *
     * @return true if the key named an input or an output
     */
    static boolean classify(String key, String value, Set<String> inputs, Set<String> outputs) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String normalized = key.replaceFirst("^-+", "").toLowerCase(Locale.ROOT);
        List<String> tokens = List.of(normalized.split("[^a-z0-9]+"));
        if (normalized.contains("input") || normalized.contains("source") || tokens.contains("src") || tokens.contains("in")) {
            inputs.add(value.trim());
            return true;
        }
        if (normalized.contains("output") || normalized.contains("target") || tokens.contains("dest") || tokens.contains("out")) {
            outputs.add(value.trim());
            return true;
        }
        return false;
    }

    private static String describe(String type, Map<String, String> parameters) {
        if (type == null) {
            return null;
        }
        for (String field : List.of("script", "exec", "main-class", "class", "jar")) {
            if (parameters.containsKey(field)) {
                return type + ": " + parameters.get(field);
            }
        }
        return type;
    }

    // ==================== Structure ====================

    private Map<String, JsonNode> indexByName(JsonNode nodes) {
        Map<String, JsonNode> byName = new LinkedHashMap<>();
        for (JsonNode node : normalizeToArray(nodes)) {
            String name = extractAttribute(node, "name");
            if (name != null) {
                byName.putIfAbsent(name, node);
            }
        }
        return byName;
    }

    private Map<String, String> readJobProperties(Path workflowFile) throws IOException {
        Path beside = workflowFile.toAbsolutePath().getParent().resolve(JOB_PROPERTIES);
        Path inWorkflow = WorkflowLayout.workflowDirectory(workflowFile).resolve(JOB_PROPERTIES);
        Path source = Files.isRegularFile(beside) ? beside : Files.isRegularFile(inWorkflow) ? inWorkflow : null;
        if (source == null) {
            return Map.of();
        }

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(source)) {
            properties.load(reader);
        }
        Map<String, String> values = new LinkedHashMap<>();
        properties.stringPropertyNames().stream().sorted()
            .forEach(key -> values.put(key, properties.getProperty(key).trim()));
        return values;
    }

    /**
     * Control nodes of one workflow, used to follow transitions.
     */
    private final class Graph {
        private final Map<String, JsonNode> actions;
        private final Map<String, JsonNode> forks;
        private final Map<String, JsonNode> joins;
        private final Map<String, JsonNode> decisions;

        Graph(Map<String, JsonNode> actions, Map<String, JsonNode> forks,
              Map<String, JsonNode> joins, Map<String, JsonNode> decisions) {
            this.actions = actions;
            this.forks = forks;
            this.joins = joins;
            this.decisions = decisions;
        }

        /**
         * Returns the actions first reached from a node, looking through control nodes.
         */
        List<String> reachableActions(String node) {
            List<String> reached = new ArrayList<>();
            collect(node, reached, new HashSet<>());
            return reached;
        }

        private void collect(String node, List<String> reached, Set<String> visited) {
            if (node == null || !visited.add(node)) {
                return;
            }
            if (actions.containsKey(node)) {
                if (!reached.contains(node)) {
                    reached.add(node);
                }
            } else if (forks.containsKey(node)) {
                for (JsonNode path : normalizeToArray(forks.get(node).get("path"))) {
                    collect(extractAttribute(path, "start"), reached, visited);
                }
            } else if (joins.containsKey(node)) {
                collect(extractAttribute(joins.get(node), "to"), reached, visited);
            } else if (decisions.containsKey(node)) {
                JsonNode decisionSwitch = decisions.get(node).get("switch");
                for (JsonNode branch : normalizeToArray(decisionSwitch != null ? decisionSwitch.get("case") : null)) {
                    collect(extractAttribute(branch, "to"), reached, visited);
                }
                collect(extractAttribute(decisionSwitch != null ? decisionSwitch.get("default") : null, "to"),
                    reached, visited);
            }
        }

        /**
         * Orders actions breadth-first along ok transitions from the start node, then
         * appends actions that are never reached.
         */
        List<String> actionOrder(String start) {
            Set<String> ordered = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>(reachableActions(start));
            while (!queue.isEmpty()) {
                String action = queue.poll();
                if (ordered.add(action)) {
                    queue.addAll(reachableActions(extractAttribute(actions.get(action).get("ok"), "to")));
                }
            }
            ordered.addAll(actions.keySet());
            return new ArrayList<>(ordered);
        }
    }
}
