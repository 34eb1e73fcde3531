package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.Schema;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.base.AbstractRegexAdapter;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Pig Latin scripts.
 *
 * <p>{@code LOAD 'path'} locations are inputs and {@code STORE alias INTO 'path'}
 * locations are outputs. The {@code AS (name:type, ...)} clause of the first
 * {@code LOAD} that has one becomes the unit schema. {@code %default} and
 * {@code %declare} values are kept as {@code param.<name>} parameters; paths keep their
 * {@code $NAME} references. The script joins its workflow's process like Hive and
 * Spark jobs do.
 */
public class PigScriptAdapter extends AbstractRegexAdapter {

    public static final String ADAPTER_ID = "pig-script";

    static final String ROLE_HINT = "pig";

    private static final Pattern LOAD = Pattern.compile(
        "\\bLOAD\\s+(['\"])([^'\"]+)\\1([^;]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STORE = Pattern.compile(
        "\\bSTORE\\s+\\w+\\s+INTO\\s+(['\"])([^'\"]+)\\1", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOAD_SCHEMA = Pattern.compile("\\bAS\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARAMETER = Pattern.compile(
        "^\\s*%(?:default|declare)\\s+(\\w+)\\s+(['\"]?)(.*?)\\2\\s*;?\\s*$",
        Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern QUOTED = Pattern.compile("'[^']*'");
    private static final Pattern OPERATION = Pattern.compile(
        "\\b(FILTER|FOREACH|GROUP|COGROUP|JOIN|UNION|DISTINCT|ORDER|LIMIT)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Pig Script Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.HADOOP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*.pig");
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(ROLE_HINT, ComponentRole.TRANSFORM);
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        String content = readFileContent(file);
        String script = stripSqlComments(content);
        String relativeName = context.relativeName(file);
        List<String> warnings = new ArrayList<>();

        Set<String> inputs = new LinkedHashSet<>();
        Schema schema = null;
        for (MatchResult load : findMatches(LOAD, script)) {
            inputs.add(load.group(2));
            if (schema == null) {
                schema = loadSchema(load.group(3));
            }
        }
        Set<String> outputs = new LinkedHashSet<>();
        for (MatchResult store : findMatches(STORE, script)) {
            outputs.add(store.group(2));
        }
        if (inputs.isEmpty() && outputs.isEmpty()) {
            warnings.add("No LOAD or STORE locations found in " + relativeName);
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("script", relativeName);
        for (MatchResult parameter : findMatches(PARAMETER, script)) {
            parameters.put("param." + parameter.group(1), parameter.group(3).trim());
        }
        Set<String> operations = new LinkedHashSet<>();
        for (MatchResult operation : findMatches(OPERATION, QUOTED.matcher(script).replaceAll("''"))) {
            operations.add(operation.group(1).toUpperCase(Locale.ROOT));
        }
        if (!operations.isEmpty()) {
            parameters.put("operations", String.join(", ", operations));
        }

        NormalizedUnit unit = new NormalizedUnit(
            FileUtils.getBaseName(file),
            ROLE_HINT,
            new ArrayList<>(inputs),
            new ArrayList<>(outputs),
            schema,
            content,
            parameters
        );

        ScanUnit workflow = new ScanUnit(
            WorkflowLayout.scanIdentifier(file, context),
            WorkflowLayout.workflowName(file, context),
            SystemType.HADOOP,
            ProcessType.WORKFLOW,
            Map.of(),
            WorkflowLayout.relativeDirectory(file, context),
            List.of(unit),
            List.of()
        );
        log.debug("Pig script {}: loads {}, stores {}", unit.name(), inputs, outputs);
        return result(List.of(workflow), warnings);
    }

    /**
     * Reads {@code AS (id:long, name:chararray, tags:bag{t:(tag:chararray)})} after a
     * {@code LOAD}.
     *
     * @param loadTail text between the load location and the end of the statement
     * @return schema, or null if the statement declares none
     */
    static Schema loadSchema(String loadTail) {
        Matcher as = LOAD_SCHEMA.matcher(loadTail);
        if (!as.find()) {
            return null;
        }
        List<Schema.Field> fields = new ArrayList<>();
        for (String column : splitTopLevel(loadTail, as.end())) {
            String trimmed = column.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            String name = colon > 0 ? trimmed.substring(0, colon).trim() : trimmed;
            String type = colon > 0 ? trimmed.substring(colon + 1).trim().toLowerCase(Locale.ROOT) : "bytearray";
            fields.add(new Schema.Field(name, type, true, null));
        }
        return fields.isEmpty() ? null : new Schema(fields);
    }

    private static List<String> splitTopLevel(String text, int from) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '{' || c == '[') {
                depth++;
            } else if (c == ')' || c == '}' || c == ']') {
                if (depth == 0) {
                    parts.add(text.substring(start, i));
                    return parts;
                }
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        return List.of();
    }
}
