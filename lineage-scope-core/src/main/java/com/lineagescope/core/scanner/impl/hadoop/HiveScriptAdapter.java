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
import com.lineagescope.core.scanner.base.SqlPatterns;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads HiveQL scripts.
 *
 * <p>Each script becomes one unit of the workflow its directory belongs to (see
 * {@link WorkflowLayout}), so a script under {@code daily/hive/} joins the process of
 * {@code daily/oozie/workflow.xml}. Tables after {@code FROM}/{@code JOIN} and
 * {@code LOAD DATA INPATH} locations are inputs; {@code INSERT} targets,
 * {@code CREATE TABLE} names and {@code LOAD DATA} targets are outputs. A table the
 * script both reads and writes is listed on both sides. The first
 * {@code CREATE TABLE} column list becomes the unit schema.
 */
public class HiveScriptAdapter extends AbstractRegexAdapter {

    public static final String ADAPTER_ID = "hive-script";

    static final String ROLE_HINT = "hive";

    private static final Pattern COLUMN = Pattern.compile(
        "^`?(\\w+)`?\\s+([\\w<>:,]+?)(?:\\s*\\(\\s*(\\d+)[^)]*\\))?(?:\\s+(.*))?$", Pattern.DOTALL);

    private static final Set<String> CONSTRAINT_KEYWORDS = Set.of("primary", "constraint", "foreign", "unique");

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Hive Script Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.HADOOP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*.hql", "**/hive/*.sql", "**/hive/**/*.sql");
    }

    @Override
    public int getPriority() {
        return 30;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(ROLE_HINT, ComponentRole.TRANSFORM);
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        String content = readFileContent(file);
        String sql = stripSqlComments(content);
        List<String> warnings = new ArrayList<>();

        SqlPatterns.TableReferences tables = SqlPatterns.tableReferences(sql);
        List<String> inputs = tables.reads();
        List<String> outputs = tables.writes();

        if (inputs.isEmpty() && outputs.isEmpty()) {
            warnings.add("No table references found in " + context.relativeName(file));
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("script", context.relativeName(file));

        NormalizedUnit unit = new NormalizedUnit(
            FileUtils.getBaseName(file),
            ROLE_HINT,
            inputs,
            outputs,
            extractSchema(sql),
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
        log.debug("Hive script {}: reads {}, writes {}", unit.name(), inputs, outputs);
        return result(List.of(workflow), warnings);
    }

    /**
     * Reads the column list of the first {@code CREATE TABLE} statement.
     *
     * @param sql script text without comments
     * @return schema, or null if the script defines no columns
     */
    Schema extractSchema(String sql) {
        Matcher create = findFirst(SqlPatterns.CREATE_TABLE, sql);
        if (create == null) {
            return null;
        }
        int open = create.end();
        while (open < sql.length() && Character.isWhitespace(sql.charAt(open))) {
            open++;
        }
        if (open >= sql.length() || sql.charAt(open) != '(') {
            return null;
        }

        List<Schema.Field> fields = new ArrayList<>();
        for (String column : splitColumns(sql, open)) {
            Schema.Field field = toField(column);
            if (field != null) {
                fields.add(field);
            }
        }
        return fields.isEmpty() ? null : new Schema(fields);
    }

    private static List<String> splitColumns(String sql, int open) {
        List<String> columns = new ArrayList<>();
        int depth = 0;
        int start = open + 1;
        for (int i = open; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '(' || c == '<') {
                depth++;
            } else if (c == ')' || c == '>') {
                depth--;
                if (depth == 0) {
                    columns.add(sql.substring(start, i));
                    return columns;
                }
            } else if (c == ',' && depth == 1) {
                columns.add(sql.substring(start, i));
                start = i + 1;
            }
        }
        // Unterminated column list
        return List.of();
    }

    private static Schema.Field toField(String column) {
        String trimmed = column.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        Matcher matcher = COLUMN.matcher(trimmed);
        if (!matcher.matches() || CONSTRAINT_KEYWORDS.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
            return null;
        }
        String modifiers = matcher.group(4) == null ? "" : matcher.group(4).toUpperCase(Locale.ROOT);
        Integer length = matcher.group(3) == null ? null : Integer.valueOf(matcher.group(3));
        return new Schema.Field(
            matcher.group(1),
            matcher.group(2).toLowerCase(Locale.ROOT),
            !modifiers.contains("NOT NULL"),
            length
        );
    }
}
