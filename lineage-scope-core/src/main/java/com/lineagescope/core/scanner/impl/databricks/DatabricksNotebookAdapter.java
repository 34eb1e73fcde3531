package com.lineagescope.core.scanner.impl.databricks;

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
import com.lineagescope.core.scanner.base.SparkCodePatterns;
import com.lineagescope.core.scanner.base.SqlPatterns;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Databricks notebooks: exported source files under a {@code notebooks/}
 * directory ({@code .py}, {@code .scala}, {@code .sql}) and Jupyter files
 * ({@code .ipynb}) anywhere.
 *
 * <p>Each notebook is its own {@link ProcessType#NOTEBOOK} process.
 * <ul>
 *   <li>Python and Scala notebooks become a single unit. Spark reader and writer calls
 *       and {@code %sql} cells supply its datasets.</li>
 *   <li>SQL notebooks become one unit per statement that touches a table, named
 *       {@code <notebook>_statement_<index>} with the zero-based statement index.</li>
 * </ul>
 * Widgets declared with {@code dbutils.widgets.*("name", "default")} become
 * {@code param.<name>} process parameters.
 */
public class DatabricksNotebookAdapter extends AbstractJacksonAdapter {

    public static final String ADAPTER_ID = "databricks-notebook";

    static final String NOTEBOOK_HINT = "notebook";
    static final String SQL_HINT = "sql";

    private static final Pattern COMMAND_SEPARATOR = Pattern.compile("(?m)^[ \\t]*(?:#|//|--)[ \\t]*COMMAND -{5,}[ \\t]*$");
    private static final Pattern MAGIC_PREFIX = Pattern.compile("(?m)^[ \\t]*(?:#|//)[ \\t]*MAGIC ?");
    private static final Pattern WIDGET = Pattern.compile(
        "dbutils\\.widgets\\.(?:text|dropdown|combobox|multiselect)\\(\\s*[\"'](\\w+)[\"']\\s*,\\s*[\"']([^\"']*)[\"']");

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Databricks Notebook Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.DATABRICKS;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(
            "**/notebooks/*.py", "**/notebooks/**/*.py",
            "**/notebooks/*.scala", "**/notebooks/**/*.scala",
            "**/notebooks/*.sql", "**/notebooks/**/*.sql",
            "**/*.ipynb"
        );
    }

    @Override
    public int getPriority() {
        return 60;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(
            NOTEBOOK_HINT, ComponentRole.TRANSFORM,
            SQL_HINT, ComponentRole.TRANSFORM
        );
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        String relativeName = context.relativeName(file);
        String extension = FileUtils.getExtension(file);
        String stem = FileUtils.getBaseName(file);
        List<String> warnings = new ArrayList<>();

        Map<String, String> parameters = new LinkedHashMap<>();
        List<NormalizedUnit> units;
        if ("ipynb".equals(extension)) {
            JsonNode notebook;
            try {
                notebook = parseJson(file);
            } catch (IOException e) {
                throw new AdapterException(file, "Malformed notebook JSON: " + e.getMessage(), e);
            }
            String language = jupyterLanguage(notebook);
            Cells cells = jupyterCells(notebook);
            parameters.put("language", language);
            addWidgets(parameters, cells.code());
            units = List.of(codeUnit(stem, cells, language, relativeName));
        } else if ("sql".equals(extension)) {
            parameters.put("language", "sql");
            units = statementUnits(stem, readFileContent(file));
        } else {
            String content = readFileContent(file);
            String language = "scala".equals(extension) ? "scala" : "python";
            Cells cells = sourceCells(content);
            parameters.put("language", language);
            addWidgets(parameters, cells.code());
            units = List.of(codeUnit(stem, cells, language, relativeName));
        }

        if (units.stream().allMatch(unit -> unit.inputDatasets().isEmpty() && unit.outputDatasets().isEmpty())) {
            warnings.add("No dataset references found in " + relativeName);
        }

        ScanUnit process = new ScanUnit(
            scanIdentifier(context, file),
            stem,
            SystemType.DATABRICKS,
            ProcessType.NOTEBOOK,
            parameters,
            relativeName,
            units,
            List.of()
        );
        log.debug("Notebook {} ({}): {} units", stem, parameters.get("language"), units.size());
        return result(List.of(process), warnings);
    }

    private NormalizedUnit codeUnit(String stem, Cells cells, String language, String relativeName) {
        SqlPatterns.TableReferences api = SparkCodePatterns.datasetReferences(cells.code());
        Set<String> reads = new LinkedHashSet<>(api.reads());
        Set<String> writes = new LinkedHashSet<>(api.writes());
        for (String sql : cells.sql()) {
            SqlPatterns.TableReferences tables = SqlPatterns.tableReferences(SqlPatterns.stripComments(sql));
            reads.addAll(tables.reads());
            writes.addAll(tables.writes());
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("notebook", relativeName);
        parameters.put("language", language);
        List<String> operations = SparkCodePatterns.operations(cells.code());
        if (!operations.isEmpty()) {
            parameters.put("operations", String.join(", ", operations));
        }
        if (!cells.sql().isEmpty()) {
            parameters.put("sql_cells", String.valueOf(cells.sql().size()));
        }

        return new NormalizedUnit(
            stem,
            NOTEBOOK_HINT,
            new ArrayList<>(reads),
            new ArrayList<>(writes),
            SparkCodePatterns.schema(cells.code()),
            cells.code(),
            parameters
        );
    }

    private List<NormalizedUnit> statementUnits(String stem, String content) {
        List<String> statements = SqlPatterns.splitStatements(SqlPatterns.stripComments(content));
        List<NormalizedUnit> units = new ArrayList<>();
        for (int index = 0; index < statements.size(); index++) {
            String statement = statements.get(index);
            SqlPatterns.TableReferences tables = SqlPatterns.tableReferences(statement);
            if (tables.isEmpty()) {
                continue;
            }
            Map<String, String> parameters = new LinkedHashMap<>();
            parameters.put("statement.index", String.valueOf(index));
            parameters.put("statement.type", SqlPatterns.statementType(statement));
            units.add(new NormalizedUnit(
                stem + "_statement_" + index,
                SQL_HINT,
                tables.reads(),
                tables.writes(),
                null,
                statement,
                parameters
            ));
        }
        return units;
    }

    /**
     * Splits an exported source notebook into code and {@code %sql} cells.
     *
     * @param content notebook source with {@code COMMAND ----------} separators
     * @return code cells joined in order, and the text of each SQL cell
     */
    static Cells sourceCells(String content) {
        StringBuilder code = new StringBuilder();
        List<String> sql = new ArrayList<>();
        for (String cell : COMMAND_SEPARATOR.split(content)) {
            String unmagic = MAGIC_PREFIX.matcher(cell).replaceAll("");
            if (cell.equals(unmagic)) {
                code.append(cell).append('\n');
                continue;
            }
            String body = unmagic.strip();
            if (body.startsWith("%sql")) {
                sql.add(body.substring("%sql".length()));
            }
        }
        return new Cells(code.toString(), sql);
    }

    private Cells jupyterCells(JsonNode notebook) {
        StringBuilder code = new StringBuilder();
        List<String> sql = new ArrayList<>();
        for (JsonNode cell : normalizeToArray(notebook.get("cells"))) {
            if (!"code".equals(cell.path("cell_type").asText())) {
                continue;
            }
            String source = cellSource(cell.get("source")).strip();
            if (source.startsWith("%sql")) {
                sql.add(source.substring("%sql".length()));
            } else if (!source.startsWith("%md")) {
                code.append(source.replaceFirst("^%(?:python|scala|pyspark)\\b", "")).append('\n');
            }
        }
        return new Cells(code.toString(), sql);
    }

    private static String cellSource(JsonNode source) {
        if (source == null || source.isNull()) {
            return "";
        }
        if (source.isTextual()) {
            return source.asText();
        }
        StringBuilder text = new StringBuilder();
        source.forEach(line -> text.append(line.asText()));
        return text.toString();
    }

    private static String jupyterLanguage(JsonNode notebook) {
        JsonNode metadata = notebook.path("metadata");
        String language = metadata.path("language_info").path("name").asText(null);
        if (language == null) {
            language = metadata.path("kernelspec").path("language").asText("python");
        }
        return language.toLowerCase(Locale.ROOT);
    }

    private static void addWidgets(Map<String, String> parameters, String code) {
        Matcher widget = WIDGET.matcher(code);
        while (widget.find()) {
            parameters.putIfAbsent("param." + widget.group(1), widget.group(2));
        }
    }

    /**
     * Notebook content split by cell language.
     *
     * @param code Python or Scala cells joined in order
     * @param sql text of each {@code %sql} cell
     */
    record Cells(String code, List<String> sql) {
    }
}
