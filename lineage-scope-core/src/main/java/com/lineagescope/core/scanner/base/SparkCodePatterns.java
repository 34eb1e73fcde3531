package com.lineagescope.core.scanner.base;

import com.lineagescope.core.model.Schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared patterns for Spark jobs written against the DataFrame API, in PySpark or Scala.
 *
 * <p>Dataset references are string literals passed to reader and writer calls:
 * <ul>
 *   <li>{@code load}, {@code table} and {@code spark.table} read</li>
 *   <li>{@code save}, {@code saveAsTable}, {@code insertInto} and {@code toTable} write</li>
 *   <li>format shortcuts ({@code parquet}, {@code csv}, ...) take the direction of the
 *       closest preceding {@code read}/{@code readStream} or {@code write}/{@code writeStream}</li>
 *   <li>SQL passed to {@code spark.sql(...)} is read with {@link SqlPatterns}</li>
 * </ul>
 */
public final class SparkCodePatterns {

    // dbutils.widgets.text(...) declares a notebook parameter, not a text source
    private static final Pattern IO_CALL = Pattern.compile(
        "(?<!widgets)\\.\\s*(parquet|csv|json|orc|text|avro|load|table|save|saveAsTable|insertInto|toTable)"
            + "\\(\\s*[rfb]?[\"']([^\"']+)[\"']");
    private static final Pattern DIRECTION = Pattern.compile("\\.\\s*(readStream|read|writeStream|write)\\b");
    private static final Pattern SQL_CALL = Pattern.compile(
        "\\.sql\\(\\s*[rf]?(\"\"\"|'''|\"|')(.*?)\\1", Pattern.DOTALL);
    private static final Pattern OPERATION = Pattern.compile(
        "\\.(filter|where|select|withColumn|join|groupBy|agg|orderBy|union|unionByName|distinct|dropDuplicates)\\(");
    private static final Pattern STRUCT_FIELD = Pattern.compile(
        "StructField\\(\\s*[\"'](\\w+)[\"']\\s*,\\s*(\\w+)(?:\\(([^)]*)\\))?\\s*(?:,\\s*(True|False|true|false))?");

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");

    private static final Set<String> READ_CALLS = Set.of("load", "table");
    private static final Set<String> WRITE_CALLS = Set.of("save", "saveAsTable", "insertInto", "toTable");

    private SparkCodePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Collects the datasets a Spark job reads and writes.
     *
     * @param code job source
     * @return references in first-seen order, API calls before embedded SQL
     */
    public static SqlPatterns.TableReferences datasetReferences(String code) {
        Set<String> reads = new LinkedHashSet<>();
        Set<String> writes = new LinkedHashSet<>();

        List<Direction> directions = new ArrayList<>();
        Matcher direction = DIRECTION.matcher(code);
        while (direction.find()) {
            directions.add(new Direction(direction.start(), direction.group(1).startsWith("write")));
        }

        Matcher call = IO_CALL.matcher(code);
        while (call.find()) {
            String method = call.group(1);
            String dataset = call.group(2);
            if (WRITE_CALLS.contains(method)) {
                writes.add(dataset);
            } else if (READ_CALLS.contains(method) || !isWrite(directions, call.start())) {
                reads.add(dataset);
            } else {
                writes.add(dataset);
            }
        }

        for (String sql : embeddedSql(code)) {
            SqlPatterns.TableReferences tables = SqlPatterns.tableReferences(SqlPatterns.stripComments(sql));
            reads.addAll(tables.reads());
            writes.addAll(tables.writes());
        }
        return new SqlPatterns.TableReferences(new ArrayList<>(reads), new ArrayList<>(writes));
    }

    /**
     * Returns the SQL text of every {@code .sql(...)} call with a literal argument.
     *
     * @param code job source
     * @return SQL strings in source order
     */
    public static List<String> embeddedSql(String code) {
        List<String> statements = new ArrayList<>();
        Matcher matcher = SQL_CALL.matcher(code);
        while (matcher.find()) {
            statements.add(matcher.group(2));
        }
        return statements;
    }

    /**
     * Lists the DataFrame operations a job uses, each once.
     *
     * @param code job source
     * @return operation names in first-use order
     */
    public static List<String> operations(String code) {
        Set<String> operations = new LinkedHashSet<>();
        Matcher matcher = OPERATION.matcher(code);
        while (matcher.find()) {
            operations.add(matcher.group(1).equals("where") ? "filter" : matcher.group(1));
        }
        return new ArrayList<>(operations);
    }

    /**
     * Reads the fields of the first {@code StructType} in the source.
     *
     * <p>{@code StructField("amount", DecimalType(12, 2), False)} becomes a
     * non-nullable {@code decimal} field with precision 12.
     *
     * @param code job source
     * @return schema, or null if the job declares none
     */
    public static Schema schema(String code) {
        int start = code.indexOf("StructType(");
        if (start < 0) {
            return null;
        }
        String struct = code.substring(start, closingParen(code, start + "StructType".length()));

        List<Schema.Field> fields = new ArrayList<>();
        Matcher matcher = STRUCT_FIELD.matcher(struct);
        while (matcher.find()) {
            String type = matcher.group(2).replaceFirst("Type$", "").toLowerCase(Locale.ROOT);
            fields.add(new Schema.Field(matcher.group(1), type, !"false".equalsIgnoreCase(matcher.group(4)),
                leadingNumber(matcher.group(3))));
        }
        return fields.isEmpty() ? null : new Schema(fields);
    }

    private static boolean isWrite(List<Direction> directions, int position) {
        Direction closest = null;
        for (Direction direction : directions) {
            if (direction.position() >= position) {
                break;
            }
            closest = direction;
        }
        return closest != null && closest.write();
    }

    private static int closingParen(String code, int open) {
        int depth = 0;
        for (int i = open; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i + 1;
            }
        }
        return code.length();
    }

    private static Integer leadingNumber(String arguments) {
        if (arguments == null) {
            return null;
        }
        Matcher digits = LEADING_NUMBER.matcher(arguments);
        return digits.find() ? Integer.valueOf(digits.group(1)) : null;
    }

    private record Direction(int position, boolean write) {
    }
}
