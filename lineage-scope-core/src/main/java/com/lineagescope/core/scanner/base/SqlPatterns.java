package com.lineagescope.core.scanner.base;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared SQL patterns for the adapters that read HiveQL, Spark SQL and notebook SQL.
 *
 * <p>Tables after {@code FROM}/{@code JOIN}, {@code MERGE} sources and
 * {@code LOAD DATA INPATH} locations are reads. {@code INSERT} and {@code MERGE INTO} targets, {@code CREATE TABLE} names and
 * {@code LOAD DATA} targets are writes. CTE names and a few keywords that can follow {@code FROM} are
 * never tables. A table that is both read and written appears on both sides.
 *
 * <pre>{@code
 * SqlPatterns.TableReferences tables = SqlPatterns.tableReferences(SqlPatterns.stripComments(sql));
 * }</pre>
 */
public final class SqlPatterns {

    private static final String TABLE = "([\\w.$\\{\\}:`]+)";

    public static final Pattern CREATE_TABLE = Pattern.compile(
        "\\bCREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:TEMPORARY\\s+)?(?:EXTERNAL\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?"
            + TABLE,
        Pattern.CASE_INSENSITIVE);

    private static final Pattern READ_TABLE = Pattern.compile(
        "\\b(?:FROM|JOIN)\\s+" + TABLE, Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERT_TABLE = Pattern.compile(
        "\\bINSERT\\s+(?:OVERWRITE|INTO)\\s+(?:TABLE\\s+)?" + TABLE, Pattern.CASE_INSENSITIVE);
    private static final Pattern MERGE_TABLE = Pattern.compile(
        "\\bMERGE\\s+INTO\\s+" + TABLE, Pattern.CASE_INSENSITIVE);
    private static final Pattern MERGE_SOURCE = Pattern.compile(
        "\\bMERGE\\s+INTO\\s+" + TABLE + "(?:\\s+(?:AS\\s+)?(?!USING\\b)\\w+)?\\s+USING\\s+" + TABLE,
        Pattern.CASE_INSENSITIVE);
    private static final Pattern LOAD_DATA = Pattern.compile(
        "\\bLOAD\\s+DATA\\s+(?:LOCAL\\s+)?INPATH\\s+'([^']+)'\\s+(?:OVERWRITE\\s+)?INTO\\s+TABLE\\s+" + TABLE,
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CTE_NAME = Pattern.compile(
        "(?:\\bWITH|,)\\s*(\\w+)\\s+AS\\s*\\(", Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");

    private static final Set<String> NOT_TABLES = Set.of("select", "values", "unnest", "lateral", "table");

    private SqlPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Tables and locations a piece of SQL reads and writes, in first-seen order.
     *
     * @param reads tables and paths read
     * @param writes tables written
     */
    public record TableReferences(List<String> reads, List<String> writes) {
        public TableReferences {
            reads = List.copyOf(reads);
            writes = List.copyOf(writes);
        }

        public boolean isEmpty() {
            return reads.isEmpty() && writes.isEmpty();
        }
    }

    /**
     * Collects the tables a statement or script reads and writes.
     *
     * @param sql SQL text without comments
     * @return table references
     */
    public static TableReferences tableReferences(String sql) {
        Set<String> writes = new LinkedHashSet<>();
        Set<String> reads = new LinkedHashSet<>();

        Matcher load = LOAD_DATA.matcher(sql);
        while (load.find()) {
            reads.add(load.group(1));
            writes.add(tableName(load.group(2)));
        }
        Matcher insert = INSERT_TABLE.matcher(sql);
        while (insert.find()) {
            writes.add(tableName(insert.group(1)));
        }
        Matcher merge = MERGE_TABLE.matcher(sql);
        while (merge.find()) {
            writes.add(tableName(merge.group(1)));
        }
        Matcher create = CREATE_TABLE.matcher(sql);
        while (create.find()) {
            writes.add(tableName(create.group(1)));
        }

        Set<String> cteNames = new LinkedHashSet<>();
        Matcher cte = CTE_NAME.matcher(sql);
        while (cte.find()) {
            cteNames.add(cte.group(1).toLowerCase(Locale.ROOT));
        }
        Matcher read = READ_TABLE.matcher(sql);
        while (read.find()) {
            String table = tableName(read.group(1));
            String lower = table.toLowerCase(Locale.ROOT);
            if (!table.isEmpty() && !NOT_TABLES.contains(lower) && !cteNames.contains(lower)) {
                reads.add(table);
            }
        }
        Matcher mergeSource = MERGE_SOURCE.matcher(sql);
        while (mergeSource.find()) {
            reads.add(tableName(mergeSource.group(2)));
        }
        return new TableReferences(new ArrayList<>(reads), new ArrayList<>(writes));
    }

    /**
     * Removes SQL block and line comments.
     *
     * @param sql SQL text, may be null
     * @return text without comments
     */
    public static String stripComments(String sql) {
        if (sql == null) {
            return "";
        }
        String withoutBlocks = BLOCK_COMMENT.matcher(sql).replaceAll(" ");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }

    /**
     * Splits a comment-free script on {@code ;} into trimmed, non-blank statements.
     *
     * <p>Semicolons inside single-quoted literals do not split.
     *
     * @param sql SQL text without comments
     * @return statements in script order
     */
    public static List<String> splitStatements(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ';' && !quoted) {
                addStatement(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    /**
     * Names the kind of a statement by its leading keyword.
     *
     * @param statement one SQL statement
     * @return {@code create_table}, {@code insert}, {@code merge}, {@code select} or the
     *         lowercased first keyword
     */
    public static String statementType(String statement) {
        String upper = statement.trim().toUpperCase(Locale.ROOT);
        if (CREATE_TABLE.matcher(upper).lookingAt()) {
            return "create_table";
        }
        if (upper.startsWith("INSERT")) {
            return "insert";
        }
        if (upper.startsWith("MERGE")) {
            return "merge";
        }
        if (upper.startsWith("SELECT") || upper.startsWith("WITH")) {
            return "select";
        }
        int end = 0;
        while (end < upper.length() && Character.isLetter(upper.charAt(end))) {
            end++;
        }
        return end == 0 ? "unknown" : upper.substring(0, end).toLowerCase(Locale.ROOT);
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static String tableName(String raw) {
        String name = raw.replace("`", "");
        while (name.endsWith(";") || name.endsWith(",")) {
            name = name.substring(0, name.length() - 1);
        }
        return name;
    }
}
