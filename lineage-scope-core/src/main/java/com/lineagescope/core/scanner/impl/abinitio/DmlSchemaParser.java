package com.lineagescope.core.scanner.impl.abinitio;

import com.lineagescope.core.model.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the field list of a DML record format.
 *
 * <p>Only the flat field declarations of the outermost record are read:
 * <pre>
 * record
 *   string(10) order_id;
 *   decimal(12,2) amount = NULL;
 *   date("YYYY-MM-DD") order_date NOT NULL;
 * end
 * </pre>
 * A numeric type argument becomes the field's length or precision. Fields are nullable
 * unless declared {@code NOT NULL}. Declarations that cannot be read are skipped.
 */
public final class DmlSchemaParser {

    private static final Pattern FIELD = Pattern.compile(
        "^(?:(?:unsigned|signed|little\\s+endian|big\\s+endian)\\s+)*"
            + "([A-Za-z_]\\w*)\\s*(?:\\((.*?)\\))?\\s+([A-Za-z_]\\w*)(.*)$",
        Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern RECORD = Pattern.compile("\\brecord\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END = Pattern.compile("\\bend\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");
    private static final Pattern NOT_NULL = Pattern.compile("\\bnot\\s+null\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENTS = Pattern.compile("/\\*.*?\\*/|//[^\\n]*", Pattern.DOTALL);

    private static final Set<String> KEYWORDS = Set.of("record", "end", "type", "include", "let", "in", "out");

    /**
     * Parses a DML record format.
     *
     * @param dml DML text, may be null
     * @return schema, or empty if no field could be read
     */
    public Optional<Schema> parse(String dml) {
        if (dml == null || dml.isBlank()) {
            return Optional.empty();
        }

        List<Schema.Field> fields = new ArrayList<>();
        for (String statement : statements(recordBody(COMMENTS.matcher(dml).replaceAll(" ")))) {
            parseField(statement).ifPresent(fields::add);
        }
        return fields.isEmpty() ? Optional.empty() : Optional.of(new Schema(fields));
    }

    /**
     * Returns true if the text looks like a record format rather than a path.
     *
     * @param text candidate text
     * @return true if the text declares a record
     */
    public boolean isRecordFormat(String text) {
        return text != null && RECORD.matcher(text).find() && text.contains(";");
    }

    private Optional<Schema.Field> parseField(String statement) {
        Matcher matcher = FIELD.matcher(statement.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String type = matcher.group(1).toLowerCase(Locale.ROOT);
        if (KEYWORDS.contains(type)) {
            return Optional.empty();
        }

        Integer length = null;
        if (matcher.group(2) != null) {
            Matcher number = LEADING_NUMBER.matcher(matcher.group(2));
            if (number.find()) {
                length = Integer.valueOf(number.group(1));
            }
        }
        boolean nullable = !NOT_NULL.matcher(matcher.group(4)).find();
        return Optional.of(new Schema.Field(matcher.group(3), type, nullable, length));
    }

    private static String recordBody(String dml) {
        Matcher record = RECORD.matcher(dml);
        String body = record.find() ? dml.substring(record.end()) : dml;

        int lastEnd = -1;
        Matcher end = END.matcher(body);
        while (end.find()) {
            lastEnd = end.start();
        }
        return lastEnd >= 0 ? body.substring(0, lastEnd) : body;
    }

    private static List<String> statements(String body) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"' && (i == 0 || body.charAt(i - 1) != '\\')) {
                inQuote = !inQuote;
            }
            if (c == ';' && !inQuote) {
                if (!current.toString().isBlank()) {
                    statements.add(current.toString());
                }
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        return statements;
    }
}
