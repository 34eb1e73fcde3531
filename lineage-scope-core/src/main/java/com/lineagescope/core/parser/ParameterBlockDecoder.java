package com.lineagescope.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the typed parameters of a block from its labeled parameter section.
 *
 * <p>A parameter section is a marker token followed by a delimited region holding one
 * sub-block per parameter:
 * <pre>
 * !fparameters{ {1|string|!name|orders|} {2|string|!layout|/data/orders.dml|} }
 * </pre>
 * Each sub-block is read positionally as {@code index | type | name | value | ...}.
 * The name loses any leading marker character; a missing value decodes as an empty
 * string. A block without a parameter section has no parameters.
 */
public final class ParameterBlockDecoder {

    private static final Logger log = LoggerFactory.getLogger(ParameterBlockDecoder.class);

    /** Marker introducing the parameter section in graph definitions. */
    public static final String DEFAULT_SECTION_MARKER = "!fparameters";

    private static final int MIN_FIELDS = 3;

    private final StructuralBlockParser parser;
    private final String sectionMarker;

    public ParameterBlockDecoder() {
        this(new StructuralBlockParser(), DEFAULT_SECTION_MARKER);
    }

    /**
     * Creates a decoder for a specific parser and section marker.
     *
     * @param parser parser used for the parameter region and its sub-blocks
     * @param sectionMarker token that precedes the parameter region
     */
    public ParameterBlockDecoder(StructuralBlockParser parser, String sectionMarker) {
        if (sectionMarker == null || sectionMarker.isBlank()) {
            throw new IllegalArgumentException("sectionMarker must not be blank");
        }
        this.parser = parser;
        this.sectionMarker = sectionMarker;
    }

    /**
     * Decodes every parameter of the block's parameter section.
     *
     * @param blockText block header or whole block text
     * @return parameters in declaration order, empty if there is no section
     */
    public List<BlockParameter> decode(String blockText) {
        if (blockText == null || blockText.isEmpty()) {
            return List.of();
        }

        Optional<String> region = findSection(blockText);
        if (region.isEmpty()) {
            return List.of();
        }

        BlockScan scan = parser.scan(region.get());
        List<BlockParameter> parameters = new ArrayList<>(scan.spans().size());
        for (String span : scan.spans()) {
            decodeParameter(span).ifPresent(parameters::add);
        }
        return parameters;
    }

    /**
     * Decodes the parameter section into a name to value map.
     *
     * <p>When a name repeats, the last declaration wins.
     *
     * @param blockText block header or whole block text
     * @return parameters by name, in first-declaration order
     */
    public Map<String, String> decodeAsMap(String blockText) {
        Map<String, String> byName = new LinkedHashMap<>();
        for (BlockParameter parameter : decode(blockText)) {
            byName.put(parameter.name(), parameter.value());
        }
        return byName;
    }

    /**
     * Decodes a single parameter sub-block.
     *
     * @param span sub-block text, e.g. <code>{1|string|!name|orders|}</code>
     * @return the parameter, or empty if the block has fewer than three fields or no name
     */
    public Optional<BlockParameter> decodeParameter(String span) {
        List<String> fields = parser.splitFields(span);
        if (fields.size() < MIN_FIELDS) {
            return Optional.empty();
        }

        String name = stripMarker(fields.get(2).trim());
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String value = fields.size() > MIN_FIELDS ? fields.get(3).trim() : "";
        return Optional.of(new BlockParameter(fields.get(0).trim(), fields.get(1).trim(), name, value));
    }

    private Optional<String> findSection(String text) {
        int markerIndex = text.indexOf(sectionMarker);
        while (markerIndex >= 0) {
            int afterMarker = markerIndex + sectionMarker.length();
            int openIndex = skipWhitespace(text, afterMarker);
            if (openIndex < text.length() && text.charAt(openIndex) == parser.open()) {
                int end = parser.findBlockEnd(text, openIndex);
                if (end < 0) {
                    log.debug("Parameter section at offset {} never closes, decoding what is complete", openIndex);
                    return Optional.of(text.substring(openIndex + 1));
                }
                return Optional.of(text.substring(openIndex + 1, end - 1));
            }
            markerIndex = text.indexOf(sectionMarker, afterMarker);
        }
        return Optional.empty();
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String stripMarker(String token) {
        int i = 0;
        while (i < token.length() && !Character.isLetterOrDigit(token.charAt(i)) && token.charAt(i) != '_') {
            i++;
        }
        return token.substring(i).trim();
    }
}
