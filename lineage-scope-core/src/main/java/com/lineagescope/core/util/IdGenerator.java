package com.lineagescope.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic identifiers from content.
 *
 * <p>Ids are the leading 16 hex characters of a SHA-256 digest over the given
 * components, each written as {@code <length>:<text>}. Length prefixes keep the input
 * unambiguous when components themselves contain {@code ':'}, as scan identifiers do.
 * The same inputs always produce the same id, on
 * any runtime, which keeps process and component ids stable across re-scans and
 * independent of the order in which files were parsed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String processId = IdGenerator.generate("hadoop:workflows/daily_orders", "daily_orders");
 * String componentId = IdGenerator.generate(processId, "load_orders");
 * }</pre>
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a 16-character id from one or more components.
     *
     * @param components id components, in a fixed order
     * @return 16-character lowercase hex id
     * @throws IllegalArgumentException if no components are given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        StringBuilder input = new StringBuilder();
        for (String component : components) {
            String text = component == null ? "" : component;
            input.append(text.length()).append(':').append(text);
        }
        return sha256(input.toString()).substring(0, SHORT_ID_LENGTH);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
