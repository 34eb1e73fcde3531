package com.lineagescope.core.parser;

import java.util.Set;

/**
 * Adapter-supplied rules for reconstructing a hierarchy breadcrumb from block trailers.
 *
 * @param groupKey group key of the blocks whose trailers carry parent labels, or null to disable tracking
 * @param fieldIndex zero-based index of the label among the trailer's fields
 * @param excludedLabels labels that never enter the path
 * @param separator separator between path segments
 */
public record BreadcrumbPolicy(
    String groupKey,
    int fieldIndex,
    Set<String> excludedLabels,
    String separator
) {
    /** Separator used when none is configured. */
    public static final String DEFAULT_SEPARATOR = ".";

    public BreadcrumbPolicy {
        if (fieldIndex < 0) {
            throw new IllegalArgumentException("fieldIndex must not be negative: " + fieldIndex);
        }
        excludedLabels = excludedLabels == null ? Set.of() : Set.copyOf(excludedLabels);
        if (separator == null || separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
    }

    /**
     * Policy that never records a breadcrumb.
     *
     * @return disabled policy
     */
    public static BreadcrumbPolicy disabled() {
        return new BreadcrumbPolicy(null, 0, Set.of(), DEFAULT_SEPARATOR);
    }

    /**
     * Returns true if blocks with the given group key feed the breadcrumb.
     *
     * @param blockGroupKey group key of a block
     * @return true if tracking is enabled and the key matches
     */
    public boolean tracks(String blockGroupKey) {
        return groupKey != null && groupKey.equals(blockGroupKey);
    }

    /**
     * Returns true if the label may enter the path.
     *
     * @param label candidate label
     * @return true if non-blank and not excluded
     */
    public boolean accepts(String label) {
        return label != null && !label.isBlank() && !excludedLabels.contains(label);
    }
}
