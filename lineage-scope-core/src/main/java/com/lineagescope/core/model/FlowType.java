package com.lineagescope.core.model;

import java.util.Locale;

/**
 * Kind of dependency a {@link DataFlow} represents.
 */
public enum FlowType {
    /** Records produced by the source are consumed by the target */
    DATA,

    /** The source is reference data looked up by the target */
    LOOKUP,

    /** The target runs after the source (workflow transition, no data hand-off) */
    CONTROL;

    /**
     * Parses an adapter-supplied flow type.
     *
     * @param value flow type text, may be null
     * @return matching type, or {@link #DATA} if null, blank or unrecognized
     */
    public static FlowType fromString(String value) {
        if (value == null || value.isBlank()) {
            return DATA;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DATA;
        }
    }
}
