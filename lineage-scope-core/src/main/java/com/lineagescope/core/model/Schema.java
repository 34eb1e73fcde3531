package com.lineagescope.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Record layout attached to a component.
 *
 * <p>Produced by format-specific field extractors and passed through unchanged.
 *
 * @param fields ordered field definitions
 */
public record Schema(List<Field> fields) {

    /**
     * Compact constructor with validation.
     */
    public Schema {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * Returns true if the schema has no fields.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * A single field of a schema.
     *
     * @param name field name
     * @param type field type as written in the source dialect
     * @param nullable whether the field accepts nulls
     * @param lengthOrPrecision declared length or precision, or null
     */
    public record Field(
        String name,
        String type,
        boolean nullable,
        Integer lengthOrPrecision
    ) {
        public Field {
            Objects.requireNonNull(name, "name must not be null");
            if (type == null) {
                type = "unknown";
            }
        }
    }
}
