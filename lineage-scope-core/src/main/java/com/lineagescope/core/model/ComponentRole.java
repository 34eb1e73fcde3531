package com.lineagescope.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Role a component plays in a pipeline.
 *
 * <p>The set is closed. Format adapters map their own vocabulary onto it through role
 * aliases; anything that does not resolve becomes {@link #UNKNOWN}.
 */
public enum ComponentRole {
    /** Reads data from outside the pipeline (input file, table extract) */
    SOURCE,

    /** Writes data out of the pipeline (output file, table load) */
    SINK,

    /** Reference data used as a secondary input */
    LOOKUP,

    /** Reshapes records (reformat, filter, sort, aggregate, query) */
    TRANSFORM,

    /** Combines two or more inputs on a key */
    JOIN,

    /** Unknown or unclassified component */
    UNKNOWN;

    /**
     * Resolves an enum constant from its name, ignoring case and separators.
     *
     * @param name candidate name, e.g. {@code "source"} or {@code "Transform"}
     * @return the matching role, or empty if the name is not a role name
     */
    public static Optional<ComponentRole> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        for (ComponentRole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true for roles that take part in the transform chain of the role heuristic.
     *
     * @return true for {@link #TRANSFORM} and {@link #JOIN}
     */
    public boolean isTransforming() {
        return this == TRANSFORM || this == JOIN;
    }
}
