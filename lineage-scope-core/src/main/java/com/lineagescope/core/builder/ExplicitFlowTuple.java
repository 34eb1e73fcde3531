package com.lineagescope.core.builder;

import java.util.Objects;

/**
 * A connection declared in a source definition, referencing components by name.
 *
 * @param sourceName name of the upstream component
 * @param targetName name of the downstream component
 * @param datasetName dataset carried by the connection, or null
 * @param flowType flow type text ({@code data}, {@code lookup}, {@code control}), or null
 */
public record ExplicitFlowTuple(
    String sourceName,
    String targetName,
    String datasetName,
    String flowType
) {
    public ExplicitFlowTuple {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
    }

    public static ExplicitFlowTuple of(String sourceName, String targetName) {
        return new ExplicitFlowTuple(sourceName, targetName, null, null);
    }
}
