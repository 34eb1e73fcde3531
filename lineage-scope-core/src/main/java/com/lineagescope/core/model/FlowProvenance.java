package com.lineagescope.core.model;

/**
 * Evidence an inferred {@link DataFlow} is based on, ordered by descending trust.
 *
 * <p><b>Levels:</b></p>
 * <ul>
 *   <li><b>EXPLICIT:</b> connection declared in the source definition</li>
 *   <li><b>DATASET_MATCH:</b> one component writes a dataset another one reads</li>
 *   <li><b>ROLE_HEURISTIC:</b> guessed from component roles and encounter order</li>
 * </ul>
 *
 * <p>When several passes produce an edge for the same component pair, the edge with
 * the highest provenance is kept.
 */
public enum FlowProvenance {
    EXPLICIT("Declared connection", 1.0),
    DATASET_MATCH("Dataset name match", 0.7),
    ROLE_HEURISTIC("Role heuristic", 0.4);

    private final String description;
    private final double weight;

    FlowProvenance(String description, double weight) {
        this.description = description;
        this.weight = weight;
    }

    /**
     * Returns a human-readable description of this provenance.
     *
     * @return description string
     */
    public String getDescription() {
        return description;
    }

    /**
     * Returns the numeric trust weight (0.0 to 1.0).
     *
     * @return weight (1.0 = EXPLICIT, 0.7 = DATASET_MATCH, 0.4 = ROLE_HEURISTIC)
     */
    public double getWeight() {
        return weight;
    }

    /**
     * Returns true if this provenance is strictly more trusted than the other one.
     *
     * @param other provenance to compare against
     * @return true if this outranks {@code other}
     */
    public boolean outranks(FlowProvenance other) {
        return this.weight > other.weight;
    }
}
