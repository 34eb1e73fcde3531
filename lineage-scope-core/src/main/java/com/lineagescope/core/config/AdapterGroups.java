package com.lineagescope.core.config;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Technology groups for adapter selection.
 *
 * <pre>{@code
 * adapters:
 *   groups:
 *     - hadoop
 * }</pre>
 */
public final class AdapterGroups {

    private AdapterGroups() {
        // Utility class
    }

    /**
     * Map of group names to adapter IDs.
     */
    public static final Map<String, List<String>> GROUPS = Map.of(
        "abinitio", List.of("abinitio-graph"),
        "hadoop", List.of("oozie-coordinator", "oozie-workflow", "hive-script", "spark-script", "pig-script"),
        "databricks", List.of("databricks-notebook", "adf-pipeline")
    );

    /**
     * Get all adapter IDs for the specified groups. Unknown groups are ignored.
     *
     * @param groupNames names of groups to expand
     * @return set of adapter IDs from all specified groups
     */
    public static Set<String> getAdaptersForGroups(List<String> groupNames) {
        return groupNames.stream()
            .filter(GROUPS::containsKey)
            .flatMap(group -> GROUPS.get(group).stream())
            .collect(Collectors.toSet());
    }

    public static Set<String> getAvailableGroups() {
        return GROUPS.keySet();
    }
}
