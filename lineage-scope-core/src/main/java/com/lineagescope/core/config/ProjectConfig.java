package com.lineagescope.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.ScanOptions;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration for LineageScope scans.
 *
 * <p>Loaded from {@code lineagescope.yaml} in the scan root. Every section is
 * optional; missing values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "warehouse-migration"
 *
 * scan:
 *   parallelism: 4
 *   timeoutSeconds: 600
 *   crossProcessLineage: true
 *   exclude:
 *     - "archive/**"
 *
 * adapters:
 *   groups:
 *     - hadoop
 *   config:
 *     abinitio-graph:
 *       breadcrumbFieldIndex: 8
 * }</pre>
 *
 * @param project project metadata
 * @param scan scan settings
 * @param adapters adapter selection and adapter-specific settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("scan") ScanSettings scan,
    @JsonProperty("adapters") AdapterConfig adapters
) {
    /**
     * Creates a default configuration with every adapter enabled.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ProjectInfo(null, null),
            new ScanSettings(null, null, null, null, List.of()),
            new AdapterConfig(List.of(), List.of(), Map.of())
        );
    }

    /**
     * Builds the scan context for a root directory.
     *
     * @param rootPath scan root
     * @return context carrying these settings
     */
    public ScanContext toScanContext(Path rootPath) {
        ScanSettings settings = scan != null ? scan : defaults().scan();
        AdapterConfig adapterConfig = adapters != null ? adapters : defaults().adapters();

        ScanOptions options = new ScanOptions(
            settings.parallelism() != null ? settings.parallelism() : 0,
            settings.timeoutSeconds() != null ? settings.timeoutSeconds() : 0,
            Boolean.TRUE.equals(settings.crossProcessLineage()),
            Boolean.TRUE.equals(settings.quoteAwareBlocks()),
            settings.exclude(),
            adapterConfig.effectiveEnabled()
        );

        String name = project != null ? project.name() : null;
        return new ScanContext(rootPath, name, adapterConfig.perAdapterConfig(), options);
    }

    /**
     * Project metadata.
     *
     * @param name project name, used as the scan name
     * @param description optional description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * Scan settings. Null values mean "use the default".
     *
     * @param parallelism worker threads
     * @param timeoutSeconds whole-scan timeout, 0 for none
     * @param crossProcessLineage whether dataset matching spans processes
     * @param quoteAwareBlocks whether block parsing honours quoted literals
     * @param exclude root-relative globs of files never scanned
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanSettings(
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("crossProcessLineage") Boolean crossProcessLineage,
        @JsonProperty("quoteAwareBlocks") Boolean quoteAwareBlocks,
        @JsonProperty("exclude") List<String> exclude
    ) {}

    /**
     * Adapter selection.
     *
     * <p>With neither {@code enabled} nor {@code groups} set, every adapter runs.
     * Otherwise the union of the listed ids and the groups' ids runs.
     *
     * @param enabled adapter ids to run
     * @param groups adapter groups to run (see {@link AdapterGroups})
     * @param config adapter-specific settings keyed by adapter id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AdapterConfig(
        @JsonProperty("enabled") List<String> enabled,
        @JsonProperty("groups") List<String> groups,
        @JsonProperty("config") Map<String, Map<String, Object>> config
    ) {
        /**
         * Returns the adapter ids to run.
         *
         * @return ids, empty when every adapter runs
         */
        public Set<String> effectiveEnabled() {
            Set<String> ids = new LinkedHashSet<>();
            if (enabled != null) {
                ids.addAll(enabled);
            }
            if (groups != null) {
                ids.addAll(AdapterGroups.getAdaptersForGroups(groups));
            }
            return ids;
        }

        /**
         * Checks if an adapter is enabled.
         *
         * @param adapterId adapter id
         * @return true if the adapter runs
         */
        public boolean isEnabled(String adapterId) {
            Set<String> ids = effectiveEnabled();
            return ids.isEmpty() || ids.contains(adapterId);
        }

        Map<String, Map<String, Object>> perAdapterConfig() {
            if (config == null) {
                return Map.of();
            }
            Map<String, Map<String, Object>> copy = new HashMap<>();
            config.forEach((id, values) -> copy.put(id, values != null ? Map.copyOf(values) : Map.of()));
            return Map.copyOf(copy);
        }
    }
}
