package com.lineagescope.core.scanner;

import com.lineagescope.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to adapters during a scan.
 *
 * @param rootPath scan root directory, stored absolute and normalized
 * @param scanName name of the scanned project
 * @param configuration adapter-specific configuration, keyed by adapter id
 * @param options scan-wide settings
 */
public record ScanContext(
    Path rootPath,
    String scanName,
    Map<String, Map<String, Object>> configuration,
    ScanOptions options
) {
    /**
     * Compact constructor with validation.
     */
    public ScanContext {
        Objects.requireNonNull(rootPath, "rootPath must not be null");
        rootPath = rootPath.toAbsolutePath().normalize();
        if (scanName == null || scanName.isBlank()) {
            Path fileName = rootPath.getFileName();
            scanName = fileName != null ? fileName.toString() : "project";
        }
        if (configuration == null) {
            configuration = Map.of();
        }
        if (options == null) {
            options = ScanOptions.defaults();
        }
    }

    /**
     * Creates a context with default options and no adapter configuration.
     *
     * @param rootPath scan root directory, stored absolute and normalized
     * @return context
     */
    public static ScanContext of(Path rootPath) {
        return new ScanContext(rootPath, null, Map.of(), ScanOptions.defaults());
    }

    /**
     * Gets a configuration value for an adapter.
     *
     * @param adapterId adapter id
     * @param key configuration key
     * @param <T> expected type
     * @return configuration value or null if not found
     */
    @SuppressWarnings("unchecked")
    public <T> T getConfig(String adapterId, String key) {
        Map<String, Object> adapterConfig = configuration.get(adapterId);
        return adapterConfig == null ? null : (T) adapterConfig.get(key);
    }

    /**
     * Gets a configuration value for an adapter with a default.
     *
     * @param adapterId adapter id
     * @param key configuration key
     * @param defaultValue default value if key not found
     * @param <T> expected type
     * @return configuration value or default
     */
    public <T> T getConfigOrDefault(String adapterId, String key, T defaultValue) {
        T value = getConfig(adapterId, key);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns the root-relative name of a file, with '/' separators.
     *
     * @param file file under the root
     * @return relative name
     */
    public String relativeName(Path file) {
        return FileUtils.relativeName(rootPath, file.toAbsolutePath().normalize());
    }
}
