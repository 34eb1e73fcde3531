package com.lineagescope.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code lineagescope.yaml} into a {@link ProjectConfig}.
 *
 * <p>Configuration problems never stop a scan. A missing, unreadable, empty or
 * malformed file is logged at WARN and replaced by {@link ProjectConfig#defaults()},
 * which runs every adapter with default settings.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanContext context = ConfigLoader.loadFromRoot(root).toScanContext(root);
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the scan root. */
    public static final String DEFAULT_FILE_NAME = "lineagescope.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads an explicitly named configuration file.
     *
     * @param configPath path to the YAML file
     * @return the configuration, or defaults if the file cannot be used
     */
    public static ProjectConfig load(Path configPath) {
        return read(configPath).orElseGet(ProjectConfig::defaults);
    }

    /**
     * Loads {@code lineagescope.yaml} from a scan root. A root without the file is
     * normal and only logged at DEBUG.
     *
     * @param rootPath scan root
     * @return the configuration, or defaults
     */
    public static ProjectConfig loadFromRoot(Path rootPath) {
        Path configPath = rootPath.resolve(DEFAULT_FILE_NAME);
        if (Files.notExists(configPath)) {
            log.debug("No {} in {}, using defaults", DEFAULT_FILE_NAME, rootPath);
            return ProjectConfig.defaults();
        }
        return load(configPath);
    }

    private static Optional<ProjectConfig> read(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file {} is missing or unreadable, running all adapters with defaults", configPath);
            return Optional.empty();
        }
        try {
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file {} is empty, using defaults", configPath);
                return Optional.empty();
            }
            log.info("Loaded configuration from {}", configPath);
            return Optional.of(config);
        } catch (IOException e) {
            log.warn("Cannot parse configuration file {} ({}), using defaults", configPath, e.getMessage());
            return Optional.empty();
        }
    }
}
