package com.lineagescope.core.scanner;

import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Front end that turns one kind of pipeline definition file into scan units.
 *
 * <p>Adapters are discovered via Java Service Provider Interface (SPI). The
 * {@link ScanOrchestrator} assigns every candidate file to the first enabled adapter
 * (by ascending priority) whose patterns match it, then calls {@link #parse} for
 * that file on a worker thread. Implementations must therefore be stateless or
 * otherwise thread-safe.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.lineagescope.core.scanner.FormatAdapter}
 *
 * @see ScanContext
 * @see AdapterResult
 */
public interface FormatAdapter {

    /**
     * Returns unique identifier for this adapter.
     *
     * <p>Used for enabling adapters and keying adapter configuration. Should be
     * kebab-case (e.g., "abinitio-graph", "oozie-workflow").
     *
     * @return unique adapter identifier
     */
    String getId();

    /**
     * Returns human-readable display name, used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the technology the adapter's definitions belong to.
     *
     * @return source system
     */
    SystemType getSystem();

    /**
     * Returns glob patterns, relative to the scan root, of files this adapter parses.
     *
     * @return glob patterns
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Returns the adapter's claim priority.
     *
     * <p>Lower values claim files first when several adapters match the same file.
     *
     * @return priority value (lower = earlier claim)
     */
    int getPriority();

    /**
     * Returns the adapter's own role vocabulary.
     *
     * <p>Keys are role hints as the adapter emits them, values the roles they mean.
     * Hints absent from this map and from the built-in aliases resolve to
     * {@link ComponentRole#UNKNOWN}.
     *
     * @return role aliases, empty by default
     */
    default Map<String, ComponentRole> getRoleAliases() {
        return Map.of();
    }

    /**
     * Checks if a file matches one of the adapter's patterns.
     *
     * @param relativePath path relative to the scan root
     * @return true if the adapter would parse the file
     */
    default boolean supports(Path relativePath) {
        return FileUtils.matchesAny(relativePath, getSupportedFilePatterns());
    }

    /**
     * Parses one file.
     *
     * <p>Malformed content should be reported through {@link AdapterResult#warnings()}
     * where parsing can continue. A file that cannot be interpreted at all should
     * fail with {@link AdapterException} or {@link IOException}; the orchestrator
     * records the failure and continues with other files.
     *
     * @param file absolute path of the file
     * @param context scan context
     * @return scan units extracted from the file
     * @throws IOException if the file cannot be read
     */
    AdapterResult parse(Path file, ScanContext context) throws IOException;
}
