package com.lineagescope.core.scanner.base;

import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.FormatAdapter;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Abstract base class for format adapters providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per adapter class)</li>
 *   <li>File reading ({@link #readFileContent(Path)})</li>
 *   <li>Scan identifier helpers so that related files agree on process ids</li>
 *   <li>Result creation ({@link #result(List, List)})</li>
 * </ul>
 *
 * @see FormatAdapter
 * @see ScanContext
 */
public abstract class AbstractFormatAdapter implements FormatAdapter {

    /**
     * Logger instance for this adapter.
     * Automatically initialized with the concrete adapter class name.
     */
    protected final Logger log;

    protected AbstractFormatAdapter() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== File Reading Utilities ====================

    /**
     * Reads the entire content of a file as a single string.
     *
     * @param file path to the file to read
     * @return file content as string
     * @throws IOException if file cannot be read
     */
    protected String readFileContent(Path file) throws IOException {
        return FileUtils.readString(file);
    }

    // ==================== Scan Identifiers ====================

    /**
     * Builds a scan identifier from the adapter's system and a root-relative location.
     *
     * @param context scan context
     * @param location file or directory under the root
     * @return identifier such as {@code "abinitio:graphs/load.mp"}
     */
    protected String scanIdentifier(ScanContext context, Path location) {
        String relative = context.relativeName(location);
        return getSystem().name().toLowerCase(Locale.ROOT) + ":" + (relative.isEmpty() ? "." : relative);
    }

    // ==================== Result Creation Helpers ====================

    protected AdapterResult result(List<ScanUnit> scanUnits, List<String> warnings) {
        return new AdapterResult(scanUnits, warnings);
    }
}
