package com.lineagescope.core.scanner;

import java.nio.file.Path;

/**
 * Raised by a {@link FormatAdapter} when a file cannot be interpreted.
 *
 * <p>Caught per file by the {@link ScanOrchestrator}; it never aborts a scan.
 */
public class AdapterException extends RuntimeException {

    private final transient Path file;

    public AdapterException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public AdapterException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    /**
     * Returns the file that failed.
     *
     * @return file path, may be null
     */
    public Path getFile() {
        return file;
    }
}
