package com.lineagescope.core.scanner;

/**
 * A non-fatal issue, tied to a file when there is one.
 *
 * @param file root-relative file path, or null for scan-wide warnings
 * @param message description
 */
public record ScanWarning(String file, String message) {

    public static ScanWarning global(String message) {
        return new ScanWarning(null, message);
    }

    @Override
    public String toString() {
        return file == null ? message : file + ": " + message;
    }
}
