package com.lineagescope.core.scanner;

import com.lineagescope.core.builder.ProcessExtraction;

import java.util.List;
import java.util.Objects;

/**
 * Isolated result of parsing one file on a worker thread.
 *
 * @param file root-relative file path
 * @param adapterId adapter that parsed the file
 * @param extractions processes built from the file
 * @param warnings non-fatal issues reported by the adapter
 * @param error failure message, null when parsing succeeded
 */
public record FileScanResult(
    String file,
    String adapterId,
    List<ProcessExtraction> extractions,
    List<String> warnings,
    String error
) {
    public FileScanResult {
        Objects.requireNonNull(file, "file must not be null");
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static FileScanResult success(String file, String adapterId,
                                         List<ProcessExtraction> extractions, List<String> warnings) {
        return new FileScanResult(file, adapterId, extractions, warnings, null);
    }

    public static FileScanResult failed(String file, String adapterId, String error) {
        return new FileScanResult(file, adapterId, List.of(), List.of(), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
