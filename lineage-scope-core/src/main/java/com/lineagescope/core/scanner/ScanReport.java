package com.lineagescope.core.scanner;

import java.util.List;

/**
 * Per-file outcome of a scan.
 *
 * @param parsedFiles root-relative paths of files parsed successfully, in discovery order
 * @param failedFiles root-relative paths of files whose adapter failed
 * @param warnings non-fatal issues, file-level and scan-wide
 * @param statistics counters
 */
public record ScanReport(
    List<String> parsedFiles,
    List<String> failedFiles,
    List<ScanWarning> warnings,
    ScanStatistics statistics
) {
    public ScanReport {
        parsedFiles = parsedFiles == null ? List.of() : List.copyOf(parsedFiles);
        failedFiles = failedFiles == null ? List.of() : List.copyOf(failedFiles);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (statistics == null) {
            statistics = ScanStatistics.empty();
        }
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
