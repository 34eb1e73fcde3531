package com.lineagescope.core.scanner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during a scan.
 *
 * @param filesDiscovered candidate files claimed by an adapter
 * @param filesParsed files parsed successfully
 * @param filesFailed files whose adapter threw
 * @param filesAbandoned files not finished before the scan timeout
 * @param unresolvedReferences declared connections that named no known component
 * @param droppedDanglingEdges inferred edges dropped for a missing endpoint
 * @param errorCounts failure counts by exception type
 * @param topErrors first failure messages (max 10)
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesParsed,
    int filesFailed,
    int filesAbandoned,
    int unresolvedReferences,
    int droppedDanglingEdges,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesParsed = Math.max(0, filesParsed);
        filesFailed = Math.max(0, filesFailed);
        filesAbandoned = Math.max(0, filesAbandoned);
        unresolvedReferences = Math.max(0, unresolvedReferences);
        droppedDanglingEdges = Math.max(0, droppedDanglingEdges);
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the share of discovered files that parsed.
     *
     * @return success rate as percentage (0.0 to 100.0), or 0 if nothing was discovered
     */
    public double getSuccessRate() {
        if (filesDiscovered == 0) {
            return 0.0;
        }
        return (filesParsed * 100.0) / filesDiscovered;
    }

    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns true if files were discovered and none of them parsed.
     *
     * @return true when the whole scan failed
     */
    public boolean allFailed() {
        return filesDiscovered > 0 && filesParsed == 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Parsed: %d (%.1f%%), Failed: %d, Abandoned: %d, Unresolved references: %d",
            filesDiscovered,
            filesParsed,
            getSuccessRate(),
            filesFailed,
            filesAbandoned,
            unresolvedReferences
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesParsed = 0;
        private int filesFailed = 0;
        private int filesAbandoned = 0;
        private int unresolvedReferences = 0;
        private int droppedDanglingEdges = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesParsed() {
            this.filesParsed++;
            return this;
        }

        public Builder incrementFilesAbandoned() {
            this.filesAbandoned++;
            return this;
        }

        public Builder unresolvedReferences(int count) {
            this.unresolvedReferences = count;
            return this;
        }

        public Builder droppedDanglingEdges(int count) {
            this.droppedDanglingEdges = count;
            return this;
        }

        public Builder addFailure(String errorType, String errorDetail) {
            this.filesFailed++;
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesParsed,
                filesFailed,
                filesAbandoned,
                unresolvedReferences,
                droppedDanglingEdges,
                errorCounts,
                topErrors
            );
        }
    }
}
