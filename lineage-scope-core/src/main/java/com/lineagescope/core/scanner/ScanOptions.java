package com.lineagescope.core.scanner;

import java.util.List;
import java.util.Set;

/**
 * Scan-wide settings.
 *
 * @param parallelism worker threads; 1 parses sequentially on the calling thread
 * @param timeoutSeconds whole-scan timeout, 0 for none
 * @param crossProcessLineage whether dataset matching spans process boundaries
 * @param quoteAwareBlocks whether block parsing skips delimiters inside quoted literals
 * @param excludePatterns root-relative globs of files never scanned
 * @param enabledAdapters adapter ids to run, empty for all
 */
public record ScanOptions(
    int parallelism,
    long timeoutSeconds,
    boolean crossProcessLineage,
    boolean quoteAwareBlocks,
    List<String> excludePatterns,
    Set<String> enabledAdapters
) {
    public ScanOptions {
        if (parallelism < 1) {
            parallelism = defaultParallelism();
        }
        if (timeoutSeconds < 0) {
            timeoutSeconds = 0;
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        enabledAdapters = enabledAdapters == null ? Set.of() : Set.copyOf(enabledAdapters);
    }

    public static ScanOptions defaults() {
        return new ScanOptions(defaultParallelism(), 0, false, false, List.of(), Set.of());
    }

    public ScanOptions withParallelism(int threads) {
        return new ScanOptions(threads, timeoutSeconds, crossProcessLineage, quoteAwareBlocks,
            excludePatterns, enabledAdapters);
    }

    public ScanOptions withCrossProcessLineage(boolean enabled) {
        return new ScanOptions(parallelism, timeoutSeconds, enabled, quoteAwareBlocks,
            excludePatterns, enabledAdapters);
    }

    public ScanOptions withTimeoutSeconds(long seconds) {
        return new ScanOptions(parallelism, seconds, crossProcessLineage, quoteAwareBlocks,
            excludePatterns, enabledAdapters);
    }

    /**
     * Checks if an adapter should run.
     *
     * @param adapterId adapter id
     * @return true if no adapter list is configured or the id is listed
     */
    public boolean isAdapterEnabled(String adapterId) {
        return enabledAdapters.isEmpty() || enabledAdapters.contains(adapterId);
    }

    private static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
