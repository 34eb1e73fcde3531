package com.lineagescope.core.parser;

import java.util.List;

/**
 * Result of scanning text for top-level balanced blocks.
 *
 * @param spans complete top-level spans in text order, each from its open to its close delimiter
 * @param warnings structural problems found during the scan (unclosed or stray delimiters)
 */
public record BlockScan(List<String> spans, List<String> warnings) {

    public BlockScan {
        spans = spans == null ? List.of() : List.copyOf(spans);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
