package com.lineagescope.core.scanner;

import com.lineagescope.core.builder.ScanUnit;

import java.util.List;

/**
 * Output of one {@link FormatAdapter#parse} call.
 *
 * @param scanUnits top-level definitions found in the file
 * @param warnings non-fatal issues (unbalanced blocks, skipped entries)
 */
public record AdapterResult(
    List<ScanUnit> scanUnits,
    List<String> warnings
) {
    public AdapterResult {
        scanUnits = scanUnits == null ? List.of() : List.copyOf(scanUnits);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static AdapterResult of(ScanUnit scanUnit) {
        return new AdapterResult(List.of(scanUnit), List.of());
    }
}
