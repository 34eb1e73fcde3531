package com.lineagescope.cli;

import com.lineagescope.core.config.AdapterGroups;
import com.lineagescope.core.scanner.FormatAdapter;
import com.lineagescope.core.scanner.ScanOrchestrator;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list the available format adapters.
 *
 * <p>Adapters are discovered via SPI, in the order the orchestrator tries them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * lineagescope list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available format adapters and adapter groups",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available Adapters:");
        System.out.println();

        List<FormatAdapter> adapters = ScanOrchestrator.discoverAdapters();
        if (adapters.isEmpty()) {
            System.out.println("  No adapters found.");
            return 0;
        }

        for (FormatAdapter adapter : adapters) {
            System.out.printf("  • %s (ID: %s)%n", adapter.getDisplayName(), adapter.getId());
            System.out.printf("    System: %s%n", adapter.getSystem());
            System.out.printf("    Patterns: %s%n", new TreeSet<>(adapter.getSupportedFilePatterns()));
            System.out.printf("    Priority: %d%n", adapter.getPriority());
            System.out.println();
        }

        System.out.println("Adapter Groups:");
        for (String group : AdapterGroups.getAvailableGroups()) {
            System.out.printf("  %s: %s%n", group, AdapterGroups.getAdaptersForGroups(List.of(group)));
        }
        return 0;
    }
}
