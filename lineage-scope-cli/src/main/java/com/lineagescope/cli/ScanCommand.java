package com.lineagescope.cli;

import com.lineagescope.core.config.ConfigLoader;
import com.lineagescope.core.config.ProjectConfig;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.LineageModel;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.ScanOptions;
import com.lineagescope.core.scanner.ScanOrchestrator;
import com.lineagescope.core.scanner.ScanOutcome;
import com.lineagescope.core.scanner.ScanReport;
import com.lineagescope.core.scanner.ScanStatistics;
import com.lineagescope.core.scanner.ScanWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to scan a directory and report its lineage.
 *
 * <p>Loads {@code lineagescope.yaml} (or the file given with {@code --config}), runs
 * every enabled adapter through the {@link ScanOrchestrator}, prints a model summary
 * and the scan report, and optionally writes the model as JSON.
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} on an unexpected failure, {@code 2}
 * when files were found but none of them could be parsed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * lineagescope scan ./etl
 * lineagescope scan ./etl -o build/lineage.json -j 8 --cross-process
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan a directory of ETL definitions and report the lineage model",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    static final int EXIT_ALL_FAILED = 2;

    @Parameters(
        index = "0",
        description = "Directory to scan (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <dir>/" + ConfigLoader.DEFAULT_FILE_NAME + ")"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Write the model and report as JSON to this file"
    )
    private Path outputFile;

    @Option(
        names = {"-j", "--threads"},
        description = "Worker threads (overrides config)"
    )
    private Integer threads;

    @Option(
        names = {"--cross-process"},
        description = "Match datasets across processes (overrides config)"
    )
    private boolean crossProcess;

    @Override
    public Integer call() {
        try {
            ScanContext context = createScanContext();
            log.info("Starting scan of: {}", context.rootPath());
            System.out.println("Scanning: " + context.rootPath());
            System.out.println();

            ScanOutcome outcome = ScanOrchestrator.withDiscoveredAdapters().scan(context);

            printModelSummary(outcome);
            printReport(outcome.report());

            if (outputFile != null) {
                LineageExport.from(outcome).write(outputFile);
                System.out.println("✓ Wrote lineage to: " + outputFile.toAbsolutePath());
            }

            if (outcome.report().statistics().allFailed()) {
                System.err.println("✗ No file could be parsed");
                return EXIT_ALL_FAILED;
            }
            return 0;

        } catch (Exception e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }
    }

    private ScanContext createScanContext() {
        Path root = projectPath.toAbsolutePath().normalize();
        ScanContext context = loadConfiguration(root, configPath).toScanContext(root);
        ScanOptions options = context.options();
        if (threads != null) {
            options = options.withParallelism(threads);
        }
        if (crossProcess) {
            options = options.withCrossProcessLineage(true);
        }
        return new ScanContext(context.rootPath(), context.scanName(), context.configuration(), options);
    }

    /**
     * Loads the configuration for a scan root.
     *
     * @param root absolute scan root
     * @param configPath explicit config file, relative to the root, or null for the default
     * @return configuration, defaults when the file is missing or invalid
     */
    static ProjectConfig loadConfiguration(Path root, Path configPath) {
        if (configPath == null) {
            return ConfigLoader.loadFromRoot(root);
        }
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private void printModelSummary(ScanOutcome outcome) {
        LineageModel model = outcome.model();
        Map<ComponentRole, Integer> roles = new EnumMap<>(ComponentRole.class);
        model.components().forEach(component -> roles.merge(component.role(), 1, Integer::sum));
        Map<FlowProvenance, Integer> provenance = new EnumMap<>(FlowProvenance.class);
        model.flows().forEach(flow -> provenance.merge(flow.provenance(), 1, Integer::sum));

        System.out.println("Lineage Model Summary (" + model.scanName() + "):");
        System.out.println("  Processes:   " + model.processes().size());
        System.out.println("  Components:  " + model.components().size() + " " + roles);
        System.out.println("  Flows:       " + model.flows().size() + " " + provenance);
        System.out.println("  Roots:       " + outcome.graph().roots(model.components()).size());
        System.out.println("  Leaves:      " + outcome.graph().leaves(model.components()).size());
        System.out.println();
    }

    private void printReport(ScanReport report) {
        ScanStatistics statistics = report.statistics();
        System.out.println("Scan Report:");
        System.out.println("  " + statistics.getSummary());
        if (statistics.droppedDanglingEdges() > 0) {
            System.out.println("  Dropped dangling edges: " + statistics.droppedDanglingEdges());
        }
        for (String failed : report.failedFiles()) {
            System.out.println("  ✗ " + failed);
        }
        if (report.hasWarnings()) {
            System.out.println("  Warnings:");
            for (ScanWarning warning : report.warnings()) {
                System.out.println("    ⚠ " + warning);
            }
        }
        System.out.println();
    }
}
