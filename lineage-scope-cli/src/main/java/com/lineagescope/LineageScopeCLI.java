package com.lineagescope;

import ch.qos.logback.classic.Level;
import com.lineagescope.cli.ListCommand;
import com.lineagescope.cli.ScanCommand;
import com.lineagescope.cli.TraceCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for LineageScope.
 *
 * <p>LineageScope scans ETL definitions (Ab Initio graphs, Oozie workflows, Hive
 * scripts) and reconstructs component-level data lineage.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Scan a directory and report the lineage model</li>
 *   <li>{@code trace} - Show the direct neighbours of one component</li>
 *   <li>{@code list} - List available format adapters</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Scan a repository and export the model
 * lineagescope scan ./etl -o lineage.json
 *
 * # Where does the data of "Load_Orders" come from?
 * lineagescope trace ./etl Load_Orders --direction up
 * }</pre>
 */
@Command(
    name = "lineagescope",
    mixinStandardHelpOptions = true,
    version = "LineageScope 1.0.0-SNAPSHOT",
    description = "Data lineage extraction for ETL repositories",
    subcommands = {
        ScanCommand.class,
        TraceCommand.class,
        ListCommand.class
    }
)
public class LineageScopeCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors",
        scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("LineageScope - Data lineage extraction for ETL repositories");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'lineagescope --help' to see available commands");
    }

    /**
     * Sets the root Logback level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        LineageScopeCLI cli = new LineageScopeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
