package com.lineagescope.cli;

import com.lineagescope.core.lineage.LineageGraph;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.LineageModel;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.ScanOrchestrator;
import com.lineagescope.core.scanner.ScanOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to show the direct upstream and downstream neighbours of a component.
 *
 * <p>The component is looked up by id first, then by name. A name shared by components
 * of several processes traces each of them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * lineagescope trace ./etl Load_Orders --direction up
 * }</pre>
 */
@Command(
    name = "trace",
    description = "Show the direct neighbours of a component",
    mixinStandardHelpOptions = true
)
public class TraceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TraceCommand.class);

    /**
     * Which neighbours to show.
     */
    public enum Direction {
        UP, DOWN, BOTH
    }

    @Parameters(index = "0", description = "Directory to scan")
    private Path projectPath;

    @Parameters(index = "1", description = "Component id or name")
    private String component;

    @Option(
        names = {"-d", "--direction"},
        description = "up, down or both (default: ${DEFAULT-VALUE})",
        defaultValue = "BOTH",
        converter = DirectionConverter.class
    )
    private Direction direction;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configPath;

    @Override
    public Integer call() {
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            ScanContext context = ScanCommand.loadConfiguration(root, configPath).toScanContext(root);
            ScanOutcome outcome = ScanOrchestrator.withDiscoveredAdapters().scan(context);
            LineageModel model = outcome.model();

            List<Component> matches = resolve(model);
            if (matches.isEmpty()) {
                System.err.println("✗ Unknown component: " + component);
                return 1;
            }
            for (Component match : matches) {
                print(match, model, outcome.graph());
            }
            return 0;

        } catch (Exception e) {
            log.error("Trace failed", e);
            System.err.println("✗ Trace failed: " + e.getMessage());
            return 1;
        }
    }

    private List<Component> resolve(LineageModel model) {
        Optional<Component> byId = model.findComponent(component);
        if (byId.isPresent()) {
            return List.of(byId.get());
        }
        return model.findComponentsByName(component);
    }

    private void print(Component target, LineageModel model, LineageGraph graph) {
        System.out.println(target.name() + " [" + target.role() + "] (" + target.id() + ")");
        if (direction != Direction.DOWN) {
            System.out.println("  Upstream:");
            printFlows(graph.flowsTo(target.id()), true, model);
        }
        if (direction != Direction.UP) {
            System.out.println("  Downstream:");
            printFlows(graph.flowsFrom(target.id()), false, model);
        }
        System.out.println();
    }

    private void printFlows(List<DataFlow> flows, boolean upstream, LineageModel model) {
        if (flows.isEmpty()) {
            System.out.println("    (none)");
            return;
        }
        for (DataFlow flow : flows) {
            String neighbourId = upstream ? flow.sourceComponentId() : flow.targetComponentId();
            String neighbour = model.findComponent(neighbourId).map(Component::name).orElse(neighbourId);
            List<String> details = new ArrayList<>();
            details.add(flow.flowType().name());
            details.add(flow.provenance().name());
            if (flow.datasetName() != null) {
                details.add(flow.datasetName());
            }
            System.out.println("    " + (upstream ? "← " : "→ ") + neighbour + " " + details);
        }
    }

    /**
     * Accepts directions in any case.
     */
    static class DirectionConverter implements ITypeConverter<Direction> {
        @Override
        public Direction convert(String value) {
            return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
