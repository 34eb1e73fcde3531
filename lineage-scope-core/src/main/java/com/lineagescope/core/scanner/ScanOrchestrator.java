package com.lineagescope.core.scanner;

import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.builder.ModelBuilder;
import com.lineagescope.core.builder.ProcessExtraction;
import com.lineagescope.core.builder.RoleResolver;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.lineage.FlowInferenceEngine;
import com.lineagescope.core.lineage.FlowInferenceResult;
import com.lineagescope.core.lineage.LineageGraph;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.LineageModel;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a whole scan: file discovery, parallel parsing, merge and lineage inference.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>List files under the root in sorted order and assign each one to the first
 *       enabled adapter, by ascending priority, whose patterns match it</li>
 *   <li>Parse every file in its own task. Tasks share nothing and each returns a
 *       {@link FileScanResult}; a failing file is recorded and never stops the scan</li>
 *   <li>Merge results on the calling thread in discovery order, so the model does not
 *       depend on which task finished first</li>
 *   <li>Run the {@link FlowInferenceEngine} and build the {@link LineageGraph}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanOrchestrator orchestrator = ScanOrchestrator.withDiscoveredAdapters();
 * ScanOutcome outcome = orchestrator.scan(ScanContext.of(Path.of("pipelines")));
 * }</pre>
 */
public class ScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    /** Component metadata key holding the root-relative file that defined the component. */
    public static final String SOURCE_FILE_KEY = "sourceFile";

    private final List<FormatAdapter> adapters;

    /**
     * @param adapters candidate adapters, in any order
     */
    public ScanOrchestrator(List<FormatAdapter> adapters) {
        Objects.requireNonNull(adapters, "adapters must not be null");
        List<FormatAdapter> sorted = new ArrayList<>(adapters);
        sorted.sort(Comparator.comparingInt(FormatAdapter::getPriority).thenComparing(FormatAdapter::getId));
        this.adapters = List.copyOf(sorted);
    }

    /**
     * Creates an orchestrator over every adapter registered via SPI.
     *
     * @return orchestrator
     */
    public static ScanOrchestrator withDiscoveredAdapters() {
        return new ScanOrchestrator(discoverAdapters());
    }

    /**
     * Discovers all available adapters via SPI, sorted by priority.
     *
     * @return adapters
     */
    public static List<FormatAdapter> discoverAdapters() {
        List<FormatAdapter> discovered = new ArrayList<>();
        ServiceLoader.load(FormatAdapter.class).forEach(discovered::add);
        discovered.sort(Comparator.comparingInt(FormatAdapter::getPriority).thenComparing(FormatAdapter::getId));
        log.debug("Discovered {} format adapters", discovered.size());
        return discovered;
    }

    public List<FormatAdapter> getAdapters() {
        return adapters;
    }

    /**
     * Scans the context's root directory.
     *
     * <p>Never throws for file-level problems: unreadable roots, unparseable files and
     * timeouts all end up in the returned report.
     *
     * @param context scan context
     * @return model, graph and report
     */
    public ScanOutcome scan(ScanContext context) {
        ScanOptions options = context.options();
        List<ScanWarning> warnings = new ArrayList<>();
        ScanStatistics.Builder statistics = new ScanStatistics.Builder();

        List<FormatAdapter> active = adapters.stream()
            .filter(adapter -> options.isAdapterEnabled(adapter.getId()))
            .toList();
        log.info("Scanning {} with {} adapter(s)", context.rootPath(), active.size());

        List<Assignment> assignments = discover(context, active, warnings);
        statistics.filesDiscovered(assignments.size());
        if (assignments.isEmpty()) {
            warnings.add(ScanWarning.global("No candidate files found under " + context.rootPath()));
        }

        List<FileScanResult> results = dispatch(assignments, context, warnings, statistics);
        return merge(context, results, warnings, statistics);
    }

    // ==================== Discovery ====================

    private List<Assignment> discover(ScanContext context, List<FormatAdapter> active, List<ScanWarning> warnings) {
        Path root = context.rootPath();
        if (!Files.isDirectory(root)) {
            warnings.add(ScanWarning.global("Scan root is not a directory: " + root));
            return List.of();
        }

        List<Path> files;
        try {
            files = FileUtils.listFiles(root);
        } catch (IOException e) {
            log.warn("Failed to list files under {}: {}", root, e.getMessage());
            warnings.add(ScanWarning.global("Failed to list files: " + e.getMessage()));
            return List.of();
        }

        List<Assignment> assignments = new ArrayList<>();
        for (Path file : files) {
            Path relative = root.relativize(file);
            if (FileUtils.matchesAny(relative, context.options().excludePatterns())) {
                continue;
            }
            for (FormatAdapter adapter : active) {
                if (adapter.supports(relative)) {
                    assignments.add(new Assignment(file, context.relativeName(file), adapter));
                    break;
                }
            }
        }

        log.debug("Discovered {} candidate files among {} files", assignments.size(), files.size());
        return assignments;
    }

    // ==================== Parsing ====================

    private List<FileScanResult> dispatch(
            List<Assignment> assignments,
            ScanContext context,
            List<ScanWarning> warnings,
            ScanStatistics.Builder statistics) {

        int threads = Math.min(context.options().parallelism(), Math.max(1, assignments.size()));
        if (threads <= 1 && context.options().timeoutSeconds() == 0) {
            List<FileScanResult> results = new ArrayList<>(assignments.size());
            for (Assignment assignment : assignments) {
                results.add(parseFile(assignment, context));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        try {
            List<Future<FileScanResult>> futures = new ArrayList<>(assignments.size());
            for (Assignment assignment : assignments) {
                futures.add(pool.submit(() -> parseFile(assignment, context)));
            }
            return collect(assignments, futures, context, warnings, statistics);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<FileScanResult> collect(
            List<Assignment> assignments,
            List<Future<FileScanResult>> futures,
            ScanContext context,
            List<ScanWarning> warnings,
            ScanStatistics.Builder statistics) {

        long timeoutSeconds = context.options().timeoutSeconds();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        List<FileScanResult> results = new ArrayList<>(futures.size());

        for (int i = 0; i < futures.size(); i++) {
            Assignment assignment = assignments.get(i);
            try {
                if (timeoutSeconds > 0) {
                    long remaining = Math.max(0, deadline - System.nanoTime());
                    results.add(futures.get(i).get(remaining, TimeUnit.NANOSECONDS));
                } else {
                    results.add(futures.get(i).get());
                }
            } catch (TimeoutException e) {
                log.warn("Scan timed out after {}s, abandoning {} unfinished file(s)",
                    timeoutSeconds, futures.size() - i);
                abandon(assignments, futures, i, "scan timeout of " + timeoutSeconds + "s reached", warnings, statistics);
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(assignments, futures, i, "scan interrupted", warnings, statistics);
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Failed to parse {}: {}", assignment.relativeName(), cause.getMessage());
                results.add(FileScanResult.failed(assignment.relativeName(), assignment.adapter().getId(),
                    describe(cause)));
            }
        }
        return results;
    }

    private void abandon(
            List<Assignment> assignments,
            List<Future<FileScanResult>> futures,
            int from,
            String reason,
            List<ScanWarning> warnings,
            ScanStatistics.Builder statistics) {

        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
            warnings.add(new ScanWarning(assignments.get(j).relativeName(), "Abandoned: " + reason));
            statistics.incrementFilesAbandoned();
        }
    }

    private FileScanResult parseFile(Assignment assignment, ScanContext context) {
        FormatAdapter adapter = assignment.adapter();
        try {
            log.debug("Parsing {} with {}", assignment.relativeName(), adapter.getId());
            AdapterResult result = adapter.parse(assignment.file(), context);

            ModelBuilder builder = new ModelBuilder(RoleResolver.withAliases(adapter.getRoleAliases()));
            List<ProcessExtraction> extractions = new ArrayList<>(result.scanUnits().size());
            for (ScanUnit unit : result.scanUnits()) {
                extractions.add(builder.build(unit));
            }
            return FileScanResult.success(assignment.relativeName(), adapter.getId(), extractions, result.warnings());
        } catch (Exception | Error e) {
            // Errors become failed files on both the sequential and the pooled path
            log.warn("Failed to parse {} with {}: {}", assignment.relativeName(), adapter.getId(), e.getMessage());
            log.debug("Parse failure details for {}", assignment.relativeName(), e);
            return FileScanResult.failed(assignment.relativeName(), adapter.getId(), describe(e));
        }
    }

    // ==================== Merge ====================

    private ScanOutcome merge(
            ScanContext context,
            List<FileScanResult> results,
            List<ScanWarning> warnings,
            ScanStatistics.Builder statistics) {

        Map<String, Process> processes = new LinkedHashMap<>();
        Map<String, Component> components = new LinkedHashMap<>();
        Map<String, List<ExplicitFlowTuple>> explicitFlows = new LinkedHashMap<>();
        List<String> parsedFiles = new ArrayList<>();
        List<String> failedFiles = new ArrayList<>();

        for (FileScanResult result : results) {
            result.warnings().forEach(message -> warnings.add(new ScanWarning(result.file(), message)));

            if (!result.isSuccess()) {
                failedFiles.add(result.file());
                warnings.add(new ScanWarning(result.file(), "Parse failed: " + result.error()));
                statistics.addFailure(errorType(result.error()), result.file() + ": " + result.error());
                continue;
            }

            parsedFiles.add(result.file());
            statistics.incrementFilesParsed();

            for (ProcessExtraction extraction : result.extractions()) {
                Process incoming = extraction.process();
                processes.merge(incoming.id(), incoming, ScanOrchestrator::mergeProcess);
                for (Component component : extraction.components()) {
                    components.merge(component.id(), component.withMetadata(SOURCE_FILE_KEY, result.file()),
                        Component::mergedWith);
                }
                if (!extraction.explicitFlows().isEmpty()) {
                    explicitFlows.computeIfAbsent(incoming.id(), id -> new ArrayList<>())
                        .addAll(extraction.explicitFlows());
                }
            }
        }

        List<Process> processList = new ArrayList<>(processes.values());
        List<Component> componentList = new ArrayList<>(components.values());

        FlowInferenceEngine engine = new FlowInferenceEngine(context.options().crossProcessLineage());
        FlowInferenceResult inference = engine.infer(processList, componentList, explicitFlows);
        statistics.unresolvedReferences(inference.unresolvedReferences());
        statistics.droppedDanglingEdges(inference.droppedDanglingEdges());

        LineageModel model = new LineageModel(context.scanName(), processList, componentList, inference.flows());
        LineageGraph graph = LineageGraph.build(componentList, inference.flows());
        ScanReport report = new ScanReport(parsedFiles, failedFiles, warnings, statistics.build());

        log.info("Scan complete: {} processes, {} components, {} flows ({})",
            processList.size(), componentList.size(), inference.flows().size(), report.statistics().getSummary());

        return new ScanOutcome(model, graph, report);
    }

    private static Process mergeProcess(Process existing, Process incoming) {
        Process merged = existing;
        for (String componentId : incoming.componentIds()) {
            merged = merged.withComponentId(componentId);
        }
        if (incoming.parameters().isEmpty()) {
            return merged;
        }
        Map<String, String> parameters = new HashMap<>(incoming.parameters());
        parameters.putAll(merged.parameters());
        return new Process(merged.id(), merged.name(), merged.system(), merged.type(),
            merged.componentIds(), parameters, merged.sourcePath());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static String errorType(String error) {
        int colon = error.indexOf(':');
        return colon > 0 ? error.substring(0, colon) : error;
    }

    private record Assignment(Path file, String relativeName, FormatAdapter adapter) {
    }

    private static final class ScanThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "lineage-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
