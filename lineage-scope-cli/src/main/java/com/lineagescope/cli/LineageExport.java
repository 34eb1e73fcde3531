package com.lineagescope.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.LineageModel;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.model.Schema;
import com.lineagescope.core.scanner.ScanOutcome;
import com.lineagescope.core.scanner.ScanReport;
import com.lineagescope.core.scanner.ScanStatistics;
import com.lineagescope.core.scanner.ScanWarning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * JSON document written by {@code scan --output}.
 *
 * <p>Flat records mirroring the lineage model, so the file format does not change when
 * helper methods are added to the model types.
 */
public record LineageExport(
    String scanName,
    List<ProcessEntry> processes,
    List<ComponentEntry> components,
    List<FlowEntry> flows,
    ReportEntry report
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static LineageExport from(ScanOutcome outcome) {
        LineageModel model = outcome.model();
        return new LineageExport(
            model.scanName(),
            model.processes().stream().map(ProcessEntry::of).toList(),
            model.components().stream().map(ComponentEntry::of).toList(),
            model.flows().stream().map(FlowEntry::of).toList(),
            ReportEntry.of(outcome.report())
        );
    }

    /**
     * Writes the document, creating parent directories as needed.
     *
     * @param file target file
     * @throws IOException if the file cannot be written
     */
    public void write(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(file.toFile(), this);
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    public record ProcessEntry(
        String id,
        String name,
        String system,
        String type,
        List<String> componentIds,
        Map<String, String> parameters,
        String sourcePath
    ) {
        static ProcessEntry of(Process process) {
            return new ProcessEntry(process.id(), process.name(), process.system().name(), process.type().name(),
                process.componentIds(), process.parameters(), process.sourcePath());
        }
    }

    public record ComponentEntry(
        String id,
        String name,
        String role,
        String processId,
        List<String> inputDatasets,
        List<String> outputDatasets,
        List<FieldEntry> schema,
        Map<String, String> parameters,
        Map<String, String> metadata
    ) {
        static ComponentEntry of(Component component) {
            Schema schema = component.schema();
            List<FieldEntry> fields = schema == null ? null : schema.fields().stream().map(FieldEntry::of).toList();
            return new ComponentEntry(component.id(), component.name(), component.role().name(), component.processId(),
                component.inputDatasetNames(), component.outputDatasetNames(), fields,
                component.parameters(), component.metadata());
        }
    }

    public record FieldEntry(String name, String type, boolean nullable, Integer length) {
        static FieldEntry of(Schema.Field field) {
            return new FieldEntry(field.name(), field.type(), field.nullable(), field.lengthOrPrecision());
        }
    }

    public record FlowEntry(String source, String target, String dataset, String type, String provenance) {
        static FlowEntry of(DataFlow flow) {
            return new FlowEntry(flow.sourceComponentId(), flow.targetComponentId(), flow.datasetName(),
                flow.flowType().name(), flow.provenance().name());
        }
    }

    public record ReportEntry(
        int filesDiscovered,
        int filesParsed,
        int filesFailed,
        int filesAbandoned,
        int unresolvedReferences,
        int droppedDanglingEdges,
        List<String> failedFiles,
        List<String> warnings
    ) {
        static ReportEntry of(ScanReport report) {
            ScanStatistics statistics = report.statistics();
            return new ReportEntry(statistics.filesDiscovered(), statistics.filesParsed(), statistics.filesFailed(),
                statistics.filesAbandoned(), statistics.unresolvedReferences(), statistics.droppedDanglingEdges(),
                report.failedFiles(), report.warnings().stream().map(ScanWarning::toString).toList());
        }
    }
}
