package com.lineagescope.core.scanner.impl.abinitio;

import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.RoleResolver;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.Schema;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.parser.BlockScan;
import com.lineagescope.core.parser.BreadcrumbPolicy;
import com.lineagescope.core.parser.ParameterBlockDecoder;
import com.lineagescope.core.parser.StructuralBlock;
import com.lineagescope.core.parser.StructuralBlockParser;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.base.AbstractRegexAdapter;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Reads Ab Initio graph files ({@code .mp}).
 *
 * <p>A graph file is a flat sequence of pipe-delimited, brace-nested records. Each
 * top-level record whose parameter section carries a {@code !prototype_path} is a
 * component; the prototype's file stem ({@code Input_File}, {@code Reformat}, ...)
 * is its role hint. Records of the graph group ({@code 0} by default) describe
 * subgraph nesting and feed the hierarchy breadcrumb attached to every later
 * component as the {@code subgraph_hierarchy} parameter.
 *
 * <p>Adapter settings ({@code adapters.config.abinitio-graph} in
 * {@code lineagescope.yaml}):
 * <ul>
 *   <li>{@code graphGroupKey} (default {@code "0"})</li>
 *   <li>{@code breadcrumbFieldIndex} (default {@code 8})</li>
 *   <li>{@code breadcrumbExclude} (default {@code ["@@@1"]})</li>
 * </ul>
 */
public class AbInitioGraphAdapter extends AbstractRegexAdapter {

    public static final String ADAPTER_ID = "abinitio-graph";

    static final String PROTOTYPE_PARAMETER = "prototype_path";
    static final String LAYOUT_PARAMETER = "layout";
    static final String HIERARCHY_PARAMETER = "subgraph_hierarchy";
    static final String GRAPH_ID_PARAMETER = "graph_id";
    static final String NAME_MARKER = "Ab Initio Software";

    private static final String DEFAULT_GRAPH_GROUP = "0";
    private static final int DEFAULT_BREADCRUMB_FIELD = 8;
    private static final int DEFAULT_NAME_FIELD = 8;
    private static final List<String> DEFAULT_BREADCRUMB_EXCLUDE = List.of("@@@1");
    private static final List<String> RECORD_FORMAT_PARAMETERS = List.of("record_format", "dml", LAYOUT_PARAMETER);
    private static final List<String> TRANSFORM_PARAMETERS = List.of("transform", "select_expr", "key");

    private static final Pattern CONNECTION = Pattern.compile("\\b(\\w+)(?:\\.out\\w*)?\\s*->\\s*(\\w+)");
    private static final Pattern GRAPH_PARAMETER = Pattern.compile("\\bparameter\\s+(\\w+)\\s*=\\s*\"([^\"]*)\"");

    private final DmlSchemaParser dmlParser = new DmlSchemaParser();

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Ab Initio Graph Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.ABINITIO;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*.mp");
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(
            "Input_File", ComponentRole.SOURCE,
            "Input_Table", ComponentRole.SOURCE,
            "Output_File", ComponentRole.SINK,
            "Output_Table", ComponentRole.SINK,
            "Lookup_File", ComponentRole.LOOKUP,
            "Join", ComponentRole.JOIN,
            "Merge", ComponentRole.JOIN,
            "Rollup", ComponentRole.TRANSFORM,
            "Scan", ComponentRole.TRANSFORM,
            "Dedup_Sorted", ComponentRole.TRANSFORM
        );
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        String content = readFileContent(file);

        StructuralBlockParser parser = new StructuralBlockParser(
            StructuralBlockParser.DEFAULT_OPEN, StructuralBlockParser.DEFAULT_CLOSE,
            context.options().quoteAwareBlocks());
        ParameterBlockDecoder decoder = new ParameterBlockDecoder(parser, ParameterBlockDecoder.DEFAULT_SECTION_MARKER);
        RoleResolver roles = RoleResolver.withAliases(getRoleAliases());

        BlockScan scan = parser.scan(content);
        List<StructuralBlock> blocks = parser.decompose(scan.spans(), breadcrumbPolicy(context));
        List<String> warnings = new ArrayList<>(scan.warnings());

        List<NormalizedUnit> units = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            StructuralBlock block = blocks.get(i);
            Map<String, String> parameters = decoder.decodeAsMap(block.text());
            String prototype = parameters.get(PROTOTYPE_PARAMETER);
            if (prototype == null || prototype.isBlank()) {
                continue;
            }
            units.add(toUnit(block, i, parameters, componentType(prototype), parser, roles));
        }

        List<ExplicitFlowTuple> connections = new ArrayList<>();
        for (MatchResult match : findMatches(CONNECTION, content)) {
            connections.add(new ExplicitFlowTuple(match.group(1), match.group(2), null, "data"));
        }

        Map<String, String> graphParameters = new LinkedHashMap<>();
        for (MatchResult match : findMatches(GRAPH_PARAMETER, content)) {
            graphParameters.put(match.group(1), match.group(2));
        }
        graphParameters.put("block_count", String.valueOf(blocks.size()));

        String name = FileUtils.getBaseName(file);
        log.debug("Graph {}: {} blocks, {} components, {} connections",
            name, blocks.size(), units.size(), connections.size());

        ScanUnit graph = new ScanUnit(
            scanIdentifier(context, file),
            name,
            SystemType.ABINITIO,
            ProcessType.GRAPH,
            graphParameters,
            context.relativeName(file),
            units,
            connections
        );
        return result(List.of(graph), warnings);
    }

    private NormalizedUnit toUnit(
            StructuralBlock block,
            int blockIndex,
            Map<String, String> decoded,
            String componentType,
            StructuralBlockParser parser,
            RoleResolver roles) {

        String name = componentName(block.trailer(), parser);
        if (name.isEmpty()) {
            name = componentType + "_" + blockIndex;
            log.debug("Block {} has no component name, using {}", blockIndex, name);
        }

        Map<String, String> parameters = new LinkedHashMap<>(decoded);
        parameters.put(HIERARCHY_PARAMETER, block.hierarchyPath());
        parameters.put(GRAPH_ID_PARAMETER, block.groupKey());

        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        String layout = decoded.get(LAYOUT_PARAMETER);
        if (layout != null && !layout.isBlank() && !dmlParser.isRecordFormat(layout)) {
            ComponentRole role = roles.resolve(componentType);
            if (role == ComponentRole.SOURCE || role == ComponentRole.LOOKUP) {
                inputs.add(layout);
            } else if (role == ComponentRole.SINK) {
                outputs.add(layout);
            }
        }

        return new NormalizedUnit(
            name,
            componentType,
            inputs,
            outputs,
            schemaOf(decoded),
            firstPresent(decoded, TRANSFORM_PARAMETERS),
            parameters
        );
    }

    private Schema schemaOf(Map<String, String> parameters) {
        for (String key : RECORD_FORMAT_PARAMETERS) {
            String value = parameters.get(key);
            if (dmlParser.isRecordFormat(value)) {
                return dmlParser.parse(value).orElse(null);
            }
        }
        return null;
    }

    /**
     * Derives the component type from a prototype path such as
     * {@code /components/Input_File.mdc}.
     */
    static String componentType(String prototypePath) {
        String path = prototypePath.trim();
        String last = path.substring(path.lastIndexOf('/') + 1);
        int dot = last.indexOf('.');
        return dot > 0 ? last.substring(0, dot) : last;
    }

    /**
     * Reads the component name from a block trailer: the field before the vendor
     * marker, else the field at the default name position, else the first field.
     */
    static String componentName(String trailer, StructuralBlockParser parser) {
        if (trailer == null || trailer.isBlank()) {
            return "";
        }
        String stripped = trailer.strip().replaceAll("^[@{}]+|[@{}]+$", "");
        List<String> fields = parser.splitFields(stripped);

        for (int i = 1; i < fields.size(); i++) {
            if (NAME_MARKER.equals(fields.get(i).trim())) {
                return fields.get(i - 1).trim();
            }
        }
        if (fields.size() > DEFAULT_NAME_FIELD) {
            return fields.get(DEFAULT_NAME_FIELD).trim();
        }
        return fields.isEmpty() ? "" : fields.get(0).trim();
    }

    private BreadcrumbPolicy breadcrumbPolicy(ScanContext context) {
        Object groupKey = context.<Object>getConfigOrDefault(ADAPTER_ID, "graphGroupKey", DEFAULT_GRAPH_GROUP);
        Object fieldIndex = context.<Object>getConfigOrDefault(ADAPTER_ID, "breadcrumbFieldIndex", DEFAULT_BREADCRUMB_FIELD);
        Object excluded = context.<Object>getConfigOrDefault(ADAPTER_ID, "breadcrumbExclude", DEFAULT_BREADCRUMB_EXCLUDE);

        Set<String> labels = new HashSet<>();
        if (excluded instanceof Collection<?> values) {
            values.forEach(label -> labels.add(String.valueOf(label)));
        } else {
            labels.add(String.valueOf(excluded));
        }
        int index = fieldIndex instanceof Number number
            ? number.intValue()
            : Integer.parseInt(String.valueOf(fieldIndex).trim());
        return new BreadcrumbPolicy(String.valueOf(groupKey), index, labels, BreadcrumbPolicy.DEFAULT_SEPARATOR);
    }

    private static String firstPresent(Map<String, String> parameters, List<String> keys) {
        for (String key : keys) {
            String value = parameters.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
