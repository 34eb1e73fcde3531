package com.lineagescope.core.scanner.impl.hadoop;

import com.lineagescope.core.builder.NormalizedUnit;
import com.lineagescope.core.builder.ScanUnit;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.SystemType;
import com.lineagescope.core.scanner.AdapterResult;
import com.lineagescope.core.scanner.ScanContext;
import com.lineagescope.core.scanner.base.AbstractRegexAdapter;
import com.lineagescope.core.scanner.base.SparkCodePatterns;
import com.lineagescope.core.scanner.base.SqlPatterns;
import com.lineagescope.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads Spark jobs (PySpark or Scala) kept in a workflow's {@code spark/} directory.
 *
 * <p>Like Hive scripts, each job becomes one unit of its workflow's process (see
 * {@link WorkflowLayout}) and merges with the Oozie {@code spark} action of the same
 * name. Datasets, operations and the first {@code StructType} schema come from
 * {@link SparkCodePatterns}.
 */
public class SparkScriptAdapter extends AbstractRegexAdapter {

    public static final String ADAPTER_ID = "spark-script";

    static final String ROLE_HINT = "spark";

    @Override
    public String getId() {
        return ADAPTER_ID;
    }

    @Override
    public String getDisplayName() {
        return "Spark Script Adapter";
    }

    @Override
    public SystemType getSystem() {
        return SystemType.HADOOP;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/spark/*.py", "**/spark/**/*.py", "**/spark/*.scala", "**/spark/**/*.scala");
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public Map<String, ComponentRole> getRoleAliases() {
        return Map.of(ROLE_HINT, ComponentRole.TRANSFORM);
    }

    @Override
    public AdapterResult parse(Path file, ScanContext context) throws IOException {
        String code = readFileContent(file);
        String relativeName = context.relativeName(file);
        List<String> warnings = new ArrayList<>();

        SqlPatterns.TableReferences datasets = SparkCodePatterns.datasetReferences(code);
        if (datasets.isEmpty()) {
            warnings.add("No dataset references found in " + relativeName);
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("script", relativeName);
        parameters.put("language", relativeName.endsWith(".scala") ? "scala" : "python");
        List<String> operations = SparkCodePatterns.operations(code);
        if (!operations.isEmpty()) {
            parameters.put("operations", String.join(", ", operations));
        }

        NormalizedUnit unit = new NormalizedUnit(
            FileUtils.getBaseName(file),
            ROLE_HINT,
            datasets.reads(),
            datasets.writes(),
            SparkCodePatterns.schema(code),
            code,
            parameters
        );

        ScanUnit workflow = new ScanUnit(
            WorkflowLayout.scanIdentifier(file, context),
            WorkflowLayout.workflowName(file, context),
            SystemType.HADOOP,
            ProcessType.WORKFLOW,
            Map.of(),
            WorkflowLayout.relativeDirectory(file, context),
            List.of(unit),
            List.of()
        );
        log.debug("Spark job {}: reads {}, writes {}", unit.name(), datasets.reads(), datasets.writes());
        return result(List.of(workflow), warnings);
    }
}
