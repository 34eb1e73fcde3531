package com.lineagescope.core.builder;

import com.lineagescope.core.model.ProcessType;
import com.lineagescope.core.model.SystemType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One top-level definition (graph, workflow, script group) extracted by a format adapter.
 *
 * <p>The scan identifier and name fully determine the id of the resulting process, so
 * adapters that describe the same definition from different files (workflow XML and
 * the scripts it runs) can agree on one process by using the same pair.
 *
 * @param scanIdentifier stable identifier of the definition's location, e.g. {@code "hadoop:workflows/daily"}
 * @param name process name
 * @param system source technology
 * @param type kind of definition
 * @param parameters process-level parameters
 * @param sourcePath root-relative path of the file the unit came from, or null
 * @param units processing nodes in encounter order
 * @param explicitFlows declared connections between the units
 */
public record ScanUnit(
    String scanIdentifier,
    String name,
    SystemType system,
    ProcessType type,
    Map<String, String> parameters,
    String sourcePath,
    List<NormalizedUnit> units,
    List<ExplicitFlowTuple> explicitFlows
) {
    public ScanUnit {
        Objects.requireNonNull(scanIdentifier, "scanIdentifier must not be null");
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        units = units == null ? List.of() : List.copyOf(units);
        explicitFlows = explicitFlows == null ? List.of() : List.copyOf(explicitFlows);
    }
}
