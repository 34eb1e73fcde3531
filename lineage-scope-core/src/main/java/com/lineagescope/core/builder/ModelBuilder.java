package com.lineagescope.core.builder;

import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.Process;
import com.lineagescope.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns adapter output into {@link Process} and {@link Component} instances.
 *
 * <p>Ids are content-derived: a process id is a function of its scan identifier and
 * name, a component id of its process id and name. Building the same input twice,
 * in any order or on any thread, yields the same ids.
 */
public class ModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModelBuilder.class);

    /** Metadata key holding the role hint a component was classified from. */
    public static final String ROLE_HINT_KEY = "roleHint";

    private final RoleResolver roleResolver;

    public ModelBuilder() {
        this(RoleResolver.defaults());
    }

    public ModelBuilder(RoleResolver roleResolver) {
        this.roleResolver = Objects.requireNonNull(roleResolver, "roleResolver must not be null");
    }

    /**
     * Creates the process for a scan unit, with no component ids yet.
     *
     * @param scanUnit top-level definition
     * @return process with a content-derived id
     */
    public Process buildProcess(ScanUnit scanUnit) {
        String id = IdGenerator.generate(scanUnit.scanIdentifier(), scanUnit.name());
        return new Process(
            id,
            scanUnit.name(),
            scanUnit.system(),
            scanUnit.type(),
            List.of(),
            scanUnit.parameters(),
            scanUnit.sourcePath()
        );
    }

    /**
     * Creates the component for one normalized unit of a process.
     *
     * @param unit normalized unit
     * @param process owning process
     * @return immutable component with a content-derived id
     */
    public Component buildComponent(NormalizedUnit unit, Process process) {
        String id = IdGenerator.generate(process.id(), unit.name());
        ComponentRole role = roleResolver.resolve(unit.roleHint());

        Map<String, String> metadata = new HashMap<>();
        if (unit.roleHint() != null) {
            metadata.put(ROLE_HINT_KEY, unit.roleHint());
        }

        return new Component(
            id,
            unit.name(),
            role,
            unit.inputDatasets(),
            unit.outputDatasets(),
            unit.schema(),
            unit.transformationText(),
            process.id(),
            unit.parameters(),
            metadata
        );
    }

    /**
     * Builds a process and all of its components.
     *
     * <p>Component ids are appended to the process in encounter order. Units whose
     * names repeat inside the scan unit map to the same id; the first one is kept.
     *
     * @param scanUnit top-level definition
     * @return the process, its components and its declared connections
     */
    public ProcessExtraction build(ScanUnit scanUnit) {
        Process process = buildProcess(scanUnit);
        Map<String, Component> components = new LinkedHashMap<>();

        for (NormalizedUnit unit : scanUnit.units()) {
            Component component = buildComponent(unit, process);
            if (components.putIfAbsent(component.id(), component) != null) {
                log.debug("Duplicate component '{}' in process '{}', keeping first definition",
                    unit.name(), process.name());
                continue;
            }
            process = process.withComponentId(component.id());
        }

        return new ProcessExtraction(process, new ArrayList<>(components.values()), scanUnit.explicitFlows());
    }
}
