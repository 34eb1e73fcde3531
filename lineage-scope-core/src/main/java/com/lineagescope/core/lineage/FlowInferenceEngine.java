package com.lineagescope.core.lineage;

import com.lineagescope.core.builder.ExplicitFlowTuple;
import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.ComponentRole;
import com.lineagescope.core.model.DataFlow;
import com.lineagescope.core.model.FlowProvenance;
import com.lineagescope.core.model.FlowType;
import com.lineagescope.core.model.Process;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers lineage edges between components from three evidence sources.
 *
 * <p><b>Passes</b>, in descending trust:
 * <ol>
 *   <li><b>Explicit:</b> connections declared by the adapter, resolved by component
 *       name inside their process. Names that do not resolve are counted and
 *       skipped.</li>
 *   <li><b>Dataset match:</b> a component writing dataset {@code d} is connected to
 *       every component reading {@code d}. When several components write {@code d},
 *       the last one in process order is the producer. Matching is scoped to one
 *       process unless cross-process matching is enabled.</li>
 *   <li><b>Role heuristic:</b> always runs. Per process, the first source feeds the
 *       first transform, transforms are chained in encounter order, the last
 *       transform feeds every sink, and a lookup feeds every join whose
 *       transformation text or parameters mention the lookup's name.</li>
 * </ol>
 *
 * <p>Edges are deduplicated by (source, target). The edge with the highest
 * provenance survives; on a tie the first one emitted does. Self-loops are kept.
 *
 * <p>The engine is stateless apart from its configuration and is safe to share.
 */
public class FlowInferenceEngine {

    private static final Logger log = LoggerFactory.getLogger(FlowInferenceEngine.class);

    private final boolean crossProcess;

    public FlowInferenceEngine() {
        this(false);
    }

    /**
     * @param crossProcess whether dataset matching spans process boundaries
     */
    public FlowInferenceEngine(boolean crossProcess) {
        this.crossProcess = crossProcess;
    }

    public boolean isCrossProcess() {
        return crossProcess;
    }

    /**
     * Infers edges without declared connections.
     *
     * @param processes processes in merge order
     * @param components components in merge order
     * @return inferred edges and counters
     */
    public FlowInferenceResult infer(List<Process> processes, List<Component> components) {
        return infer(processes, components, Map.of());
    }

    /**
     * Infers edges for one extraction run.
     *
     * @param processes processes in merge order
     * @param components components in merge order
     * @param explicitFlows declared connections keyed by process id
     * @return inferred edges and counters
     */
    public FlowInferenceResult infer(
            List<Process> processes,
            List<Component> components,
            Map<String, List<ExplicitFlowTuple>> explicitFlows) {

        Map<String, List<Component>> byProcess = groupByProcess(processes, components);
        List<DataFlow> emitted = new ArrayList<>();

        int unresolved = explicitPass(byProcess, explicitFlows, emitted);
        int unmatched = datasetPass(byProcess, components, emitted);
        rolePass(byProcess, emitted);

        Set<String> knownIds = new HashSet<>();
        components.forEach(component -> knownIds.add(component.id()));

        Map<EdgeKey, DataFlow> kept = new LinkedHashMap<>();
        int dangling = 0;
        for (DataFlow flow : emitted) {
            boolean valid = knownIds.contains(flow.sourceComponentId())
                && knownIds.contains(flow.targetComponentId());
            assert valid : "Inferred edge references unknown component: " + flow;
            if (!valid) {
                dangling++;
                continue;
            }
            EdgeKey key = new EdgeKey(flow.sourceComponentId(), flow.targetComponentId());
            DataFlow existing = kept.get(key);
            if (existing == null || flow.provenance().outranks(existing.provenance())) {
                kept.put(key, flow);
            }
        }

        log.debug("Inferred {} edges from {} candidates ({} unresolved references, {} unmatched datasets)",
            kept.size(), emitted.size(), unresolved, unmatched);

        return new FlowInferenceResult(new ArrayList<>(kept.values()), unresolved, unmatched, dangling);
    }

    // ==================== Pass A: declared connections ====================

    private int explicitPass(
            Map<String, List<Component>> byProcess,
            Map<String, List<ExplicitFlowTuple>> explicitFlows,
            List<DataFlow> out) {

        int unresolved = 0;
        for (Map.Entry<String, List<ExplicitFlowTuple>> entry : explicitFlows.entrySet()) {
            Map<String, Component> byName = indexByName(byProcess.getOrDefault(entry.getKey(), List.of()));

            for (ExplicitFlowTuple tuple : entry.getValue()) {
                Component source = byName.get(tuple.sourceName());
                Component target = byName.get(tuple.targetName());
                if (source == null || target == null) {
                    log.debug("Unresolved connection {} -> {} in process {}",
                        tuple.sourceName(), tuple.targetName(), entry.getKey());
                    unresolved++;
                    continue;
                }
                out.add(new DataFlow(source.id(), target.id(), tuple.datasetName(),
                    FlowType.fromString(tuple.flowType()), FlowProvenance.EXPLICIT));
            }
        }
        return unresolved;
    }

    // ==================== Pass B: dataset match ====================

    private int datasetPass(Map<String, List<Component>> byProcess, List<Component> components, List<DataFlow> out) {
        if (crossProcess) {
            List<Component> ordered = new ArrayList<>();
            byProcess.values().forEach(ordered::addAll);
            return matchDatasets(ordered, out);
        }
        int unmatched = 0;
        for (List<Component> scope : byProcess.values()) {
            unmatched += matchDatasets(scope, out);
        }
        return unmatched;
    }

    private int matchDatasets(List<Component> scope, List<DataFlow> out) {
        Map<String, Component> producerOf = new LinkedHashMap<>();
        Map<String, List<Component>> consumersOf = new LinkedHashMap<>();

        for (Component component : scope) {
            for (String dataset : component.outputDatasetNames()) {
                if (!dataset.isBlank()) {
                    producerOf.put(dataset, component);
                }
            }
            for (String dataset : component.inputDatasetNames()) {
                if (!dataset.isBlank()) {
                    consumersOf.computeIfAbsent(dataset, d -> new ArrayList<>()).add(component);
                }
            }
        }

        for (Map.Entry<String, Component> entry : producerOf.entrySet()) {
            Component producer = entry.getValue();
            for (Component consumer : consumersOf.getOrDefault(entry.getKey(), List.of())) {
                out.add(new DataFlow(producer.id(), consumer.id(), entry.getKey(),
                    FlowType.DATA, FlowProvenance.DATASET_MATCH));
            }
        }

        int unmatched = 0;
        for (String dataset : consumersOf.keySet()) {
            if (!producerOf.containsKey(dataset)) {
                unmatched++;
            }
        }
        return unmatched;
    }

    // ==================== Pass C: role heuristic ====================

    private void rolePass(Map<String, List<Component>> byProcess, List<DataFlow> out) {
        for (List<Component> scope : byProcess.values()) {
            List<Component> sources = new ArrayList<>();
            List<Component> transforms = new ArrayList<>();
            List<Component> sinks = new ArrayList<>();
            List<Component> lookups = new ArrayList<>();
            List<Component> joins = new ArrayList<>();

            for (Component component : scope) {
                ComponentRole role = component.role();
                if (role == ComponentRole.SOURCE) {
                    sources.add(component);
                } else if (role == ComponentRole.SINK) {
                    sinks.add(component);
                } else if (role == ComponentRole.LOOKUP) {
                    lookups.add(component);
                }
                if (role.isTransforming()) {
                    transforms.add(component);
                }
                if (role == ComponentRole.JOIN) {
                    joins.add(component);
                }
            }

            if (!sources.isEmpty() && !transforms.isEmpty()) {
                out.add(heuristic(sources.get(0), transforms.get(0), FlowType.DATA));
            }
            for (int i = 1; i < transforms.size(); i++) {
                out.add(heuristic(transforms.get(i - 1), transforms.get(i), FlowType.DATA));
            }
            if (!transforms.isEmpty()) {
                Component last = transforms.get(transforms.size() - 1);
                for (Component sink : sinks) {
                    out.add(heuristic(last, sink, FlowType.DATA));
                }
            }
            for (Component lookup : lookups) {
                for (Component join : joins) {
                    if (mentions(join, lookup.name())) {
                        out.add(heuristic(lookup, join, FlowType.LOOKUP));
                    }
                }
            }
        }
    }

    private static boolean mentions(Component join, String name) {
        if (join.transformationText() != null && join.transformationText().contains(name)) {
            return true;
        }
        return join.parameters().toString().contains(name);
    }

    private static DataFlow heuristic(Component source, Component target, FlowType type) {
        return new DataFlow(source.id(), target.id(), null, type, FlowProvenance.ROLE_HEURISTIC);
    }

    // ==================== Helpers ====================

    private static Map<String, List<Component>> groupByProcess(List<Process> processes, List<Component> components) {
        Map<String, List<Component>> byProcess = new LinkedHashMap<>();
        for (Process process : processes) {
            byProcess.put(process.id(), new ArrayList<>());
        }
        for (Component component : components) {
            byProcess.computeIfAbsent(component.processId(), id -> new ArrayList<>()).add(component);
        }
        return byProcess;
    }

    private static Map<String, Component> indexByName(List<Component> scope) {
        Map<String, Component> byName = new LinkedHashMap<>();
        for (Component component : scope) {
            byName.putIfAbsent(component.name(), component);
        }
        return byName;
    }

    private record EdgeKey(String source, String target) {
    }
}
