package com.lineagescope.core.lineage;

import com.lineagescope.core.model.Component;
import com.lineagescope.core.model.DataFlow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Queryable, immutable view of the edges of one extraction run.
 *
 * <p>Adjacency is computed once at construction; every query is a single hop, so
 * cycles and self-loops need no special handling. Edges whose endpoints are not
 * among the graph's components are left out.
 */
public final class LineageGraph {

    private final Set<String> componentIds;
    private final List<DataFlow> flows;
    private final Map<String, List<DataFlow>> outgoing;
    private final Map<String, List<DataFlow>> incoming;

    private LineageGraph(Set<String> componentIds, List<DataFlow> flows) {
        this.componentIds = componentIds;
        this.flows = flows;
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
        for (DataFlow flow : flows) {
            outgoing.computeIfAbsent(flow.sourceComponentId(), id -> new ArrayList<>()).add(flow);
            incoming.computeIfAbsent(flow.targetComponentId(), id -> new ArrayList<>()).add(flow);
        }
    }

    /**
     * Builds a graph over the given components.
     *
     * @param components graph nodes
     * @param flows edges, typically {@link FlowInferenceResult#flows()}
     * @return the graph
     */
    public static LineageGraph build(Collection<Component> components, List<DataFlow> flows) {
        Set<String> ids = new LinkedHashSet<>();
        components.forEach(component -> ids.add(component.id()));
        List<DataFlow> kept = flows.stream()
            .filter(flow -> ids.contains(flow.sourceComponentId()) && ids.contains(flow.targetComponentId()))
            .toList();
        return new LineageGraph(Set.copyOf(ids), kept);
    }

    public static LineageGraph empty() {
        return new LineageGraph(Set.of(), List.of());
    }

    /**
     * Returns the distinct direct predecessors of a component.
     *
     * @param componentId component id
     * @return upstream component ids in edge order, empty for unknown ids
     */
    public List<String> upstream(String componentId) {
        Set<String> ids = new LinkedHashSet<>();
        flowsTo(componentId).forEach(flow -> ids.add(flow.sourceComponentId()));
        return List.copyOf(ids);
    }

    /**
     * Returns the distinct direct successors of a component.
     *
     * @param componentId component id
     * @return downstream component ids in edge order, empty for unknown ids
     */
    public List<String> downstream(String componentId) {
        Set<String> ids = new LinkedHashSet<>();
        flowsFrom(componentId).forEach(flow -> ids.add(flow.targetComponentId()));
        return List.copyOf(ids);
    }

    public List<DataFlow> flowsFrom(String componentId) {
        return List.copyOf(outgoing.getOrDefault(componentId, List.of()));
    }

    public List<DataFlow> flowsTo(String componentId) {
        return List.copyOf(incoming.getOrDefault(componentId, List.of()));
    }

    /**
     * Components nothing flows into.
     *
     * @param components candidate components, usually the model's
     * @return ids of components without incoming edges
     */
    public List<String> roots(Collection<Component> components) {
        return components.stream()
            .map(Component::id)
            .filter(componentIds::contains)
            .filter(id -> !incoming.containsKey(id))
            .toList();
    }

    /**
     * Components nothing flows out of.
     *
     * @param components candidate components, usually the model's
     * @return ids of components without outgoing edges
     */
    public List<String> leaves(Collection<Component> components) {
        return components.stream()
            .map(Component::id)
            .filter(componentIds::contains)
            .filter(id -> !outgoing.containsKey(id))
            .toList();
    }

    public boolean contains(String componentId) {
        return componentIds.contains(componentId);
    }

    public List<DataFlow> flows() {
        return flows;
    }

    public int edgeCount() {
        return flows.size();
    }
}
