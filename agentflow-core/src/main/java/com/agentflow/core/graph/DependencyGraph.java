package com.agentflow.core.graph;

import com.agentflow.core.model.WorkflowStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Step dependency graph for one workflow, as an adjacency list keyed by step id.
 *
 * Dependencies may name a step or give its id; names win when both match. Topological layers are
 * computed once with Kahn's algorithm, ties broken by definition order. A graph whose layers do not
 * cover every step contains a cycle, reported through {@link #cyclicSteps()}.
 */
public final class DependencyGraph {

    private final List<String> stepIds;
    private final Map<String, Integer> definitionIndex;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final List<UnresolvedDependency> unresolved;
    private final Set<String> selfDependent;
    private final List<List<String>> layers;
    private final List<String> cyclicSteps;

    private DependencyGraph(List<WorkflowStep> steps) {
        this.stepIds = new ArrayList<>();
        this.definitionIndex = new HashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();
        this.unresolved = new ArrayList<>();
        this.selfDependent = new LinkedHashSet<>();

        Map<String, String> idsByName = new HashMap<>();
        Set<String> ids = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (ids.add(step.id())) {
                definitionIndex.put(step.id(), stepIds.size());
                stepIds.add(step.id());
                dependencies.put(step.id(), new ArrayList<>());
                dependents.put(step.id(), new ArrayList<>());
            }
            if (step.name() != null) {
                idsByName.putIfAbsent(step.name(), step.id());
            }
        }

        for (WorkflowStep step : steps) {
            List<String> resolved = dependencies.get(step.id());
            for (String reference : step.dependencies()) {
                String target = idsByName.get(reference);
                if (target == null && ids.contains(reference)) {
                    target = reference;
                }
                if (target == null) {
                    unresolved.add(new UnresolvedDependency(step.id(), step.name(), reference));
                } else if (target.equals(step.id())) {
                    selfDependent.add(step.id());
                } else if (!resolved.contains(target)) {
                    resolved.add(target);
                    dependents.get(target).add(step.id());
                }
            }
        }

        this.layers = computeLayers();
        Set<String> ordered = new HashSet<>();
        layers.forEach(ordered::addAll);
        List<String> cyclic = new ArrayList<>();
        for (String id : stepIds) {
            if (!ordered.contains(id)) {
                cyclic.add(id);
            }
        }
        this.cyclicSteps = Collections.unmodifiableList(cyclic);
    }

    public static DependencyGraph of(List<WorkflowStep> steps) {
        return new DependencyGraph(steps);
    }

    // ========== Queries ==========

    /**
     * Step ids in definition order.
     */
    public List<String> stepIds() {
        return Collections.unmodifiableList(stepIds);
    }

    public int definitionIndex(String stepId) {
        Integer index = definitionIndex.get(stepId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return index;
    }

    public List<String> dependenciesOf(String stepId) {
        return Collections.unmodifiableList(dependencies.getOrDefault(stepId, List.of()));
    }

    public List<String> dependentsOf(String stepId) {
        return Collections.unmodifiableList(dependents.getOrDefault(stepId, List.of()));
    }

    /**
     * Every step reachable by following dependency edges backwards from the given step.
     */
    public Set<String> upstreamOf(String stepId) {
        return reachable(stepId, dependencies);
    }

    /**
     * Every step that directly or transitively depends on the given step.
     */
    public Set<String> downstreamOf(String stepId) {
        return reachable(stepId, dependents);
    }

    public List<UnresolvedDependency> unresolved() {
        return Collections.unmodifiableList(unresolved);
    }

    public Set<String> selfDependent() {
        return Collections.unmodifiableSet(selfDependent);
    }

    /**
     * Topological layers: every step in layer n depends only on steps in earlier layers.
     */
    public List<List<String>> layers() {
        return layers;
    }

    /**
     * A full topological order, or the partial order covering the acyclic part of the graph.
     */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>();
        layers.forEach(order::addAll);
        return order;
    }

    public boolean isAcyclic() {
        return cyclicSteps.isEmpty();
    }

    /**
     * Steps that could not be ordered: members of a cycle or downstream of one.
     */
    public List<String> cyclicSteps() {
        return cyclicSteps;
    }

    // ========== Internal Methods ==========

    private List<List<String>> computeLayers() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : stepIds) {
            inDegree.put(id, dependencies.get(id).size());
        }

        List<List<String>> result = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String id : stepIds) {
            if (inDegree.get(id) == 0) {
                current.add(id);
            }
        }

        while (!current.isEmpty()) {
            result.add(Collections.unmodifiableList(current));
            List<String> next = new ArrayList<>();
            for (String id : current) {
                for (String dependent : dependents.get(id)) {
                    int remaining = inDegree.merge(dependent, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(dependent);
                    }
                }
            }
            next.sort((a, b) -> Integer.compare(definitionIndex.get(a), definitionIndex.get(b)));
            current = next;
        }
        return Collections.unmodifiableList(result);
    }

    private static Set<String> reachable(String start, Map<String, List<String>> edges) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(edges.getOrDefault(start, List.of()));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (seen.add(id)) {
                queue.addAll(edges.getOrDefault(id, List.of()));
            }
        }
        return seen;
    }

    /**
     * A dependency reference that names no step of the workflow.
     */
    public record UnresolvedDependency(String stepId, String stepName, String reference) {
    }
}
