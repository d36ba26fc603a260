package com.contextflow.core.composition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over a phase dependency map ({@code phaseId -> ids it depends on}).
 * <p>
 * Node order is the phase order of the workflow; every traversal visits nodes in that
 * order so results are deterministic.
 */
public final class DependencyGraph {

    /**
     * A dependency edge: {@code dependent} depends on {@code dependency}.
     */
    public record Edge(String dependent, String dependency) {}

    private final List<String> nodes;
    private final Set<String> nodeSet;
    private final Map<String, List<String>> dependencies;

    public DependencyGraph(List<String> nodes, Map<String, List<String>> dependencies) {
        this.nodes = List.copyOf(nodes);
        this.nodeSet = new LinkedHashSet<>(nodes);
        this.dependencies = dependencies == null ? Map.of() : dependencies;
    }

    /** Dependency ids that do not name a node, keyed by the referencing phase. */
    public Map<String, List<String>> unknownReferences() {
        var unknown = new LinkedHashMap<String, List<String>>();
        dependencies.forEach((phaseId, deps) -> {
            var missing = new ArrayList<String>();
            if (!nodeSet.contains(phaseId)) {
                missing.add(phaseId);
            }
            for (String dep : deps) {
                if (!nodeSet.contains(dep)) {
                    missing.add(dep);
                }
            }
            if (!missing.isEmpty()) {
                unknown.put(phaseId, missing);
            }
        });
        return unknown;
    }

    public boolean hasCycle() {
        return !backEdges().isEmpty();
    }

    /**
     * Edges that close a cycle, found by a depth-first walk in node order.
     * Removing all of them leaves the graph acyclic.
     */
    public List<Edge> backEdges() {
        var backEdges = new ArrayList<Edge>();
        var state = new HashMap<String, Integer>(); // 1 = on stack, 2 = done
        for (String node : nodes) {
            if (!state.containsKey(node)) {
                visit(node, state, backEdges);
            }
        }
        return backEdges;
    }

    private void visit(String node, Map<String, Integer> state, List<Edge> backEdges) {
        state.put(node, 1);
        for (String dep : knownDependencies(node)) {
            Integer depState = state.get(dep);
            if (depState == null) {
                visit(dep, state, backEdges);
            } else if (depState == 1) {
                backEdges.add(new Edge(node, dep));
            }
        }
        state.put(node, 2);
    }

    /**
     * True when {@code dependent} transitively depends on {@code dependency}.
     */
    public boolean dependsOn(String dependent, String dependency) {
        var seen = new HashSet<String>();
        Deque<String> stack = new ArrayDeque<>(knownDependencies(dependent));
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (next.equals(dependency)) {
                return true;
            }
            if (seen.add(next)) {
                stack.addAll(knownDependencies(next));
            }
        }
        return false;
    }

    /** True when either node transitively depends on the other. */
    public boolean related(String a, String b) {
        return dependsOn(a, b) || dependsOn(b, a);
    }

    /**
     * True when the graph, ignoring edge direction, forms a single component.
     * Graphs with fewer than two nodes are connected.
     */
    public boolean isConnected() {
        if (nodes.size() < 2) {
            return true;
        }
        var adjacency = new HashMap<String, Set<String>>();
        for (String node : nodes) {
            adjacency.computeIfAbsent(node, k -> new HashSet<>());
            for (String dep : knownDependencies(node)) {
                adjacency.get(node).add(dep);
                adjacency.computeIfAbsent(dep, k -> new HashSet<>()).add(node);
            }
        }
        var seen = new HashSet<String>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(nodes.get(0));
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (seen.add(next)) {
                stack.addAll(adjacency.get(next));
            }
        }
        return seen.size() == nodeSet.size();
    }

    /**
     * Stable Kahn topological order: among ready nodes the one earliest in node order goes first.
     * Nodes left on a cycle are appended in node order.
     */
    public List<String> topologicalOrder() {
        var remaining = new HashMap<String, Integer>();
        for (String node : nodes) {
            remaining.put(node, new LinkedHashSet<>(knownDependencies(node)).size());
        }
        var ordered = new ArrayList<String>();
        var placed = new HashSet<String>();
        boolean progress = true;
        while (progress && ordered.size() < nodes.size()) {
            progress = false;
            for (String node : nodes) {
                if (!placed.contains(node) && remaining.get(node) == 0) {
                    ordered.add(node);
                    placed.add(node);
                    for (String other : nodes) {
                        if (!placed.contains(other) && new LinkedHashSet<>(knownDependencies(other)).contains(node)) {
                            remaining.merge(other, -1, Integer::sum);
                        }
                    }
                    progress = true;
                    break;
                }
            }
        }
        for (String node : nodes) {
            if (!placed.contains(node)) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    private List<String> knownDependencies(String node) {
        return dependencies.getOrDefault(node, List.of()).stream()
                .filter(nodeSet::contains)
                .toList();
    }
}
