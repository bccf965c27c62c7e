package com.architecture.dataops.modelplan.service.graph;

import com.architecture.dataops.modelplan.dto.graph.CircularDependency;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Detects circular dependencies between models using DFS cycle detection.
 * Nodes and neighbours are visited in sorted order so the same graph always reports the same cycles.
 */
@Service
@Slf4j
public class CircularDependencyDetector {

    /**
     * Detect all distinct cycles in a dependency graph.
     */
    public List<CircularDependency> detectCircularDependencies(DependencyGraph graph) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (String node : graph.nodes()) {
            adjacency.put(node, graph.successors(node));
        }
        return detectCircularDependencies(adjacency);
    }

    /**
     * Detect cycles in an adjacency map of {@code node -> downstream nodes}.
     */
    public List<CircularDependency> detectCircularDependencies(Map<String, ? extends Collection<String>> adjacency) {
        List<List<String>> cycles = findCyclesDFS(adjacency);

        List<CircularDependency> results = cycles.stream()
                .map(cycle -> CircularDependency.builder()
                        .description("Circular dependency between models: " + String.join(" -> ", cycle))
                        .cycle(cycle)
                        .build())
                .sorted(Comparator.comparing(dep -> String.join("\u0000", dep.getCycle())))
                .toList();

        if (!results.isEmpty()) {
            log.warn("Found {} circular dependencies across {} models", results.size(), adjacency.size());
        }
        return results;
    }

    // ========================= DFS CYCLE DETECTION =========================

    private List<List<String>> findCyclesDFS(Map<String, ? extends Collection<String>> adjacency) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> reportedCycles = new HashSet<>();

        for (String node : new TreeSet<>(adjacency.keySet())) {
            if (!visited.contains(node)) {
                dfs(node, adjacency, visited, new ArrayList<>(), cycles, reportedCycles);
            }
        }
        return cycles;
    }

    private void dfs(String node, Map<String, ? extends Collection<String>> adjacency,
                     Set<String> visited, List<String> stack,
                     List<List<String>> cycles, Set<String> reportedCycles) {
        visited.add(node);
        stack.add(node);

        Collection<String> neighbors = adjacency.get(node);
        for (String neighbor : neighbors == null ? Collections.<String>emptySet() : new TreeSet<>(neighbors)) {
            if (!adjacency.containsKey(neighbor)) continue; // external table, not a managed model

            int onStack = stack.indexOf(neighbor);
            if (onStack >= 0) {
                List<String> cycle = normalizeCycle(stack.subList(onStack, stack.size()));
                if (reportedCycles.add(cycle.toString())) {
                    cycles.add(cycle);
                }
            } else if (!visited.contains(neighbor)) {
                dfs(neighbor, adjacency, visited, stack, cycles, reportedCycles);
            }
        }

        stack.remove(stack.size() - 1);
    }

    /**
     * Rotate a cycle so its smallest node comes first, then close it.
     * The same cycle entered from different nodes yields the same list.
     */
    private List<String> normalizeCycle(List<String> core) {
        String min = Collections.min(core);
        int minIdx = core.indexOf(min);
        List<String> normalized = new ArrayList<>(core.size() + 1);
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        normalized.add(min);
        return normalized;
    }
}
