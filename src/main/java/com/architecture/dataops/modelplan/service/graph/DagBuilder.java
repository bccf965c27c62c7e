package com.architecture.dataops.modelplan.service.graph;

import com.architecture.dataops.modelplan.dto.graph.CircularDependency;
import com.architecture.dataops.modelplan.exception.CyclicDependencyException;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the model dependency graph from loaded model definitions.
 *
 * Upstream names come from both the explicit header dependencies and the tables
 * referenced in the SQL body. Only references to managed models become edges;
 * external source tables are surfaced by {@link #validate}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DagBuilder {

    private final CircularDependencyDetector circularDependencyDetector;

    public DependencyGraph build(Collection<ModelDefinition> models) {
        Set<String> names = models.stream()
                .map(ModelDefinition::getName)
                .collect(Collectors.toCollection(TreeSet::new));

        DependencyGraph graph = DependencyGraph.create();
        names.forEach(graph::addNode);

        for (ModelDefinition model : sortedByName(models)) {
            for (String upstream : upstreamNames(model)) {
                if (names.contains(upstream) && !upstream.equals(model.getName())) {
                    graph.addEdge(upstream, model.getName());
                }
            }
        }

        log.debug("Built dependency graph: {} models, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Simplified {@code model -> sorted upstream models} form used by the impact analyzer.
     */
    public Map<String, List<String>> toAdjacency(Collection<ModelDefinition> models) {
        Set<String> names = models.stream()
                .map(ModelDefinition::getName)
                .collect(Collectors.toSet());

        Map<String, List<String>> adjacency = new TreeMap<>();
        for (ModelDefinition model : sortedByName(models)) {
            List<String> upstream = upstreamNames(model).stream()
                    .filter(names::contains)
                    .filter(u -> !u.equals(model.getName()))
                    .toList();
            adjacency.put(model.getName(), upstream);
        }
        return adjacency;
    }

    /**
     * Topological order of the whole graph, alphabetical among independent models.
     *
     * @throws CyclicDependencyException with every distinct cycle when the graph is not a DAG
     */
    public List<String> topologicalOrder(DependencyGraph graph) {
        try {
            return graph.topologicalSort();
        } catch (CyclicDependencyException e) {
            List<CircularDependency> cycles = circularDependencyDetector.detectCircularDependencies(graph);
            throw new CyclicDependencyException(cycles.stream().map(CircularDependency::getCycle).toList());
        }
    }

    public List<CircularDependency> detectCycles(DependencyGraph graph) {
        return circularDependencyDetector.detectCircularDependencies(graph);
    }

    /**
     * Warnings for references that do not resolve to a managed model.
     */
    public List<String> validate(Collection<ModelDefinition> models) {
        Set<String> names = models.stream()
                .map(ModelDefinition::getName)
                .collect(Collectors.toSet());

        List<String> warnings = new ArrayList<>();
        for (ModelDefinition model : sortedByName(models)) {
            for (String dependency : new TreeSet<>(nullSafe(model.getDependencies()))) {
                if (!names.contains(dependency)) {
                    warnings.add(String.format("Model '%s' depends on '%s', which is not a known model",
                            model.getName(), dependency));
                }
            }
        }
        return warnings;
    }

    private static Set<String> upstreamNames(ModelDefinition model) {
        Set<String> upstream = new TreeSet<>(nullSafe(model.getReferencedTables()));
        upstream.addAll(nullSafe(model.getDependencies()));
        return upstream;
    }

    private static List<ModelDefinition> sortedByName(Collection<ModelDefinition> models) {
        return models.stream()
                .sorted(Comparator.comparing(ModelDefinition::getName))
                .toList();
    }

    private static <T> Collection<T> nullSafe(Collection<T> values) {
        return values == null ? List.of() : values;
    }
}
