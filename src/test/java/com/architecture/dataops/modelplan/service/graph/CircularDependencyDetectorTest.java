package com.architecture.dataops.modelplan.service.graph;

import com.architecture.dataops.modelplan.dto.graph.CircularDependency;
import com.architecture.dataops.modelplan.model.DependencyGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CircularDependencyDetectorTest {

    private final CircularDependencyDetector detector = new CircularDependencyDetector();

    @Test
    void reportsEachCycleOnceRotatedToSmallestName() {
        DependencyGraph graph = DependencyGraph.create()
                .addEdge("c", "a")
                .addEdge("a", "b")
                .addEdge("b", "c")
                .addEdge("x", "y")
                .addEdge("y", "x");

        List<CircularDependency> cycles = detector.detectCircularDependencies(graph);

        assertThat(cycles).extracting(CircularDependency::getCycle).containsExactly(
                List.of("a", "b", "c", "a"),
                List.of("x", "y", "x"));
        assertThat(cycles.get(0).getDescription()).contains("a -> b -> c -> a");
    }

    @Test
    void acyclicGraphHasNoCycles() {
        DependencyGraph graph = DependencyGraph.create().addEdge("a", "b").addEdge("b", "c");

        assertThat(detector.detectCircularDependencies(graph)).isEmpty();
    }

    @Test
    void ignoresEdgesToUnmanagedTables() {
        Map<String, List<String>> adjacency = Map.of(
                "a", List.of("external.table"),
                "b", List.of("a"));

        assertThat(detector.detectCircularDependencies(adjacency)).isEmpty();
    }
}
