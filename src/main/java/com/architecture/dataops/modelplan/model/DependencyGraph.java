package com.architecture.dataops.modelplan.model;

import com.architecture.dataops.modelplan.exception.CyclicDependencyException;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.Graph;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Directed graph over model names, backed by a Guava {@link MutableGraph}. Edges point from
 * upstream to downstream, i.e. an edge {@code a -> b} means b reads from a.
 * <p>
 * Nodes iterate in natural order and every neighbour query returns a sorted copy, so results
 * are stable regardless of insertion order.
 */
public final class DependencyGraph {

    private final MutableGraph<String> graph;

    private DependencyGraph(MutableGraph<String> graph) {
        this.graph = graph;
    }

    public static DependencyGraph create() {
        return new DependencyGraph(GraphBuilder.directed()
                .allowsSelfLoops(false)
                .nodeOrder(ElementOrder.<String>natural())
                .build());
    }

    /**
     * Build a graph from upstream-to-downstream edges. Both endpoints are added as nodes.
     */
    public static DependencyGraph fromEdges(Collection<String> nodes, Map<String, ? extends Collection<String>> downstreamByUpstream) {
        DependencyGraph dag = create();
        if (nodes != null) {
            nodes.forEach(dag::addNode);
        }
        if (downstreamByUpstream != null) {
            downstreamByUpstream.forEach((upstream, downstreams) -> {
                dag.addNode(upstream);
                for (String downstream : downstreams) {
                    dag.addEdge(upstream, downstream);
                }
            });
        }
        return dag;
    }

    public DependencyGraph addNode(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        graph.addNode(name);
        return this;
    }

    public DependencyGraph addEdge(String upstream, String downstream) {
        if (upstream.equals(downstream)) {
            throw new IllegalArgumentException("Self-dependency is not allowed: " + upstream);
        }
        addNode(upstream);
        addNode(downstream);
        graph.putEdge(upstream, downstream);
        return this;
    }

    public boolean hasNode(String name) {
        return graph.nodes().contains(name);
    }

    public SortedSet<String> nodes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(graph.nodes()));
    }

    public int nodeCount() {
        return graph.nodes().size();
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    /**
     * Direct upstream models of {@code name}, sorted. Empty for unknown nodes.
     */
    public SortedSet<String> predecessors(String name) {
        if (!hasNode(name)) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(graph.predecessors(name)));
    }

    /**
     * Direct downstream models of {@code name}, sorted. Empty for unknown nodes.
     */
    public SortedSet<String> successors(String name) {
        if (!hasNode(name)) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(graph.successors(name)));
    }

    /**
     * Every model reachable downstream of {@code name}, excluding itself unless it sits on a cycle.
     */
    public SortedSet<String> descendants(String name) {
        if (!hasNode(name)) {
            return Collections.emptySortedSet();
        }
        return reachableFromNeighbours(graph, graph.successors(name));
    }

    /**
     * Every model {@code name} transitively reads from.
     */
    public SortedSet<String> ancestors(String name) {
        if (!hasNode(name)) {
            return Collections.emptySortedSet();
        }
        return reachableFromNeighbours(Graphs.transpose(graph), graph.predecessors(name));
    }

    // Graphs.reachableNodes always contains its start node, so walk from the neighbours instead
    private static SortedSet<String> reachableFromNeighbours(Graph<String> view, Set<String> neighbours) {
        TreeSet<String> reached = new TreeSet<>();
        for (String neighbour : neighbours) {
            if (!reached.contains(neighbour)) {
                reached.addAll(Graphs.reachableNodes(view, neighbour));
            }
        }
        return reached;
    }

    /**
     * Subgraph induced by {@code keep}: the kept nodes that exist here and the edges between them.
     */
    public DependencyGraph subgraph(Collection<String> keep) {
        Set<String> present = new TreeSet<>();
        for (String node : keep) {
            if (hasNode(node)) {
                present.add(node);
            }
        }
        return new DependencyGraph(Graphs.inducedSubgraph(graph, present));
    }

    /**
     * Topological order with alphabetical tie-breaking (Kahn's algorithm over a min-heap).
     *
     * @throws CyclicDependencyException if the graph has a cycle
     */
    public List<String> topologicalSort() {
        if (Graphs.hasCycle(graph)) {
            throw new CyclicDependencyException(List.of(findCycle()));
        }

        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>();
        for (String node : graph.nodes()) {
            int degree = graph.inDegree(node);
            inDegree.put(node, degree);
            if (degree == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>(graph.nodes().size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String next : graph.successors(node)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }

    /**
     * First cycle met by a depth-first walk in node order, closed so that the first and last
     * elements are the same model.
     */
    private List<String> findCycle() {
        Map<String, Boolean> onPath = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String start : graph.nodes()) {
            List<String> cycle = findCycleFrom(start, onPath, path);
            if (cycle != null) {
                return cycle;
            }
        }
        return List.of();
    }

    private List<String> findCycleFrom(String node, Map<String, Boolean> onPath, List<String> path) {
        Boolean state = onPath.get(node);
        if (Boolean.FALSE.equals(state)) {
            return null;
        }
        if (Boolean.TRUE.equals(state)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            return cycle;
        }

        onPath.put(node, Boolean.TRUE);
        path.add(node);
        for (String next : successors(node)) {
            List<String> cycle = findCycleFrom(next, onPath, path);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        onPath.put(node, Boolean.FALSE);
        return null;
    }
}
