package com.architecture.dataops.modelplan.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A cycle found in the model dependency graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircularDependency {

    private String description;
    private List<String> cycle;     // e.g. ["a", "b", "c", "a"], rotated so the smallest name comes first
}
