package com.architecture.dataops.modelplan.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a dependency graph that must be acyclic contains a cycle.
 */
@Getter
public class CyclicDependencyException extends RuntimeException {

    // Each cycle is closed: first and last element are the same model
    private final List<List<String>> cycles;

    public CyclicDependencyException(List<List<String>> cycles) {
        super("Cyclic dependencies detected: " + cycles.stream()
                .map(cycle -> String.join(" -> ", cycle))
                .collect(Collectors.joining("; ")));
        this.cycles = cycles;
    }
}
