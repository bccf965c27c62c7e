package com.architecture.dataops.modelplan.exception;

import lombok.Getter;

/**
 * Raised when a downstream walk goes deeper than the configured limit,
 * which almost always means a cycle slipped into the dependency graph.
 */
@Getter
public class TraversalDepthExceededException extends RuntimeException {

    private final String modelName;
    private final int maxDepth;

    public TraversalDepthExceededException(String modelName, int maxDepth) {
        super(String.format("Impact analysis exceeded max_depth=%d at model '%s'. "
                + "This may indicate a cyclic dependency graph or an unexpectedly deep chain.",
                maxDepth, modelName));
        this.modelName = modelName;
        this.maxDepth = maxDepth;
    }
}
