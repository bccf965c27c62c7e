package com.architecture.dataops.modelplan.dto.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Historical execution metrics for one model, read from the run store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStatistics {

    // Null when the store has no timing for the model yet
    private Double avgRuntimeSeconds;

    private int runCount;

    public static RunStatistics ofAverage(double avgRuntimeSeconds) {
        return RunStatistics.builder().avgRuntimeSeconds(avgRuntimeSeconds).build();
    }

    public void validate(String modelName) {
        if (avgRuntimeSeconds == null) {
            return;
        }
        if (avgRuntimeSeconds.isNaN() || avgRuntimeSeconds.isInfinite() || avgRuntimeSeconds < 0) {
            throw new IllegalArgumentException("Run statistics for model '" + modelName
                    + "' have an invalid average runtime: " + avgRuntimeSeconds);
        }
    }
}
