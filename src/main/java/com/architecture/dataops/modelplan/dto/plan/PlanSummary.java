package com.architecture.dataops.modelplan.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate statistics for a plan, surfaced in PR comments and logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanSummary {

    private int totalSteps;
    private double estimatedCostUsd;

    // Sorted names of every model the plan rebuilds
    @Builder.Default
    private List<String> modelsChanged = new ArrayList<>();

    @Builder.Default
    private List<String> cosmeticChangesSkipped = new ArrayList<>();

    private int contractViolationsCount;
    private int breakingContractViolations;
}
