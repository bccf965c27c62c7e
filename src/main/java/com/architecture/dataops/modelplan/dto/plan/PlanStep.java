package com.architecture.dataops.modelplan.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single unit of work inside an execution plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanStep {

    // SHA-256 of "{model}:{base}:{target}"
    private String stepId;
    private String model;
    private RunType runType;

    // Only set for INCREMENTAL runs
    private DateRange inputRange;

    // Step ids (not model names) that must finish first
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    private int parallelGroup;
    private String reason;
    private double estimatedComputeSeconds;
    private double estimatedCostUsd;

    @Builder.Default
    private List<StepContractViolation> contractViolations = new ArrayList<>();

    private StepDiffDetail diffDetail;
}
