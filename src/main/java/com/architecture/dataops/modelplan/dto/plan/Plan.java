package com.architecture.dataops.modelplan.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A fully resolved execution plan.
 *
 * The plan id is derived from base, target and the ordered step ids, and no
 * wall-clock timestamp is stored, so identical inputs always give an identical plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Plan {

    private String planId;
    private String base;
    private String target;
    private PlanSummary summary;

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();
}
