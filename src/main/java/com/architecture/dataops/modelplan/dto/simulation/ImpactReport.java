package com.architecture.dataops.modelplan.dto.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of simulating column changes on a model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactReport {

    private String sourceModel;

    @Builder.Default
    private List<ColumnChange> columnChanges = new ArrayList<>();

    @Builder.Default
    private List<AffectedModel> directlyAffected = new ArrayList<>();

    @Builder.Default
    private List<AffectedModel> transitivelyAffected = new ArrayList<>();

    @Builder.Default
    private List<SimulatedViolation> contractViolations = new ArrayList<>();

    private int breakingCount;
    private int warningCount;

    @Builder.Default
    private List<String> orphanedModels = new ArrayList<>();

    private String summary;
}
