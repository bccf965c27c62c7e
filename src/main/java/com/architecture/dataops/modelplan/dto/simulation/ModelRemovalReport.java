package com.architecture.dataops.modelplan.dto.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of simulating the removal of a whole model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelRemovalReport {

    private String removedModel;

    @Builder.Default
    private List<AffectedModel> directlyAffected = new ArrayList<>();

    @Builder.Default
    private List<AffectedModel> transitivelyAffected = new ArrayList<>();

    // Downstream models left with no upstream at all
    @Builder.Default
    private List<String> orphanedModels = new ArrayList<>();

    private int breakingCount;
    private String summary;
}
