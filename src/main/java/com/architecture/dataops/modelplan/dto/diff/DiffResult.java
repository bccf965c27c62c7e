package com.architecture.dataops.modelplan.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural diff between a base and a target snapshot.
 * The three model lists are disjoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffResult {

    @Builder.Default
    private List<String> addedModels = new ArrayList<>();

    @Builder.Default
    private List<String> removedModels = new ArrayList<>();

    @Builder.Default
    private List<String> modifiedModels = new ArrayList<>();

    public boolean isAdded(String modelName) {
        return addedModels != null && addedModels.contains(modelName);
    }

    public boolean isModified(String modelName) {
        return modifiedModels != null && modifiedModels.contains(modelName);
    }
}
