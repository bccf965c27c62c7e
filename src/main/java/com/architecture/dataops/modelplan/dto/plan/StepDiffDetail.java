package com.architecture.dataops.modelplan.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Condensed column-level change summary rendered next to a step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepDiffDetail {

    private String changeType;

    @Builder.Default
    private List<String> columnsAdded = new ArrayList<>();

    @Builder.Default
    private List<String> columnsRemoved = new ArrayList<>();

    @Builder.Default
    private List<String> columnsModified = new ArrayList<>();
}
