package com.architecture.dataops.modelplan.dto.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A downstream model reached by an impact simulation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedModel {

    public static final String DIRECT = "direct";
    public static final String TRANSITIVE = "transitive";

    private String modelName;

    // "direct" for immediate children, "transitive" beyond
    private String referenceType;

    @Builder.Default
    private List<String> columnsAffected = new ArrayList<>();

    @Builder.Default
    private List<SimulatedViolation> contractViolations = new ArrayList<>();

    private ReferenceSeverity severity;
}
