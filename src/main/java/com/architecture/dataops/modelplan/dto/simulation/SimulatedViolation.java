package com.architecture.dataops.modelplan.dto.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contract that a downstream model would break if the simulated change shipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulatedViolation {
    private String modelName;
    private String columnName;
    private String violationType;   // COLUMN_REMOVED, COLUMN_RENAMED, TYPE_CHANGED
    private ReferenceSeverity severity;
    private String message;
}
