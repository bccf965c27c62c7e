package com.architecture.dataops.modelplan.dto.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain copy of a contract violation embedded into a plan step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepContractViolation {
    private String columnName;
    private String violationType;   // COLUMN_REMOVED, TYPE_CHANGED, NULLABLE_TIGHTENED, COLUMN_ADDED
    private String severity;        // BREAKING, WARNING, INFO
    private String expected;
    private String actual;
    private String message;
}
