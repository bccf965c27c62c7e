package com.architecture.dataops.modelplan.dto.contract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single schema contract violation found by comparing a model's contract to its actual output.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractViolation {
    private String modelName;
    private String columnName;
    private String violationType;   // COLUMN_REMOVED, TYPE_CHANGED, NULLABLE_TIGHTENED, COLUMN_ADDED
    private ViolationSeverity severity;

    @Builder.Default
    private String expected = "";

    @Builder.Default
    private String actual = "";

    @Builder.Default
    private String message = "";
}
