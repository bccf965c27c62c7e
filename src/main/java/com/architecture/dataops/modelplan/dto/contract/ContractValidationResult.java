package com.architecture.dataops.modelplan.dto.contract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of validating schema contracts for one or more models.
 * Violations are kept sorted by model, column and violation type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractValidationResult {

    @Builder.Default
    private List<ContractViolation> violations = new ArrayList<>();

    private int modelsChecked;

    public List<ContractViolation> violationsForModel(String modelName) {
        return violations.stream()
                .filter(v -> modelName.equals(v.getModelName()))
                .toList();
    }

    public boolean hasBreakingViolations() {
        return getBreakingCount() > 0;
    }

    public long getBreakingCount() {
        return countBySeverity(ViolationSeverity.BREAKING);
    }

    public long getWarningCount() {
        return countBySeverity(ViolationSeverity.WARNING);
    }

    public long getInfoCount() {
        return countBySeverity(ViolationSeverity.INFO);
    }

    private long countBySeverity(ViolationSeverity severity) {
        return violations.stream().filter(v -> v.getSeverity() == severity).count();
    }
}
