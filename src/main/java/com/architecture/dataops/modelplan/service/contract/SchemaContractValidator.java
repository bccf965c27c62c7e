package com.architecture.dataops.modelplan.service.contract;

import com.architecture.dataops.modelplan.dto.contract.ColumnInfo;
import com.architecture.dataops.modelplan.dto.contract.ContractValidationResult;
import com.architecture.dataops.modelplan.dto.contract.ContractViolation;
import com.architecture.dataops.modelplan.dto.contract.ViolationSeverity;
import com.architecture.dataops.modelplan.model.ColumnContract;
import com.architecture.dataops.modelplan.model.ModelDefinition;
import com.architecture.dataops.modelplan.model.SchemaContractMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Compares declared column contracts against the columns a model actually produces.
 *
 * Missing columns, type mismatches and NOT NULL columns that became nullable are breaking.
 * Extra columns are reported as informational.
 */
@Service
@Slf4j
public class SchemaContractValidator {

    private static final Map<String, String> TYPE_ALIASES = Map.ofEntries(
            Map.entry("INTEGER", "INT"),
            Map.entry("BIGINTEGER", "BIGINT"),
            Map.entry("LONG", "BIGINT"),
            Map.entry("SHORT", "SMALLINT"),
            Map.entry("TINYINT", "SMALLINT"),
            Map.entry("REAL", "FLOAT"),
            Map.entry("DOUBLE PRECISION", "DOUBLE"),
            Map.entry("VARCHAR", "STRING"),
            Map.entry("TEXT", "STRING"),
            Map.entry("CHAR", "STRING"),
            Map.entry("NVARCHAR", "STRING"),
            Map.entry("DATETIME", "TIMESTAMP"),
            Map.entry("BOOL", "BOOLEAN"),
            Map.entry("NUMERIC", "DECIMAL"),
            Map.entry("NUMBER", "DECIMAL"));

    private static final Comparator<ContractViolation> VIOLATION_ORDER = Comparator
            .comparing(ContractViolation::getModelName)
            .thenComparing(ContractViolation::getColumnName)
            .thenComparing(ContractViolation::getViolationType);

    /**
     * Validate every model with an enabled contract.
     *
     * @param actualColumns observed columns per model; models without an entry fall back
     *                      to their inferred output columns (names only)
     */
    public ContractValidationResult validate(Collection<ModelDefinition> models,
                                             Map<String, List<ColumnInfo>> actualColumns) {
        List<ContractViolation> violations = new ArrayList<>();
        int modelsChecked = 0;

        for (ModelDefinition model : models) {
            List<ColumnInfo> actual = actualColumns != null ? actualColumns.get(model.getName()) : null;
            ContractValidationResult result = validateModel(model, actual);
            violations.addAll(result.getViolations());
            modelsChecked += result.getModelsChecked();
        }

        violations.sort(VIOLATION_ORDER);
        ContractValidationResult result = ContractValidationResult.builder()
                .violations(violations)
                .modelsChecked(modelsChecked)
                .build();

        if (!violations.isEmpty()) {
            log.info("Schema contract validation: {} violation(s) across {} model(s), {} breaking",
                    violations.size(), modelsChecked, result.getBreakingCount());
        }
        return result;
    }

    public ContractValidationResult validateModel(ModelDefinition model, List<ColumnInfo> actualColumns) {
        if (model.getContractMode() == null || model.getContractMode() == SchemaContractMode.DISABLED) {
            return ContractValidationResult.builder().modelsChecked(0).build();
        }
        if (model.getContractColumns() == null || model.getContractColumns().isEmpty()) {
            return ContractValidationResult.builder().modelsChecked(1).build();
        }

        List<ColumnInfo> columns = actualColumns != null
                ? actualColumns
                : model.getOutputColumns().stream().map(ColumnInfo::named).toList();

        Map<String, ColumnInfo> actualByName = new HashMap<>();
        for (ColumnInfo column : columns) {
            actualByName.putIfAbsent(lower(column.getName()), column);
        }

        List<ContractViolation> violations = new ArrayList<>();
        for (ColumnContract contract : model.getContractColumns()) {
            ColumnInfo actual = actualByName.get(lower(contract.getName()));

            if (actual == null) {
                violations.add(violation(model, contract.getName(), "COLUMN_REMOVED", ViolationSeverity.BREAKING,
                        contract.getName() + ": " + contract.getDataType(), "(missing)",
                        String.format("Contracted column '%s' (type: %s) is missing from model output.",
                                contract.getName(), contract.getDataType())));
                continue;
            }

            if (actual.getDataType() != null && contract.getDataType() != null
                    && !normalizeType(contract.getDataType()).equals(normalizeType(actual.getDataType()))) {
                violations.add(violation(model, contract.getName(), "TYPE_CHANGED", ViolationSeverity.BREAKING,
                        contract.getDataType(), actual.getDataType(),
                        String.format("Column '%s' type changed: contract declares %s, actual is %s.",
                                contract.getName(), contract.getDataType(), actual.getDataType())));
            }

            if (!contract.isNullable() && Boolean.TRUE.equals(actual.getNullable())) {
                violations.add(violation(model, contract.getName(), "NULLABLE_TIGHTENED", ViolationSeverity.BREAKING,
                        "NOT NULL", "NULLABLE",
                        String.format("Column '%s' is declared NOT NULL in contract but is nullable in actual output.",
                                contract.getName())));
            }
        }

        Set<String> contracted = new HashSet<>();
        model.getContractColumns().forEach(c -> contracted.add(lower(c.getName())));
        columns.stream()
                .map(ColumnInfo::getName)
                .filter(name -> !contracted.contains(lower(name)))
                .sorted()
                .forEach(name -> violations.add(violation(model, name, "COLUMN_ADDED", ViolationSeverity.INFO,
                        "(not in contract)", name,
                        String.format("Column '%s' exists in output but is not declared in the schema contract.", name))));

        violations.sort(VIOLATION_ORDER);
        log.debug("Checked contract of {}: {} violation(s)", model.getName(), violations.size());
        return ContractValidationResult.builder()
                .violations(violations)
                .modelsChecked(1)
                .build();
    }

    static String normalizeType(String dataType) {
        String normalized = dataType.trim().toUpperCase(Locale.ROOT);
        return TYPE_ALIASES.getOrDefault(normalized, normalized);
    }

    private static ContractViolation violation(ModelDefinition model, String column, String type,
                                               ViolationSeverity severity, String expected, String actual,
                                               String message) {
        return ContractViolation.builder()
                .modelName(model.getName())
                .columnName(column)
                .violationType(type)
                .severity(severity)
                .expected(expected)
                .actual(actual)
                .message(message)
                .build();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
