package com.architecture.dataops.modelplan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A named SQL transformation unit as produced by the model loader.
 * The planner and the impact analyzer only read these.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDefinition {

    // Canonical dotted name, e.g. "analytics.orders_daily"
    private String name;
    private ModelKind kind;

    @Builder.Default
    private Materialization materialization = Materialization.TABLE;

    private String timeColumn;
    private String uniqueKey;
    private String owner;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    // Upstream model names declared in the header
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    private String filePath;
    private String rawSql;

    // SQL after ref() substitution and header stripping
    private String cleanSql;

    private String contentHash;

    @Builder.Default
    private List<String> referencedTables = new ArrayList<>();

    @Builder.Default
    private List<String> outputColumns = new ArrayList<>();

    @Builder.Default
    private SchemaContractMode contractMode = SchemaContractMode.DISABLED;

    @Builder.Default
    private List<ColumnContract> contractColumns = new ArrayList<>();

    /**
     * The SQL body analysis should look at: the cleaned SQL when present, the raw file otherwise.
     */
    public String effectiveSql() {
        if (cleanSql != null && !cleanSql.isBlank()) {
            return cleanSql;
        }
        return rawSql != null ? rawSql : "";
    }

    public boolean hasActiveContract() {
        return contractMode != null
                && contractMode != SchemaContractMode.DISABLED
                && contractColumns != null
                && !contractColumns.isEmpty();
    }
}
