package com.architecture.dataops.modelplan.dto.contract;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An output column as observed in the warehouse (or inferred from the SELECT list).
 * Type and nullability are optional; when absent the matching checks are skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnInfo {
    private String name;
    private String dataType;
    private Boolean nullable;

    public static ColumnInfo named(String name) {
        return ColumnInfo.builder().name(name).build();
    }
}
