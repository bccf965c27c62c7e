package com.architecture.dataops.modelplan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A declared type contract for a single output column.
 * Data types use warehouse-agnostic names (STRING, INT, BIGINT, TIMESTAMP, ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnContract {

    private String name;
    private String dataType;

    @Builder.Default
    private boolean nullable = true;
}
