package com.architecture.dataops.modelplan.service.sql;

/**
 * SQL analysis needed by the planner and the impact analyzer.
 * Implementations never throw for unparseable SQL; they report it through the result type.
 */
public interface SqlToolkit {

    /**
     * Classify the change between two versions of a model's SQL.
     */
    CosmeticCheck classifyChange(String oldSql, String newSql);

    /**
     * Extract the (lower-cased) column names a statement references.
     */
    ColumnExtraction extractColumns(String sql);
}
