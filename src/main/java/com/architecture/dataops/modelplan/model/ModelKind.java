package com.architecture.dataops.modelplan.model;

/**
 * Incremental strategy for a SQL model.
 */
public enum ModelKind {
    FULL_REFRESH,
    INCREMENTAL_BY_TIME_RANGE,
    APPEND_ONLY,
    MERGE_BY_KEY
}
