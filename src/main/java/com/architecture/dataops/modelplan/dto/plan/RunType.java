package com.architecture.dataops.modelplan.dto.plan;

/**
 * Whether a step rebuilds the whole model or only a date range.
 */
public enum RunType {
    FULL_REFRESH,
    INCREMENTAL
}
