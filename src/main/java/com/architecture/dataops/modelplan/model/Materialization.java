package com.architecture.dataops.modelplan.model;

/**
 * How the model output is written to the target warehouse.
 */
public enum Materialization {
    TABLE,
    VIEW,
    MERGE,
    INSERT_OVERWRITE
}
