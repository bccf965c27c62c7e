package com.architecture.dataops.modelplan.dto.simulation;

/**
 * Kind of hypothetical column change fed to the impact analyzer.
 */
public enum ChangeAction {
    ADD,
    REMOVE,
    RENAME,
    TYPE_CHANGE
}
