package com.architecture.dataops.modelplan.dto.diff;

/**
 * Classification of a change detected between two versions of a model.
 */
public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED,
    COSMETIC_ONLY,
    NO_CHANGE
}
