package com.architecture.dataops.modelplan.service.sql;

/**
 * Outcome of comparing two versions of a model's SQL.
 */
public enum CosmeticCheck {
    IDENTICAL,
    COSMETIC_ONLY,      // whitespace, comments, keyword case
    SEMANTIC,
    UNPARSEABLE;        // one side could not be read

    /**
     * Whether the planner may skip the model. Unparseable SQL is never cosmetic.
     */
    public boolean isSkippable() {
        return this == IDENTICAL || this == COSMETIC_ONLY;
    }
}
