package com.architecture.dataops.modelplan.dto.simulation;

/**
 * Severity of a simulated downstream impact, most severe first.
 */
public enum ReferenceSeverity {
    BREAKING,
    WARNING,
    INFO;

    public ReferenceSeverity worse(ReferenceSeverity other) {
        return other != null && other.ordinal() < ordinal() ? other : this;
    }
}
