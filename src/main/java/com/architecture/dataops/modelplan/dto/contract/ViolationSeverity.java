package com.architecture.dataops.modelplan.dto.contract;

/**
 * How critical a contract violation is.
 */
public enum ViolationSeverity {
    BREAKING,
    WARNING,
    INFO
}
