package com.architecture.dataops.modelplan.model;

/**
 * Controls how schema contract violations are handled.
 */
public enum SchemaContractMode {
    DISABLED,   // no enforcement
    WARN,       // surfaced in the plan, does not block apply
    STRICT      // breaking violations block apply
}
