package com.strata.domain;

/**
 * What started an execution: the periodic loop or an operator request.
 */
public enum ExecutionTrigger {
    SCHEDULED,
    MANUAL
}
