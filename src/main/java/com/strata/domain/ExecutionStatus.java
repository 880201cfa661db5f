package com.strata.domain;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
