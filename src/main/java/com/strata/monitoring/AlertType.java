package com.strata.monitoring;

/**
 * Conditions an operator is alerted about.
 */
public enum AlertType {

    /**
     * Failed actions in the rolling window exceeded the threshold
     */
    FAILURE_RATE,

    /**
     * An action outlived its timeout; the storage operation may still be running
     */
    ACTION_TIMEOUT,

    /**
     * A loop could not read the metadata it depends on
     */
    METADATA_UNAVAILABLE
}
