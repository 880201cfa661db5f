package com.strata.domain;

/**
 * State of an evaluation queue entry.
 *
 * PENDING -&gt; RUNNING -&gt; SUCCESS | FAILED. FAILED returns to PENDING on the next
 * eligible evaluation unless the failure was terminal. SKIPPED marks a pair that was
 * evaluated and found ineligible (or unavailable), always with a reason.
 */
public enum QueueStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    SKIPPED;

    public boolean isExecuted() {
        return this == SUCCESS || this == FAILED;
    }
}
