package com.strata.domain;

/**
 * Whether a failed action may be attempted again on the next evaluation pass.
 */
public enum FailureKind {

    /**
     * Timeouts, lock contention, transient connectivity
     */
    RETRYABLE,

    /**
     * Invalid target, policy/action mismatch, partition no longer exists.
     * Requires operator correction of the policy.
     */
    TERMINAL
}
