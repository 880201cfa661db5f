package com.strata.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated outcome of one policy's executions.
 */
public class PolicyExecutionStats {

    @JsonProperty("policy_id")
    private final Long policyId;

    @JsonProperty("policy_name")
    private final String policyName;

    @JsonProperty("successes")
    private final long successes;

    @JsonProperty("failures")
    private final long failures;

    @JsonProperty("space_saved_bytes")
    private final long spaceSavedBytes;

    @JsonProperty("average_duration_ms")
    private final double averageDurationMs;

    public PolicyExecutionStats(Long policyId, String policyName, long successes, long failures,
                                long spaceSavedBytes, double averageDurationMs) {
        this.policyId = policyId;
        this.policyName = policyName;
        this.successes = successes;
        this.failures = failures;
        this.spaceSavedBytes = spaceSavedBytes;
        this.averageDurationMs = averageDurationMs;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public String getPolicyName() {
        return policyName;
    }

    public long getSuccesses() {
        return successes;
    }

    public long getFailures() {
        return failures;
    }

    public long getSpaceSavedBytes() {
        return spaceSavedBytes;
    }

    public double getAverageDurationMs() {
        return averageDurationMs;
    }

    @JsonProperty("success_rate")
    public double getSuccessRate() {
        long total = successes + failures;
        return total == 0 ? 0.0 : Math.round(successes * 10000.0 / total) / 100.0;
    }
}
