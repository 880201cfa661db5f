package com.strata.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts of one evaluation pass.
 */
public class EvaluationSummary {

    @JsonProperty("policies_evaluated")
    private int policiesEvaluated;

    @JsonProperty("partitions_evaluated")
    private int partitionsEvaluated;

    @JsonProperty("queued")
    private int queued;

    @JsonProperty("skipped")
    private int skipped;

    /**
     * Running, terminally blocked or recently executed pairs that were left as they were
     */
    @JsonProperty("unchanged")
    private int unchanged;

    @JsonProperty("errors")
    private int errors;

    @JsonProperty("purged")
    private int purged;

    @JsonProperty("duration_ms")
    private long durationMs;

    void policyEvaluated() {
        policiesEvaluated++;
    }

    void record(PairOutcome outcome) {
        partitionsEvaluated++;
        switch (outcome) {
            case QUEUED:
                queued++;
                break;
            case SKIPPED:
                skipped++;
                break;
            default:
                unchanged++;
                break;
        }
    }

    void error() {
        errors++;
    }

    void setPurged(int purged) {
        this.purged = purged;
    }

    void addPurged(int purged) {
        this.purged += purged;
    }

    void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public int getPoliciesEvaluated() {
        return policiesEvaluated;
    }

    public int getPartitionsEvaluated() {
        return partitionsEvaluated;
    }

    public int getQueued() {
        return queued;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public int getErrors() {
        return errors;
    }

    public int getPurged() {
        return purged;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return String.format("policies=%d, partitions=%d, queued=%d, skipped=%d, unchanged=%d, errors=%d, purged=%d",
            policiesEvaluated, partitionsEvaluated, queued, skipped, unchanged, errors, purged);
    }

    /**
     * What happened to one (policy, partition) pair.
     */
    enum PairOutcome {
        QUEUED,
        SKIPPED,
        BUSY,
        BLOCKED,
        RECENTLY_EXECUTED
    }
}
