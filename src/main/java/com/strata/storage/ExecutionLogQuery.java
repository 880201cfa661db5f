package com.strata.storage;

import com.strata.domain.ExecutionStatus;

import java.time.Instant;

/**
 * Filter for the execution log. Every criterion is optional.
 */
public class ExecutionLogQuery {

    public static final int DEFAULT_LIMIT = 100;

    private String datasetId;
    private Long policyId;
    private ExecutionStatus status;
    private Instant from;
    private Instant to;
    private int limit = DEFAULT_LIMIT;

    public static ExecutionLogQuery all() {
        return new ExecutionLogQuery();
    }

    public ExecutionLogQuery dataset(String datasetId) {
        this.datasetId = datasetId;
        return this;
    }

    public ExecutionLogQuery policy(Long policyId) {
        this.policyId = policyId;
        return this;
    }

    public ExecutionLogQuery status(ExecutionStatus status) {
        this.status = status;
        return this;
    }

    public ExecutionLogQuery from(Instant from) {
        this.from = from;
        return this;
    }

    public ExecutionLogQuery to(Instant to) {
        this.to = to;
        return this;
    }

    public ExecutionLogQuery limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        this.limit = limit;
        return this;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public Long getPolicyId() {
        return policyId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public int getLimit() {
        return limit;
    }
}
