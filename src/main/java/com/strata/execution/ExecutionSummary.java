package com.strata.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome counts of one execution pass. Workers update it concurrently.
 */
public class ExecutionSummary {

    @JsonProperty("claimed")
    private final AtomicInteger claimed = new AtomicInteger();

    @JsonProperty("succeeded")
    private final AtomicInteger succeeded = new AtomicInteger();

    @JsonProperty("failed")
    private final AtomicInteger failed = new AtomicInteger();

    @JsonProperty("timed_out")
    private final AtomicInteger timedOut = new AtomicInteger();

    @JsonProperty("skipped")
    private final AtomicInteger skipped = new AtomicInteger();

    @JsonProperty("not_started_reason")
    private String notStartedReason;

    @JsonProperty("duration_ms")
    private long durationMs;

    public static ExecutionSummary notStarted(String reason) {
        ExecutionSummary summary = new ExecutionSummary();
        summary.notStartedReason = reason;
        return summary;
    }

    void claimed() {
        claimed.incrementAndGet();
    }

    void succeeded() {
        succeeded.incrementAndGet();
    }

    void failed() {
        failed.incrementAndGet();
    }

    void timedOut() {
        timedOut.incrementAndGet();
    }

    void skipped() {
        skipped.incrementAndGet();
    }

    void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public int getClaimed() {
        return claimed.get();
    }

    public int getSucceeded() {
        return succeeded.get();
    }

    /**
     * Failures including timeouts.
     */
    public int getFailed() {
        return failed.get();
    }

    public int getTimedOut() {
        return timedOut.get();
    }

    public int getSkipped() {
        return skipped.get();
    }

    public String getNotStartedReason() {
        return notStartedReason;
    }

    public boolean isStarted() {
        return notStartedReason == null;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        if (!isStarted()) {
            return "ExecutionSummary{notStarted='" + notStartedReason + "'}";
        }
        return "ExecutionSummary{" +
            "claimed=" + claimed +
            ", succeeded=" + succeeded +
            ", failed=" + failed +
            ", timedOut=" + timedOut +
            ", skipped=" + skipped +
            ", durationMs=" + durationMs +
            '}';
    }
}
