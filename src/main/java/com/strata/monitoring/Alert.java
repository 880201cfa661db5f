package com.strata.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Operator alert.
 */
public class Alert {

    public enum Severity {
        WARNING,
        CRITICAL
    }

    @JsonProperty("type")
    private final AlertType type;

    @JsonProperty("severity")
    private final Severity severity;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("raised_at")
    private final Instant raisedAt;

    public Alert(AlertType type, Severity severity, String message, Instant raisedAt) {
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.raisedAt = raisedAt;
    }

    public AlertType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Instant getRaisedAt() {
        return raisedAt;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + type + ": " + message;
    }
}
