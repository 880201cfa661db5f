package com.strata.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the REST API.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    @JsonProperty("status")
    private final int status;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("message")
    private final String message;

    /**
     * One entry per defect for validation failures
     */
    @JsonProperty("errors")
    private final List<?> errors;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    public ErrorResponse(int status, String error, String message, List<?> errors, Instant timestamp) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.errors = errors;
        this.timestamp = timestamp;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public List<?> getErrors() {
        return errors;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
