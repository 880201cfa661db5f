package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One defect found while validating a write.
 */
public class ValidationError {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("code")
    private final ValidationCode code;

    @JsonProperty("message")
    private final String message;

    public ValidationError(String field, ValidationCode code, String message) {
        this.field = field;
        this.code = code;
        this.message = message;
    }

    public String getField() {
        return field;
    }

    public ValidationCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return Objects.equals(field, that.field) && code == that.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, code);
    }

    @Override
    public String toString() {
        return field + ": " + message + " (" + code + ")";
    }
}
