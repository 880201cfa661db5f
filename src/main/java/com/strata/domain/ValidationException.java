package com.strata.domain;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a policy or threshold profile write is rejected.
 * Carries every defect found, not just the first one.
 */
public class ValidationException extends RuntimeException {

    private final String subject;
    private final List<ValidationError> errors;

    public ValidationException(String subject, List<ValidationError> errors) {
        super("Validation failed for " + subject);
        this.subject = subject;
        this.errors = Collections.unmodifiableList(errors);
    }

    public ValidationException(String subject, ValidationError error) {
        this(subject, List.of(error));
    }

    public String getSubject() {
        return subject;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public boolean hasError(ValidationCode code) {
        return errors.stream().anyMatch(error -> error.getCode() == code);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (!errors.isEmpty()) {
            sb.append(" [Errors: ")
                .append(errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")))
                .append("]");
        }
        return sb.toString();
    }
}
