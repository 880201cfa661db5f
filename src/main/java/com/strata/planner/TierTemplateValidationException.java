package com.strata.planner;

import com.strata.domain.StorageTier;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a tier template is incomplete or inconsistent.
 */
public class TierTemplateValidationException extends RuntimeException {

    private final String templateName;
    private final List<TemplateError> errors;

    public TierTemplateValidationException(String templateName, List<TemplateError> errors) {
        super("Invalid tier template " + templateName);
        this.templateName = templateName;
        this.errors = Collections.unmodifiableList(errors);
    }

    public String getTemplateName() {
        return templateName;
    }

    public List<TemplateError> getErrors() {
        return errors;
    }

    public boolean hasError(StorageTier tier, TemplateErrorCode code) {
        return errors.stream().anyMatch(error -> error.getTier() == tier && error.getCode() == code);
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Errors: "
            + errors.stream().map(TemplateError::toString).collect(Collectors.joining("; ")) + "]";
    }
}
