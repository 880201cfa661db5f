package com.strata.planner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.domain.StorageTier;

/**
 * One defect in one tier of a template. {@code tier} is null for template-level defects.
 */
public class TemplateError {

    @JsonProperty("tier")
    private final StorageTier tier;

    @JsonProperty("code")
    private final TemplateErrorCode code;

    @JsonProperty("message")
    private final String message;

    public TemplateError(StorageTier tier, TemplateErrorCode code, String message) {
        this.tier = tier;
        this.code = code;
        this.message = message;
    }

    public StorageTier getTier() {
        return tier;
    }

    public TemplateErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return (tier != null ? tier + " " : "") + code + ": " + message;
    }
}
