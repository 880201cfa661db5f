package com.strata.planner;

import java.util.Collections;
import java.util.List;

/**
 * Planning failed; no partition layout was produced.
 */
public class PlanningException extends RuntimeException {

    private final String datasetId;
    private final List<TemplateError> templateErrors;

    public PlanningException(String message, String datasetId) {
        super(message);
        this.datasetId = datasetId;
        this.templateErrors = Collections.emptyList();
    }

    public PlanningException(String message, String datasetId, TierTemplateValidationException cause) {
        super(message, cause);
        this.datasetId = datasetId;
        this.templateErrors = cause.getErrors();
    }

    public String getDatasetId() {
        return datasetId;
    }

    public List<TemplateError> getTemplateErrors() {
        return templateErrors;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (datasetId != null) {
            sb.append(" [Dataset: ").append(datasetId).append("]");
        }
        if (getCause() != null) {
            sb.append(" [Cause: ").append(getCause().getMessage()).append("]");
        }
        return sb.toString();
    }
}
