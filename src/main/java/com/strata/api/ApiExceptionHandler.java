package com.strata.api;

import com.strata.domain.ResourceNotFoundException;
import com.strata.domain.ValidationException;
import com.strata.planner.PlanningException;
import com.strata.planner.TierTemplateValidationException;
import com.strata.policy.MetadataUnavailableException;
import com.strata.storage.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.List;

/**
 * Maps service exceptions to HTTP responses: rejected writes and invalid plans to 400 with
 * every defect listed, unknown identifiers to 404, an unreachable metadata store to 503.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "Validation failed for " + e.getSubject(), e.getErrors());
    }

    @ExceptionHandler(TierTemplateValidationException.class)
    public ResponseEntity<ErrorResponse> handleTemplateValidation(TierTemplateValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "Tier template " + e.getTemplateName() + " is invalid", e.getErrors());
    }

    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<ErrorResponse> handlePlanning(PlanningException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getTemplateErrors());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), null);
    }

    @ExceptionHandler({MetadataUnavailableException.class, MetadataStoreException.class})
    public ResponseEntity<ErrorResponse> handleMetadataUnavailable(RuntimeException e) {
        log.error("Request failed, metadata store unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, List<?> errors) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.value(), status.getReasonPhrase(), message, errors, clock.instant()));
    }
}
