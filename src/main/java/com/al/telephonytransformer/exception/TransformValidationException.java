package com.al.telephonytransformer.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Exception thrown when a record fails its entity contract, either before
 * or after transformation, or when a required mapped field is absent.
 * Contains one entry per failed check so callers can report all of them.
 */
@Getter
public class TransformValidationException extends RuntimeException {

    private final String jobTypeCode;
    private final List<ValidationError> validationErrors;

    public TransformValidationException(String jobTypeCode, String message, List<ValidationError> validationErrors) {
        super(message);
        this.jobTypeCode = jobTypeCode;
        this.validationErrors = validationErrors == null ? new ArrayList<>() : validationErrors;
    }

    public TransformValidationException(String jobTypeCode, String message) {
        this(jobTypeCode, message, new ArrayList<>());
    }

    /**
     * Build an exception listing missing required fields.
     */
    public static TransformValidationException missingFields(String jobTypeCode, List<String> fields) {
        List<ValidationError> errors = new ArrayList<>();
        for (String field : fields) {
            errors.add(new ValidationError("error", field, "Missing required field: " + field));
        }
        return new TransformValidationException(jobTypeCode,
                String.format("Missing required fields for %s: %s", jobTypeCode, fields), errors);
    }

    /**
     * Represents a single validation error with location and severity
     */
    @Getter
    public static class ValidationError {
        private final String severity;
        private final String location;
        private final String message;

        public ValidationError(String severity, String location, String message) {
            this.severity = severity;
            this.location = location;
            this.message = message;
        }
    }
}
