package com.al.telephonytransformer.exception;

import lombok.Getter;

/**
 * Exception thrown when a transformer fails unexpectedly. Wraps the cause
 * together with the job type being processed.
 */
@Getter
public class TransformationException extends RuntimeException {

    private final String jobTypeCode;

    public TransformationException(String jobTypeCode, Throwable cause) {
        super(String.format("Transformation failed for %s: %s", jobTypeCode, cause.getMessage()), cause);
        this.jobTypeCode = jobTypeCode;
    }
}
