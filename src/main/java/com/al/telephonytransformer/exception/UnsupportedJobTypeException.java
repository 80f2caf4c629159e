package com.al.telephonytransformer.exception;

import java.util.List;

/**
 * Exception thrown when a dispatcher has no transformer for a job type code
 * or id, or the transformer is disabled by configuration.
 */
public class UnsupportedJobTypeException extends TransformerNotFoundException {

    public UnsupportedJobTypeException(String jobType, String dispatcher, List<String> supported) {
        super(String.format("Unsupported job type '%s' for %s. Supported types: %s", jobType, dispatcher,
                String.join(", ", supported)), jobType, supported);
    }
}
