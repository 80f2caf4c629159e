package com.al.telephonytransformer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a record that could not be transformed in a batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordError {

    /**
     * Position of the record in the submitted batch
     */
    private int recordIndex;

    /**
     * Record {@code id}, when the record has one
     */
    private String recordId;

    private String jobTypeCode;

    /**
     * Error code for programmatic handling
     */
    private String errorCode;

    private String message;

    /**
     * Individual validation failures, empty for other errors
     */
    @Builder.Default
    private List<String> details = new ArrayList<>();

    /**
     * The original exception class name (for debugging)
     */
    private String exceptionType;
}
