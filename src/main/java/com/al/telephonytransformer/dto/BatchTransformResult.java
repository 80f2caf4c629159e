package com.al.telephonytransformer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of a batch transform supporting partial success. Transformed
 * records keep the order of the input; failed records are reported in
 * {@link #errors} and left out of {@link #records}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchTransformResult {

    private String sourcePlatform;

    private String targetPlatform;

    private String jobTypeCode;

    @Builder.Default
    private List<Map<String, Object>> records = new ArrayList<>();

    @Builder.Default
    private List<RecordError> errors = new ArrayList<>();

    private int totalCount;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public int getSuccessCount() {
        return records == null ? 0 : records.size();
    }

    public int getFailureCount() {
        return errors == null ? 0 : errors.size();
    }

    /**
     * Whether some but not all records failed
     */
    public boolean isPartialSuccess() {
        return hasErrors() && getSuccessCount() > 0;
    }

    public void addRecord(Map<String, Object> record) {
        if (records == null) {
            records = new ArrayList<>();
        }
        records.add(record);
    }

    public void addError(RecordError error) {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(error);
    }
}
