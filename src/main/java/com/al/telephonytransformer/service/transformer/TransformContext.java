package com.al.telephonytransformer.service.transformer;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-call context passed from the caller through the dispatcher to the
 * transformer. Used for correlation in logs.
 */
@Data
@Builder
public class TransformContext {
    private String jobId;
    private Integer jobGroupId;
    private String transactionId;
    private boolean dryRun;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    public static TransformContext empty() {
        return TransformContext.builder().build();
    }
}
