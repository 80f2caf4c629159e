package com.al.telephonytransformer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes one transformer registered with a dispatcher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransformerInfo {

    private String jobTypeCode;

    private int jobTypeId;

    private String displayName;

    private String sourcePlatform;

    private String targetPlatform;

    private String targetEntity;

    private boolean extractionOnly;

    /**
     * Job type codes whose output must be loaded first
     */
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    private String transformerClass;

    private boolean enabled;
}
