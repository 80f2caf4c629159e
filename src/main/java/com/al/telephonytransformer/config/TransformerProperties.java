package com.al.telephonytransformer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the transformation engine.
 * Loaded from application.yml under {@code telephony-transformer}.
 */
@Configuration
@ConfigurationProperties(prefix = "telephony-transformer")
@Data
public class TransformerProperties {

    /**
     * Maximum length of a generated site code
     */
    private int siteCodeMaxLength = 20;

    /**
     * Zoom limit for auto receptionist names
     */
    private int autoReceptionistNameMaxLength = 30;

    /**
     * Transformer enable/disable flags keyed by job type code
     */
    private Map<String, Boolean> transformers = new HashMap<>();

    /**
     * Batch processing limits
     */
    private Batch batch = new Batch();

    /**
     * Check if the transformer for a job type is enabled. Unlisted job types
     * are enabled.
     */
    public boolean isTransformerEnabled(String jobTypeCode) {
        return transformers.getOrDefault(jobTypeCode, true);
    }

    @Data
    public static class Batch {
        private int maxRecords = 5000;
    }
}
