package com.al.telephonytransformer.service.transformer;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.mapping.FieldMappingProvider;
import com.al.telephonytransformer.service.mapping.TransformationConfigProvider;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collaborators handed to every transformer a dispatcher constructs.
 */
@Component
@Getter
@Slf4j
public class TransformerSupport {

    private final FieldMappingProvider fieldMappingProvider;
    private final TransformationConfigProvider transformationConfigProvider;
    private final FieldMappingApplier fieldMappingApplier;
    private final TransformerProperties properties;

    @Autowired
    public TransformerSupport(FieldMappingProvider fieldMappingProvider,
            TransformationConfigProvider transformationConfigProvider,
            FieldMappingApplier fieldMappingApplier,
            TransformerProperties properties) {
        this.fieldMappingProvider = fieldMappingProvider;
        this.transformationConfigProvider = transformationConfigProvider;
        this.fieldMappingApplier = fieldMappingApplier;
        this.properties = properties;
    }

    public TransformationSettings settingsFor(JobType jobType) {
        return new TransformationSettings(jobType.getCode(), transformationConfigProvider);
    }

    /**
     * Fetch the field mappings for a job type. Failures yield an empty list.
     */
    public List<FieldMapping> mappingsFor(JobType jobType) {
        try {
            List<FieldMapping> mappings = fieldMappingProvider.getFieldMappings(jobType.getId(),
                    jobType.getSourcePlatform().getCode(), jobType.getTargetEntity());
            return mappings == null ? new ArrayList<>() : mappings;
        } catch (RuntimeException e) {
            log.warn("Could not load field mappings for {}, continuing without: {}", jobType.getCode(),
                    e.getMessage());
            return new ArrayList<>();
        }
    }
}
