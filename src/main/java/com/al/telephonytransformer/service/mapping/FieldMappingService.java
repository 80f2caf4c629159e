package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.repository.FieldMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads field mappings from MongoDB. Store failures degrade to "no mappings"
 * so transformers fall back to their built-in field handling.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FieldMappingService implements FieldMappingProvider {

    private final FieldMappingRepository fieldMappingRepository;

    @Override
    public List<FieldMapping> getFieldMappings(int jobTypeId, String sourcePlatform, String targetEntity) {
        try {
            List<FieldMapping> mappings = fieldMappingRepository
                    .findByJobTypeIdAndSourcePlatformAndTargetEntity(jobTypeId, sourcePlatform, targetEntity);
            log.debug("Loaded {} field mappings for job type {} ({} -> {})", mappings.size(), jobTypeId,
                    sourcePlatform, targetEntity);
            return mappings;
        } catch (DataAccessException e) {
            log.error("Failed to load field mappings for job type {} ({} -> {}): {}", jobTypeId, sourcePlatform,
                    targetEntity, e.getMessage());
            return new ArrayList<>();
        }
    }
}
