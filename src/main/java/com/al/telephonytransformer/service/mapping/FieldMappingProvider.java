package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.FieldMapping;

import java.util.List;

/**
 * Source of declarative field mappings. Implementations return an empty list
 * rather than failing when the store is unavailable.
 */
public interface FieldMappingProvider {

    List<FieldMapping> getFieldMappings(int jobTypeId, String sourcePlatform, String targetEntity);
}
