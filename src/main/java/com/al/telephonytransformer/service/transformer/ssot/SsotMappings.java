package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.exception.TransformValidationException;
import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.mapping.MappingResult;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Field-mapping step shared by the SSOT transformers.
 */
final class SsotMappings {

    private SsotMappings() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Apply the mappings nested under {@code targetParent} and merge the
     * result into {@code transformed}.
     *
     * @return the mapped values
     * @throws TransformValidationException if a required source field is absent
     */
    static Map<String, Object> applyInto(Map<String, Object> transformed, Map<String, Object> record,
            FieldMappingApplier applier, List<FieldMapping> mappings, String targetParent, String jobTypeCode) {
        MappingResult result = applier.applyNested(record, mappings, targetParent);
        if (result.hasMissingRequiredFields()) {
            throw TransformValidationException.missingFields(jobTypeCode, result.getMissingRequiredFields());
        }
        ZoomRecordShapes.mergeInto(transformed, result.getValues());
        return result.getValues();
    }

    /**
     * Source fields flagged as required by the mappings and missing in the record.
     */
    static List<String> missingRequired(Map<String, Object> record, List<FieldMapping> mappings) {
        List<String> required = new ArrayList<>();
        for (FieldMapping mapping : mappings) {
            if (mapping.isRequired() && mapping.getSourceField() != null) {
                required.add(mapping.getSourceField());
            }
        }
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!record.containsKey(field) && FieldPathResolver.get(record, field) == null) {
                missing.add(field);
            }
        }
        return missing;
    }
}
