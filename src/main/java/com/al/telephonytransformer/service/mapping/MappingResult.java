package com.al.telephonytransformer.service.mapping;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of applying field mappings: the mapped values and the required
 * source fields that were absent.
 */
@Getter
public class MappingResult {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> missingRequiredFields = new ArrayList<>();

    public boolean hasMissingRequiredFields() {
        return !missingRequiredFields.isEmpty();
    }

    void addMissing(String sourceField) {
        missingRequiredFields.add(sourceField);
    }
}
