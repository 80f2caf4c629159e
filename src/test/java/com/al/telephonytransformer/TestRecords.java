package com.al.telephonytransformer;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test helpers: JSON fixtures and transformer collaborators without a store.
 */
public final class TestRecords {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private TestRecords() {
    }

    /**
     * Load {@code src/test/resources/fixtures/<name>} as a mutable record.
     */
    public static Map<String, Object> fixture(String name) {
        try (InputStream in = TestRecords.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + name);
            }
            return MAPPER.readValue(in, RECORD_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parse a JSON object literal. Single quotes may be used for readability.
     */
    public static Map<String, Object> json(String json) {
        try {
            return MAPPER.readValue(json.replace('\'', '"'), RECORD_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static TransformerSupport support() {
        return support(new ArrayList<>(), new LinkedHashMap<>(), new TransformerProperties());
    }

    public static TransformerSupport support(List<FieldMapping> mappings, Map<String, Object> config) {
        return support(mappings, config, new TransformerProperties());
    }

    public static TransformerSupport support(List<FieldMapping> mappings, Map<String, Object> config,
            TransformerProperties properties) {
        return new TransformerSupport(
                (jobTypeId, sourcePlatform, targetEntity) -> mappings,
                jobTypeCode -> config,
                new FieldMappingApplier(),
                properties);
    }

    public static FieldMapping mapping(String sourceField, String targetField, String rule, boolean required) {
        return FieldMapping.builder()
                .sourceField(sourceField)
                .targetField(targetField)
                .transformationRule(rule)
                .required(required)
                .build();
    }
}
