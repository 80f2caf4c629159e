package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.model.TransformationConfigEntity;
import com.al.telephonytransformer.repository.TransformationConfigRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a job type's transformation configuration from MongoDB and parses
 * its YAML text. Missing rows, empty text and parse errors all yield an
 * empty map.
 */
@Service
@Slf4j
public class TransformationConfigService implements TransformationConfigProvider {

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    private final TransformationConfigRepository transformationConfigRepository;
    private final ObjectMapper yamlMapper;

    @Autowired
    public TransformationConfigService(TransformationConfigRepository transformationConfigRepository) {
        this.transformationConfigRepository = transformationConfigRepository;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    @Override
    public Map<String, Object> getTransformationConfig(String jobTypeCode) {
        Optional<TransformationConfigEntity> entity;
        try {
            entity = transformationConfigRepository.findByJobTypeCodeAndActiveTrue(jobTypeCode);
        } catch (DataAccessException e) {
            log.error("Failed to load transformation config for {}: {}", jobTypeCode, e.getMessage());
            return new LinkedHashMap<>();
        }
        if (entity.isEmpty()) {
            log.debug("No transformation config for {}, using defaults", jobTypeCode);
            return new LinkedHashMap<>();
        }
        return parse(jobTypeCode, entity.get().getTransformationConfig());
    }

    /**
     * Parse YAML configuration text into a map.
     */
    public Map<String, Object> parse(String jobTypeCode, String yaml) {
        if (yaml == null || yaml.trim().isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> config = yamlMapper.readValue(yaml, CONFIG_TYPE);
            return config == null ? new LinkedHashMap<>() : config;
        } catch (JsonProcessingException e) {
            log.error("Invalid transformation config YAML for {}: {}", jobTypeCode, e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
