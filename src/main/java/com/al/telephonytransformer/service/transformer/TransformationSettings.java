package com.al.telephonytransformer.service.transformer;

import com.al.telephonytransformer.service.mapping.TransformationConfigProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lazily loaded transformation configuration of one transformer instance.
 * The provider is consulted once, on first access.
 */
@Slf4j
public class TransformationSettings {

    private final String jobTypeCode;
    private final TransformationConfigProvider provider;
    private volatile Map<String, Object> config;

    public TransformationSettings(String jobTypeCode, TransformationConfigProvider provider) {
        this.jobTypeCode = jobTypeCode;
        this.provider = provider;
    }

    public Map<String, Object> get() {
        Map<String, Object> loaded = config;
        if (loaded == null) {
            synchronized (this) {
                loaded = config;
                if (loaded == null) {
                    loaded = load();
                    config = loaded;
                }
            }
        }
        return loaded;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = get().get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(String.valueOf(value));
    }

    public int getInt(String key, int defaultValue) {
        Object value = get().get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config '{}' for {} is not a number: {}", key, jobTypeCode, value);
            }
        }
        return defaultValue;
    }

    public String getString(String key, String defaultValue) {
        Object value = get().get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = get().get(key);
        return value instanceof Map ? (Map<String, Object>) value : new LinkedHashMap<>();
    }

    private Map<String, Object> load() {
        if (provider == null) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> loaded = provider.getTransformationConfig(jobTypeCode);
            log.debug("Loaded transformation config for {}: {} keys", jobTypeCode,
                    loaded == null ? 0 : loaded.size());
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (RuntimeException e) {
            log.warn("Could not load transformation config for {}, using defaults: {}", jobTypeCode,
                    e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
