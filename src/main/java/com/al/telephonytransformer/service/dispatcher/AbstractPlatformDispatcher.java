package com.al.telephonytransformer.service.dispatcher;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.dto.TransformerInfo;
import com.al.telephonytransformer.exception.TransformValidationException;
import com.al.telephonytransformer.exception.TransformationException;
import com.al.telephonytransformer.exception.UnsupportedJobTypeException;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Base dispatcher holding an explicit job type to transformer factory table.
 *
 * <p>
 * Subclasses register their transformers in the constructor. Transformer
 * instances are built lazily through {@link ConcurrentHashMap#computeIfAbsent},
 * so concurrent first calls for the same job type share one instance.
 */
@Slf4j
public abstract class AbstractPlatformDispatcher implements PlatformDispatcher {

    private final String sourcePlatform;
    private final String targetPlatform;
    private final TransformerSupport support;
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final Map<Integer, String> codesById = new HashMap<>();
    private final Map<String, EntityTransformer> transformers = new ConcurrentHashMap<>();

    protected AbstractPlatformDispatcher(String sourcePlatform, String targetPlatform, TransformerSupport support) {
        this.sourcePlatform = sourcePlatform;
        this.targetPlatform = targetPlatform;
        this.support = support;
    }

    /**
     * Add a transformer factory for a job type. Called from subclass
     * constructors only.
     */
    protected final void register(JobType jobType, Function<TransformerSupport, EntityTransformer> factory) {
        registrations.put(jobType.getCode(), new Registration(jobType, factory));
        codesById.put(jobType.getId(), jobType.getCode());
    }

    @Override
    public String getSourcePlatform() {
        return sourcePlatform;
    }

    @Override
    public String getTargetPlatform() {
        return targetPlatform;
    }

    @Override
    public List<String> getSupportedJobTypes() {
        return new ArrayList<>(registrations.keySet());
    }

    @Override
    public boolean supportsJobType(String jobType) {
        String code = resolveCode(jobType);
        return code != null && registrations.containsKey(code);
    }

    @Override
    public EntityTransformer getTransformer(String jobType) {
        String code = resolveCode(jobType);
        Registration registration = code == null ? null : registrations.get(code);
        if (registration == null) {
            throw new UnsupportedJobTypeException(jobType, describe(), getSupportedJobTypes());
        }
        if (!isEnabled(code)) {
            log.warn("Transformer for {} is disabled by configuration", code);
            throw new UnsupportedJobTypeException(jobType, describe(), enabledJobTypes());
        }
        return transformers.computeIfAbsent(code, key -> {
            log.info("Creating transformer for {} ({})", key, describe());
            return registration.factory.apply(support);
        });
    }

    @Override
    public EntityTransformer getTransformerById(int jobTypeId) {
        return getTransformer(String.valueOf(jobTypeId));
    }

    @Override
    public Map<String, TransformerInfo> getTransformerInfo() {
        Map<String, TransformerInfo> info = new LinkedHashMap<>();
        for (Registration registration : registrations.values()) {
            JobType jobType = registration.jobType;
            EntityTransformer cached = transformers.get(jobType.getCode());
            info.put(jobType.getCode(), TransformerInfo.builder()
                    .jobTypeCode(jobType.getCode())
                    .jobTypeId(jobType.getId())
                    .displayName(jobType.getDisplayName())
                    .sourcePlatform(sourcePlatform)
                    .targetPlatform(jobType.getTargetPlatform())
                    .targetEntity(jobType.getTargetEntity())
                    .extractionOnly(jobType.isExtractionOnly())
                    .dependencies(new ArrayList<>(jobType.getDependencies()))
                    .transformerClass(cached == null ? null : cached.getClass().getName())
                    .enabled(isEnabled(jobType.getCode()))
                    .build());
        }
        return info;
    }

    @Override
    public Map<String, Object> transform(String jobType, Map<String, Object> data, TransformContext context) {
        EntityTransformer transformer = getTransformer(jobType);
        String code = transformer.getJobTypeCode();
        TransformContext effectiveContext = context == null ? TransformContext.empty() : context;

        if (data == null || !transformer.validateInput(data)) {
            throw new TransformValidationException(code, "Input validation failed for " + code);
        }

        Map<String, Object> transformed;
        try {
            transformed = transformer.transform(data, effectiveContext);
        } catch (TransformValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Transformer {} failed: {}", code, e.getMessage(), e);
            throw new TransformationException(code, e);
        }

        if (!transformer.validateOutput(transformed)) {
            throw new TransformValidationException(code, "Output validation failed for " + code);
        }
        log.debug("Transformed record with {} ({} keys)", code, transformed.size());
        return transformed;
    }

    /**
     * Map a code or numeric id to a registered code. Unknown ids yield null.
     */
    private String resolveCode(String jobType) {
        if (jobType == null || jobType.trim().isEmpty()) {
            return null;
        }
        String value = jobType.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return codesById.get(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                log.debug("Job type id {} is out of range", value);
                return null;
            }
        }
        return value.toLowerCase();
    }

    private boolean isEnabled(String code) {
        TransformerProperties properties = support == null ? null : support.getProperties();
        return properties == null || properties.isTransformerEnabled(code);
    }

    private List<String> enabledJobTypes() {
        List<String> enabled = new ArrayList<>();
        for (String code : registrations.keySet()) {
            if (isEnabled(code)) {
                enabled.add(code);
            }
        }
        return enabled;
    }

    private String describe() {
        return sourcePlatform + " -> " + targetPlatform;
    }

    private static final class Registration {
        private final JobType jobType;
        private final Function<TransformerSupport, EntityTransformer> factory;

        private Registration(JobType jobType, Function<TransformerSupport, EntityTransformer> factory) {
            this.jobType = jobType;
            this.factory = factory;
        }
    }
}
