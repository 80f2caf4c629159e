package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.rules.AddressRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformationSettings;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * SSOT site to Zoom site.
 *
 * <p>
 * The emergency address is built from {@code businessAddress}, from the
 * {@code address_transformation} block of the transformation config, or from
 * the flat SSOT address columns, in that order. {@code businessAddress} is
 * removed after folding.
 */
@Slf4j
public class SsotSitesTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.SSOT_TO_ZOOM_SITES;
    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);

    private final FieldMappingApplier applier;
    private final List<FieldMapping> mappings;
    private final TransformationSettings settings;
    private final TransformerProperties properties;

    public SsotSitesTransformer(TransformerSupport support) {
        this.applier = support.getFieldMappingApplier();
        this.mappings = support.mappingsFor(JOB_TYPE);
        this.settings = support.settingsFor(JOB_TYPE);
        this.properties = support.getProperties();
        log.debug("Initialized {} transformer with {} field mappings", JOB_TYPE.getCode(), mappings.size());
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        SsotMappings.applyInto(transformed, record, applier, mappings, KEY_EMERGENCY_ADDRESS, JOB_TYPE.getCode());

        Map<String, Object> address = emergencyAddress(record);
        if (!address.isEmpty()) {
            ZoomRecordShapes.mergeInto(transformed, Map.of(KEY_EMERGENCY_ADDRESS, address));
        }
        transformed.remove(KEY_BUSINESS_ADDRESS);

        ZoomRecordShapes.addSiteNaming(transformed, FieldPathResolver.getString(transformed, KEY_NAME), settings,
                properties);
        log.info("Transformed SSOT site {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    private Map<String, Object> emergencyAddress(Map<String, Object> record) {
        Object businessAddress = record.get(KEY_BUSINESS_ADDRESS);
        if (businessAddress instanceof Map) {
            return AddressRules.fromBusinessAddress((Map<?, ?>) businessAddress);
        }

        Map<String, Object> addressConfig = settings.getMap("address_transformation");
        if (!addressConfig.isEmpty()) {
            Map<String, Object> assembled = AddressRules.assembleAddress(record,
                    asMap(addressConfig.get("source_fields")), asMap(addressConfig.get("fallback_mapping")));
            return assembled.isEmpty() ? assembled : AddressRules.fromBusinessAddress(assembled);
        }

        if (FieldPathResolver.isBlank(record.get("street_address"))) {
            return new LinkedHashMap<>();
        }
        return AddressRules.emergencyAddress(
                record.get("street_address"),
                record.get("street_address2"),
                record.get("city"),
                FieldPathResolver.getFirst(record, "state_province", "state"),
                FieldPathResolver.getFirst(record, "postal_code", "zip"),
                record.get("country"));
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = new ArrayList<>(FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT));
        missing.addAll(SsotMappings.missingRequired(record, mappings));
        if (!missing.isEmpty()) {
            log.error("SSOT site is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (record.containsKey(KEY_BUSINESS_ADDRESS)) {
            log.warn("SSOT site {} still carries businessAddress", record.get(KEY_ID));
        }
        if (FieldPathResolver.isBlank(record.get(KEY_SITE_CODE))) {
            log.error("Transformed site {} has no site_code", record.get(KEY_ID));
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
