package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.AddressRules;
import com.al.telephonytransformer.service.rules.TimezoneRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformationSettings;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Dialpad office to Zoom site, emitted in the RingCentral site shape.
 *
 * <p>
 * {@code e911_address} becomes {@code default_emergency_address}; the office
 * timezone becomes a RingCentral {@code regionalSettings.timezone} object.
 */
@Slf4j
public class DialpadSitesTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.DIALPAD_ZOOM_SITES;
    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);
    private static final String KEY_E911_ADDRESS = "e911_address";
    private static final String URI_TEMPLATE = "https://dialpad-api/offices/%s";

    private final TransformationSettings settings;
    private final TransformerProperties properties;

    public DialpadSitesTransformer(TransformerSupport support) {
        this.settings = support.settingsFor(JOB_TYPE);
        this.properties = support.getProperties();
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        String name = FieldPathResolver.getString(record, KEY_NAME);

        Object e911 = record.get(KEY_E911_ADDRESS);
        if (e911 instanceof Map && !((Map<?, ?>) e911).isEmpty()) {
            Map<?, ?> address = (Map<?, ?>) e911;
            transformed.put(KEY_EMERGENCY_ADDRESS, AddressRules.emergencyAddress(
                    address.get("address"),
                    address.get("address2"),
                    address.get("city"),
                    address.get("state"),
                    address.get("zip"),
                    address.get("country")));
        }

        String timezone = TimezoneRules.timezoneToIana(record.get("timezone"));
        Map<String, Object> timezoneObject = new LinkedHashMap<>();
        timezoneObject.put(KEY_ID, TimezoneRules.ianaToPlatformTimezoneId(timezone));
        timezoneObject.put(KEY_NAME, timezone);
        Map<String, Object> regionalSettings = new LinkedHashMap<>();
        regionalSettings.put("timezone", timezoneObject);
        Map<String, Object> update = new LinkedHashMap<>();
        update.put(KEY_REGIONAL_SETTINGS, regionalSettings);
        ZoomRecordShapes.mergeInto(transformed, update);

        Object extension = FieldPathResolver.getFirst(record, KEY_OFFICE_ID, KEY_ID);
        if (extension != null) {
            transformed.put(KEY_EXTENSION_NUMBER, String.valueOf(extension));
        }
        if (name != null) {
            transformed.put("callerIdName", name.toUpperCase());
        }
        transformed.put("uri", String.format(URI_TEMPLATE, record.get(KEY_ID)));
        ZoomRecordShapes.addSiteNaming(transformed, name, settings, properties);

        log.info("Transformed Dialpad office {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT);
        if (!missing.isEmpty()) {
            log.error("Dialpad office is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_SITE_CODE))) {
            log.error("Transformed site {} has no site_code", record.get(KEY_ID));
            return false;
        }
        if (record.containsKey(KEY_E911_ADDRESS) && !record.containsKey(KEY_EMERGENCY_ADDRESS)) {
            log.warn("Site {} has an e911_address but no default_emergency_address", record.get(KEY_ID));
        }
        return true;
    }
}
