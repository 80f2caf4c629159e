package com.al.telephonytransformer.service.transformer.ringcentral;

import com.al.telephonytransformer.config.TransformerProperties;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.AddressRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformationSettings;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * RingCentral site to Zoom site.
 *
 * <p>
 * Adds {@code default_emergency_address} from {@code businessAddress} (which
 * is kept), {@code site_code} and optionally {@code auto_receptionist_name}.
 */
@Slf4j
public class RingCentralSitesTransformer implements EntityTransformer {

    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);

    private final TransformationSettings settings;
    private final TransformerProperties properties;

    public RingCentralSitesTransformer(TransformerSupport support) {
        this.settings = support.settingsFor(JobType.RC_ZOOM_SITES);
        this.properties = support.getProperties();
    }

    @Override
    public String getJobTypeCode() {
        return JobType.RC_ZOOM_SITES.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);

        Object businessAddress = record.get(KEY_BUSINESS_ADDRESS);
        if (businessAddress instanceof Map) {
            transformed.put(KEY_EMERGENCY_ADDRESS, AddressRules.fromBusinessAddress((Map<?, ?>) businessAddress));
        }
        ZoomRecordShapes.addSiteNaming(transformed, FieldPathResolver.getString(record, KEY_NAME), settings,
                properties);

        log.info("Transformed RingCentral site {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT);
        if (!missing.isEmpty()) {
            log.error("RingCentral site is missing required fields: {}", missing);
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
        if (record.containsKey(KEY_BUSINESS_ADDRESS) && !record.containsKey(KEY_EMERGENCY_ADDRESS)) {
            log.warn("Site {} has a businessAddress but no default_emergency_address", record.get(KEY_ID));
        }
        return true;
    }
}
