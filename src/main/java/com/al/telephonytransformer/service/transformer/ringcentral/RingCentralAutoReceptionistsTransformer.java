package com.al.telephonytransformer.service.transformer.ringcentral;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * RingCentral IVR menu extension to Zoom auto receptionist. Exposes the
 * owning site as {@code rc_site_id} for dependency resolution.
 */
@Slf4j
public class RingCentralAutoReceptionistsTransformer implements EntityTransformer {

    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);

    public RingCentralAutoReceptionistsTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JobType.RC_ZOOM_ARS.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JobType.RC_ZOOM_ARS.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        Object siteId = ZoomRecordShapes.siteId(record);
        if (siteId != null) {
            transformed.put(KEY_RC_SITE_ID, siteId);
        }
        log.info("Transformed RingCentral auto receptionist {} (site {}, job {})", record.get(KEY_ID), siteId,
                context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT);
        if (!missing.isEmpty()) {
            log.error("RingCentral auto receptionist is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (ZoomRecordShapes.siteId(record) != null && !record.containsKey(KEY_RC_SITE_ID)) {
            log.warn("Auto receptionist {} has a site id but no rc_site_id", record.get(KEY_ID));
        }
        return FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT).isEmpty();
    }
}
