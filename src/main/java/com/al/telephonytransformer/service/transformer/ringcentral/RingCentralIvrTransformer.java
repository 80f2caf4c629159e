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
 * RingCentral IVR menu to Zoom IVR settings.
 *
 * <p>
 * {@code ivr_details[0].actions} become {@code ivr_actions} and
 * {@code ivr_details} is removed. Target types are guessed from extension
 * names, see {@link com.al.telephonytransformer.service.rules.IvrRules#detectExtensionType}.
 */
@Slf4j
public class RingCentralIvrTransformer implements EntityTransformer {

    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);

    public RingCentralIvrTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JobType.RC_ZOOM_IVR.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JobType.RC_ZOOM_IVR.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        Object details = record.get(KEY_IVR_DETAILS);
        if (details instanceof List && !((List<?>) details).isEmpty()) {
            Object actions = FieldPathResolver.get(details, "[0].actions");
            if (actions != null) {
                List<Map<String, Object>> ivrActions = ZoomRecordShapes.ivrActions(actions);
                transformed.put(KEY_IVR_ACTIONS, ivrActions);
                log.debug("IVR {}: mapped {} actions", record.get(KEY_ID), ivrActions.size());
            }
            transformed.remove(KEY_IVR_DETAILS);
        } else {
            log.info("IVR {} has no ivr_details, copying as-is", record.get(KEY_ID));
        }
        log.info("Transformed RingCentral IVR {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT);
        if (!missing.isEmpty()) {
            log.error("RingCentral IVR is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (record.containsKey(KEY_IVR_DETAILS)) {
            log.warn("IVR {} still carries ivr_details after transformation", record.get(KEY_ID));
        }
        return !FieldPathResolver.isBlank(record.get(KEY_ID));
    }
}
