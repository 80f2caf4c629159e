package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * SSOT IVR menu to Zoom IVR.
 *
 * <p>
 * Actions from {@code ivr_details[0].actions} and {@code menu_options} are
 * folded into one {@code ivr_actions} list, in that order; both source keys
 * are removed. Mapped values are nested under {@code ivr_setting}.
 */
@Slf4j
public class SsotIvrTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.SSOT_TO_ZOOM_IVR;
    private static final String KEY_MENU_OPTIONS = "menu_options";
    private static final String IVR_SETTING = "ivr_setting";

    private final FieldMappingApplier applier;
    private final List<FieldMapping> mappings;

    public SsotIvrTransformer(TransformerSupport support) {
        this.applier = support.getFieldMappingApplier();
        this.mappings = support.mappingsFor(JOB_TYPE);
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        SsotMappings.applyInto(transformed, record, applier, mappings, IVR_SETTING, JOB_TYPE.getCode());

        List<Map<String, Object>> actions = new ArrayList<>();
        actions.addAll(ZoomRecordShapes.ivrActions(FieldPathResolver.get(record, KEY_IVR_DETAILS + "[0].actions")));
        actions.addAll(ZoomRecordShapes.ivrActions(record.get(KEY_MENU_OPTIONS)));

        if (record.containsKey(KEY_IVR_DETAILS) || record.containsKey(KEY_MENU_OPTIONS)) {
            transformed.put(KEY_IVR_ACTIONS, actions);
            transformed.remove(KEY_IVR_DETAILS);
            transformed.remove(KEY_MENU_OPTIONS);
        }
        log.info("Transformed SSOT IVR {} with {} actions (job {})", record.get(KEY_ID), actions.size(),
                context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = new ArrayList<>();
        if (FieldPathResolver.isBlank(record.get(KEY_ID))) {
            missing.add(KEY_ID);
        }
        missing.addAll(SsotMappings.missingRequired(record, mappings));
        if (!missing.isEmpty()) {
            log.error("SSOT IVR is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (record.containsKey(KEY_IVR_DETAILS) || record.containsKey(KEY_MENU_OPTIONS)) {
            log.warn("IVR {} still carries source menu keys", record.get(KEY_ID));
        }
        return !FieldPathResolver.isBlank(record.get(KEY_ID));
    }
}
