package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.rules.ScheduleRules;
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
 * SSOT auto attendant to Zoom auto receptionist. Mapped values are nested
 * under {@code auto_receptionist}.
 */
@Slf4j
public class SsotAutoReceptionistsTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.SSOT_TO_ZOOM_AUTO_RECEPTIONISTS;

    private final FieldMappingApplier applier;
    private final List<FieldMapping> mappings;

    public SsotAutoReceptionistsTransformer(TransformerSupport support) {
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
        SsotMappings.applyInto(transformed, record, applier, mappings, ENTITY_AUTO_RECEPTIONIST,
                JOB_TYPE.getCode());

        Object siteId = ZoomRecordShapes.siteId(record);
        if (siteId == null) {
            siteId = record.get("site_id");
        }
        if (siteId != null) {
            transformed.put(KEY_RC_SITE_ID, siteId);
        }

        ZoomRecordShapes.addCustomHours(transformed,
                ScheduleRules.extractWeeklyRanges(record.get(KEY_BUSINESS_HOURS)));
        log.info("Transformed SSOT auto receptionist {} (job {})", record.get(KEY_NAME), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = new ArrayList<>();
        if (FieldPathResolver.isBlank(record.get(KEY_NAME))) {
            missing.add(KEY_NAME);
        }
        missing.addAll(SsotMappings.missingRequired(record, mappings));
        if (!missing.isEmpty()) {
            log.error("SSOT auto receptionist is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_NAME))) {
            log.error("Transformed auto receptionist has no name");
            return false;
        }
        if (!record.containsKey(KEY_RC_SITE_ID)) {
            log.warn("Auto receptionist {} has no rc_site_id", record.get(KEY_NAME));
        }
        return true;
    }
}
