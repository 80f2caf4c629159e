package com.al.telephonytransformer.service.transformer.ringcentral;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.ScheduleRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * RingCentral call queue to Zoom call queue. Business hours become
 * {@code custom_hours_settings}; a queue without business hours is copied
 * unchanged.
 */
@Slf4j
public class RingCentralCallQueuesTransformer implements EntityTransformer {

    public RingCentralCallQueuesTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JobType.RC_ZOOM_CALL_QUEUES.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JobType.RC_ZOOM_CALL_QUEUES.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        Object weeklyRanges = ScheduleRules.extractWeeklyRanges(record.get(KEY_BUSINESS_HOURS));
        if (ZoomRecordShapes.addCustomHours(transformed, weeklyRanges)) {
            log.debug("Call queue {} has custom hours", record.get(KEY_ID));
        }
        log.info("Transformed RingCentral call queue {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_ID))) {
            log.error("RingCentral call queue is missing id");
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (record.get(KEY_BUSINESS_HOURS) != null && !record.containsKey(KEY_CUSTOM_HOURS)) {
            log.warn("Call queue {} has business_hours but no custom_hours_settings", record.get(KEY_ID));
        }
        return !FieldPathResolver.isBlank(record.get(KEY_ID));
    }
}
