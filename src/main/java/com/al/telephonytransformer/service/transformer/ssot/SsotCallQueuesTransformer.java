package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.rules.ExtensionRules;
import com.al.telephonytransformer.service.rules.ScheduleRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformerSupport;
import com.al.telephonytransformer.service.transformer.ZoomRecordShapes;
import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * SSOT call queue to Zoom call queue.
 *
 * <p>
 * {@code business_hours} is read either in the RingCentral shape
 * ({@code schedule.weeklyRanges}) or as SSOT day settings under
 * {@code weekly_hours}. A {@code 24_7} schedule has no custom hours.
 */
@Slf4j
public class SsotCallQueuesTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.SSOT_TO_ZOOM_CALL_QUEUES;
    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);
    private static final String SCHEDULE_24_7 = "24_7";
    private static final String EXTENSION_PREFIX = "10";
    private static final int EXTENSION_MIN_LENGTH = 3;

    private final FieldMappingApplier applier;
    private final List<FieldMapping> mappings;

    public SsotCallQueuesTransformer(TransformerSupport support) {
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
        SsotMappings.applyInto(transformed, record, applier, mappings, null, JOB_TYPE.getCode());

        ZoomRecordShapes.addCustomHours(transformed, weeklyRanges(record.get(KEY_BUSINESS_HOURS)));

        Object extension = record.get("extension_number");
        if (!transformed.containsKey(KEY_EXTENSION_NUMBER) && !FieldPathResolver.isBlank(extension)) {
            transformed.put(KEY_EXTENSION_NUMBER,
                    ExtensionRules.applyCustomExtensionFormat(extension, EXTENSION_PREFIX, EXTENSION_MIN_LENGTH));
        }
        log.info("Transformed SSOT call queue {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    private static Object weeklyRanges(Object businessHours) {
        Object ranges = ScheduleRules.extractWeeklyRanges(businessHours);
        if (ranges != null || !(businessHours instanceof Map)) {
            return ranges;
        }
        Map<?, ?> hours = (Map<?, ?>) businessHours;
        if (SCHEDULE_24_7.equals(hours.get("schedule_type"))) {
            return null;
        }
        return ScheduleRules.weeklyRangesFromDaySettings(hours.get("weekly_hours"));
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = new ArrayList<>(FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT));
        missing.addAll(SsotMappings.missingRequired(record, mappings));
        if (!missing.isEmpty()) {
            log.error("SSOT call queue is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_NAME))) {
            log.error("Transformed call queue {} has no name", record.get(KEY_ID));
            return false;
        }
        return true;
    }
}
