package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.model.enums.JobType;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Dialpad department to Zoom call queue.
 *
 * <p>
 * The per-day {@code <day>_hours} arrays are rebuilt as RingCentral
 * {@code business_hours} and then converted like a RingCentral queue. The
 * queue extension is synthesized with {@link ExtensionRules#deterministicExtension}.
 */
@Slf4j
public class DialpadCallQueuesTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.DIALPAD_ZOOM_CALL_QUEUES;
    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, KEY_NAME);
    private static final String DAY_HOURS_SUFFIX = "_hours";

    public DialpadCallQueuesTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JOB_TYPE.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);

        Map<String, Object> weeklyRanges = ScheduleRules.weeklyRangesFromDayArrays(record, DAY_HOURS_SUFFIX);
        if (!weeklyRanges.isEmpty()) {
            Map<String, Object> schedule = new LinkedHashMap<>();
            schedule.put("weeklyRanges", weeklyRanges);
            Map<String, Object> businessHours = new LinkedHashMap<>();
            businessHours.put("schedule", schedule);
            List<Object> hoursList = new ArrayList<>();
            hoursList.add(businessHours);
            transformed.put(KEY_BUSINESS_HOURS, hoursList);
            ZoomRecordShapes.addCustomHours(transformed, weeklyRanges);
        }

        transformed.put(KEY_EXTENSION_NUMBER,
                ExtensionRules.deterministicExtension(record.get(KEY_ID), ExtensionRules.CLASS_CALL_QUEUE));

        Map<String, Object> site = new LinkedHashMap<>();
        site.put(KEY_ID, record.get(KEY_OFFICE_ID));
        site.put(KEY_NAME, record.get(KEY_NAME));
        transformed.put("site", site);

        log.info("Transformed Dialpad department {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT);
        if (!missing.isEmpty()) {
            log.error("Dialpad department is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_EXTENSION_NUMBER))) {
            log.error("Transformed call queue {} has no extensionNumber", record.get(KEY_ID));
            return false;
        }
        return true;
    }
}
