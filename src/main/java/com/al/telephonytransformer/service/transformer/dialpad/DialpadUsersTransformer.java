package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.TimezoneRules;
import com.al.telephonytransformer.service.rules.UserRules;
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
 * Dialpad user to Zoom user, emitted in the RingCentral user shape
 * ({@code name}, {@code extensionNumber}, {@code status}, {@code type} and
 * {@code user_info}).
 */
@Slf4j
public class DialpadUsersTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.DIALPAD_ZOOM_USERS;
    private static final String USER_TYPE = "User";
    private static final List<String> REQUIRED_USER_INFO = Arrays.asList("first_name", "last_name", "email");

    public DialpadUsersTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JOB_TYPE.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);

        if (record.get("display_name") != null) {
            transformed.put(KEY_NAME, record.get("display_name"));
        }
        if (record.get("extension") != null) {
            transformed.put(KEY_EXTENSION_NUMBER, String.valueOf(record.get("extension")));
        }
        transformed.put("status", UserRules.mapDialpadStatus(FieldPathResolver.getString(record, "state")));
        transformed.put(KEY_TYPE, USER_TYPE);

        Map<String, Object> userInfo = ZoomRecordShapes.userInfo(
                record.get("first_name"),
                record.get("last_name"),
                DialpadRecords.firstOf(record, "emails"),
                DialpadRecords.firstOf(record, "phone_numbers"),
                TimezoneRules.timezoneToIana(record.get("timezone")),
                USER_TYPE);
        transformed.put(KEY_USER_INFO, userInfo);

        log.info("Transformed Dialpad user {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_ID))) {
            log.error("Dialpad user is missing id");
            return false;
        }
        if (DialpadRecords.firstOf(record, "emails") == null) {
            log.error("Dialpad user {} has no email address", record.get(KEY_ID));
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        List<String> missing = FieldPathResolver.missingRequiredFields(record.get(KEY_USER_INFO),
                REQUIRED_USER_INFO);
        if (!missing.isEmpty()) {
            log.error("Transformed Dialpad user {} is missing user_info fields: {}", record.get(KEY_ID), missing);
            return false;
        }
        return true;
    }
}
