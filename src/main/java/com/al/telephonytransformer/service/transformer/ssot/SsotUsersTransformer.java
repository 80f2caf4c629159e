package com.al.telephonytransformer.service.transformer.ssot;

import com.al.telephonytransformer.model.FieldMapping;
import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.mapping.FieldMappingApplier;
import com.al.telephonytransformer.service.rules.TimezoneRules;
import com.al.telephonytransformer.service.rules.UserRules;
import com.al.telephonytransformer.service.transformer.EntityTransformer;
import com.al.telephonytransformer.service.transformer.TransformContext;
import com.al.telephonytransformer.service.transformer.TransformationSettings;
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
 * SSOT user to Zoom user.
 *
 * <p>
 * {@code user_info} values come from field mappings targeting
 * {@code user_info.*} first, then from the conventional SSOT columns.
 */
@Slf4j
public class SsotUsersTransformer implements EntityTransformer {

    private static final JobType JOB_TYPE = JobType.SSOT_TO_ZOOM_USERS;
    private static final List<String> REQUIRED_INPUT = Arrays.asList(KEY_ID, "email");
    private static final List<String> REQUIRED_USER_INFO = Arrays.asList("first_name", "last_name", "email",
            "type");

    private final FieldMappingApplier applier;
    private final List<FieldMapping> mappings;
    private final TransformationSettings settings;

    public SsotUsersTransformer(TransformerSupport support) {
        this.applier = support.getFieldMappingApplier();
        this.mappings = support.mappingsFor(JOB_TYPE);
        this.settings = support.settingsFor(JOB_TYPE);
    }

    @Override
    public String getJobTypeCode() {
        return JOB_TYPE.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);
        Map<String, Object> mapped = SsotMappings.applyInto(transformed, record, applier, mappings, KEY_USER_INFO,
                JOB_TYPE.getCode());

        Object firstName = firstOf(mapped, "user_info.first_name", record, "first_name", "firstName");
        Object lastName = firstOf(mapped, "user_info.last_name", record, "last_name", "lastName");
        Object email = firstOf(mapped, "user_info.email", record, "email");
        Object phone = firstOf(mapped, "user_info.phone_number", record, "phone_number", "phoneNumber",
                "business_phone");
        String timezone = TimezoneRules.timezoneToIana(firstOf(mapped, "user_info.timezone", record, "timezone"));

        Map<String, Object> userInfo = ZoomRecordShapes.userInfo(firstName, lastName, email, phone, timezone,
                userType(mapped, record));
        List<Map<String, Object>> phoneNumbers = UserRules.formatPhoneNumbers(record.get("phone_numbers"));
        if (!phoneNumbers.isEmpty()) {
            userInfo.put("phone_numbers", phoneNumbers);
        }
        ZoomRecordShapes.mergeInto(transformed, Map.of(KEY_USER_INFO, userInfo));

        if (!record.containsKey("display_name")) {
            transformed.put("display_name", UserRules.displayName(stringOf(firstName), stringOf(lastName)));
        }
        if (!record.containsKey("status")) {
            transformed.put("status", "active");
        }
        log.info("Transformed SSOT user {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    private Object userType(Map<String, Object> mapped, Map<String, Object> record) {
        Object mappedType = FieldPathResolver.get(mapped, "user_info.type");
        if (mappedType instanceof Number) {
            return mappedType;
        }
        Object sourceType = mappedType != null ? mappedType : FieldPathResolver.getFirst(record, "user_type", "userType");
        if (sourceType == null) {
            return settings.getInt("default_user_type", DEFAULT_USER_TYPE);
        }
        return UserRules.mapUserType(String.valueOf(sourceType));
    }

    private static Object firstOf(Map<String, Object> mapped, String mappedPath, Map<String, Object> record,
            String... sourcePaths) {
        Object value = FieldPathResolver.get(mapped, mappedPath);
        return FieldPathResolver.isBlank(value) ? FieldPathResolver.getFirst(record, sourcePaths) : value;
    }

    private static String stringOf(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        List<String> missing = new ArrayList<>(FieldPathResolver.missingRequiredFields(record, REQUIRED_INPUT));
        missing.addAll(SsotMappings.missingRequired(record, mappings));
        if (!missing.isEmpty()) {
            log.error("SSOT user is missing required fields: {}", missing);
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        Object userInfo = record.get(KEY_USER_INFO);
        if (!(userInfo instanceof Map)) {
            log.error("Transformed SSOT user {} has no user_info", record.get(KEY_ID));
            return false;
        }
        List<String> missing = FieldPathResolver.missingRequiredFields(userInfo, REQUIRED_USER_INFO);
        if (!missing.isEmpty()) {
            log.error("Transformed SSOT user {} is missing user_info fields: {}", record.get(KEY_ID), missing);
            return false;
        }
        return true;
    }
}
