package com.al.telephonytransformer.service.transformer.ringcentral;

import com.al.telephonytransformer.model.enums.JobType;
import com.al.telephonytransformer.service.rules.TimezoneRules;
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
 * RingCentral extension to Zoom user.
 *
 * <p>
 * {@code contact} is folded into {@code user_info} and removed. The user
 * type is passed through, defaulting to 1.
 */
@Slf4j
public class RingCentralUsersTransformer implements EntityTransformer {

    private static final List<String> REQUIRED_USER_INFO = Arrays.asList("first_name", "last_name", "email");

    public RingCentralUsersTransformer(TransformerSupport support) {
        log.debug("Initialized {} transformer", JobType.RC_ZOOM_USERS.getCode());
    }

    @Override
    public String getJobTypeCode() {
        return JobType.RC_ZOOM_USERS.getCode();
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> record, TransformContext context) {
        Map<String, Object> transformed = FieldPathResolver.copyOf(record);

        Object contact = record.get(KEY_CONTACT);
        if (contact instanceof Map) {
            Object type = FieldPathResolver.isBlank(record.get(KEY_TYPE)) ? DEFAULT_USER_TYPE : record.get(KEY_TYPE);
            String timezone = TimezoneRules.timezoneToIana(FieldPathResolver.get(record, "regionalSettings.timezone"));
            transformed.put(KEY_USER_INFO, ZoomRecordShapes.userInfo(
                    FieldPathResolver.get(contact, "firstName"),
                    FieldPathResolver.get(contact, "lastName"),
                    FieldPathResolver.get(contact, "email"),
                    FieldPathResolver.get(contact, "businessPhone"),
                    timezone,
                    type));
            transformed.remove(KEY_CONTACT);
        }

        log.info("Transformed RingCentral user {} (job {})", record.get(KEY_ID), context.getJobId());
        return transformed;
    }

    @Override
    public boolean validateInput(Map<String, Object> record) {
        if (FieldPathResolver.isBlank(record.get(KEY_ID))) {
            log.error("RingCentral user is missing id");
            return false;
        }
        if (!(record.get(KEY_CONTACT) instanceof Map)) {
            log.error("RingCentral user {} has no contact object", record.get(KEY_ID));
            return false;
        }
        if (FieldPathResolver.isBlank(FieldPathResolver.get(record, "contact.email"))) {
            log.error("RingCentral user {} has no contact.email", record.get(KEY_ID));
            return false;
        }
        return true;
    }

    @Override
    public boolean validateOutput(Map<String, Object> record) {
        Object userInfo = record.get(KEY_USER_INFO);
        if (!(userInfo instanceof Map)) {
            log.error("Transformed user {} has no user_info", record.get(KEY_ID));
            return false;
        }
        List<String> missing = FieldPathResolver.missingRequiredFields(userInfo, REQUIRED_USER_INFO);
        if (!missing.isEmpty()) {
            log.error("Transformed user {} is missing user_info fields: {}", record.get(KEY_ID), missing);
            return false;
        }
        if (record.containsKey(KEY_CONTACT)) {
            log.warn("Transformed user {} still carries contact", record.get(KEY_ID));
        }
        return true;
    }
}
