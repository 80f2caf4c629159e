package com.al.telephonytransformer.service.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User type, status, display name and phone number conversions.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class UserRules {

    public static final int USER_TYPE_BASIC = 1;
    public static final int USER_TYPE_DIGITAL = 2;
    public static final int USER_TYPE_OTHER = 99;

    private static final Map<String, Integer> USER_TYPES = new HashMap<>();
    private static final Map<String, String> PHONE_TYPES = new HashMap<>();
    private static final Map<String, String> DIALPAD_STATUSES = new HashMap<>();

    static {
        USER_TYPES.put("User", USER_TYPE_BASIC);
        USER_TYPES.put("DigitalUser", USER_TYPE_DIGITAL);
        USER_TYPES.put("FlexibleUser", USER_TYPE_BASIC);
        for (String other : new String[] { "FaxUser", "VirtualUser", "Department", "Announcement", "Voicemail",
                "SharedLinesGroup", "PagingOnly", "IvrMenu", "ApplicationExtension", "ParkLocation", "Limited",
                "Bot", "ProxyAdmin", "DelegatedLinesGroup", "Site" }) {
            USER_TYPES.put(other, USER_TYPE_OTHER);
        }

        PHONE_TYPES.put("work", "office");
        PHONE_TYPES.put("home", "home");
        PHONE_TYPES.put("mobile", "mobile");
        PHONE_TYPES.put("business", "office");
        PHONE_TYPES.put("direct", "office");

        DIALPAD_STATUSES.put("active", "Enabled");
        DIALPAD_STATUSES.put("inactive", "Disabled");
        DIALPAD_STATUSES.put("pending", "NotActivated");
        DIALPAD_STATUSES.put("suspended", "Disabled");
    }

    private UserRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Map a platform user type to a Zoom user type code. Unknown types map
     * to {@value #USER_TYPE_OTHER}.
     */
    public static int mapUserType(String userType) {
        Integer code = userType == null ? null : USER_TYPES.get(userType.trim());
        if (code == null) {
            log.warn("Unknown user type '{}', mapping to {} (Other)", userType, USER_TYPE_OTHER);
            return USER_TYPE_OTHER;
        }
        return code;
    }

    /**
     * Map a Dialpad user state to the RingCentral status vocabulary.
     */
    public static String mapDialpadStatus(String state) {
        if (state == null) {
            return "Enabled";
        }
        String status = DIALPAD_STATUSES.get(state.trim().toLowerCase());
        if (status == null) {
            log.warn("Unknown Dialpad user state '{}', mapping to Enabled", state);
            return "Enabled";
        }
        return status;
    }

    /**
     * Join first and last name with a single space, skipping blank parts.
     */
    public static String displayName(String firstName, String lastName) {
        boolean hasFirst = firstName != null && !firstName.trim().isEmpty();
        boolean hasLast = lastName != null && !lastName.trim().isEmpty();
        if (hasFirst && hasLast) {
            return firstName + " " + lastName;
        }
        if (hasFirst) {
            return firstName;
        }
        if (hasLast) {
            return lastName;
        }
        log.warn("Both first_name and last_name are empty");
        return "";
    }

    /**
     * Convert {@code [{type, number}]} entries to Zoom phone numbers.
     * Entries that are not objects or have no number are skipped.
     */
    public static List<Map<String, Object>> formatPhoneNumbers(Object phoneNumbers) {
        List<Map<String, Object>> formatted = new ArrayList<>();
        if (!(phoneNumbers instanceof List)) {
            return formatted;
        }
        for (Object entry : (List<?>) phoneNumbers) {
            if (!(entry instanceof Map)) {
                log.debug("Skipping invalid phone entry: {}", entry);
                continue;
            }
            Map<?, ?> phone = (Map<?, ?>) entry;
            Object number = phone.get("number");
            if (number == null || String.valueOf(number).isEmpty()) {
                log.debug("Skipping phone entry without number: {}", phone);
                continue;
            }
            Object type = phone.get("type");
            String zoomType = type == null ? null : PHONE_TYPES.get(String.valueOf(type).toLowerCase());

            Map<String, Object> zoomPhone = new LinkedHashMap<>();
            zoomPhone.put("number", String.valueOf(number));
            zoomPhone.put("type", zoomType == null ? "office" : zoomType);
            formatted.add(zoomPhone);
        }
        return formatted;
    }
}
