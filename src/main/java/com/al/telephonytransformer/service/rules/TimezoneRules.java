package com.al.telephonytransformer.service.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Converts platform timezone representations to IANA zone ids.
 *
 * <p>
 * Accepted inputs, tried in order:
 * <ol>
 * <li>a RingCentral timezone object ({@code {"id": "58", "name": ...}})</li>
 * <li>a numeric RingCentral timezone id ({@code 58} or {@code "58"})</li>
 * <li>an IANA id ({@code America/...}, {@code Europe/...}, {@code UTC} ...),
 * returned as-is</li>
 * <li>a display name or abbreviation ({@code "Eastern Standard Time"},
 * {@code "PST"}, {@code "US/Central"})</li>
 * <li>a name containing pacific, mountain, central or eastern</li>
 * </ol>
 * Anything else resolves to {@value #DEFAULT_TIMEZONE} with a warning.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class TimezoneRules {

    public static final String DEFAULT_TIMEZONE = "America/Los_Angeles";
    public static final String DEFAULT_PLATFORM_TIMEZONE_ID = "58";

    private static final String[] IANA_PREFIXES = { "America/", "Europe/", "Asia/", "Pacific/", "Australia/",
            "Africa/" };

    private static final Map<String, String> PLATFORM_ID_TO_IANA = new HashMap<>();
    private static final Map<String, String> IANA_TO_PLATFORM_ID = new HashMap<>();
    private static final Map<String, String> NAME_TO_IANA = new HashMap<>();

    static {
        PLATFORM_ID_TO_IANA.put("58", "America/New_York");
        PLATFORM_ID_TO_IANA.put("59", "America/Chicago");
        PLATFORM_ID_TO_IANA.put("60", "America/Denver");
        PLATFORM_ID_TO_IANA.put("61", "America/Los_Angeles");
        PLATFORM_ID_TO_IANA.put("62", "America/Phoenix");
        PLATFORM_ID_TO_IANA.put("63", "America/Anchorage");
        PLATFORM_ID_TO_IANA.put("64", "Pacific/Honolulu");
        PLATFORM_ID_TO_IANA.forEach((id, zone) -> IANA_TO_PLATFORM_ID.put(zone, id));

        // Full names
        NAME_TO_IANA.put("pacific standard time", "America/Los_Angeles");
        NAME_TO_IANA.put("pacific daylight time", "America/Los_Angeles");
        NAME_TO_IANA.put("mountain standard time", "America/Denver");
        NAME_TO_IANA.put("mountain daylight time", "America/Denver");
        NAME_TO_IANA.put("central standard time", "America/Chicago");
        NAME_TO_IANA.put("central daylight time", "America/Chicago");
        NAME_TO_IANA.put("eastern standard time", "America/New_York");
        NAME_TO_IANA.put("eastern daylight time", "America/New_York");
        NAME_TO_IANA.put("atlantic standard time", "America/Halifax");
        NAME_TO_IANA.put("atlantic daylight time", "America/Halifax");
        NAME_TO_IANA.put("alaska standard time", "America/Anchorage");
        NAME_TO_IANA.put("alaska daylight time", "America/Anchorage");
        NAME_TO_IANA.put("hawaii standard time", "Pacific/Honolulu");
        NAME_TO_IANA.put("greenwich mean time", "Europe/London");
        NAME_TO_IANA.put("british summer time", "Europe/London");
        NAME_TO_IANA.put("central european time", "Europe/Paris");
        NAME_TO_IANA.put("central european summer time", "Europe/Paris");
        NAME_TO_IANA.put("eastern european time", "Europe/Bucharest");
        NAME_TO_IANA.put("eastern european summer time", "Europe/Bucharest");
        NAME_TO_IANA.put("japan standard time", "Asia/Tokyo");
        NAME_TO_IANA.put("china standard time", "Asia/Shanghai");
        NAME_TO_IANA.put("australian eastern standard time", "Australia/Sydney");
        NAME_TO_IANA.put("australian eastern daylight time", "Australia/Sydney");

        // Common short names
        NAME_TO_IANA.put("eastern time", "America/New_York");
        NAME_TO_IANA.put("central time", "America/Chicago");
        NAME_TO_IANA.put("mountain time", "America/Denver");
        NAME_TO_IANA.put("pacific time", "America/Los_Angeles");
        NAME_TO_IANA.put("alaska time", "America/Anchorage");
        NAME_TO_IANA.put("hawaii time", "Pacific/Honolulu");

        // Abbreviations
        NAME_TO_IANA.put("utc", "UTC");
        NAME_TO_IANA.put("gmt", "UTC");
        NAME_TO_IANA.put("pst", "America/Los_Angeles");
        NAME_TO_IANA.put("pdt", "America/Los_Angeles");
        NAME_TO_IANA.put("mst", "America/Denver");
        NAME_TO_IANA.put("mdt", "America/Denver");
        NAME_TO_IANA.put("cst", "America/Chicago");
        NAME_TO_IANA.put("cdt", "America/Chicago");
        NAME_TO_IANA.put("est", "America/New_York");
        NAME_TO_IANA.put("edt", "America/New_York");

        // Legacy tz database aliases (Dialpad)
        NAME_TO_IANA.put("us/pacific", "America/Los_Angeles");
        NAME_TO_IANA.put("us/mountain", "America/Denver");
        NAME_TO_IANA.put("us/arizona", "America/Phoenix");
        NAME_TO_IANA.put("us/central", "America/Chicago");
        NAME_TO_IANA.put("us/eastern", "America/New_York");
        NAME_TO_IANA.put("us/alaska", "America/Anchorage");
        NAME_TO_IANA.put("us/hawaii", "Pacific/Honolulu");
    }

    private TimezoneRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Convert any supported timezone representation to an IANA zone id.
     * Never returns null and never throws.
     */
    public static String timezoneToIana(Object timezone) {
        if (timezone instanceof Map) {
            return fromTimezoneObject((Map<?, ?>) timezone);
        }
        if (timezone instanceof Number) {
            return fromString(String.valueOf(((Number) timezone).longValue()));
        }
        return fromString(timezone == null ? null : String.valueOf(timezone));
    }

    /**
     * Reverse lookup of a RingCentral timezone id. Unknown zones map to
     * {@value #DEFAULT_PLATFORM_TIMEZONE_ID} (Eastern).
     */
    public static String ianaToPlatformTimezoneId(String ianaTimezone) {
        String id = ianaTimezone == null ? null : IANA_TO_PLATFORM_ID.get(ianaTimezone.trim());
        if (id == null) {
            log.warn("No platform timezone id for '{}', defaulting to {}", ianaTimezone,
                    DEFAULT_PLATFORM_TIMEZONE_ID);
            return DEFAULT_PLATFORM_TIMEZONE_ID;
        }
        return id;
    }

    private static String fromTimezoneObject(Map<?, ?> timezone) {
        Object id = timezone.get("id");
        if (id != null) {
            String zone = PLATFORM_ID_TO_IANA.get(String.valueOf(id).trim());
            if (zone != null) {
                return zone;
            }
            log.debug("Unknown platform timezone id '{}', trying name", id);
        }
        return fromString(timezone.get("name") == null ? null : String.valueOf(timezone.get("name")));
    }

    private static String fromString(String timezone) {
        if (timezone == null || timezone.trim().isEmpty()) {
            log.warn("No timezone provided, defaulting to {}", DEFAULT_TIMEZONE);
            return DEFAULT_TIMEZONE;
        }
        String value = timezone.trim();
        if (isIana(value)) {
            return value;
        }

        String zone = PLATFORM_ID_TO_IANA.get(value);
        if (zone == null) {
            zone = NAME_TO_IANA.get(value.toLowerCase());
        }
        if (zone != null) {
            log.debug("Converted timezone: {} -> {}", value, zone);
            return zone;
        }

        String lower = value.toLowerCase();
        if (lower.contains("pacific")) {
            zone = "America/Los_Angeles";
        } else if (lower.contains("mountain")) {
            zone = "America/Denver";
        } else if (lower.contains("central")) {
            zone = "America/Chicago";
        } else if (lower.contains("eastern")) {
            zone = "America/New_York";
        }
        if (zone != null) {
            log.info("Timezone '{}' matched by name to {}", value, zone);
            return zone;
        }

        log.warn("Unknown timezone format: {}, defaulting to {}", value, DEFAULT_TIMEZONE);
        return DEFAULT_TIMEZONE;
    }

    private static boolean isIana(String value) {
        if ("UTC".equals(value)) {
            return true;
        }
        for (String prefix : IANA_PREFIXES) {
            if (value.startsWith(prefix) && value.length() > prefix.length()) {
                return true;
            }
        }
        return false;
    }
}
