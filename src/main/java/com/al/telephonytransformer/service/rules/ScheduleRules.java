package com.al.telephonytransformer.service.rules;

import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.CUSTOM_HOURS_TYPE;

/**
 * Business-hours schedule conversions.
 *
 * <p>
 * The canonical schedule is a RingCentral {@code weeklyRanges} map:
 * {@code {"Monday": [{"from": "08:00", "to": "17:00"}], ...}}. Zoom expects
 * a flat list of {@code {weekday, from, to, type}} entries with Sunday = 1
 * through Saturday = 7.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class ScheduleRules {

    /** Day names in Zoom weekday order, Sunday first */
    public static final List<String> DAYS = Arrays.asList("sunday", "monday", "tuesday", "wednesday", "thursday",
            "friday", "saturday");

    private static final Map<String, Integer> WEEKDAYS = new HashMap<>();

    static {
        for (int i = 0; i < DAYS.size(); i++) {
            WEEKDAYS.put(DAYS.get(i), i + 1);
        }
    }

    private ScheduleRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Zoom weekday number for a day name (case-insensitive), or null.
     */
    public static Integer weekdayNumber(String dayName) {
        return dayName == null ? null : WEEKDAYS.get(dayName.trim().toLowerCase());
    }

    /**
     * Flatten a {@code weeklyRanges} map into Zoom custom hours. Unknown day
     * names and malformed ranges are skipped with a warning.
     */
    public static List<Map<String, Object>> weeklyRangesToCustomHours(Object weeklyRanges) {
        List<Map<String, Object>> customHours = new ArrayList<>();
        if (!(weeklyRanges instanceof Map)) {
            return customHours;
        }
        for (Map.Entry<?, ?> day : ((Map<?, ?>) weeklyRanges).entrySet()) {
            String dayName = String.valueOf(day.getKey());
            Integer weekday = weekdayNumber(dayName);
            if (weekday == null) {
                log.warn("Unknown day name '{}' in weekly ranges, skipping", dayName);
                continue;
            }
            if (!(day.getValue() instanceof List)) {
                continue;
            }
            for (Object range : (List<?>) day.getValue()) {
                if (!(range instanceof Map)) {
                    log.warn("Skipping malformed time range for {}: {}", dayName, range);
                    continue;
                }
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("weekday", weekday);
                entry.put("from", ((Map<?, ?>) range).get("from"));
                entry.put("to", ((Map<?, ?>) range).get("to"));
                entry.put("type", CUSTOM_HOURS_TYPE);
                customHours.add(entry);
            }
        }
        return customHours;
    }

    /**
     * Locate {@code schedule.weeklyRanges} inside a {@code business_hours}
     * value, which is either a list (first element used) or a single object.
     */
    public static Object extractWeeklyRanges(Object businessHours) {
        if (businessHours instanceof List) {
            return FieldPathResolver.get(businessHours, "[0].schedule.weeklyRanges");
        }
        return FieldPathResolver.get(businessHours, "schedule.weeklyRanges");
    }

    /**
     * Build {@code weeklyRanges} from per-day {@code [from, to]} arrays such as
     * Dialpad's {@code monday_hours}.
     *
     * @param record source record
     * @param suffix key suffix after the lower-case day name, e.g. {@code "_hours"}
     * @return weekly ranges keyed by capitalized day name, empty when no day is set
     */
    public static Map<String, Object> weeklyRangesFromDayArrays(Map<String, Object> record, String suffix) {
        Map<String, Object> weeklyRanges = new LinkedHashMap<>();
        for (String day : DAYS) {
            Object hours = record.get(day + suffix);
            if (!(hours instanceof List) || ((List<?>) hours).size() < 2) {
                continue;
            }
            List<?> pair = (List<?>) hours;
            weeklyRanges.put(capitalize(day), singleRange(pair.get(0), pair.get(1)));
        }
        return weeklyRanges;
    }

    /**
     * Build {@code weeklyRanges} from {@code {day: {enabled, start_time, end_time}}}.
     * Days with {@code enabled: false} are left out.
     */
    public static Map<String, Object> weeklyRangesFromDaySettings(Object weeklyHours) {
        Map<String, Object> weeklyRanges = new LinkedHashMap<>();
        if (!(weeklyHours instanceof Map)) {
            return weeklyRanges;
        }
        for (Map.Entry<?, ?> day : ((Map<?, ?>) weeklyHours).entrySet()) {
            if (!(day.getValue() instanceof Map)) {
                continue;
            }
            Map<?, ?> settings = (Map<?, ?>) day.getValue();
            if (Boolean.FALSE.equals(settings.get("enabled"))) {
                continue;
            }
            Object start = settings.get("start_time");
            Object end = settings.get("end_time");
            if (start == null || end == null) {
                continue;
            }
            weeklyRanges.put(capitalize(String.valueOf(day.getKey())), singleRange(start, end));
        }
        return weeklyRanges;
    }

    private static List<Object> singleRange(Object from, Object to) {
        List<Object> ranges = new ArrayList<>();
        ranges.add(range(from, to));
        return ranges;
    }

    private static Map<String, Object> range(Object from, Object to) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("from", from);
        range.put("to", to);
        return range;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase();
    }
}
