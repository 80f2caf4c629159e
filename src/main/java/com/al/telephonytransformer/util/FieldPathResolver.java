package com.al.telephonytransformer.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves dotted, array-aware paths against untyped JSON-like records.
 *
 * <p>
 * Records are nested {@link Map}s and {@link List}s as produced by Jackson.
 * Supported path syntax:
 * <ul>
 * <li>{@code contact.email} - nested map traversal</li>
 * <li>{@code ivr_details[0].actions} - explicit array index</li>
 * <li>{@code members[*].id} - fan out over every element, keeping one slot
 * per element (null where the sub-path does not resolve)</li>
 * </ul>
 * A path that exists as a literal key of the record (for example
 * {@code "site.id"}) always wins over nested traversal.
 *
 * <p>
 * Lookups never throw. Every failure returns {@code null} and is logged at
 * debug level.
 *
 * @author Telephony Transformer Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Slf4j
public final class FieldPathResolver {

    private static final Pattern INDEXED_SEGMENT = Pattern.compile("^([^\\[\\]]*)\\[(\\*|\\d+)]$");
    private static final Pattern TEMPLATE_PLACEHOLDER = Pattern.compile("\\{([^}]+)}");
    private static final String WILDCARD = "*";

    /**
     * Private constructor to prevent instantiation.
     */
    private FieldPathResolver() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Resolve a path against a record.
     *
     * @param record source record (map or list)
     * @param path   dotted path, e.g. {@code "a.b[*].c"}
     * @return resolved value, a list for wildcard lookups, or null
     */
    public static Object get(Object record, String path) {
        if (record == null || path == null || path.isEmpty()) {
            return null;
        }
        if (record instanceof Map && ((Map<?, ?>) record).containsKey(path)) {
            return ((Map<?, ?>) record).get(path);
        }
        return resolve(record, path.split("\\."), 0, path);
    }

    /**
     * Resolve a path and return its string form, or null when absent.
     */
    public static String getString(Object record, String path) {
        Object value = get(record, path);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Return the first non-blank value among the given paths.
     *
     * @param record record to search
     * @param paths  candidate paths in priority order
     * @return first value that is present and not a blank string
     */
    public static Object getFirst(Object record, String... paths) {
        for (String path : paths) {
            Object value = get(record, path);
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Resolve several paths at once.
     *
     * @return map of path to resolved value, in the order given
     */
    public static Map<String, Object> getAll(Object record, Collection<String> paths) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String path : paths) {
            values.put(path, get(record, path));
        }
        return values;
    }

    /**
     * Assign a value at a dotted path, creating intermediate maps as needed.
     * Lists are never modified.
     *
     * @return true if the value was written
     */
    @SuppressWarnings("unchecked")
    public static boolean set(Map<String, Object> record, String path, Object value) {
        if (record == null || path == null || path.isEmpty()) {
            return false;
        }
        String[] segments = path.split("\\.");
        Map<String, Object> current = record;
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (next == null) {
                next = new LinkedHashMap<String, Object>();
                current.put(segments[i], next);
            } else if (!(next instanceof Map)) {
                log.debug("Cannot set '{}': segment '{}' holds a {}", path, segments[i],
                        next.getClass().getSimpleName());
                return false;
            }
            current = (Map<String, Object>) next;
        }
        current.put(segments[segments.length - 1], value);
        return true;
    }

    /**
     * Replace every {@code {path}} placeholder in the template with the
     * resolved value. Unresolved placeholders become an empty string.
     */
    public static String renderTemplate(String template, Object record) {
        if (template == null) {
            return null;
        }
        Matcher matcher = TEMPLATE_PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            Object value = get(record, matcher.group(1).trim());
            String replacement = value == null ? "" : String.valueOf(value);
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    /**
     * List the required paths that are absent or blank in the record.
     */
    public static List<String> missingRequiredFields(Object record, Collection<String> requiredPaths) {
        List<String> missing = new ArrayList<>();
        for (String path : requiredPaths) {
            if (isBlank(get(record, path))) {
                missing.add(path);
            }
        }
        return missing;
    }

    /**
     * Deep copy of a record. Maps and lists are copied, leaf values are shared.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyOf(Map<String, Object> record) {
        if (record == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) deepCopy(record);
    }

    /**
     * Deep copy of a single value. Maps and lists come back as mutable
     * {@link LinkedHashMap} and {@link ArrayList}; scalars are returned as is.
     */
    public static Object copyValue(Object value) {
        return deepCopy(value);
    }

    /**
     * Null, empty strings, empty maps and empty lists count as blank.
     */
    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).trim().isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        return false;
    }

    private static Object resolve(Object current, String[] segments, int index, String path) {
        if (index == segments.length) {
            return current;
        }
        String segment = segments[index];
        Matcher matcher = INDEXED_SEGMENT.matcher(segment);
        if (!matcher.matches()) {
            Object next = child(current, segment, path);
            return next == null ? null : resolve(next, segments, index + 1, path);
        }

        String key = matcher.group(1);
        String selector = matcher.group(2);
        Object container = key.isEmpty() ? current : child(current, key, path);
        if (container == null) {
            return null;
        }
        if (!(container instanceof List)) {
            log.debug("Path '{}': '{}' is not an array", path, key);
            return null;
        }
        List<?> list = (List<?>) container;

        if (WILDCARD.equals(selector)) {
            if (index == segments.length - 1) {
                return list;
            }
            List<Object> fanned = new ArrayList<>(list.size());
            for (Object element : list) {
                fanned.add(resolve(element, segments, index + 1, path));
            }
            return fanned;
        }

        int position;
        try {
            position = Integer.parseInt(selector);
        } catch (NumberFormatException e) {
            log.debug("Path '{}': index '{}' is not a valid integer", path, selector);
            return null;
        }
        if (position >= list.size()) {
            log.debug("Path '{}': index {} out of bounds for array of size {}", path, position, list.size());
            return null;
        }
        return resolve(list.get(position), segments, index + 1, path);
    }

    private static Object child(Object current, String key, String path) {
        if (!(current instanceof Map)) {
            log.debug("Path '{}': cannot read '{}' from a non-object value", path, key);
            return null;
        }
        Object value = ((Map<?, ?>) current).get(key);
        if (value == null) {
            log.debug("Path '{}': key '{}' not found", path, key);
        }
        return value;
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        return value;
    }
}
