package com.al.telephonytransformer.service.transformer.dialpad;

import com.al.telephonytransformer.util.FieldPathResolver;

import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.KEY_ID;
import static com.al.telephonytransformer.util.MappingConstants.KEY_OFFICE_ID;

/**
 * Lookups shared by the Dialpad transformers.
 */
final class DialpadRecords {

    private DialpadRecords() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Office id of an office-level record: {@code id}, else {@code office_id},
     * as a string. Each Dialpad office becomes one Zoom site, so this is also
     * the site id.
     */
    static String officeId(Map<String, Object> record) {
        Object id = FieldPathResolver.getFirst(record, KEY_ID, KEY_OFFICE_ID);
        return id == null ? null : String.valueOf(id);
    }

    /**
     * First element of a list field, or null.
     */
    static Object firstOf(Map<String, Object> record, String field) {
        Object value = record.get(field);
        if (value instanceof List && !((List<?>) value).isEmpty()) {
            return ((List<?>) value).get(0);
        }
        return null;
    }
}
