package com.al.telephonytransformer.service.rules;

import com.al.telephonytransformer.util.FieldPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.al.telephonytransformer.util.MappingConstants.*;

/**
 * Country and street-address normalization.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class AddressRules {

    private static final Map<String, String> COUNTRY_CODES = new HashMap<>();
    private static final Map<String, String> INNER_ABBREVIATIONS = new LinkedHashMap<>();
    private static final Map<String, String> TRAILING_ABBREVIATIONS = new LinkedHashMap<>();

    static {
        COUNTRY_CODES.put("united states", "US");
        COUNTRY_CODES.put("united states of america", "US");
        COUNTRY_CODES.put("usa", "US");
        COUNTRY_CODES.put("us", "US");
        COUNTRY_CODES.put("canada", "CA");
        COUNTRY_CODES.put("united kingdom", "GB");
        COUNTRY_CODES.put("great britain", "GB");
        COUNTRY_CODES.put("uk", "GB");
        COUNTRY_CODES.put("australia", "AU");
        COUNTRY_CODES.put("germany", "DE");
        COUNTRY_CODES.put("france", "FR");
        COUNTRY_CODES.put("japan", "JP");
        COUNTRY_CODES.put("china", "CN");
        COUNTRY_CODES.put("india", "IN");
        COUNTRY_CODES.put("brazil", "BR");
        COUNTRY_CODES.put("mexico", "MX");

        for (String word : new String[] { "Po", "Ne", "Nw", "Se", "Sw", "Ct", "St", "Ave", "Blvd", "Dr", "Ln",
                "Rd", "Apt", "Ste" }) {
            INNER_ABBREVIATIONS.put(" " + word + " ", " " + word.toUpperCase() + " ");
        }
        for (String word : new String[] { "Ct", "St", "Ave", "Blvd", "Dr", "Ln", "Rd" }) {
            TRAILING_ABBREVIATIONS.put(" " + word, " " + word.toUpperCase());
        }
    }

    private AddressRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Convert a country name or abbreviation to its ISO 3166-1 alpha-2 code.
     * Unknown values are returned unchanged.
     */
    public static Object countryToIso(Object country) {
        if (!(country instanceof String)) {
            return country;
        }
        String code = COUNTRY_CODES.get(((String) country).trim().toLowerCase());
        if (code == null) {
            log.debug("No ISO code mapping for country '{}'", country);
            return country;
        }
        return code;
    }

    /**
     * Title-case a street or city value, keeping directionals and street
     * suffixes upper-case ({@code "123 main st"} becomes {@code "123 Main ST"}).
     */
    public static String normalizeAddressField(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String normalized = titleCase(value);
        for (Map.Entry<String, String> entry : INNER_ABBREVIATIONS.entrySet()) {
            normalized = normalized.replace(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, String> entry : TRAILING_ABBREVIATIONS.entrySet()) {
            if (normalized.endsWith(entry.getKey())) {
                normalized = normalized.substring(0, normalized.length() - entry.getKey().length())
                        + entry.getValue();
            }
        }
        return normalized;
    }

    /**
     * Build a Zoom emergency address. {@code address_line2} is only written
     * when a second street line is present.
     */
    public static Map<String, Object> emergencyAddress(Object line1, Object line2, Object city, Object state,
            Object zip, Object country) {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put(ADDRESS_LINE1, line1);
        if (!FieldPathResolver.isBlank(line2)) {
            address.put(ADDRESS_LINE2, line2);
        }
        address.put(ADDRESS_CITY, city);
        address.put(ADDRESS_STATE_CODE, state);
        address.put(ADDRESS_ZIP, zip);
        address.put(ADDRESS_COUNTRY, countryToIso(country));
        return address;
    }

    /**
     * Convert a RingCentral style {@code businessAddress} (street, street2,
     * city, state, zip, country) into a Zoom emergency address.
     */
    public static Map<String, Object> fromBusinessAddress(Map<?, ?> businessAddress) {
        if (businessAddress == null || businessAddress.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return emergencyAddress(
                businessAddress.get("street"),
                businessAddress.get("street2"),
                businessAddress.get("city"),
                businessAddress.get("state"),
                businessAddress.get("zip"),
                businessAddress.get("country"));
    }

    /**
     * Assemble an address from flat record fields using a configured
     * target-to-source field map, filling gaps from a fallback map.
     * Street and city values are normalized. Boolean entries are written as
     * static values.
     *
     * @param record         source record
     * @param sourceFields   target field to source field (or Boolean constant)
     * @param fallbackFields consulted only for targets the primary map missed
     * @return assembled address, possibly empty
     */
    public static Map<String, Object> assembleAddress(Map<String, Object> record, Map<String, Object> sourceFields,
            Map<String, Object> fallbackFields) {
        Map<String, Object> address = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        if (sourceFields != null) {
            sourceFields.forEach((target, source) -> {
                if (!copyAddressField(record, address, target, source)) {
                    missing.add(target);
                }
            });
        }
        if (!missing.isEmpty() && fallbackFields != null) {
            fallbackFields.forEach((target, source) -> {
                if (missing.contains(target)) {
                    copyAddressField(record, address, target, source);
                }
            });
        }
        return address;
    }

    /**
     * Return the names of required address fields that are missing or blank.
     */
    public static List<String> missingAddressFields(Map<String, Object> address, List<String> requiredFields) {
        return FieldPathResolver.missingRequiredFields(address, requiredFields);
    }

    private static boolean copyAddressField(Map<String, Object> record, Map<String, Object> address, String target,
            Object source) {
        if (source instanceof Boolean) {
            address.put(target, source);
            return true;
        }
        Object value = FieldPathResolver.get(record, String.valueOf(source));
        if (FieldPathResolver.isBlank(value)) {
            return false;
        }
        if (value instanceof String && ("street".equals(target) || "street2".equals(target)
                || "city".equals(target))) {
            value = normalizeAddressField((String) value);
        }
        address.put(target, value);
        return true;
    }

    private static String titleCase(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (char c : value.toCharArray()) {
            result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            previousIsLetter = Character.isLetter(c);
        }
        return result.toString();
    }
}
