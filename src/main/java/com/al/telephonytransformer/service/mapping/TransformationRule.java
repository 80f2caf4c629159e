package com.al.telephonytransformer.service.mapping;

import com.al.telephonytransformer.service.rules.AddressRules;
import com.al.telephonytransformer.service.rules.TimezoneRules;
import com.al.telephonytransformer.service.rules.UserRules;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Named value conversions a field mapping may reference in its
 * {@code transformation_rule} column.
 */
@Slf4j
public enum TransformationRule {

    UPPERCASE("uppercase") {
        @Override
        public Object apply(Object value) {
            return value == null ? null : String.valueOf(value).toUpperCase();
        }
    },
    LOWERCASE("lowercase") {
        @Override
        public Object apply(Object value) {
            return value == null ? null : String.valueOf(value).toLowerCase();
        }
    },
    CAPITALIZE("capitalize") {
        @Override
        public Object apply(Object value) {
            if (value == null) {
                return null;
            }
            String text = String.valueOf(value);
            return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1).toLowerCase();
        }
    },
    BOOLEAN("boolean") {
        @Override
        public Object apply(Object value) {
            if (value == null) {
                return false;
            }
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue() != 0;
            }
            if (value instanceof Map) {
                return !((Map<?, ?>) value).isEmpty();
            }
            if (value instanceof Collection) {
                return !((Collection<?>) value).isEmpty();
            }
            String text = String.valueOf(value).trim().toLowerCase();
            return text.equals("true") || text.equals("yes") || text.equals("y") || text.equals("1")
                    || text.equals("on");
        }
    },
    INTEGER("integer") {
        @Override
        public Object apply(Object value) {
            if (value == null || String.valueOf(value).trim().isEmpty()) {
                return 0;
            }
            if (value instanceof Integer || value instanceof Long) {
                return value;
            }
            if (value instanceof Number) {
                return ((Number) value).longValue();
            }
            String text = String.valueOf(value).trim();
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                try {
                    return Long.parseLong(text);
                } catch (NumberFormatException ignored) {
                    log.warn("Cannot convert '{}' to integer, keeping original value", value);
                    return value;
                }
            }
        }
    },
    STRING("string") {
        @Override
        public Object apply(Object value) {
            return value == null ? null : String.valueOf(value);
        }
    },
    COUNTRY_TO_ISO("country_to_iso") {
        @Override
        public Object apply(Object value) {
            return AddressRules.countryToIso(value);
        }
    },
    TIMEZONE_TO_IANA("timezone_to_iana") {
        @Override
        public Object apply(Object value) {
            return TimezoneRules.timezoneToIana(value);
        }
    },
    MAP_USER_TYPE("map_user_type") {
        @Override
        public Object apply(Object value) {
            return UserRules.mapUserType(value == null ? null : String.valueOf(value));
        }
    },
    NORMALIZE_ADDRESS("normalize_address") {
        @Override
        public Object apply(Object value) {
            return value instanceof String ? AddressRules.normalizeAddressField((String) value) : value;
        }
    };

    private final String ruleName;

    TransformationRule(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }

    public abstract Object apply(Object value);

    public static Optional<TransformationRule> fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values()).filter(rule -> rule.ruleName.equals(normalized)).findFirst();
    }
}
