package com.al.telephonytransformer.model.enums;

/**
 * Kind of extension an IVR menu option forwards to. The value is the
 * string written into {@code ivr_actions[].target.type}.
 */
public enum IvrTargetType {
    USER("user"),
    CALL_QUEUE("call_queue"),
    AUTO_RECEPTIONIST("auto_receptionist");

    private final String value;

    IvrTargetType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup by value or constant name; null when unknown.
     */
    public static IvrTargetType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        for (IvrTargetType type : values()) {
            if (type.value.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
