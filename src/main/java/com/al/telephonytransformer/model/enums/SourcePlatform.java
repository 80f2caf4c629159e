package com.al.telephonytransformer.model.enums;

/**
 * Platforms records are read from.
 */
public enum SourcePlatform {
    RINGCENTRAL("ringcentral"),
    SSOT("ssot"),
    DIALPAD("dialpad");

    private final String code;

    SourcePlatform(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
