package com.al.telephonytransformer.service.rules;

import lombok.extern.slf4j.Slf4j;

/**
 * Site code and auto receptionist naming.
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class SiteRules {

    public static final int DEFAULT_SITE_CODE_LENGTH = 20;
    public static final int DEFAULT_AR_NAME_LENGTH = 30;
    public static final String NOT_IN_USE_SUFFIX = " (NIU)";

    private SiteRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static String siteCode(String siteName) {
        return siteCode(siteName, DEFAULT_SITE_CODE_LENGTH);
    }

    /**
     * Upper-case the name, turn spaces and hyphens into underscores, drop any
     * other non-alphanumeric character and cut to {@code maxLength}.
     */
    public static String siteCode(String siteName, int maxLength) {
        if (siteName == null) {
            return "";
        }
        String upper = siteName.toUpperCase().replace(' ', '_').replace('-', '_');
        StringBuilder code = new StringBuilder();
        for (char c : upper.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_') {
                code.append(c);
            }
        }
        return code.length() > maxLength ? code.substring(0, maxLength) : code.toString();
    }

    /**
     * Name for the placeholder auto receptionist Zoom creates with a site.
     * Appends {@value #NOT_IN_USE_SUFFIX}, shortening the base name rather
     * than the suffix when the limit is exceeded.
     */
    public static String autoReceptionistName(String siteName, int maxLength) {
        if (siteName == null || siteName.trim().isEmpty()) {
            log.warn("Invalid site name for auto receptionist: '{}'", siteName);
            return truncate("Unknown" + NOT_IN_USE_SUFFIX, maxLength);
        }
        String base = siteName.trim();
        String fullName = base + NOT_IN_USE_SUFFIX;
        if (fullName.length() <= maxLength) {
            return fullName;
        }
        int available = maxLength - NOT_IN_USE_SUFFIX.length();
        if (available <= 0) {
            return truncate(NOT_IN_USE_SUFFIX, maxLength);
        }
        String truncated = base.substring(0, available).stripTrailing() + NOT_IN_USE_SUFFIX;
        log.debug("Auto receptionist name shortened: '{}' -> '{}'", siteName, truncated);
        return truncated;
    }

    private static String truncate(String value, int maxLength) {
        return value.length() > maxLength ? value.substring(0, Math.max(maxLength, 0)) : value;
    }
}
