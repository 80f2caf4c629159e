package com.al.telephonytransformer.service.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.Random;

/**
 * Extension number synthesis and formatting.
 *
 * <p>
 * Synthesized extensions come from disjoint bands so a call queue and an
 * auto receptionist created for the same office never collide:
 * <ul>
 * <li>{@code cq} - 200 to 299</li>
 * <li>{@code ar} - 300 to 399</li>
 * <li>anything else - 400 to 999</li>
 * </ul>
 *
 * @author Telephony Transformer Team
 * @since 1.0.0
 */
@Slf4j
public final class ExtensionRules {

    public static final String CLASS_AUTO_RECEPTIONIST = "ar";
    public static final String CLASS_CALL_QUEUE = "cq";

    private ExtensionRules() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Derive a reproducible 3-digit extension for an entity. The same id and
     * class always produce the same number, in every JVM.
     */
    public static String deterministicExtension(Object entityId, String extensionClass) {
        String seedValue = entityId + "_" + extensionClass;
        Random random = new Random(Math.floorMod(seedValue.hashCode(), 1_000_000));
        int extension;
        if (CLASS_AUTO_RECEPTIONIST.equals(extensionClass)) {
            extension = 300 + random.nextInt(100);
        } else if (CLASS_CALL_QUEUE.equals(extensionClass)) {
            extension = 200 + random.nextInt(100);
        } else {
            extension = 400 + random.nextInt(600);
        }
        return String.valueOf(extension);
    }

    /**
     * Pad a value to a minimum length.
     *
     * @param leftPad pad on the left (true) or right (false)
     * @return padded string, or null for null input
     */
    public static String applyMinimumLength(Object value, int minLength, char paddingChar, boolean leftPad) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        if (text.length() >= minLength) {
            return text;
        }
        StringBuilder padding = new StringBuilder();
        for (int i = text.length(); i < minLength; i++) {
            padding.append(paddingChar);
        }
        return leftPad ? padding + text : text + padding;
    }

    /**
     * Lift short numeric extensions to the Zoom minimum length: a single digit
     * gets the whole prefix ({@code 2} to {@code 102}), two digits get the
     * first prefix character ({@code 25} to {@code 125}). Other values are
     * returned trimmed.
     */
    public static String applyCustomExtensionFormat(Object value, String prefix, int minLength) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        if (text.length() >= minLength) {
            return text;
        }
        if (!isDigits(text) || prefix == null || prefix.isEmpty()) {
            log.warn("Could not format extension '{}', returning as-is", text);
            return text;
        }
        if (text.length() == 1) {
            return prefix + text;
        }
        if (text.length() == 2) {
            return prefix.charAt(0) + text;
        }
        log.warn("Could not format extension '{}', returning as-is", text);
        return text;
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (char c : text.toCharArray()) {
            if (!Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
