package com.nana.contacts.importer;

import java.util.regex.Pattern;

/**
 * PhoneNumbers - Lenient North American phone number helpers.
 */
public final class PhoneNumbers {

    private static final Pattern FORMATTING = Pattern.compile("[\\s\\-().]");

    /** Digits a complete number keeps after {@link #normalize(String)}. */
    public static final int COMPLETE_LENGTH = 10;

    private PhoneNumbers() {
        throw new UnsupportedOperationException(
                "PhoneNumbers is a static utility class.");
    }

    /**
     * Removes spaces, dashes, parentheses and dots, then a leading
     * {@code +1}, then a leading {@code 1}.
     *
     * @param phone raw phone text; null yields an empty string
     * @return the stripped number
     */
    public static String normalize(String phone) {
        if (phone == null) {
            return "";
        }
        String stripped = FORMATTING.matcher(phone).replaceAll("");
        if (stripped.startsWith("+1")) {
            stripped = stripped.substring(2);
        }
        if (stripped.startsWith("1")) {
            stripped = stripped.substring(1);
        }
        return stripped.trim();
    }

    /**
     * Renders a 10-digit number as {@code (XXX) XXX-XXXX}.
     *
     * @param phone raw phone text
     * @return the formatted number, or {@code phone} unchanged when it does
     *         not normalize to exactly ten characters
     */
    public static String format(String phone) {
        String normalized = normalize(phone);
        if (normalized.length() != COMPLETE_LENGTH) {
            return phone;
        }
        return "(" + normalized.substring(0, 3) + ") "
               + normalized.substring(3, 6) + "-"
               + normalized.substring(6);
    }

    /**
     * @param phone raw phone text
     * @return true when the normalized number is shorter than ten characters
     */
    public static boolean isIncomplete(String phone) {
        return normalize(phone).length() < COMPLETE_LENGTH;
    }
}
