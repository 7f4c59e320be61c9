package com.ecowatch.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public final class TextUtils {
    private TextUtils() {
    }

    /**
     * Lower-cases the value and capitalizes the first letter of each whitespace-separated word.
     */
    public static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return Arrays.stream(value.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    /**
     * Rounds half-up to {@code digits} decimal places; {@code null} and non-finite values give {@code null}.
     */
    public static Double round(Double value, int digits) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Drops the fractional part of a reading; {@code null} and non-finite values give {@code null}.
     */
    public static Integer wholeNumber(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.DOWN).intValue();
    }
}
