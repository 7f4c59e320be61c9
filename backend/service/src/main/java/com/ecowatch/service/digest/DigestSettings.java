package com.ecowatch.service.digest;

import java.util.Map;

/**
 * When and for whom the daily digest runs.
 */
public record DigestSettings(boolean enabled, int hour, int minute, String recipientName, String location) {
    public static final int DEFAULT_HOUR = 10;
    public static final int DEFAULT_MINUTE = 0;

    public DigestSettings {
        hour = Math.min(Math.max(hour, 0), 23);
        minute = Math.min(Math.max(minute, 0), 59);
        recipientName = recipientName == null || recipientName.isBlank() ? "there" : recipientName.trim();
        location = location == null ? "" : location.trim();
    }

    /**
     * Reads {@code DAILY_DIGEST_ENABLED}, {@code DAILY_DIGEST_HOUR}, {@code DAILY_DIGEST_MINUTE},
     * {@code DIGEST_RECIPIENT_NAME} and {@code DIGEST_LOCATION}. Unparseable numbers fall back to
     * the defaults; out-of-range ones are clamped.
     */
    public static DigestSettings fromEnvironment(Map<String, String> env) {
        String enabledRaw = env.get("DAILY_DIGEST_ENABLED");
        boolean enabled = enabledRaw == null || !"false".equalsIgnoreCase(enabledRaw.trim());
        return new DigestSettings(
                enabled,
                intOrDefault(env.get("DAILY_DIGEST_HOUR"), DEFAULT_HOUR),
                intOrDefault(env.get("DAILY_DIGEST_MINUTE"), DEFAULT_MINUTE),
                env.get("DIGEST_RECIPIENT_NAME"),
                env.get("DIGEST_LOCATION")
        );
    }

    private static int intOrDefault(String raw, int fallback) {
        if (raw == null || !raw.trim().matches("-?\\d{1,9}")) {
            return fallback;
        }
        return Integer.parseInt(raw.trim());
    }
}
