package com.ecowatch.core.model;

import java.util.List;

public record AlertBulletin(String summaryLine, List<String> notices) {
    public static final String NO_WARNINGS = "No major warnings today.";
    public static final String SERVICE_UNAVAILABLE = "Alerts service unavailable.";

    public AlertBulletin {
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    public static AlertBulletin noWarnings() {
        return new AlertBulletin(NO_WARNINGS, List.of());
    }

    public static AlertBulletin unavailable() {
        return new AlertBulletin(SERVICE_UNAVAILABLE, List.of());
    }
}
