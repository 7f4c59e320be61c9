package com.ecowatch.core.model;

import java.util.Map;

public final class AirQualityCategory {
    public static final String UNAVAILABLE = "Unavailable";

    private static final Map<Integer, String> LABELS = Map.of(
            1, "Good",
            2, "Fair",
            3, "Moderate",
            4, "Poor",
            5, "Very Poor"
    );

    private AirQualityCategory() {
    }

    /**
     * Label for a 1-5 index; anything else, including {@code null}, is {@link #UNAVAILABLE}.
     */
    public static String label(Integer index) {
        if (index == null) {
            return UNAVAILABLE;
        }
        return LABELS.getOrDefault(index, UNAVAILABLE);
    }
}
