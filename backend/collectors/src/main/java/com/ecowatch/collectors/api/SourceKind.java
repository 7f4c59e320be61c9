package com.ecowatch.collectors.api;

public enum SourceKind {
    WEATHER("Weather"),
    AIR_QUALITY("Air Quality"),
    ALERTS("Alerts"),
    EARTHQUAKES("Earthquakes");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    /**
     * Prefix used for this source's entry in a summary's error list.
     */
    public String label() {
        return label;
    }
}
