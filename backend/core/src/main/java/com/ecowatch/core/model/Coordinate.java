package com.ecowatch.core.model;

public record Coordinate(double latitude, double longitude) {
    /**
     * Dehradun, used whenever the weather lookup cannot supply a position.
     */
    public static final Coordinate DEFAULT_FALLBACK = new Coordinate(30.3165, 78.0322);
}
