package com.ecowatch.core.model;

import java.util.List;

/**
 * Composite result of one aggregation call.
 *
 * <p>{@code weather} and {@code airQuality} are {@code null} when their source failed; callers
 * must read that as "unavailable", not as zero readings. {@code alerts} is never {@code null}
 * once assembled by the aggregator. Each entry of {@code sourceErrors} names one failed source.
 */
public record EnvironmentalSummary(
        String targetLocationName,
        WeatherRecord weather,
        AirQualityRecord airQuality,
        AlertBulletin alerts,
        List<SeismicEvent> seismicEvents,
        List<String> sourceErrors
) {
    public EnvironmentalSummary {
        seismicEvents = seismicEvents == null ? List.of() : List.copyOf(seismicEvents);
        sourceErrors = sourceErrors == null ? List.of() : List.copyOf(sourceErrors);
    }

    public boolean degraded() {
        return !sourceErrors.isEmpty();
    }
}
