package com.ecowatch.collectors.config;

import com.ecowatch.core.model.Coordinate;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Endpoints and knobs shared by the four sources. Any component left {@code null}, e.g. omitted
 * from {@code aggregator.json}, takes its default.
 */
public record AggregatorConfig(
        String defaultLocation,
        String regionName,
        Coordinate fallbackCoordinate,
        String weatherEndpoint,
        String airQualityEndpoint,
        String bulletinUrl,
        String seismicFeedUrl,
        String userAgent,
        Duration requestTimeout,
        Duration recencyWindow,
        ZoneId feedZone
) {
    public static final String DEFAULT_LOCATION = "Dehradun";
    public static final String DEFAULT_REGION = "Uttarakhand";
    public static final String DEFAULT_WEATHER_ENDPOINT = "https://api.openweathermap.org/data/2.5/weather";
    public static final String DEFAULT_AIR_QUALITY_ENDPOINT = "https://api.openweathermap.org/data/2.5/air_pollution";
    public static final String DEFAULT_BULLETIN_URL =
            "https://mausam.imd.gov.in/imd_latest/contents/subdivisionwise-warning.php";
    public static final String DEFAULT_SEISMIC_FEED_URL =
            "https://riseq.seismo.gov.in/riseq/earthquake/recent_earthquake";
    public static final String DEFAULT_USER_AGENT = "EcoWatch-Dashboard/1.0";

    public AggregatorConfig {
        defaultLocation = orDefault(defaultLocation, DEFAULT_LOCATION);
        regionName = orDefault(regionName, DEFAULT_REGION);
        fallbackCoordinate = fallbackCoordinate == null ? Coordinate.DEFAULT_FALLBACK : fallbackCoordinate;
        weatherEndpoint = orDefault(weatherEndpoint, DEFAULT_WEATHER_ENDPOINT);
        airQualityEndpoint = orDefault(airQualityEndpoint, DEFAULT_AIR_QUALITY_ENDPOINT);
        bulletinUrl = orDefault(bulletinUrl, DEFAULT_BULLETIN_URL);
        seismicFeedUrl = orDefault(seismicFeedUrl, DEFAULT_SEISMIC_FEED_URL);
        userAgent = orDefault(userAgent, DEFAULT_USER_AGENT);
        requestTimeout = positiveOrDefault(requestTimeout, Duration.ofSeconds(15));
        recencyWindow = positiveOrDefault(recencyWindow, Duration.ofHours(24));
        feedZone = feedZone == null ? ZoneId.of("Asia/Kolkata") : feedZone;
    }

    public static AggregatorConfig defaults() {
        return new AggregatorConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    public AggregatorConfig withEndpoints(
            String weatherEndpoint,
            String airQualityEndpoint,
            String bulletinUrl,
            String seismicFeedUrl
    ) {
        return new AggregatorConfig(
                defaultLocation,
                regionName,
                fallbackCoordinate,
                weatherEndpoint,
                airQualityEndpoint,
                bulletinUrl,
                seismicFeedUrl,
                userAgent,
                requestTimeout,
                recencyWindow,
                feedZone
        );
    }

    public AggregatorConfig withRequestTimeout(Duration timeout) {
        return new AggregatorConfig(
                defaultLocation,
                regionName,
                fallbackCoordinate,
                weatherEndpoint,
                airQualityEndpoint,
                bulletinUrl,
                seismicFeedUrl,
                userAgent,
                timeout,
                recencyWindow,
                feedZone
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
