package com.ecowatch.core.model;

/**
 * Current conditions for one named location.
 *
 * @param countryCode        ISO country code, {@code null} when the upstream omitted it
 * @param coordinate         position reported upstream, {@code null} when omitted
 * @param temperatureCelsius whole degrees, {@code null} when not reported
 * @param humidityPercent    whole percent, {@code null} when not reported
 * @param rainfallMm         never negative, {@code 0.0} when no rain block was reported
 * @param source             endpoint the reading came from
 */
public record WeatherRecord(
        String locationName,
        String countryCode,
        Coordinate coordinate,
        Integer temperatureCelsius,
        String conditionText,
        Integer humidityPercent,
        double rainfallMm,
        String source
) {
    public WeatherRecord {
        if (rainfallMm < 0 || Double.isNaN(rainfallMm)) {
            rainfallMm = 0.0;
        }
    }
}
