package com.ecowatch.service.digest;

import com.ecowatch.core.model.AirQualityRecord;
import com.ecowatch.core.model.AlertBulletin;
import com.ecowatch.core.model.EnvironmentalSummary;
import com.ecowatch.core.model.SeismicEvent;
import com.ecowatch.core.model.WeatherRecord;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders an {@link EnvironmentalSummary} as the plain-text daily digest.
 */
public final class DigestComposer {
    private static final String UNAVAILABLE = "Data unavailable";
    private static final String NO_RAIN = "No rainfall expected";
    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    private final String regionName;
    private final DateTimeFormatter eventTime;

    public DigestComposer(String regionName, ZoneId zone) {
        this.regionName = regionName;
        this.eventTime = DateTimeFormatter.ofPattern("d MMM, HH:mm", Locale.ENGLISH).withZone(zone);
    }

    public DigestMessage compose(String recipientName, EnvironmentalSummary summary, LocalDate date) {
        String name = recipientName == null || recipientName.isBlank() ? "there" : recipientName.trim();
        String city = summary.targetLocationName() == null || summary.targetLocationName().isBlank()
                ? regionName
                : summary.targetLocationName();
        WeatherRecord weather = summary.weather();

        String body = String.join("\n", List.of(
                "Hello " + name + ",",
                "",
                "Here is your daily environmental summary for " + city + " (" + SUBJECT_DATE.format(date) + "):",
                "",
                "Temperature: " + temperature(weather),
                "Condition: " + condition(weather),
                "Humidity: " + humidity(weather),
                "Rainfall Expected: " + rainfall(weather),
                airQuality(summary.airQuality()),
                "Alerts: " + alerts(summary.alerts()),
                "",
                "Earthquake Updates:",
                earthquakes(summary.seismicEvents()),
                "",
                "Stay safe and stay informed!",
                "-- EcoWatch",
                ""
        ));
        return new DigestMessage("Daily Environmental Update for " + city + " - EcoWatch", body);
    }

    static String temperature(WeatherRecord weather) {
        if (weather == null || weather.temperatureCelsius() == null) {
            return UNAVAILABLE;
        }
        return weather.temperatureCelsius() + "°C";
    }

    static String condition(WeatherRecord weather) {
        if (weather == null || weather.conditionText() == null || weather.conditionText().isBlank()) {
            return UNAVAILABLE;
        }
        return weather.conditionText();
    }

    static String humidity(WeatherRecord weather) {
        if (weather == null || weather.humidityPercent() == null) {
            return UNAVAILABLE;
        }
        return weather.humidityPercent() + "%";
    }

    static String rainfall(WeatherRecord weather) {
        if (weather == null || weather.rainfallMm() == 0.0) {
            return NO_RAIN;
        }
        return BigDecimal.valueOf(weather.rainfallMm()).stripTrailingZeros().toPlainString() + " mm";
    }

    static String airQuality(AirQualityRecord airQuality) {
        if (airQuality == null || airQuality.index() == null) {
            return "Air quality data unavailable.";
        }
        return "Air Quality Index: " + airQuality.index() + " / 5 (" + airQuality.category() + ").";
    }

    static String alerts(AlertBulletin alerts) {
        if (alerts == null) {
            return AlertBulletin.SERVICE_UNAVAILABLE;
        }
        if (!alerts.notices().isEmpty()) {
            return String.join("; ", alerts.notices());
        }
        return alerts.summaryLine() == null ? AlertBulletin.NO_WARNINGS : alerts.summaryLine();
    }

    String earthquakes(List<SeismicEvent> events) {
        if (events.isEmpty()) {
            return "No significant seismic activity recorded in " + regionName + " in the last 24 hours.";
        }
        SeismicEvent latest = events.get(0);
        String magnitude = latest.magnitude() == null
                ? "Magnitude not reported"
                : String.format(Locale.ROOT, "Magnitude %.1f", latest.magnitude());
        String location = latest.location() == null || latest.location().isBlank() ? regionName : latest.location();
        String time = latest.timestamp() == null ? "Recent" : eventTime.format(latest.timestamp());
        return magnitude + " near " + location + " (" + time + ").";
    }
}
