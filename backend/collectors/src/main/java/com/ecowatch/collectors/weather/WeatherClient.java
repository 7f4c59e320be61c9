package com.ecowatch.collectors.weather;

import com.ecowatch.collectors.api.SourceConfigurationException;
import com.ecowatch.collectors.api.WeatherSource;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.http.SourceRequests;
import com.ecowatch.core.model.Coordinate;
import com.ecowatch.core.model.WeatherRecord;
import com.ecowatch.core.util.JsonUtils;
import com.ecowatch.core.util.TextUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current conditions from the OpenWeatherMap "weather" endpoint, metric units.
 */
public final class WeatherClient implements WeatherSource {
    public static final String API_KEY_ENV = "OPENWEATHER_API_KEY";
    static final String LABEL = "Weather API";

    private final HttpClient httpClient;
    private final AggregatorConfig config;
    private final String apiKey;

    public WeatherClient(HttpClient httpClient, AggregatorConfig config, String apiKey) {
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public WeatherRecord fetchWeather(String locationName) {
        if (apiKey.isBlank()) {
            throw new SourceConfigurationException(API_KEY_ENV + " is not configured");
        }
        String location = locationName == null || locationName.isBlank()
                ? config.defaultLocation()
                : locationName.trim();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", location);
        params.put("units", "metric");
        params.put("appid", apiKey);
        URI uri = SourceRequests.withQuery(config.weatherEndpoint(), params);
        HttpRequest request = SourceRequests.get(uri, config.requestTimeout(), Map.of("Accept", "application/json"));

        JsonNode root = SourceRequests.readJson(SourceRequests.fetchBody(httpClient, request, LABEL), LABEL);
        return toRecord(location, root, config.weatherEndpoint());
    }

    static WeatherRecord toRecord(String location, JsonNode root, String source) {
        JsonNode main = root.path("main");
        String country = root.path("sys").path("country").asText("");
        return new WeatherRecord(
                TextUtils.titleCase(location),
                country.isBlank() ? null : country,
                coordinate(root.path("coord")),
                TextUtils.wholeNumber(JsonUtils.numberOrNull(main.get("temp"))),
                condition(root.path("weather")),
                TextUtils.wholeNumber(JsonUtils.numberOrNull(main.get("humidity"))),
                rainfallMm(root.path("rain")),
                source
        );
    }

    /**
     * Last hour's rainfall, else the last three hours', else zero; one decimal place.
     */
    static double rainfallMm(JsonNode rain) {
        Double value = JsonUtils.numberOrNull(rain.get("1h"));
        if (value == null) {
            value = JsonUtils.numberOrNull(rain.get("3h"));
        }
        Double rounded = TextUtils.round(value, 1);
        return rounded == null ? 0.0 : rounded;
    }

    static String condition(JsonNode conditions) {
        String description = "";
        if (conditions.isArray() && !conditions.isEmpty()) {
            description = conditions.get(0).path("description").asText("");
        }
        return TextUtils.titleCase(description.isBlank() ? "Unavailable" : description);
    }

    private static Coordinate coordinate(JsonNode coord) {
        Double lat = JsonUtils.numberOrNull(coord.get("lat"));
        Double lon = JsonUtils.numberOrNull(coord.get("lon"));
        if (lat == null || lon == null) {
            return null;
        }
        return new Coordinate(lat, lon);
    }
}
