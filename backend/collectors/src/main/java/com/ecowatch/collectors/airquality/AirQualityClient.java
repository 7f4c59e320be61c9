package com.ecowatch.collectors.airquality;

import com.ecowatch.collectors.api.AirQualitySource;
import com.ecowatch.collectors.api.DataShapeException;
import com.ecowatch.collectors.api.SourceConfigurationException;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.http.SourceRequests;
import com.ecowatch.collectors.weather.WeatherClient;
import com.ecowatch.core.model.AirQualityRecord;
import com.ecowatch.core.model.Coordinate;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Air pollution index and pollutant concentrations for a coordinate, from the same provider
 * and with the same API key as {@link WeatherClient}.
 */
public final class AirQualityClient implements AirQualitySource {
    static final String LABEL = "Air quality API";

    private final HttpClient httpClient;
    private final AggregatorConfig config;
    private final String apiKey;

    public AirQualityClient(HttpClient httpClient, AggregatorConfig config, String apiKey) {
        this.httpClient = httpClient;
        this.config = config;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public AirQualityRecord fetchAirQuality(Coordinate coordinate) {
        if (apiKey.isBlank()) {
            throw new SourceConfigurationException(WeatherClient.API_KEY_ENV + " is not configured");
        }
        Coordinate target = coordinate == null ? config.fallbackCoordinate() : coordinate;

        Map<String, String> params = new LinkedHashMap<>();
        params.put("lat", String.valueOf(target.latitude()));
        params.put("lon", String.valueOf(target.longitude()));
        params.put("appid", apiKey);
        URI uri = SourceRequests.withQuery(config.airQualityEndpoint(), params);
        HttpRequest request = SourceRequests.get(uri, config.requestTimeout(), Map.of("Accept", "application/json"));

        JsonNode root = SourceRequests.readJson(SourceRequests.fetchBody(httpClient, request, LABEL), LABEL);
        return toRecord(root);
    }

    static AirQualityRecord toRecord(JsonNode root) {
        JsonNode readings = root.path("list");
        if (!readings.isArray() || readings.isEmpty()) {
            throw new DataShapeException("Air quality data is missing in API response");
        }
        JsonNode reading = readings.get(0);
        return AirQualityRecord.of(index(reading.path("main").path("aqi")), components(reading.path("components")));
    }

    private static Integer index(JsonNode aqi) {
        if (!aqi.isIntegralNumber() || aqi.asInt() <= 0) {
            return null;
        }
        return aqi.asInt();
    }

    private static Map<String, Double> components(JsonNode node) {
        Map<String, Double> components = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                components.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return components;
    }
}
