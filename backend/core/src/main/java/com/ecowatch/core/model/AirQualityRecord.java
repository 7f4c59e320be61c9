package com.ecowatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param index      1-5 ordinal, {@code null} when the reading carried none
 * @param category   always defined, see {@link AirQualityCategory#label(Integer)}
 * @param components pollutant name to concentration, in upstream order
 */
public record AirQualityRecord(Integer index, String category, Map<String, Double> components) {
    public AirQualityRecord {
        category = category == null ? AirQualityCategory.label(index) : category;
        components = components == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static AirQualityRecord of(Integer index, Map<String, Double> components) {
        return new AirQualityRecord(index, AirQualityCategory.label(index), components);
    }
}
