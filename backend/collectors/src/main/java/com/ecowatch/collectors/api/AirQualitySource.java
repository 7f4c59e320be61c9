package com.ecowatch.collectors.api;

import com.ecowatch.core.model.AirQualityRecord;
import com.ecowatch.core.model.Coordinate;

@FunctionalInterface
public interface AirQualitySource {
    AirQualityRecord fetchAirQuality(Coordinate coordinate);
}
