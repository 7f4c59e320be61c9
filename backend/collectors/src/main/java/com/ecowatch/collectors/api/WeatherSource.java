package com.ecowatch.collectors.api;

import com.ecowatch.core.model.WeatherRecord;

@FunctionalInterface
public interface WeatherSource {
    WeatherRecord fetchWeather(String locationName);
}
