package com.ecowatch.collectors.config;

import java.time.Duration;
import java.util.List;

public record SummaryCollectorConfig(Duration interval, List<String> locations) {
    public SummaryCollectorConfig {
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
