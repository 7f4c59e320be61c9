package com.ecowatch.core.model;

import java.util.Map;

public record CollectorConfig(
        String name,
        boolean enabled,
        int intervalSeconds,
        Map<String, Object> params
) {
    public CollectorConfig {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
