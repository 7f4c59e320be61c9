package com.ecowatch.collectors.api;

import com.ecowatch.core.bus.EventBus;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

public record CollectorContext(
        EventBus eventBus,
        SummaryStore summaryStore,
        Clock clock,
        Map<String, Object> config
) {
    public CollectorContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(summaryStore, "summaryStore is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(config, "config is required");
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
