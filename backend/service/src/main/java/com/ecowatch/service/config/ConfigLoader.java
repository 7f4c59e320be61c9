package com.ecowatch.service.config;

import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.config.SummaryCollectorConfig;
import com.ecowatch.core.model.CollectorConfig;
import com.ecowatch.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Reads the JSON files of the config directory. A missing file means "use the defaults"; an
 * unreadable one is an error.
 */
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static AggregatorConfig loadAggregator(Path configDir) {
        Path path = configDir.resolve("aggregator.json");
        if (!Files.exists(path)) {
            return AggregatorConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        Path path = configDir.resolve("collectors.json");
        if (!Files.exists(path)) {
            return List.of();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static SummaryCollectorConfig loadSummary(Path configDir) {
        Path path = configDir.resolve("summary.json");
        if (!Files.exists(path)) {
            return new SummaryCollectorConfig(Duration.ofMinutes(30), List.of());
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
