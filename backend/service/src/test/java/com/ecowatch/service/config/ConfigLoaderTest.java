package com.ecowatch.service.config;

import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.config.SummaryCollectorConfig;
import com.ecowatch.core.model.CollectorConfig;
import com.ecowatch.core.model.Coordinate;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsAllServiceConfigs() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("collectors.json"), """
                [
                  {"name":"summaryCollector","enabled":false,"intervalSeconds":900,"params":{"note":"x"}}
                ]
                """);
        Files.writeString(dir.resolve("aggregator.json"), """
                {
                  "defaultLocation":"Shimla",
                  "regionName":"Himachal Pradesh",
                  "fallbackCoordinate":{"latitude":31.1048,"longitude":77.1734},
                  "requestTimeout":"PT10S",
                  "feedZone":"UTC"
                }
                """);
        Files.writeString(dir.resolve("summary.json"), """
                {"interval":"PT15M","locations":["Shimla","Manali"]}
                """);

        List<CollectorConfig> collectors = ConfigLoader.loadCollectors(dir);
        AggregatorConfig aggregator = ConfigLoader.loadAggregator(dir);
        SummaryCollectorConfig summary = ConfigLoader.loadSummary(dir);

        assertEquals(1, collectors.size());
        assertEquals("summaryCollector", collectors.get(0).name());
        assertFalse(collectors.get(0).enabled());
        assertEquals(900, collectors.get(0).intervalSeconds());

        assertEquals("Shimla", aggregator.defaultLocation());
        assertEquals("Himachal Pradesh", aggregator.regionName());
        assertEquals(new Coordinate(31.1048, 77.1734), aggregator.fallbackCoordinate());
        assertEquals(Duration.ofSeconds(10), aggregator.requestTimeout());
        assertEquals(ZoneId.of("UTC"), aggregator.feedZone());
        assertEquals(AggregatorConfig.DEFAULT_WEATHER_ENDPOINT, aggregator.weatherEndpoint());
        assertEquals(Duration.ofHours(24), aggregator.recencyWindow());

        assertEquals(Duration.ofMinutes(15), summary.interval());
        assertEquals(List.of("Shimla", "Manali"), summary.locations());
    }

    @Test
    void missingFilesFallBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-empty-");

        assertEquals(AggregatorConfig.defaults(), ConfigLoader.loadAggregator(dir));
        assertTrue(ConfigLoader.loadCollectors(dir).isEmpty());
        assertEquals(Duration.ofMinutes(30), ConfigLoader.loadSummary(dir).interval());
        assertTrue(ConfigLoader.loadSummary(dir).locations().isEmpty());
    }

    @Test
    void malformedFileFailsWithPath() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-bad-");
        Files.writeString(dir.resolve("aggregator.json"), "{\"regionName\": ");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadAggregator(dir));

        assertTrue(ex.getMessage().startsWith("Failed loading config from "));
        assertTrue(ex.getMessage().endsWith("aggregator.json"));
    }
}
