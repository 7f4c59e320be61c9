package com.ecowatch.collectors;

import com.ecowatch.collectors.api.CollectorContext;
import com.ecowatch.collectors.api.SourceConfigurationException;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.config.SummaryCollectorConfig;
import com.ecowatch.collectors.summary.EnvironmentalAggregator;
import com.ecowatch.collectors.summary.SummaryCollector;
import com.ecowatch.collectors.support.CollectorContractAssertions;
import com.ecowatch.collectors.support.EventCapture;
import com.ecowatch.collectors.support.TestSummaryStore;
import com.ecowatch.core.bus.EventBus;
import com.ecowatch.core.events.SourceFailed;
import com.ecowatch.core.model.AirQualityRecord;
import com.ecowatch.core.model.AlertBulletin;
import com.ecowatch.core.model.EnvironmentalSummary;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CollectorContractTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void summaryCollectorSatisfiesContractWhenSourcesDegrade() {
        EventBus bus = silentBus();
        EventCapture capture = new EventCapture(bus);
        TestSummaryStore store = new TestSummaryStore();

        EnvironmentalAggregator aggregator = new EnvironmentalAggregator(
                location -> {
                    throw new SourceConfigurationException("OPENWEATHER_API_KEY is not configured");
                },
                coordinate -> AirQualityRecord.of(2, Map.of()),
                AlertBulletin::noWarnings,
                reference -> List.of(),
                AggregatorConfig.defaults(),
                CLOCK,
                bus
        );
        CollectorContext ctx = new CollectorContext(
                bus,
                store,
                CLOCK,
                Map.of(SummaryCollector.CONFIG_KEY, new SummaryCollectorConfig(Duration.ofMinutes(30), List.of("dehradun")))
        );

        CollectorContractAssertions.assertContract(
                new SummaryCollector(aggregator, Duration.ofMinutes(30)),
                ctx,
                capture,
                Duration.ofSeconds(5),
                true
        );

        EnvironmentalSummary stored = store.latest("Dehradun").orElseThrow();
        assertNull(stored.weather());
        assertEquals(1, stored.sourceErrors().size());
        assertEquals(1, capture.byType(SourceFailed.class).size());
    }

    @Test
    void summaryCollectorSatisfiesContractWhenHealthy() {
        EventBus bus = silentBus();
        EventCapture capture = new EventCapture(bus);
        CollectorContext ctx = new CollectorContext(
                bus,
                new TestSummaryStore(),
                CLOCK,
                Map.of(SummaryCollector.CONFIG_KEY, new SummaryCollectorConfig(Duration.ofMinutes(30), List.of()))
        );
        SummaryCollector collector = new SummaryCollector(
                location -> new EnvironmentalSummary("Dehradun", null, null, AlertBulletin.noWarnings(), List.of(), List.of()),
                Duration.ofMinutes(30)
        );

        CollectorContractAssertions.assertContract(collector, ctx, capture, Duration.ofSeconds(5), false);
    }

    private static EventBus silentBus() {
        return new EventBus((event, error) -> {
            throw new AssertionError("Unexpected event handler error", error);
        });
    }
}
