package com.ecowatch.collectors.summary;

import com.ecowatch.collectors.api.Collector;
import com.ecowatch.collectors.api.CollectorContext;
import com.ecowatch.collectors.api.CollectorResult;
import com.ecowatch.collectors.config.SummaryCollectorConfig;
import com.ecowatch.core.events.AlertRaised;
import com.ecowatch.core.events.CollectorTickCompleted;
import com.ecowatch.core.events.CollectorTickStarted;
import com.ecowatch.core.model.EnvironmentalSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Refreshes the stored summary of every configured location on each tick.
 */
public final class SummaryCollector implements Collector {
    public static final String CONFIG_KEY = "summaryCollector";

    private final Function<String, EnvironmentalSummary> summaryLookup;
    private final Duration interval;

    public SummaryCollector(EnvironmentalAggregator aggregator, Duration interval) {
        this(aggregator::collectSummary, interval);
    }

    public SummaryCollector(Function<String, EnvironmentalSummary> summaryLookup, Duration interval) {
        this.summaryLookup = Objects.requireNonNull(summaryLookup, "summaryLookup is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
    }

    @Override
    public String name() {
        return "summaryCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(startedAt, name()));

        return CompletableFuture.supplyAsync(() -> runPoll(ctx))
                .handle((result, error) -> {
                    long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
                    if (error != null) {
                        String message = "Summary poll failed: " + rootMessage(error);
                        ctx.eventBus().publish(new AlertRaised(
                                ctx.clock().instant(),
                                "collector",
                                message,
                                Map.of("collector", name())
                        ));
                        ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                        return CollectorResult.failure(message, Map.of("collector", name()));
                    }
                    ctx.eventBus().publish(new CollectorTickCompleted(
                            ctx.clock().instant(),
                            name(),
                            result.success(),
                            durationMillis
                    ));
                    return result;
                });
    }

    private CollectorResult runPoll(CollectorContext ctx) {
        SummaryCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, SummaryCollectorConfig.class);
        List<String> locations = normalize(cfg.locations());

        List<String> collected = new ArrayList<>();
        int degraded = 0;
        for (String location : locations) {
            EnvironmentalSummary summary = summaryLookup.apply(location);
            ctx.summaryStore().put(summary);
            collected.add(summary.targetLocationName());
            if (summary.degraded()) {
                degraded++;
            }
        }

        Map<String, Object> stats = Map.of(
                "locations", collected,
                "degraded", degraded
        );
        if (degraded == 0) {
            return CollectorResult.success("Summary polling completed", stats);
        }
        return CollectorResult.failure("Summary polling had degraded sources", stats);
    }

    private static List<String> normalize(List<String> locations) {
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String location : locations) {
            if (location != null && !location.isBlank()) {
                normalized.add(location.trim());
            }
        }
        if (normalized.isEmpty()) {
            // An empty name makes the aggregator use its default location.
            return List.of("");
        }
        return List.copyOf(normalized);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
