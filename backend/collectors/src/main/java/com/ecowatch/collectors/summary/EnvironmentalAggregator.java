package com.ecowatch.collectors.summary;

import com.ecowatch.collectors.api.AirQualitySource;
import com.ecowatch.collectors.api.AlertSource;
import com.ecowatch.collectors.api.SeismicSource;
import com.ecowatch.collectors.api.SourceException;
import com.ecowatch.collectors.api.SourceKind;
import com.ecowatch.collectors.api.SourceResult;
import com.ecowatch.collectors.api.SourceTimeoutException;
import com.ecowatch.collectors.api.WeatherSource;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.core.bus.EventBus;
import com.ecowatch.core.events.SourceFailed;
import com.ecowatch.core.events.SummaryCollected;
import com.ecowatch.core.model.AirQualityRecord;
import com.ecowatch.core.model.AlertBulletin;
import com.ecowatch.core.model.Coordinate;
import com.ecowatch.core.model.EnvironmentalSummary;
import com.ecowatch.core.model.SeismicEvent;
import com.ecowatch.core.model.WeatherRecord;
import com.ecowatch.core.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds one {@link EnvironmentalSummary} per call from the four sources.
 *
 * <p>Weather goes first because it supplies the coordinate for the air-quality lookup; the
 * bulletin and seismic fetches start alongside it. Each call is bounded by the configured request
 * timeout and folded into the summary as a {@link SourceResult}, so a failing source only costs
 * its own field plus one entry in {@link EnvironmentalSummary#sourceErrors()}.
 * {@link #collectSummary(String)} never throws.
 */
public final class EnvironmentalAggregator {
    private static final Logger LOGGER = Logger.getLogger(EnvironmentalAggregator.class.getName());

    private final WeatherSource weatherSource;
    private final AirQualitySource airQualitySource;
    private final AlertSource alertSource;
    private final SeismicSource seismicSource;
    private final AggregatorConfig config;
    private final Clock clock;
    private final Executor executor;
    private final EventBus eventBus;

    public EnvironmentalAggregator(
            WeatherSource weatherSource,
            AirQualitySource airQualitySource,
            AlertSource alertSource,
            SeismicSource seismicSource,
            AggregatorConfig config,
            Clock clock,
            EventBus eventBus
    ) {
        this(weatherSource, airQualitySource, alertSource, seismicSource, config, clock, ForkJoinPool.commonPool(), eventBus);
    }

    public EnvironmentalAggregator(
            WeatherSource weatherSource,
            AirQualitySource airQualitySource,
            AlertSource alertSource,
            SeismicSource seismicSource,
            AggregatorConfig config,
            Clock clock,
            Executor executor,
            EventBus eventBus
    ) {
        this.weatherSource = Objects.requireNonNull(weatherSource, "weatherSource is required");
        this.airQualitySource = Objects.requireNonNull(airQualitySource, "airQualitySource is required");
        this.alertSource = Objects.requireNonNull(alertSource, "alertSource is required");
        this.seismicSource = Objects.requireNonNull(seismicSource, "seismicSource is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
    }

    public EnvironmentalSummary collectSummary(String locationName) {
        Instant startedAt = clock.instant();
        String location = TextUtils.titleCase(
                locationName == null || locationName.isBlank() ? config.defaultLocation() : locationName
        );

        CompletableFuture<SourceResult<WeatherRecord>> weather =
                call(SourceKind.WEATHER, () -> weatherSource.fetchWeather(location));
        CompletableFuture<SourceResult<AlertBulletin>> alerts =
                call(SourceKind.ALERTS, alertSource::fetchAlerts);
        CompletableFuture<SourceResult<List<SeismicEvent>>> seismic =
                call(SourceKind.EARTHQUAKES, () -> seismicSource.fetchSeismicEvents(startedAt));
        CompletableFuture<SourceResult<AirQualityRecord>> airQuality = weather.thenCompose(result ->
                call(SourceKind.AIR_QUALITY, () -> airQualitySource.fetchAirQuality(coordinateFor(result))));

        List<String> errors = new ArrayList<>();
        WeatherRecord weatherRecord = unwrap(SourceKind.WEATHER, weather.join(), location, errors);
        AirQualityRecord airQualityRecord = unwrap(SourceKind.AIR_QUALITY, airQuality.join(), location, errors);
        AlertBulletin bulletin = unwrap(SourceKind.ALERTS, alerts.join(), location, errors);
        List<SeismicEvent> events = unwrap(SourceKind.EARTHQUAKES, seismic.join(), location, errors);

        EnvironmentalSummary summary = new EnvironmentalSummary(
                location,
                weatherRecord,
                airQualityRecord,
                bulletin == null ? AlertBulletin.unavailable() : bulletin,
                events == null ? List.of() : events,
                errors
        );
        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        eventBus.publish(new SummaryCollected(
                clock.instant(),
                location,
                summary.sourceErrors().size(),
                summary.seismicEvents().size(),
                durationMillis
        ));
        LOGGER.fine(() -> "Collected summary for " + location + " with " + errors.size() + " source error(s)");
        return summary;
    }

    /**
     * Coordinate reported by a successful weather lookup, otherwise the configured fallback.
     */
    Coordinate coordinateFor(SourceResult<WeatherRecord> weather) {
        if (weather.success() && weather.value() != null && weather.value().coordinate() != null) {
            return weather.value().coordinate();
        }
        return config.fallbackCoordinate();
    }

    private <T> CompletableFuture<SourceResult<T>> call(SourceKind kind, Supplier<T> fetch) {
        try {
            return CompletableFuture.supplyAsync(fetch, executor)
                    .orTimeout(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handle((value, error) -> error == null
                            ? SourceResult.success(value)
                            : SourceResult.<T>failure(toSourceException(kind, error)));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(SourceResult.failure(toSourceException(kind, e)));
        }
    }

    private <T> T unwrap(SourceKind kind, SourceResult<T> result, String location, List<String> errors) {
        if (result.success()) {
            return result.value();
        }
        SourceException error = result.error();
        errors.add(kind.label() + ": " + error.getMessage());
        LOGGER.log(Level.WARNING, kind.label() + " source failed for " + location + ": " + error.getMessage());
        eventBus.publish(new SourceFailed(clock.instant(), location, kind.label(), error.errorKind(), error.getMessage()));
        return null;
    }

    private SourceException toSourceException(SourceKind kind, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SourceException sourceException) {
            return sourceException;
        }
        if (cause instanceof TimeoutException) {
            return new SourceTimeoutException(
                    kind.label() + " request timed out after " + describe(config.requestTimeout()),
                    cause
            );
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new SourceException(message, cause);
    }

    private static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }
}
