package com.ecowatch.service.digest;

import com.ecowatch.core.model.EnvironmentalSummary;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the digest once a day at the configured local time (in the clock's zone). A failed run
 * is logged and the next day's run is still scheduled.
 */
public final class DailyDigestScheduler {
    private static final Logger LOGGER = Logger.getLogger(DailyDigestScheduler.class.getName());

    private final DigestSettings settings;
    private final Function<String, EnvironmentalSummary> summaryLookup;
    private final DigestComposer composer;
    private final DigestSink sink;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    private boolean started;
    private ScheduledFuture<?> pending;
    private ZonedDateTime nextRunAt;

    public DailyDigestScheduler(
            DigestSettings settings,
            Function<String, EnvironmentalSummary> summaryLookup,
            DigestComposer composer,
            DigestSink sink,
            Clock clock,
            ScheduledExecutorService executor
    ) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.summaryLookup = Objects.requireNonNull(summaryLookup, "summaryLookup is required");
        this.composer = Objects.requireNonNull(composer, "composer is required");
        this.sink = Objects.requireNonNull(sink, "sink is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        if (!settings.enabled()) {
            LOGGER.info("Daily digest scheduler disabled");
            return;
        }
        started = true;
        scheduleNext();
        LOGGER.info(() -> "Daily digest scheduled for " + nextRunAt
                + " (hour=" + settings.hour() + ", minute=" + settings.minute() + ")");
    }

    public synchronized void stop() {
        started = false;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        nextRunAt = null;
    }

    public synchronized Optional<ZonedDateTime> nextRunAt() {
        return Optional.ofNullable(nextRunAt);
    }

    /**
     * Today's run time if it is still ahead of {@code now}, otherwise tomorrow's.
     */
    public ZonedDateTime computeNextRun(ZonedDateTime now) {
        ZonedDateTime target = now.withHour(settings.hour())
                .withMinute(settings.minute())
                .withSecond(0)
                .withNano(0);
        if (!target.isAfter(now)) {
            target = target.plusDays(1);
        }
        return target;
    }

    public DigestMessage runOnce() {
        EnvironmentalSummary summary = summaryLookup.apply(settings.location());
        DigestMessage message = composer.compose(settings.recipientName(), summary, LocalDate.now(clock));
        sink.deliver(message);
        return message;
    }

    private void runAndReschedule() {
        try {
            runOnce();
            LOGGER.info(() -> "Daily digest dispatched at " + clock.instant());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to send daily digest", e);
        } finally {
            synchronized (this) {
                pending = null;
                if (started) {
                    scheduleNext();
                }
            }
        }
    }

    private void scheduleNext() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        nextRunAt = computeNextRun(now);
        long delayMillis = Math.max(0, Duration.between(now, nextRunAt).toMillis());
        pending = executor.schedule(this::runAndReschedule, delayMillis, TimeUnit.MILLISECONDS);
    }
}
