package com.ecowatch.service;

import com.ecowatch.collectors.airquality.AirQualityClient;
import com.ecowatch.collectors.alerts.WarningBulletinClient;
import com.ecowatch.collectors.api.CollectorContext;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.config.SummaryCollectorConfig;
import com.ecowatch.collectors.seismic.SeismicFeedClient;
import com.ecowatch.collectors.summary.EnvironmentalAggregator;
import com.ecowatch.collectors.summary.SummaryCollector;
import com.ecowatch.collectors.weather.WeatherClient;
import com.ecowatch.core.bus.EventBus;
import com.ecowatch.core.events.AlertRaised;
import com.ecowatch.core.model.CollectorConfig;
import com.ecowatch.core.util.JsonUtils;
import com.ecowatch.service.config.ConfigLoader;
import com.ecowatch.service.digest.DailyDigestScheduler;
import com.ecowatch.service.digest.DigestComposer;
import com.ecowatch.service.digest.DigestSettings;
import com.ecowatch.service.digest.LoggingDigestSink;
import com.ecowatch.service.http.HttpClientFactory;
import com.ecowatch.service.runtime.SchedulerService;
import com.ecowatch.service.store.InMemorySummaryStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * {@code Main --once [location]} prints a single summary as JSON. Without arguments the summary
 * collector and the daily digest run until the process is stopped.
 */
public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("ECOWATCH_CONFIG_DIR", "config"));
        AggregatorConfig aggregatorConfig = ConfigLoader.loadAggregator(configDir);
        String apiKey = env.getOrDefault(WeatherClient.API_KEY_ENV, "");
        if (apiKey.isBlank()) {
            LOGGER.warning(WeatherClient.API_KEY_ENV + " is not set; weather and air quality will be reported unavailable.");
        }

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning(alert.message()));

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        ExecutorService sourceExecutor = Executors.newFixedThreadPool(8, daemonThreads("ecowatch-source"));
        EnvironmentalAggregator aggregator = new EnvironmentalAggregator(
                new WeatherClient(httpClient, aggregatorConfig, apiKey),
                new AirQualityClient(httpClient, aggregatorConfig, apiKey),
                new WarningBulletinClient(httpClient, aggregatorConfig),
                new SeismicFeedClient(httpClient, aggregatorConfig, clock),
                aggregatorConfig,
                clock,
                sourceExecutor,
                eventBus
        );

        if (args.length > 0 && "--once".equals(args[0])) {
            String location = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
            System.out.println(JsonUtils.toPrettyJson(aggregator.collectSummary(location)));
            sourceExecutor.shutdown();
            return;
        }

        SummaryCollectorConfig summaryConfig = ConfigLoader.loadSummary(configDir);
        CollectorConfig collectorConfig = ConfigLoader.loadCollectors(configDir).stream()
                .filter(cfg -> "summaryCollector".equals(cfg.name()))
                .findFirst()
                .orElse(null);
        Duration interval = collectorConfig == null
                ? summaryConfig.interval()
                : Duration.ofSeconds(Math.max(1, collectorConfig.intervalSeconds()));
        boolean enabled = collectorConfig == null || collectorConfig.enabled();

        SummaryCollector summaryCollector = new SummaryCollector(aggregator, interval);
        InMemorySummaryStore summaryStore = new InMemorySummaryStore();
        CollectorContext context = new CollectorContext(
                eventBus,
                summaryStore,
                clock,
                Map.of(SummaryCollector.CONFIG_KEY, summaryConfig)
        );
        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledCollector(summaryCollector, interval, enabled)),
                context
        );

        ScheduledExecutorService digestExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("ecowatch-digest"));
        DailyDigestScheduler digestScheduler = new DailyDigestScheduler(
                DigestSettings.fromEnvironment(env),
                aggregator::collectSummary,
                new DigestComposer(aggregatorConfig.regionName(), aggregatorConfig.feedZone()),
                new LoggingDigestSink(),
                Clock.system(aggregatorConfig.feedZone()),
                digestExecutor
        );

        scheduler.start();
        digestScheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            digestScheduler.stop();
            digestExecutor.shutdownNow();
            scheduler.shutdown();
            sourceExecutor.shutdownNow();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
