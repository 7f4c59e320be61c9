package com.ecowatch.collectors.seismic;

import com.ecowatch.collectors.api.SeismicSource;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.http.SourceRequests;
import com.ecowatch.core.model.SeismicEvent;
import com.ecowatch.core.util.HtmlUtils;
import com.ecowatch.core.util.TextUtils;
import com.ecowatch.core.util.TimestampParser;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Recent earthquakes from the national seismic network's HTML table.
 *
 * <p>Expected columns: date, time, latitude/longitude or depth columns, magnitude in the fifth
 * column (fourth on older layouts), and the location description last.
 */
public final class SeismicFeedClient implements SeismicSource {
    static final String LABEL = "Earthquake feed";
    static final int MIN_CELLS = 6;

    private static final Comparator<SeismicEvent> MOST_RECENT_FIRST = Comparator.comparing(
            SeismicEvent::timestamp,
            Comparator.nullsFirst(Comparator.<Instant>naturalOrder())
    ).reversed();

    private final HttpClient httpClient;
    private final AggregatorConfig config;
    private final Clock clock;

    public SeismicFeedClient(HttpClient httpClient, AggregatorConfig config, Clock clock) {
        this.httpClient = httpClient;
        this.config = config;
        this.clock = clock;
    }

    public List<SeismicEvent> fetchSeismicEvents() {
        return fetchSeismicEvents(clock.instant());
    }

    @Override
    public List<SeismicEvent> fetchSeismicEvents(Instant referenceTime) {
        HttpRequest request = SourceRequests.get(
                URI.create(config.seismicFeedUrl()),
                config.requestTimeout(),
                Map.of("User-Agent", config.userAgent(), "Accept", "text/html")
        );
        String html = SourceRequests.fetchBody(httpClient, request, LABEL);
        return parseEvents(html, config.regionName(), config.feedZone(), referenceTime, config.recencyWindow());
    }

    static List<SeismicEvent> parseEvents(
            String html,
            String regionName,
            ZoneId feedZone,
            Instant referenceTime,
            Duration recencyWindow
    ) {
        List<SeismicEvent> matches = new ArrayList<>();
        for (List<String> cells : HtmlUtils.extractTableRows(html)) {
            if (cells.size() < MIN_CELLS) {
                continue;
            }
            String location = cells.get(cells.size() - 1);
            if (!TextUtils.containsIgnoreCase(location, regionName)) {
                continue;
            }
            Instant timestamp = TimestampParser.parse(cells.get(0), cells.get(1), feedZone).orElse(null);
            matches.add(new SeismicEvent(location, magnitude(cells), timestamp));
        }
        matches.sort(MOST_RECENT_FIRST);

        Instant cutoff = referenceTime.minus(recencyWindow);
        return matches.stream()
                .filter(event -> event.timestamp() != null && !event.timestamp().isBefore(cutoff))
                .toList();
    }

    /**
     * Fifth cell if it holds a non-zero number, else the fourth; one decimal place.
     */
    static Double magnitude(List<String> cells) {
        Double value = nonZeroNumber(cells.get(4));
        if (value == null) {
            value = nonZeroNumber(cells.get(3));
        }
        return TextUtils.round(value, 1);
    }

    private static Double nonZeroNumber(String cell) {
        String trimmed = cell == null ? "" : cell.trim();
        if (!trimmed.matches("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)")) {
            return null;
        }
        double value = Double.parseDouble(trimmed);
        return value == 0.0 ? null : value;
    }
}
