package com.ecowatch.collectors.alerts;

import com.ecowatch.collectors.api.AlertSource;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.http.SourceRequests;
import com.ecowatch.core.model.AlertBulletin;
import com.ecowatch.core.util.HtmlUtils;
import com.ecowatch.core.util.TextUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scrapes the sub-division warning table of the meteorological bulletin for the configured region.
 */
public final class WarningBulletinClient implements AlertSource {
    static final String LABEL = "IMD alert";
    private static final Pattern NOT_A_NOTICE =
            Pattern.compile("\\bn/a\\b|\\bnil\\b|\\bno warning", Pattern.CASE_INSENSITIVE);

    private final HttpClient httpClient;
    private final AggregatorConfig config;

    public WarningBulletinClient(HttpClient httpClient, AggregatorConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public AlertBulletin fetchAlerts() {
        HttpRequest request = SourceRequests.get(
                URI.create(config.bulletinUrl()),
                config.requestTimeout(),
                Map.of("User-Agent", config.userAgent(), "Accept", "text/html")
        );
        return parseBulletin(SourceRequests.fetchBody(httpClient, request, LABEL), config.regionName());
    }

    static AlertBulletin parseBulletin(String html, String regionName) {
        Optional<List<String>> regionRow = HtmlUtils.extractTableRows(html).stream()
                .filter(row -> row.stream().anyMatch(cell -> TextUtils.containsIgnoreCase(cell, regionName)))
                .findFirst();
        if (regionRow.isEmpty()) {
            return AlertBulletin.noWarnings();
        }

        // First cell labels the row; the rest are per-day notices.
        List<String> row = regionRow.get();
        LinkedHashSet<String> notices = new LinkedHashSet<>();
        for (String cell : row.subList(1, row.size())) {
            String notice = HtmlUtils.collapseWhitespace(cell);
            if (!notice.isEmpty() && !NOT_A_NOTICE.matcher(notice).find()) {
                notices.add(notice);
            }
        }
        if (notices.isEmpty()) {
            return AlertBulletin.noWarnings();
        }
        return new AlertBulletin(notices.iterator().next(), List.copyOf(notices));
    }
}
