package com.ecowatch.collectors.alerts;

import com.ecowatch.collectors.api.UpstreamException;
import com.ecowatch.collectors.config.AggregatorConfig;
import com.ecowatch.collectors.support.FixtureUtils;
import com.ecowatch.collectors.support.StubHttpServer;
import com.ecowatch.core.model.AlertBulletin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WarningBulletinClientTest {
    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build();
    private StubHttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void collectsDistinctNoticesForRegionRow() throws Exception {
        server = new StubHttpServer()
                .respond("/warnings", 200, "text/html", FixtureUtils.fixture("fixtures/imd-warnings.html"));

        AlertBulletin bulletin = client().fetchAlerts();

        assertEquals(List.of("Heavy Rain at isolated places", "Thunderstorm & Lightning"), bulletin.notices());
        assertEquals("Heavy Rain at isolated places", bulletin.summaryLine());
        assertEquals("EcoWatch-Dashboard/1.0", server.requests().get(0).userAgent());
    }

    @Test
    void regionMatchIgnoresCase() {
        AlertBulletin bulletin = WarningBulletinClient.parseBulletin(
                FixtureUtils.fixture("fixtures/imd-warnings.html"),
                "himachal pradesh"
        );

        assertEquals(List.of("Heavy Snow"), bulletin.notices());
    }

    @Test
    void unknownRegionMeansNoWarnings() {
        AlertBulletin bulletin = WarningBulletinClient.parseBulletin(
                FixtureUtils.fixture("fixtures/imd-warnings.html"),
                "Kerala"
        );

        assertEquals(AlertBulletin.noWarnings(), bulletin);
    }

    @Test
    void rowOfPlaceholdersMeansNoWarnings() {
        String html = "<table><tr><td>Uttarakhand</td><td>NIL</td><td>n/a</td><td>No Warning</td><td> </td></tr></table>";

        AlertBulletin bulletin = WarningBulletinClient.parseBulletin(html, "Uttarakhand");

        assertEquals(AlertBulletin.NO_WARNINGS, bulletin.summaryLine());
        assertEquals(List.of(), bulletin.notices());
    }

    @Test
    void placeholderWordsInsideLongerWordsAreKept() {
        String html = "<table><tr><td>Uttarakhand</td><td>Snowfall in Nilang valley</td></tr></table>";

        AlertBulletin bulletin = WarningBulletinClient.parseBulletin(html, "Uttarakhand");

        assertEquals(List.of("Snowfall in Nilang valley"), bulletin.notices());
    }

    @Test
    void pageWithoutTableMeansNoWarnings() {
        assertEquals(AlertBulletin.noWarnings(), WarningBulletinClient.parseBulletin("<p>Maintenance</p>", "Uttarakhand"));
    }

    @Test
    void unavailableBulletinPageIsUpstreamError() throws Exception {
        server = new StubHttpServer().respond("/warnings", 503, "text/html", "<h1>Service Unavailable</h1>");

        UpstreamException error = assertThrows(UpstreamException.class, () -> client().fetchAlerts());

        assertEquals("IMD alert request failed with status 503", error.getMessage());
        assertEquals(503, error.statusCode().getAsInt());
    }

    private WarningBulletinClient client() {
        AggregatorConfig config = AggregatorConfig.defaults().withEndpoints(null, null, server.url("/warnings"), null);
        return new WarningBulletinClient(httpClient, config);
    }
}
