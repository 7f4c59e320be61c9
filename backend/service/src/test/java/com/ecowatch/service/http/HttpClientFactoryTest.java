package com.ecowatch.service.http;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void createsDirectClientWhenNoProxyConfigured() {
        HttpClient client = HttpClientFactory.create(Duration.ofMillis(200), Map.of());

        assertTrue(client.proxy().isEmpty());
        assertEquals(Optional.of(Duration.ofMillis(200)), client.connectTimeout());
        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
    }

    @Test
    void blankProxyIsIgnored() {
        assertTrue(HttpClientFactory.proxyFromEnvironment(Map.of(HttpClientFactory.PROXY_ENV, "  ")).isEmpty());
    }

    @Test
    void routesThroughConfiguredProxy() {
        HttpClient client = HttpClientFactory.create(
                Duration.ofMillis(200),
                Map.of(HttpClientFactory.PROXY_ENV, "proxy.internal:3128")
        );

        ProxySelector selector = client.proxy().orElseThrow();
        List<Proxy> proxies = selector.select(URI.create("https://api.openweathermap.org/data/2.5/weather"));
        InetSocketAddress address = (InetSocketAddress) proxies.get(0).address();
        assertEquals("proxy.internal", address.getHostString());
        assertEquals(3128, address.getPort());
    }

    @Test
    void rejectsProxyWithoutPort() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.proxyFromEnvironment(Map.of(HttpClientFactory.PROXY_ENV, "proxy.internal"))
        );
        assertTrue(ex.getMessage().contains("must be host:port"));
    }

    @Test
    void rejectsNonNumericPort() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.proxyFromEnvironment(Map.of(HttpClientFactory.PROXY_ENV, "proxy.internal:http"))
        );
        assertTrue(ex.getMessage().contains("non-numeric port"));
    }

    @Test
    void rejectsPortOutOfRange() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.proxyFromEnvironment(Map.of(HttpClientFactory.PROXY_ENV, "proxy.internal:70000"))
        );
        assertTrue(ex.getMessage().contains("port out of range"));
    }
}
