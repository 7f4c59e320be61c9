package com.ecowatch.service.http;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

public final class HttpClientFactory {
    public static final String PROXY_ENV = "ECOWATCH_PROXY";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        proxyFromEnvironment(environment).ifPresent(builder::proxy);
        return builder.build();
    }

    /**
     * Proxy from {@code ECOWATCH_PROXY=host:port}; none when the variable is unset or blank.
     */
    static Optional<ProxySelector> proxyFromEnvironment(Map<String, String> environment) {
        String raw = environment.get(PROXY_ENV);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalStateException(PROXY_ENV + " must be host:port, got " + value);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(PROXY_ENV + " has a non-numeric port: " + value, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalStateException(PROXY_ENV + " port out of range: " + port);
        }
        return Optional.of(ProxySelector.of(InetSocketAddress.createUnresolved(value.substring(0, colon), port)));
    }
}
