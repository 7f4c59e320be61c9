package com.ecowatch.collectors.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP server that answers fixed bodies per path and records what it was asked.
 */
public final class StubHttpServer implements AutoCloseable {
    private final HttpServer server;
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    public StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
    }

    public StubHttpServer respond(String path, int status, String contentType, String body) {
        server.createContext(path, exchange -> {
            requests.add(new RecordedRequest(
                    exchange.getRequestURI(),
                    exchange.getRequestHeaders().getFirst("User-Agent")
            ));
            write(exchange, status, contentType, body);
        });
        return this;
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private static void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    public record RecordedRequest(URI uri, String userAgent) {
        public String query() {
            return uri.getRawQuery() == null ? "" : uri.getRawQuery();
        }
    }
}
