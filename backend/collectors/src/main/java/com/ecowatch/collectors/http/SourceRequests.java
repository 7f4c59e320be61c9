package com.ecowatch.collectors.http;

import com.ecowatch.collectors.api.DataShapeException;
import com.ecowatch.collectors.api.SourceTimeoutException;
import com.ecowatch.collectors.api.UpstreamException;
import com.ecowatch.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single-attempt GET plumbing shared by the sources. Every failure leaves here as a
 * {@link com.ecowatch.collectors.api.SourceException} subtype labelled with the source.
 */
public final class SourceRequests {
    private SourceRequests() {
    }

    public static HttpRequest get(URI uri, Duration timeout, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout);
        headers.forEach(builder::header);
        return builder.build();
    }

    public static URI withQuery(String endpoint, Map<String, String> params) {
        String query = params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        String separator = endpoint.contains("?") ? "&" : "?";
        return URI.create(endpoint + separator + query);
    }

    public static String fetchBody(HttpClient httpClient, HttpRequest request, String label) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new UpstreamException(
                        label + " request failed with status " + response.statusCode(),
                        response.statusCode()
                );
            }
            return response.body() == null ? "" : response.body();
        } catch (HttpTimeoutException e) {
            throw new SourceTimeoutException(label + " request timed out", e);
        } catch (IOException e) {
            throw new UpstreamException(label + " request failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(label + " request was interrupted", e);
        }
    }

    public static JsonNode readJson(String body, String label) {
        try {
            JsonNode root = JsonUtils.objectMapper().readTree(body);
            if (root == null || root.isMissingNode()) {
                throw new DataShapeException(label + " returned an empty body");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DataShapeException(label + " returned malformed JSON", e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
