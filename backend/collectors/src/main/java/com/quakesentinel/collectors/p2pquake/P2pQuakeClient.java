package com.quakesentinel.collectors.p2pquake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.quakesentinel.collectors.api.FeedSource;
import com.quakesentinel.collectors.config.FeedSettings;
import com.quakesentinel.core.model.FeedType;
import com.quakesentinel.core.model.RawEventRecord;
import com.quakesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

public class P2pQuakeClient implements FeedSource {
    private final HttpClient httpClient;
    private final FeedSettings settings;
    private final P2pQuakeParser parser;

    public P2pQuakeClient(HttpClient httpClient, FeedSettings settings) {
        this(httpClient, settings, new P2pQuakeParser());
    }

    public P2pQuakeClient(HttpClient httpClient, FeedSettings settings, P2pQuakeParser parser) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.parser = Objects.requireNonNull(parser, "parser is required");
    }

    public static HttpClient newHttpClient(FeedSettings settings) {
        return HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public Optional<RawEventRecord> fetchLatest(FeedType feedType) {
        return parser.parseLatest(feedType, getJson(historyUri(feedType)));
    }

    public URI historyUri(FeedType feedType) {
        String separator = settings.baseUrl().contains("?") ? "&" : "?";
        return URI.create(settings.baseUrl() + separator
                + "codes=" + settings.codeFor(feedType)
                + "&limit=" + settings.historyLimit());
    }

    private JsonNode getJson(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json")
                .header("Cache-Control", "no-store")
                .header("User-Agent", settings.userAgent())
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException("P2PQuake request failed for " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("P2PQuake request interrupted for " + uri, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IllegalStateException("P2PQuake request failed with status " + response.statusCode() + " for " + uri);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!contentType.toLowerCase(Locale.ROOT).contains("json")) {
            throw new FeedFormatException("Unexpected content type '" + contentType + "' from " + uri);
        }
        try {
            return JsonUtils.objectMapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new FeedFormatException("Malformed JSON from " + uri, e);
        }
    }
}
