package com.gaia3d.globe.tile.source;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches tiles relative to a base URL.
 */
@Slf4j
public class HttpTileSource implements TileSource {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    @Getter
    private final URI baseUri;
    @Getter
    private final TileNameTemplate nameTemplate;
    private final HttpClient httpClient;

    public HttpTileSource(URI baseUri, TileNameTemplate nameTemplate) {
        this(baseUri, nameTemplate, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpTileSource(URI baseUri, TileNameTemplate nameTemplate, HttpClient httpClient) {
        String base = baseUri.toString();
        this.baseUri = base.endsWith("/") ? baseUri : URI.create(base + "/");
        this.nameTemplate = nameTemplate;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<byte[]> fetchResource(String resourceName) {
        URI uri = baseUri.resolve(resourceName);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/geo+json, application/json")
                .GET()
                .build();

        CompletableFuture<byte[]> result = new CompletableFuture<>();
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()).whenComplete((response, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(new TileFetchException("Request failed: " + uri, throwable));
            } else if (response.statusCode() < 200 || response.statusCode() >= 300) {
                result.completeExceptionally(new TileFetchException("HTTP " + response.statusCode() + ": " + uri));
            } else {
                log.debug("[Tile][HTTP] {} ({} bytes)", uri, response.body().length);
                result.complete(response.body());
            }
        });
        return result;
    }
}
