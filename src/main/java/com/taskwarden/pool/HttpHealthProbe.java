package com.taskwarden.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Plain {@code GET} against the worker's base URL. Any status in {@code [200, 500)}
 * counts as ready; the body is ignored.
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpHealthProbe(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout);
    }

    HttpHealthProbe(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public boolean isReady(String baseUrl) {
        var request = HttpRequest.newBuilder(URI.create(baseUrl))
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return isReadyStatus(response.statusCode());
        } catch (IOException e) {
            log.trace("Readiness probe to {} failed: {}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static boolean isReadyStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 500;
    }
}
