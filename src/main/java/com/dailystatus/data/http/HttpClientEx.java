package com.dailystatus.data.http;

import com.dailystatus.core.TransportFailureException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only GET requests and file downloads. Non-2xx responses and network errors surface as
 * {@link TransportFailureException}. Tests subclass it and override getText/download.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "ci-daily-status/1.0";
    private static final int MAX_REDIRECTS = 5;

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public String getText(String url, int timeoutSeconds, Map<String, String> headers) {
        HttpResponse<String> resp = send(url, timeoutSeconds, headers, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new TransportFailureException(url, resp.statusCode());
    }

    /**
     * Streams the response body into {@code target}. Redirects are followed by hand so that
     * the request headers (credentials included) only reach the original host.
     */
    public Path download(String url, int timeoutSeconds, Map<String, String> headers, Path target) {
        String current = url;
        Map<String, String> currentHeaders = headers;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            HttpResponse<Path> resp = send(current, timeoutSeconds, currentHeaders, toFileOn2xx(target));
            int status = resp.statusCode();
            if (status >= 200 && status < 300) {
                return resp.body();
            }
            Optional<String> location = resp.headers().firstValue("Location");
            if (status / 100 == 3 && location.isPresent()) {
                current = URI.create(current).resolve(location.get()).toString();
                currentHeaders = Map.of();
                continue;
            }
            throw new TransportFailureException(current, status);
        }
        throw new TransportFailureException(url, "too many redirects", null);
    }

    /**
     * Only a 2xx body reaches the file, and it replaces whatever the file held before.
     */
    private static HttpResponse.BodyHandler<Path> toFileOn2xx(Path target) {
        return info -> info.statusCode() / 100 == 2
                ? HttpResponse.BodySubscribers.ofFile(
                        target,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING)
                : HttpResponse.BodySubscribers.<Path>replacing(null);
    }

    private <T> HttpResponse<T> send(
            String url,
            int timeoutSeconds,
            Map<String, String> headers,
            HttpResponse.BodyHandler<T> handler
    ) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                    .GET()
                    .header("User-Agent", USER_AGENT);
        } catch (IllegalArgumentException e) {
            throw new TransportFailureException(url, "invalid url", e);
        }
        if (headers != null) {
            headers.forEach(builder::header);
        }
        try {
            return client.send(builder.build(), handler);
        } catch (IOException e) {
            throw new TransportFailureException(url, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportFailureException(url, "request interrupted", e);
        }
    }
}
