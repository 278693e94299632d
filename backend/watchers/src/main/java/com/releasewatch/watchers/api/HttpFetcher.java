package com.releasewatch.watchers.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.releasewatch.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Blocking GET with one retry on 5xx. Callers run on the sweep's worker pool.
 */
public final class HttpFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpFetcher.class.getName());
    private static final String USER_AGENT = "release-watch/0.1";

    private HttpFetcher() {
    }

    public static String getText(WatchContext ctx, URI uri, Map<String, String> headers) throws FetchException {
        return get(ctx, uri, headers, false).orElseThrow();
    }

    /**
     * Empty when upstream answers 404, the usual signal that a repository or model is not public yet.
     */
    public static Optional<JsonNode> getJsonIfPresent(WatchContext ctx, URI uri, Map<String, String> headers) throws FetchException {
        Optional<String> body = get(ctx, uri, headers, true);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(readTree(body.get(), uri));
    }

    public static JsonNode getJson(WatchContext ctx, URI uri, Map<String, String> headers) throws FetchException {
        return readTree(get(ctx, uri, headers, false).orElseThrow(), uri);
    }

    private static Optional<String> get(WatchContext ctx, URI uri, Map<String, String> headers, boolean notFoundIsEmpty)
            throws FetchException {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(ctx.requestTimeout())
                    .header("User-Agent", USER_AGENT);
            headers.forEach(builder::header);
            HttpResponse<String> response;
            try {
                response = ctx.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new FetchException("Request failed for " + uri + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException("Interrupted while fetching " + uri, e);
            }
            int status = response.statusCode();
            if (status / 100 == 2) {
                return Optional.of(response.body());
            }
            if (status == 404 && notFoundIsEmpty) {
                return Optional.empty();
            }
            if (attempts >= 2 || status < 500) {
                throw new FetchException("Request failed with status " + status + " for " + uri, status, null);
            }
            LOGGER.fine(() -> "Retrying " + uri + " after status " + status);
        }
    }

    private static JsonNode readTree(String body, URI uri) throws FetchException {
        try {
            return JsonUtils.objectMapper().readTree(body);
        } catch (IOException e) {
            throw new FetchException("Malformed JSON from " + uri, e);
        }
    }
}
