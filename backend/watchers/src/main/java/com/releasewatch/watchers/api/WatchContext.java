package com.releasewatch.watchers.api;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record WatchContext(
        HttpClient httpClient,
        Clock clock,
        Duration requestTimeout,
        Map<String, String> tokens
) {
    public static final String GITHUB_TOKEN = "GITHUB_TOKEN";
    public static final String HF_TOKEN = "HF_TOKEN";
    public static final String ARTIFICIAL_ANALYSIS_API_KEY = "ARTIFICIAL_ANALYSIS_API_KEY";

    public WatchContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        tokens = tokens == null ? Map.of() : Map.copyOf(tokens);
    }

    public Optional<String> token(String name) {
        String value = tokens.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
