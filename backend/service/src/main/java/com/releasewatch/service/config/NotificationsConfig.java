package com.releasewatch.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record NotificationsConfig(
        @JsonProperty("mention_channel_for") List<String> mentionChannelFor,
        @JsonProperty("event_routing") Map<String, String> eventRouting
) {
    public static final List<String> DEFAULT_MENTION_FOR = List.of("new_release", "new_model", "release_launched");

    // Keys are matched exactly when routing, so they are stored trimmed and lower-cased.
    public NotificationsConfig {
        mentionChannelFor = mentionChannelFor == null
                ? DEFAULT_MENTION_FOR
                : mentionChannelFor.stream().map(NotificationsConfig::normalize).distinct().toList();
        Map<String, String> routing = new TreeMap<>();
        if (eventRouting != null) {
            new TreeMap<>(eventRouting).forEach((key, channel) -> routing.put(normalize(key), channel));
        }
        eventRouting = Map.copyOf(routing);
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }

    public static NotificationsConfig defaults() {
        return new NotificationsConfig(null, null);
    }
}
