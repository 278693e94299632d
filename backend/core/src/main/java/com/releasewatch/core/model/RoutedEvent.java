package com.releasewatch.core.model;

import java.util.Objects;

public record RoutedEvent(WatchEvent event, String channel, boolean mentionChannel) {
    public RoutedEvent {
        Objects.requireNonNull(event, "event is required");
        Objects.requireNonNull(channel, "channel is required");
    }
}
