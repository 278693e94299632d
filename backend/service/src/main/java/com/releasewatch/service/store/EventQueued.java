package com.releasewatch.service.store;

import com.releasewatch.core.model.WatchEvent;

import java.time.Instant;

public record EventQueued(Instant timestamp, WatchEvent event) implements OutboxEntry {
    @Override
    public String type() {
        return "EventQueued";
    }

    @Override
    public String eventId() {
        return event.id();
    }
}
