package com.releasewatch.core.events;

import com.releasewatch.core.model.EventKind;

import java.time.Instant;

public record ChangeDetected(Instant timestamp, String eventId, EventKind kind, String entityKey, String title) implements Event {
    @Override
    public String type() {
        return "ChangeDetected";
    }
}
