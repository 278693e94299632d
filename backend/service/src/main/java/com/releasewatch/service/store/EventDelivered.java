package com.releasewatch.service.store;

import java.time.Instant;

public record EventDelivered(Instant timestamp, String eventId, String channel) implements OutboxEntry {
    @Override
    public String type() {
        return "EventDelivered";
    }
}
