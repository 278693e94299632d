package com.releasewatch.core.events;

import java.time.Instant;

public record SweepCompleted(
        Instant timestamp,
        int attempted,
        int succeeded,
        int failed,
        int eventsDetected,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SweepCompleted";
    }
}
