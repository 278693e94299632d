package com.releasewatch.core.events;

import java.time.Instant;

public record SweepStarted(Instant timestamp, int targets) implements Event {
    @Override
    public String type() {
        return "SweepStarted";
    }
}
