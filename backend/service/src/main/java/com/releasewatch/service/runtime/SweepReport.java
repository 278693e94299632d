package com.releasewatch.service.runtime;

import java.time.Instant;

public record SweepReport(
        Instant startedAt,
        int attempted,
        int succeeded,
        int failed,
        int eventsDetected,
        long durationMillis
) {
}
