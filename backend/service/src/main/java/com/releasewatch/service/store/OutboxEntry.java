package com.releasewatch.service.store;

import java.time.Instant;

/**
 * One line of the delivery outbox.
 */
public interface OutboxEntry {
    Instant timestamp();

    String type();

    String eventId();
}
