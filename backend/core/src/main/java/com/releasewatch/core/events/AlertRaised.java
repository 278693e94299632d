package com.releasewatch.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String FETCH = "fetch";
    public static final String PERSISTENCE = "persistence";
    public static final String DELIVERY = "delivery";
    public static final String OUTBOX = "outbox";
    public static final String PAIR = "pair";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
