package com.releasewatch.core.bus;

import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.Event;
import com.releasewatch.core.events.SweepStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(SweepStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(SweepStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new SweepStarted(NOW, 4));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesByTypeAndEventSubscribersSeeEverything() {
        EventBus bus = new EventBus();
        AtomicInteger sweepHits = new AtomicInteger();
        AtomicInteger alertHits = new AtomicInteger();
        List<Event> all = new ArrayList<>();

        bus.subscribe(SweepStarted.class, event -> sweepHits.incrementAndGet());
        bus.subscribe(AlertRaised.class, event -> alertHits.incrementAndGet());
        bus.subscribe(Event.class, all::add);

        bus.publish(new SweepStarted(NOW, 2));
        bus.publish(new AlertRaised(NOW.plusSeconds(1), AlertRaised.FETCH, "timeout", Map.of()));

        assertEquals(1, sweepHits.get());
        assertEquals(1, alertHits.get());
        assertEquals(List.of("SweepStarted", "AlertRaised"), all.stream().map(Event::type).toList());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(SweepStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(SweepStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new SweepStarted(NOW, 1));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void cancelledSubscriptionStopsReceiving() {
        EventBus bus = new EventBus();
        AtomicInteger hits = new AtomicInteger();
        EventBus.Subscription subscription = bus.subscribe(SweepStarted.class, event -> hits.incrementAndGet());

        bus.publish(new SweepStarted(NOW, 1));
        subscription.cancel();
        bus.publish(new SweepStarted(NOW, 1));

        assertEquals(1, hits.get());
        assertEquals(0, bus.subscriberCount());
    }
}
