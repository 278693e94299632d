package com.releasewatch.service.runtime;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.ChangeDetected;
import com.releasewatch.core.events.SweepCompleted;
import com.releasewatch.core.events.SweepStarted;
import com.releasewatch.core.model.EventKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SweepMonitorTest {
    private static final Instant NOW = Instant.parse("2026-03-03T12:00:00Z");

    @Test
    void summaryCountsChangesByKindAndAlertsByCategory() {
        EventBus bus = new EventBus();
        SweepMonitor monitor = new SweepMonitor(bus, 3);

        bus.publish(new SweepStarted(NOW, 3));
        bus.publish(new ChangeDetected(NOW, "e1", EventKind.NEW_RELEASE, "github:Qwen-Image", "v1.0"));
        bus.publish(new ChangeDetected(NOW, "e2", EventKind.NEW_RELEASE, "github:Qwen-Image", "v1.1"));
        bus.publish(new ChangeDetected(NOW, "e3", EventKind.NEW_PAPER, "arxiv:Qwen-Image", "paper"));
        bus.publish(new AlertRaised(NOW, AlertRaised.FETCH, "timeout", Map.of()));
        bus.publish(new SweepCompleted(NOW.plusSeconds(2), 3, 2, 1, 3, 2000));

        SweepMonitor.Health health = monitor.health();
        assertEquals(NOW.plusSeconds(2), health.lastCompletedAt());
        assertTrue(health.healthy());
        assertEquals(
                "Sweep finished in 2000 ms: 2/3 pairs ok, 3 new event(s) {new_paper=1, new_release=2}, alerts {fetch=1}",
                health.lastSummary()
        );
    }

    @Test
    void countsResetAtTheStartOfEachSweep() {
        EventBus bus = new EventBus();
        SweepMonitor monitor = new SweepMonitor(bus, 3);

        bus.publish(new SweepStarted(NOW, 1));
        bus.publish(new AlertRaised(NOW, AlertRaised.DELIVERY, "HTTP 500", Map.of()));
        bus.publish(new SweepCompleted(NOW, 1, 1, 0, 0, 10));
        bus.publish(new SweepStarted(NOW.plusSeconds(60), 1));
        bus.publish(new SweepCompleted(NOW.plusSeconds(61), 1, 1, 0, 0, 10));

        assertEquals("Sweep finished in 10 ms: 1/1 pairs ok, 0 new event(s)", monitor.health().lastSummary());
    }

    @Test
    void consecutiveFailedSweepsAccumulateUntilOneSucceeds() {
        EventBus bus = new EventBus();
        SweepMonitor monitor = new SweepMonitor(bus, 2);
        assertNull(monitor.health().lastCompletedAt());

        for (int i = 0; i < 3; i++) {
            bus.publish(new SweepStarted(NOW, 2));
            bus.publish(new SweepCompleted(NOW, 2, 0, 2, 0, 5));
        }
        assertEquals(3, monitor.health().consecutiveFailedSweeps());
        assertFalse(monitor.health().healthy());

        bus.publish(new SweepStarted(NOW, 2));
        bus.publish(new SweepCompleted(NOW, 2, 1, 1, 0, 5));
        assertEquals(0, monitor.health().consecutiveFailedSweeps());
    }

    @Test
    void emptySweepDoesNotCountAsFailure() {
        EventBus bus = new EventBus();
        SweepMonitor monitor = new SweepMonitor(bus, 1);

        bus.publish(new SweepCompleted(NOW, 0, 0, 0, 0, 1));

        assertTrue(monitor.health().healthy());
    }

    @Test
    void closeDetachesFromTheBus() {
        EventBus bus = new EventBus();
        SweepMonitor monitor = new SweepMonitor(bus, 1);
        assertEquals(4, bus.subscriberCount());

        monitor.close();
        bus.publish(new SweepCompleted(NOW, 1, 0, 1, 0, 1));

        assertEquals(0, bus.subscriberCount());
        assertEquals(SweepMonitor.Health.INITIAL, monitor.health());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new SweepMonitor(new EventBus(), 0));
    }
}
