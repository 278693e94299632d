package com.releasewatch.service.runtime;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.ChangeDetected;
import com.releasewatch.core.events.SweepCompleted;
import com.releasewatch.core.events.SweepStarted;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Turns the operational events of a sweep into one summary line and a health signal. A sweep in
 * which every attempted pair failed counts as unhealthy; after {@code unhealthyThreshold} of them
 * in a row the monitor logs a warning on every further failing sweep.
 */
public class SweepMonitor implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SweepMonitor.class.getName());

    private final int unhealthyThreshold;
    private final List<EventBus.Subscription> subscriptions;
    private final AtomicReference<Health> health = new AtomicReference<>(Health.INITIAL);
    private final Object lock = new Object();
    private Map<String, Integer> changesByKind = new TreeMap<>();
    private Map<String, Integer> alertsByCategory = new TreeMap<>();

    public SweepMonitor(EventBus eventBus, int unhealthyThreshold) {
        if (unhealthyThreshold < 1) {
            throw new IllegalArgumentException("unhealthyThreshold must be positive");
        }
        this.unhealthyThreshold = unhealthyThreshold;
        this.subscriptions = List.of(
                eventBus.subscribe(SweepStarted.class, this::onStarted),
                eventBus.subscribe(ChangeDetected.class, this::onChange),
                eventBus.subscribe(AlertRaised.class, this::onAlert),
                eventBus.subscribe(SweepCompleted.class, this::onCompleted)
        );
    }

    public Health health() {
        return health.get();
    }

    @Override
    public void close() {
        subscriptions.forEach(EventBus.Subscription::cancel);
    }

    private void onStarted(SweepStarted event) {
        synchronized (lock) {
            changesByKind = new TreeMap<>();
            alertsByCategory = new TreeMap<>();
        }
        LOGGER.info(() -> "Sweep started over " + event.targets() + " target(s)");
    }

    private void onChange(ChangeDetected event) {
        synchronized (lock) {
            changesByKind.merge(event.kind().key(), 1, Integer::sum);
        }
    }

    private void onAlert(AlertRaised alert) {
        synchronized (lock) {
            alertsByCategory.merge(alert.category(), 1, Integer::sum);
        }
    }

    private void onCompleted(SweepCompleted event) {
        String summary = currentSummary(event);
        boolean unhealthy = event.attempted() > 0 && event.failed() == event.attempted();
        Health next = health.updateAndGet(previous -> new Health(
                event.timestamp(),
                unhealthy ? previous.consecutiveFailedSweeps() + 1 : 0,
                summary
        ));
        LOGGER.info(summary);
        if (next.consecutiveFailedSweeps() >= unhealthyThreshold) {
            LOGGER.warning(() -> "Every pair failed in the last " + next.consecutiveFailedSweeps()
                    + " sweeps; check network access and tokens");
        }
    }

    private String currentSummary(SweepCompleted event) {
        synchronized (lock) {
            return summarize(event, changesByKind, alertsByCategory);
        }
    }

    static String summarize(SweepCompleted event, Map<String, Integer> changes, Map<String, Integer> alerts) {
        StringBuilder text = new StringBuilder("Sweep finished in ")
                .append(event.durationMillis()).append(" ms: ")
                .append(event.succeeded()).append('/').append(event.attempted()).append(" pairs ok, ")
                .append(event.eventsDetected()).append(" new event(s)");
        if (!changes.isEmpty()) {
            text.append(' ').append(changes);
        }
        if (!alerts.isEmpty()) {
            text.append(", alerts ").append(alerts);
        }
        return text.toString();
    }

    /**
     * @param lastCompletedAt        end of the latest sweep, null before the first one
     * @param consecutiveFailedSweeps sweeps in a row in which no pair succeeded
     * @param lastSummary            summary line of the latest sweep
     */
    public record Health(Instant lastCompletedAt, int consecutiveFailedSweeps, String lastSummary) {
        static final Health INITIAL = new Health(null, 0, "");

        public boolean healthy() {
            return consecutiveFailedSweeps == 0;
        }
    }
}
