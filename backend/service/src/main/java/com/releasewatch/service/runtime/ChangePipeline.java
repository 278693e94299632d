package com.releasewatch.service.runtime;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.diff.DiffEngine;
import com.releasewatch.core.diff.DiffResult;
import com.releasewatch.core.diff.LeaderboardDiffEngine;
import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.ChangeDetected;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.LeaderboardSnapshot;
import com.releasewatch.core.model.RoutedEvent;
import com.releasewatch.core.model.Snapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.StateRecord;
import com.releasewatch.core.model.WatchEvent;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.core.routing.EventRouter;
import com.releasewatch.core.state.PersistenceException;
import com.releasewatch.core.state.StateStore;
import com.releasewatch.service.notify.DeliveryException;
import com.releasewatch.service.notify.Notifier;
import com.releasewatch.service.store.JsonlOutbox;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one (entity, source) pair end to end: fetch, diff, queue the events in the outbox,
 * commit the new state, then deliver. A failed fetch leaves the store untouched; a failed commit
 * or delivery does not stop the remaining steps.
 */
public class ChangePipeline {
    private static final Logger LOGGER = Logger.getLogger(ChangePipeline.class.getName());

    private final Map<SourceKind, SourceWatcher> watchers;
    private final WatchContext context;
    private final StateStore store;
    private final JsonlOutbox outbox;
    private final DiffEngine diffEngine;
    private final LeaderboardDiffEngine leaderboardDiffEngine;
    private final int maxRank;
    private final EventRouter router;
    private final Notifier notifier;
    private final EventBus eventBus;

    public ChangePipeline(
            List<SourceWatcher> watchers,
            WatchContext context,
            StateStore store,
            JsonlOutbox outbox,
            DiffEngine diffEngine,
            LeaderboardDiffEngine leaderboardDiffEngine,
            int maxRank,
            EventRouter router,
            Notifier notifier,
            EventBus eventBus
    ) {
        Map<SourceKind, SourceWatcher> byKind = new EnumMap<>(SourceKind.class);
        for (SourceWatcher watcher : watchers) {
            byKind.put(watcher.kind(), watcher);
        }
        this.watchers = byKind;
        this.context = context;
        this.store = store;
        this.outbox = outbox;
        this.diffEngine = diffEngine;
        this.leaderboardDiffEngine = leaderboardDiffEngine;
        this.maxRank = maxRank;
        this.router = router;
        this.notifier = notifier;
        this.eventBus = eventBus;
    }

    public PairResult process(WatchTarget target) throws FetchException {
        SourceWatcher watcher = watchers.get(target.kind());
        if (watcher == null) {
            throw new IllegalStateException("No watcher registered for source " + target.kind().key());
        }
        Snapshot snapshot = watcher.fetch(target, context);
        Instant now = context.clock().instant();
        Optional<StateRecord> previous = store.get(target.entityKey());
        DiffResult result = diff(target, previous, snapshot, now);
        List<WatchEvent> events = result.events();

        boolean queued = queue(target, events);
        boolean committed = queued && commit(target, result.next());

        int delivered = 0;
        for (WatchEvent event : events) {
            eventBus.publish(new ChangeDetected(now, event.id(), event.kind(), event.entityKey(), event.item().title()));
            if (deliver(event, queued)) {
                delivered++;
            }
        }
        if (!events.isEmpty()) {
            LOGGER.info(() -> target.entityKey() + ": " + events.size() + " change(s) detected");
        }
        return new PairResult(target, events.size(), delivered, committed);
    }

    /**
     * Delivers events queued by an earlier sweep or run that never got a delivery record.
     *
     * @return the number of events delivered
     */
    public int redeliverPending() {
        List<WatchEvent> pending = outbox.pending();
        if (pending.isEmpty()) {
            return 0;
        }
        LOGGER.info(() -> "Redelivering " + pending.size() + " pending event(s)");
        int delivered = 0;
        for (WatchEvent event : pending) {
            if (deliver(event, true)) {
                delivered++;
            }
        }
        return delivered;
    }

    private DiffResult diff(WatchTarget target, Optional<StateRecord> previous, Snapshot snapshot, Instant now) {
        if (snapshot instanceof LeaderboardSnapshot board) {
            return leaderboardDiffEngine.diff(target, previous, board, maxRank, now);
        }
        if (snapshot instanceof ItemSnapshot items) {
            return diffEngine.diff(target, previous, items, now);
        }
        throw new IllegalStateException("Unsupported snapshot type " + snapshot.getClass().getSimpleName());
    }

    // State is only committed once the events it implies are durable in the outbox.
    private boolean queue(WatchTarget target, List<WatchEvent> events) {
        try {
            outbox.enqueue(events);
            return true;
        } catch (PersistenceException e) {
            LOGGER.log(Level.SEVERE, "Failed queueing events for " + target.entityKey(), e);
            alert(AlertRaised.OUTBOX, "Outbox write failed for " + target.entityKey() + ": " + e.getMessage(), target);
            return false;
        }
    }

    private boolean commit(WatchTarget target, StateRecord next) {
        try {
            store.put(next);
            return true;
        } catch (PersistenceException e) {
            LOGGER.log(Level.SEVERE, "Failed persisting state for " + target.entityKey(), e);
            alert(AlertRaised.PERSISTENCE, "State write failed for " + target.entityKey() + ": " + e.getMessage(), target);
            return false;
        }
    }

    private boolean deliver(WatchEvent event, boolean tracked) {
        RoutedEvent routed = router.route(event);
        try {
            notifier.deliver(routed);
        } catch (DeliveryException e) {
            LOGGER.warning(() -> "Delivery failed for event " + event.id() + " to " + routed.channel() + ": " + e.getMessage());
            eventBus.publish(new AlertRaised(
                    context.clock().instant(),
                    AlertRaised.DELIVERY,
                    "Delivery failed for event " + event.id() + ": " + e.getMessage(),
                    Map.of("eventId", event.id(), "channel", routed.channel())
            ));
            return false;
        }
        if (tracked) {
            try {
                outbox.markDelivered(event.id(), routed.channel());
            } catch (PersistenceException e) {
                LOGGER.log(Level.SEVERE, "Failed recording delivery of event " + event.id(), e);
                alert(AlertRaised.OUTBOX, "Outbox write failed for event " + event.id() + ": " + e.getMessage(), null);
            }
        }
        return true;
    }

    private void alert(String category, String message, WatchTarget target) {
        eventBus.publish(new AlertRaised(
                context.clock().instant(),
                category,
                message,
                target == null ? Map.of() : Map.of("entityKey", target.entityKey())
        ));
    }
}
