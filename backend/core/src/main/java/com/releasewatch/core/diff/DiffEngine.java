package com.releasewatch.core.diff;

import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.ReleaseStage;
import com.releasewatch.core.model.SeenItem;
import com.releasewatch.core.model.StatePayload;
import com.releasewatch.core.model.StateRecord;
import com.releasewatch.core.model.WatchEvent;
import com.releasewatch.core.model.WatchTarget;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compares a fresh item snapshot with the stored state of one target and reports every item
 * identifier not seen before. Pure: the caller decides when the returned state is persisted.
 */
public final class DiffEngine {
    public static final int DEFAULT_RETENTION = 200;

    private static final Comparator<Item> CHRONOLOGICAL = Comparator.comparing(Item::timestamp);

    private final FirstObservationPolicy firstObservation;
    private final ReleaseStageClassifier stageClassifier;
    private final int retention;

    public DiffEngine() {
        this(FirstObservationPolicy.suppressAll(), new ReleaseStageClassifier(), DEFAULT_RETENTION);
    }

    public DiffEngine(FirstObservationPolicy firstObservation, ReleaseStageClassifier stageClassifier, int retention) {
        this.firstObservation = Objects.requireNonNull(firstObservation, "firstObservation is required");
        this.stageClassifier = Objects.requireNonNull(stageClassifier, "stageClassifier is required");
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
    }

    public DiffResult diff(WatchTarget target, Optional<StateRecord> previous, ItemSnapshot snapshot, Instant now) {
        if (snapshot.kind() != target.kind()) {
            throw new IllegalArgumentException("Snapshot kind " + snapshot.kind() + " does not match target " + target.entityKey());
        }
        List<Item> items = chronological(snapshot.items());
        List<WatchEvent> events = new ArrayList<>();

        if (previous.isEmpty()) {
            Set<EventKind> notable = firstObservation.notableOnFirstObservation(target.kind());
            for (Item item : items) {
                EventKind kind = EventKind.forNewItem(item.category());
                if (notable.contains(kind)) {
                    events.add(newItemEvent(target, kind, item, now));
                }
            }
            return new DiffResult(events, nextRecord(target, null, items, events, now));
        }

        Map<String, SeenItem> known = new HashMap<>();
        for (SeenItem seen : previous.get().payload().items()) {
            known.putIfAbsent(seen.id(), seen);
        }
        for (Item item : items) {
            SeenItem seen = known.get(item.id());
            if (seen == null) {
                events.add(newItemEvent(target, EventKind.forNewItem(item.category()), item, now));
            } else if (item.category() == ItemCategory.MODEL && !Objects.equals(seen.fingerprint(), item.fingerprint())) {
                events.add(modelUpdateEvent(target, item, seen, now));
            }
        }
        return new DiffResult(events, nextRecord(target, previous.get(), items, events, now));
    }

    private WatchEvent newItemEvent(WatchTarget target, EventKind kind, Item item, Instant now) {
        return new WatchEvent(
                WatchEvent.newId(target.entityKey(), kind, item, now),
                kind,
                target.entityKey(),
                target.entityName(),
                target.kind(),
                item,
                now,
                stageClassifier.classify(item),
                item.metadata()
        );
    }

    private WatchEvent modelUpdateEvent(WatchTarget target, Item item, SeenItem seen, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>(item.metadata());
        details.put("previousFingerprint", seen.fingerprint());
        details.put("currentFingerprint", item.fingerprint());
        return new WatchEvent(
                WatchEvent.newId(target.entityKey(), EventKind.MODEL_UPDATE, item, now),
                EventKind.MODEL_UPDATE,
                target.entityKey(),
                target.entityName(),
                target.kind(),
                item,
                now,
                ReleaseStage.UPDATED,
                details
        );
    }

    private StateRecord nextRecord(
            WatchTarget target,
            StateRecord previous,
            List<Item> items,
            List<WatchEvent> events,
            Instant now
    ) {
        boolean changed = !events.isEmpty();
        String fingerprint;
        Instant lastChangedAt;
        if (previous == null) {
            fingerprint = latestFingerprint(items);
            lastChangedAt = changed ? now : null;
        } else if (changed) {
            fingerprint = latestFingerprint(items);
            lastChangedAt = now;
        } else {
            fingerprint = previous.fingerprint();
            lastChangedAt = previous.lastChangedAt();
        }
        List<SeenItem> payload = mergeSeen(items, previous == null ? List.of() : previous.payload().items());
        return new StateRecord(
                target.entityKey(),
                target.kind(),
                fingerprint,
                StatePayload.ofItems(payload),
                now,
                lastChangedAt
        );
    }

    // Items in the current snapshot are always kept; older identifiers fill the remaining room,
    // newest first, so ids that scrolled out of the upstream window are still deduplicated.
    private List<SeenItem> mergeSeen(List<Item> items, List<SeenItem> previous) {
        Map<String, SeenItem> merged = new LinkedHashMap<>();
        for (int i = items.size() - 1; i >= 0; i--) {
            Item item = items.get(i);
            merged.putIfAbsent(item.id(), new SeenItem(item.id(), item.fingerprint(), item.timestamp()));
        }
        List<SeenItem> older = previous.stream()
                .filter(seen -> !merged.containsKey(seen.id()))
                .sorted(Comparator.comparing(SeenItem::timestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .toList();
        int room = Math.max(0, retention - merged.size());
        for (SeenItem seen : older) {
            if (room-- <= 0) {
                break;
            }
            merged.putIfAbsent(seen.id(), seen);
        }
        return List.copyOf(merged.values());
    }

    private static String latestFingerprint(List<Item> items) {
        return items.isEmpty() ? null : items.get(items.size() - 1).fingerprint();
    }

    private static List<Item> chronological(List<Item> items) {
        Map<String, Item> unique = new LinkedHashMap<>();
        for (Item item : items) {
            unique.putIfAbsent(item.id(), item);
        }
        List<Item> sorted = new ArrayList<>(unique.values());
        sorted.sort(CHRONOLOGICAL);
        return sorted;
    }
}
