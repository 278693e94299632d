package com.releasewatch.core.diff;

import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.LeaderboardSnapshot;
import com.releasewatch.core.model.RankedEntry;
import com.releasewatch.core.model.ReleaseStage;
import com.releasewatch.core.model.StatePayload;
import com.releasewatch.core.model.StateRecord;
import com.releasewatch.core.model.WatchEvent;
import com.releasewatch.core.model.WatchTarget;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Diff over one ranked board. Events come out as entries, then rank changes, then at most one
 * top-3 change. Models leaving the tracked window are not reported.
 */
public final class LeaderboardDiffEngine {

    public DiffResult diff(
            WatchTarget target,
            Optional<StateRecord> previous,
            LeaderboardSnapshot snapshot,
            int maxRank,
            Instant now
    ) {
        if (maxRank < 1) {
            throw new IllegalArgumentException("maxRank must be positive");
        }
        List<RankedEntry> current = distinct(snapshot.truncate(maxRank).entries());
        List<String> currentTop = LeaderboardSnapshot.topOf(current);

        if (previous.isEmpty()) {
            return new DiffResult(List.of(), nextRecord(target, null, current, currentTop, false, now));
        }

        List<RankedEntry> before = previous.get().payload().ranking().stream()
                .filter(entry -> entry.rank() <= maxRank)
                .toList();
        Map<String, RankedEntry> previousById = new LinkedHashMap<>();
        for (RankedEntry entry : before) {
            previousById.putIfAbsent(entry.itemId(), entry);
        }

        List<WatchEvent> events = new ArrayList<>();
        for (RankedEntry entry : current) {
            if (!previousById.containsKey(entry.itemId())) {
                events.add(entryEvent(target, snapshot, entry, now));
            }
        }
        for (RankedEntry entry : current) {
            RankedEntry old = previousById.get(entry.itemId());
            if (old != null && old.rank() != entry.rank()) {
                events.add(rankChangeEvent(target, snapshot, old, entry, now));
            }
        }
        List<String> previousTop = LeaderboardSnapshot.topOf(before);
        if (!previousTop.isEmpty() && !new HashSet<>(previousTop).equals(new HashSet<>(currentTop))) {
            events.add(topThreeEvent(target, snapshot, previousTop, currentTop, now));
        }
        return new DiffResult(events, nextRecord(target, previous.get(), current, currentTop, !events.isEmpty(), now));
    }

    private WatchEvent entryEvent(WatchTarget target, LeaderboardSnapshot snapshot, RankedEntry entry, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("board", snapshot.board());
        details.put("rank", entry.rank());
        details.put("score", entry.score());
        details.put("creator", entry.creator());
        return event(target, EventKind.LEADERBOARD_NEW_ENTRY, entryItem(snapshot, entry), details, now);
    }

    private WatchEvent rankChangeEvent(
            WatchTarget target,
            LeaderboardSnapshot snapshot,
            RankedEntry old,
            RankedEntry entry,
            Instant now
    ) {
        int delta = old.rank() - entry.rank();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("board", snapshot.board());
        details.put("previousRank", old.rank());
        details.put("currentRank", entry.rank());
        details.put("delta", delta);
        details.put("direction", delta > 0 ? "up" : "down");
        details.put("previousScore", old.score());
        details.put("currentScore", entry.score());
        return event(target, EventKind.LEADERBOARD_RANK_CHANGE, entryItem(snapshot, entry), details, now);
    }

    private WatchEvent topThreeEvent(
            WatchTarget target,
            LeaderboardSnapshot snapshot,
            List<String> previousTop,
            List<String> currentTop,
            Instant now
    ) {
        Set<String> previousSet = new HashSet<>(previousTop);
        Set<String> currentSet = new HashSet<>(currentTop);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("board", snapshot.board());
        details.put("previousTop3", previousTop);
        details.put("currentTop3", currentTop);
        details.put("entered", currentTop.stream().filter(id -> !previousSet.contains(id)).toList());
        details.put("exited", previousTop.stream().filter(id -> !currentSet.contains(id)).toList());
        Item item = new Item(
                "top3:" + snapshot.board(),
                ItemCategory.MODEL,
                String.join(",", currentTop),
                "Top 3 changed on " + snapshot.board(),
                snapshot.url(),
                snapshot.fetchedAt(),
                Map.of()
        );
        return event(target, EventKind.LEADERBOARD_TOP3_CHANGE, item, details, now);
    }

    private static Item entryItem(LeaderboardSnapshot snapshot, RankedEntry entry) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("board", snapshot.board());
        metadata.put("rank", entry.rank());
        metadata.put("score", entry.score());
        metadata.put("creator", entry.creator());
        return new Item(
                entry.itemId(),
                ItemCategory.MODEL,
                "rank:" + entry.rank(),
                entry.itemId(),
                snapshot.url(),
                snapshot.fetchedAt(),
                metadata
        );
    }

    private static WatchEvent event(
            WatchTarget target,
            EventKind kind,
            Item item,
            Map<String, Object> details,
            Instant now
    ) {
        return new WatchEvent(
                WatchEvent.newId(target.entityKey(), kind, item, now),
                kind,
                target.entityKey(),
                target.entityName(),
                target.kind(),
                item,
                now,
                ReleaseStage.UNKNOWN,
                details
        );
    }

    private static StateRecord nextRecord(
            WatchTarget target,
            StateRecord previous,
            List<RankedEntry> ranking,
            List<String> top,
            boolean changed,
            Instant now
    ) {
        String fingerprint = String.join(",", top);
        Instant lastChangedAt = changed ? now : previous == null ? null : previous.lastChangedAt();
        if (!changed && previous != null) {
            fingerprint = previous.fingerprint();
        }
        return new StateRecord(
                target.entityKey(),
                target.kind(),
                fingerprint,
                StatePayload.ofRanking(ranking),
                now,
                lastChangedAt
        );
    }

    private static List<RankedEntry> distinct(List<RankedEntry> entries) {
        Map<String, RankedEntry> unique = new LinkedHashMap<>();
        for (RankedEntry entry : entries) {
            unique.putIfAbsent(entry.itemId(), entry);
        }
        return List.copyOf(unique.values());
    }
}
