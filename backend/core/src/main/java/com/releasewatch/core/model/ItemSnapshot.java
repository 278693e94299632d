package com.releasewatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record ItemSnapshot(SourceKind kind, List<Item> items, Instant fetchedAt) implements Snapshot {
    public ItemSnapshot {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == SourceKind.LEADERBOARD) {
            throw new IllegalArgumentException("leaderboard data must use LeaderboardSnapshot");
        }
        items = items == null ? List.of() : List.copyOf(items);
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
    }
}
