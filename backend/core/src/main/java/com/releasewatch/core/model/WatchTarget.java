package com.releasewatch.core.model;

import java.util.Objects;

/**
 * One (entity, source) pair polled once per sweep. Leaderboard boards are targets whose
 * entity name is the board name.
 */
public record WatchTarget(String entityName, SourceKind kind, String sourceId, PriorityTier priority) {
    public WatchTarget {
        Objects.requireNonNull(entityName, "entityName is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        priority = priority == null ? PriorityTier.NORMAL : priority;
    }

    public static WatchTarget board(String board) {
        return new WatchTarget(board, SourceKind.LEADERBOARD, board, PriorityTier.NORMAL);
    }

    public String entityKey() {
        return kind.key() + ":" + entityName;
    }
}
