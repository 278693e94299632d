package com.releasewatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.releasewatch.core.util.HashingUtils;
import com.releasewatch.core.util.MapUtils;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A detected change, produced once by a diff engine and never mutated afterwards.
 */
public record WatchEvent(
        String id,
        EventKind kind,
        String entityKey,
        String entityName,
        SourceKind source,
        Item item,
        Instant detectedAt,
        ReleaseStage releaseStage,
        Map<String, Object> details
) {
    public WatchEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
        releaseStage = releaseStage == null ? ReleaseStage.UNKNOWN : releaseStage;
        details = MapUtils.compact(details);
    }

    public static String newId(String entityKey, EventKind kind, Item item, Instant detectedAt) {
        return HashingUtils.shortId(entityKey, kind.key(), item.id(), item.fingerprint(), detectedAt.toString());
    }

    /**
     * The model this event is about. For board entries and rank moves that is the ranked model,
     * otherwise the watched entity.
     */
    @JsonIgnore
    public String subject() {
        if (kind == EventKind.LEADERBOARD_NEW_ENTRY || kind == EventKind.LEADERBOARD_RANK_CHANGE) {
            return item.title().isBlank() ? item.id() : item.title();
        }
        return entityName;
    }
}
