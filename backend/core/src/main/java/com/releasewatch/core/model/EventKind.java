package com.releasewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EventKind {
    NEW_REPO,
    NEW_COMMIT,
    NEW_RELEASE,
    NEW_MODEL,
    MODEL_UPDATE,
    NEW_PAPER,
    NEWS_ARTICLE,
    LEADERBOARD_NEW_ENTRY,
    LEADERBOARD_RANK_CHANGE,
    LEADERBOARD_TOP3_CHANGE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isLeaderboard() {
        return this == LEADERBOARD_NEW_ENTRY || this == LEADERBOARD_RANK_CHANGE || this == LEADERBOARD_TOP3_CHANGE;
    }

    @JsonCreator
    public static EventKind fromKey(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + value));
    }

    public static Optional<EventKind> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String lowered = value.trim().toLowerCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind.key().equals(lowered)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Event kind for a newly seen item of the given category.
     */
    public static EventKind forNewItem(ItemCategory category) {
        return switch (category) {
            case REPOSITORY -> NEW_REPO;
            case COMMIT -> NEW_COMMIT;
            case RELEASE -> NEW_RELEASE;
            case MODEL -> NEW_MODEL;
            case PAPER -> NEW_PAPER;
            case ARTICLE -> NEWS_ARTICLE;
        };
    }
}
