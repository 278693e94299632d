package com.releasewatch.core.model;

import java.util.List;

/**
 * Last-seen data needed for the next diff: item identifiers for item sources, the full ranking
 * for leaderboard boards.
 */
public record StatePayload(List<SeenItem> items, List<RankedEntry> ranking) {
    public StatePayload {
        items = items == null ? List.of() : List.copyOf(items);
        ranking = ranking == null ? List.of() : List.copyOf(ranking);
    }

    public static StatePayload ofItems(List<SeenItem> items) {
        return new StatePayload(items, List.of());
    }

    public static StatePayload ofRanking(List<RankedEntry> ranking) {
        return new StatePayload(List.of(), ranking);
    }
}
