package com.releasewatch.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ranked entries of one board in upstream order. Ties keep the upstream ordering.
 */
public record LeaderboardSnapshot(String board, String url, List<RankedEntry> entries, Instant fetchedAt) implements Snapshot {
    public static final int TOP_K = 3;

    public LeaderboardSnapshot {
        Objects.requireNonNull(board, "board is required");
        url = url == null ? "" : url;
        entries = entries == null ? List.of() : List.copyOf(entries);
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LEADERBOARD;
    }

    public LeaderboardSnapshot truncate(int maxRank) {
        List<RankedEntry> kept = entries.stream()
                .filter(entry -> entry.rank() <= maxRank)
                .toList();
        return new LeaderboardSnapshot(board, url, kept, fetchedAt);
    }

    public List<String> topThree() {
        return topOf(entries);
    }

    public static List<String> topOf(List<RankedEntry> ranking) {
        return ranking.stream()
                .filter(entry -> entry.rank() >= 1 && entry.rank() <= TOP_K)
                .limit(TOP_K)
                .map(RankedEntry::itemId)
                .toList();
    }
}
