package com.releasewatch.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.releasewatch.watchers.leaderboard.LeaderboardWatcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param boards board name to enabled flag; boards not listed stay enabled
 */
public record LeaderboardsConfig(
        Boolean enabled,
        @JsonProperty("max_rank") Integer maxRank,
        Map<String, Boolean> boards
) {
    public static final int DEFAULT_MAX_RANK = 30;

    public LeaderboardsConfig {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        maxRank = maxRank == null ? DEFAULT_MAX_RANK : maxRank;
        boards = boards == null ? Map.of() : new LinkedHashMap<>(boards);
    }

    public static LeaderboardsConfig defaults() {
        return new LeaderboardsConfig(null, null, null);
    }

    public List<String> enabledBoards() {
        if (!enabled) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String board : LeaderboardWatcher.BOARDS) {
            if (!Boolean.FALSE.equals(boards.get(board))) {
                result.add(board);
            }
        }
        return result;
    }
}
