package com.releasewatch.watchers.leaderboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.releasewatch.core.model.LeaderboardSnapshot;
import com.releasewatch.core.model.RankedEntry;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.HttpFetcher;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked media leaderboards from the Artificial Analysis data API. Entries keep upstream order.
 */
public class LeaderboardWatcher implements SourceWatcher {
    public static final String DEFAULT_API_BASE = "https://artificialanalysis.ai/api/v2/data/media";
    public static final List<String> BOARDS = List.of(
            "text-to-image",
            "image-editing",
            "text-to-video",
            "image-to-video",
            "text-to-speech"
    );

    private final String apiBase;

    public LeaderboardWatcher() {
        this(DEFAULT_API_BASE);
    }

    public LeaderboardWatcher(String apiBase) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LEADERBOARD;
    }

    @Override
    public LeaderboardSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        String board = target.sourceId();
        if (!BOARDS.contains(board)) {
            throw new FetchException("Unknown leaderboard: " + board);
        }
        String apiKey = ctx.token(WatchContext.ARTIFICIAL_ANALYSIS_API_KEY)
                .orElseThrow(() -> new FetchException(WatchContext.ARTIFICIAL_ANALYSIS_API_KEY + " is not set"));
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("x-api-key", apiKey);

        JsonNode body = HttpFetcher.getJson(ctx, URI.create(apiBase + "/" + board), headers);
        JsonNode data = body.path("data");
        if (!data.isArray()) {
            throw new FetchException("Leaderboard response for " + board + " has no data array");
        }
        List<RankedEntry> entries = new ArrayList<>();
        for (JsonNode model : data) {
            String name = model.path("name").asText("");
            int rank = model.path("rank").asInt(0);
            if (name.isBlank() || rank < 1) {
                continue;
            }
            entries.add(new RankedEntry(
                    name,
                    rank,
                    model.path("elo").asDouble(0),
                    model.path("model_creator").path("name").asText("Unknown")
            ));
        }
        return new LeaderboardSnapshot(board, pageUrl(board), entries, ctx.clock().instant());
    }

    static String pageUrl(String board) {
        return "https://artificialanalysis.ai/image/leaderboard/" + board;
    }
}
