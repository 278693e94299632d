package com.releasewatch.service.notify;

import com.releasewatch.core.model.RoutedEvent;
import com.releasewatch.core.model.WatchEvent;

import java.util.Map;

public final class MessageFormatter {
    static final String CHANNEL_MENTION = "<!channel> ";

    private MessageFormatter() {
    }

    public static String format(RoutedEvent routed) {
        WatchEvent event = routed.event();
        StringBuilder text = new StringBuilder();
        if (routed.mentionChannel()) {
            text.append(CHANNEL_MENTION);
        }
        text.append('[').append(event.kind().key()).append("] ")
                .append(event.entityName())
                .append(": ")
                .append(event.item().title().isBlank() ? event.item().id() : event.item().title());
        String summary = summary(event);
        if (!summary.isEmpty()) {
            text.append("\n").append(summary);
        }
        if (!event.item().url().isBlank()) {
            text.append("\n").append(event.item().url());
        }
        return text.toString();
    }

    private static String summary(WatchEvent event) {
        Map<String, Object> details = event.details();
        switch (event.kind()) {
            case LEADERBOARD_NEW_ENTRY:
                return "Entered " + details.get("board") + " at #" + details.get("rank");
            case LEADERBOARD_RANK_CHANGE:
                return "Moved " + details.get("direction") + " on " + details.get("board")
                        + ": #" + details.get("previousRank") + " -> #" + details.get("currentRank");
            case LEADERBOARD_TOP3_CHANGE:
                return "Top 3 now " + details.get("currentTop3") + " (was " + details.get("previousTop3") + ")";
            case MODEL_UPDATE:
                return "Fingerprint " + details.get("previousFingerprint") + " -> " + details.get("currentFingerprint");
            default:
                return event.releaseStage().alias().map(alias -> "Stage: " + alias).orElse("");
        }
    }
}
