package com.releasewatch.watchers.feed;

import java.time.Instant;
import java.util.List;

public record FeedEntry(
        String id,
        String title,
        String link,
        String summary,
        Instant publishedAt,
        String sourceName,
        List<String> authors,
        List<String> categories
) {
    public FeedEntry {
        id = id == null ? "" : id;
        title = title == null ? "(untitled)" : title;
        link = link == null ? "" : link;
        summary = summary == null ? "" : summary;
        publishedAt = publishedAt == null ? Instant.EPOCH : publishedAt;
        sourceName = sourceName == null ? "" : sourceName;
        authors = authors == null ? List.of() : List.copyOf(authors);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
