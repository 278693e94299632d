package com.releasewatch.watchers.news;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.core.util.HashingUtils;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.HttpFetcher;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;
import com.releasewatch.watchers.feed.FeedEntry;
import com.releasewatch.watchers.feed.FeedParser;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Google News search results for the entity's keywords. Articles are identified by a hash of
 * their link since the feed carries no stable id.
 */
public class NewsWatcher implements SourceWatcher {
    public static final String DEFAULT_ENDPOINT = "https://news.google.com/rss/search";
    static final int MAX_ARTICLES = 15;

    private final String endpoint;

    public NewsWatcher() {
        this(DEFAULT_ENDPOINT);
    }

    public NewsWatcher(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.NEWS;
    }

    @Override
    public ItemSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        URI uri = URI.create(endpoint
                + "?q=" + URLEncoder.encode(target.sourceId(), StandardCharsets.UTF_8)
                + "&hl=en-US&gl=US&ceid=US:en");
        String xml = HttpFetcher.getText(ctx, uri, Map.of("Accept", "application/rss+xml"));

        List<Item> items = FeedParser.parse(xml).stream()
                .filter(entry -> !entry.link().isBlank())
                .sorted(Comparator.comparing(FeedEntry::publishedAt).reversed())
                .limit(MAX_ARTICLES)
                .map(NewsWatcher::toItem)
                .toList();
        return new ItemSnapshot(SourceKind.NEWS, items, ctx.clock().instant());
    }

    private static Item toItem(FeedEntry entry) {
        String id = HashingUtils.shortId(entry.link());
        String title = stripSource(entry.title());
        return new Item(
                id,
                ItemCategory.ARTICLE,
                id,
                title.length() > 150 ? title.substring(0, 150) : title,
                entry.link(),
                entry.publishedAt(),
                Map.of("source", entry.sourceName().isBlank() ? "Unknown Source" : entry.sourceName())
        );
    }

    // Google News appends " - <publisher>" to every headline.
    static String stripSource(String title) {
        int index = title.lastIndexOf(" - ");
        return index > 0 ? title.substring(0, index) : title;
    }
}
