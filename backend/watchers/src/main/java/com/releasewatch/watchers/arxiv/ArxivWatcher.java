package com.releasewatch.watchers.arxiv;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.HttpFetcher;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;
import com.releasewatch.watchers.feed.FeedEntry;
import com.releasewatch.watchers.feed.FeedParser;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Newest submissions matching a phrase query on the arXiv export API.
 */
public class ArxivWatcher implements SourceWatcher {
    public static final String DEFAULT_ENDPOINT = "http://export.arxiv.org/api/query";
    static final int MAX_RESULTS = 10;

    private final String endpoint;

    public ArxivWatcher() {
        this(DEFAULT_ENDPOINT);
    }

    public ArxivWatcher(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.ARXIV;
    }

    @Override
    public ItemSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        String query = URLEncoder.encode("all:\"" + target.sourceId() + "\"", StandardCharsets.UTF_8);
        URI uri = URI.create(endpoint
                + "?search_query=" + query
                + "&start=0&max_results=" + MAX_RESULTS
                + "&sortBy=submittedDate&sortOrder=descending");
        String xml = HttpFetcher.getText(ctx, uri, Map.of("Accept", "application/atom+xml"));

        List<Item> items = new ArrayList<>();
        for (FeedEntry entry : FeedParser.parse(xml)) {
            if (items.size() == MAX_RESULTS) {
                break;
            }
            String arxivId = arxivId(entry.id());
            if (arxivId.isBlank()) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("authors", entry.authors().size() > 5 ? entry.authors().subList(0, 5) : entry.authors());
            metadata.put("categories", entry.categories());
            String summary = entry.summary();
            metadata.put("summary", summary.length() > 300 ? summary.substring(0, 300) : summary);
            items.add(new Item(
                    arxivId,
                    ItemCategory.PAPER,
                    arxivId,
                    entry.title(),
                    entry.link().isBlank() ? "https://arxiv.org/abs/" + arxivId : entry.link(),
                    entry.publishedAt(),
                    metadata
            ));
        }
        return new ItemSnapshot(SourceKind.ARXIV, items, ctx.clock().instant());
    }

    static String arxivId(String atomId) {
        int index = atomId.indexOf("/abs/");
        return index >= 0 ? atomId.substring(index + "/abs/".length()) : atomId;
    }
}
