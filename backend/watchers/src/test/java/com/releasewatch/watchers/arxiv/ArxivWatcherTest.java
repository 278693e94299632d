package com.releasewatch.watchers.arxiv;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.PriorityTier;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.support.FixtureServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.releasewatch.watchers.support.FixtureUtils.fixture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArxivWatcherTest {
    private static final WatchTarget TARGET = new WatchTarget("Z-Image", SourceKind.ARXIV, "Z-Image", PriorityTier.NORMAL);

    private FixtureServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void parsesPapersFromAtomFeed() throws Exception {
        server = new FixtureServer().route("/api/query", 200, fixture("arxiv-feed.xml"));

        ItemSnapshot snapshot = new ArxivWatcher(server.baseUrl() + "/api/query").fetch(TARGET, server.context(Map.of()));

        assertEquals(2, snapshot.items().size());
        Item paper = snapshot.items().get(0);
        assertEquals("2603.01234v1", paper.id());
        assertEquals(ItemCategory.PAPER, paper.category());
        assertEquals("Z-Image: An Efficient Image Generation Foundation Model", paper.title());
        assertEquals("http://arxiv.org/abs/2603.01234v1", paper.url());
        assertEquals(Instant.parse("2026-03-02T17:59:59Z"), paper.timestamp());
        assertEquals(List.of("Lin Wei", "Chen Yu"), paper.metadata().get("authors"));
        assertEquals(List.of("cs.CV", "cs.AI"), paper.metadata().get("categories"));
        assertEquals("https://arxiv.org/abs/2602.09876v2", snapshot.items().get(1).url());
    }

    @Test
    void sendsPhraseQuerySortedBySubmission() throws Exception {
        server = new FixtureServer().route("/api/query", 200, fixture("arxiv-feed.xml"));

        new ArxivWatcher(server.baseUrl() + "/api/query").fetch(TARGET, server.context(Map.of()));

        String uri = server.requests().get(0).uri();
        assertTrue(uri.contains("search_query=all%3A%22Z-Image%22"));
        assertTrue(uri.contains("max_results=10"));
        assertTrue(uri.contains("sortBy=submittedDate"));
    }

    @Test
    void malformedFeedIsAFetchFailure() throws Exception {
        server = new FixtureServer().route("/api/query", 200, "<feed><entry>");

        assertThrows(FetchException.class,
                () -> new ArxivWatcher(server.baseUrl() + "/api/query").fetch(TARGET, server.context(Map.of())));
    }
}
