package com.releasewatch.watchers.github;

import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.PriorityTier;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.WatchContext;
import com.releasewatch.watchers.support.FixtureServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static com.releasewatch.watchers.support.FixtureUtils.fixture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitHubWatcherTest {
    private static final WatchTarget TARGET = new WatchTarget("Z-Image", SourceKind.GITHUB, "Tongyi-MAI/Z-Image", PriorityTier.HIGH);

    private FixtureServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void buildsRepositoryCommitAndReleaseItems() throws Exception {
        server = new FixtureServer()
                .route("/repos/Tongyi-MAI/Z-Image", 200, fixture("github-repo.json"))
                .route("/repos/Tongyi-MAI/Z-Image/commits", 200, fixture("github-commits.json"))
                .route("/repos/Tongyi-MAI/Z-Image/releases", 200, fixture("github-releases.json"));

        ItemSnapshot snapshot = new GitHubWatcher(server.baseUrl()).fetch(TARGET, server.context(Map.of()));

        assertEquals(5, snapshot.items().size());
        Item repo = snapshot.items().get(0);
        assertEquals("repo:Tongyi-MAI/Z-Image", repo.id());
        assertEquals(ItemCategory.REPOSITORY, repo.category());
        assertEquals(true, repo.metadata().get("hasReleases"));
        assertEquals(Instant.parse("2025-11-20T08:00:00Z"), repo.timestamp());

        Item commit = snapshot.items().get(1);
        assertEquals("c0ffee1234567890c0ffee1234567890c0ffee12", commit.id());
        assertEquals("Weights released for Z-Image Turbo", commit.title());
        assertEquals("c0ffee1", commit.metadata().get("sha"));

        Item preview = snapshot.items().get(3);
        assertEquals("release:7001", preview.id());
        assertEquals(true, preview.metadata().get("prerelease"));
        assertEquals("Pre-release: v1.1.0-rc1", preview.title());
        assertEquals(Instant.parse("2026-02-10T12:00:00Z"), snapshot.items().get(4).timestamp());
        assertEquals(FixtureServer.NOW, snapshot.fetchedAt());
    }

    @Test
    void requestsBoundedPagesAndSendsToken() throws Exception {
        server = new FixtureServer()
                .route("/repos/Tongyi-MAI/Z-Image", 200, fixture("github-repo.json"))
                .route("/repos/Tongyi-MAI/Z-Image/commits", 200, "[]")
                .route("/repos/Tongyi-MAI/Z-Image/releases", 200, "[]");

        new GitHubWatcher(server.baseUrl()).fetch(TARGET, server.context(Map.of(WatchContext.GITHUB_TOKEN, "secret")));

        assertTrue(server.requests().stream().anyMatch(r -> r.uri().endsWith("/commits?per_page=10")));
        assertTrue(server.requests().stream().anyMatch(r -> r.uri().endsWith("/releases?per_page=5")));
        assertTrue(server.requests().stream().allMatch(r -> "token secret".equals(r.headers().getFirst("Authorization"))));
    }

    @Test
    void missingRepositoryYieldsEmptySnapshot() throws Exception {
        server = new FixtureServer().route("/repos/Tongyi-MAI/Z-Image", 404, "");

        ItemSnapshot snapshot = new GitHubWatcher(server.baseUrl()).fetch(TARGET, server.context(Map.of()));

        assertTrue(snapshot.items().isEmpty());
    }

    @Test
    void rateLimitIsAFetchFailure() throws Exception {
        server = new FixtureServer()
                .route("/repos/Tongyi-MAI/Z-Image", 200, fixture("github-repo.json"))
                .route("/repos/Tongyi-MAI/Z-Image/commits", 403, "{\"message\":\"API rate limit exceeded\"}");

        FetchException error = assertThrows(FetchException.class,
                () -> new GitHubWatcher(server.baseUrl()).fetch(TARGET, server.context(Map.of())));

        assertEquals(403, error.statusCode());
    }
}
