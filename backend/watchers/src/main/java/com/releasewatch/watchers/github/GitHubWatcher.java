package com.releasewatch.watchers.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ItemSnapshot;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.watchers.api.FetchException;
import com.releasewatch.watchers.api.HttpFetcher;
import com.releasewatch.watchers.api.SourceWatcher;
import com.releasewatch.watchers.api.WatchContext;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository, recent commits and recent releases of one GitHub repository. A repository that
 * answers 404 is not public yet and yields an empty snapshot.
 */
public class GitHubWatcher implements SourceWatcher {
    public static final String DEFAULT_API_BASE = "https://api.github.com";
    static final int COMMIT_PAGE = 10;
    static final int RELEASE_PAGE = 5;

    private final String apiBase;

    public GitHubWatcher() {
        this(DEFAULT_API_BASE);
    }

    public GitHubWatcher(String apiBase) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.GITHUB;
    }

    @Override
    public ItemSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        String repo = target.sourceId();
        Map<String, String> headers = headers(ctx);
        Optional<JsonNode> repository = HttpFetcher.getJsonIfPresent(ctx, uri("/repos/" + repo), headers);
        if (repository.isEmpty()) {
            return new ItemSnapshot(SourceKind.GITHUB, List.of(), ctx.clock().instant());
        }
        JsonNode commits = HttpFetcher.getJson(ctx, uri("/repos/" + repo + "/commits?per_page=" + COMMIT_PAGE), headers);
        JsonNode releases = HttpFetcher.getJson(ctx, uri("/repos/" + repo + "/releases?per_page=" + RELEASE_PAGE), headers);

        List<Item> items = new ArrayList<>();
        items.add(repositoryItem(repo, repository.get(), releases.isArray() && !releases.isEmpty()));
        for (JsonNode commit : commits) {
            commitItem(commit).ifPresent(items::add);
        }
        for (JsonNode release : releases) {
            releaseItem(release).ifPresent(items::add);
        }
        return new ItemSnapshot(SourceKind.GITHUB, items, ctx.clock().instant());
    }

    private static Item repositoryItem(String repo, JsonNode node, boolean hasReleases) {
        String fullName = node.path("full_name").asText(repo);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("description", node.path("description").asText(""));
        metadata.put("stars", node.path("stargazers_count").asInt(0));
        metadata.put("forks", node.path("forks_count").asInt(0));
        metadata.put("language", node.path("language").isTextual() ? node.path("language").asText() : null);
        metadata.put("hasReleases", hasReleases);
        String id = "repo:" + fullName;
        return new Item(
                id,
                ItemCategory.REPOSITORY,
                id,
                fullName,
                node.path("html_url").asText("https://github.com/" + repo),
                parseTime(node.path("created_at").asText(null)),
                metadata
        );
    }

    private static Optional<Item> commitItem(JsonNode node) {
        String sha = node.path("sha").asText("");
        if (sha.isBlank()) {
            return Optional.empty();
        }
        JsonNode commit = node.path("commit");
        String message = commit.path("message").asText("No message");
        String firstLine = message.lines().findFirst().orElse(message);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sha", sha.length() > 7 ? sha.substring(0, 7) : sha);
        metadata.put("author", commit.path("author").path("name").asText("Unknown"));
        metadata.put("message", message);
        return Optional.of(new Item(
                sha,
                ItemCategory.COMMIT,
                sha,
                firstLine,
                node.path("html_url").asText(""),
                parseTime(commit.path("author").path("date").asText(null)),
                metadata
        ));
    }

    private static Optional<Item> releaseItem(JsonNode node) {
        if (!node.hasNonNull("id")) {
            return Optional.empty();
        }
        String id = "release:" + node.path("id").asText();
        boolean prerelease = node.path("prerelease").asBoolean(false);
        String tag = node.path("tag_name").asText("Unknown");
        String published = node.hasNonNull("published_at")
                ? node.path("published_at").asText()
                : node.path("created_at").asText(null);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tag", tag);
        metadata.put("name", node.path("name").asText(""));
        metadata.put("prerelease", prerelease);
        metadata.put("hasAssets", node.path("assets").isArray() && !node.path("assets").isEmpty());
        return Optional.of(new Item(
                id,
                ItemCategory.RELEASE,
                id,
                (prerelease ? "Pre-release: " : "Release: ") + tag,
                node.path("html_url").asText(""),
                parseTime(published),
                metadata
        ));
    }

    private static Map<String, String> headers(WatchContext ctx) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/vnd.github+json");
        ctx.token(WatchContext.GITHUB_TOKEN).ifPresent(token -> headers.put("Authorization", "token " + token));
        return headers;
    }

    private URI uri(String path) {
        return URI.create(apiBase + path);
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }
}
