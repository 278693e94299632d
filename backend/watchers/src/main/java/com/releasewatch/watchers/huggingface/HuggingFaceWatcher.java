package com.releasewatch.watchers.huggingface;

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
 * Model card and main-branch commits of a Hugging Face model. The model item's fingerprint is
 * the current revision, so a new upload shows up as a model update.
 */
public class HuggingFaceWatcher implements SourceWatcher {
    public static final String DEFAULT_BASE = "https://huggingface.co";

    private final String base;

    public HuggingFaceWatcher() {
        this(DEFAULT_BASE);
    }

    public HuggingFaceWatcher(String base) {
        this.base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.HUGGINGFACE;
    }

    @Override
    public ItemSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        String modelId = target.sourceId();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        ctx.token(WatchContext.HF_TOKEN).ifPresent(token -> headers.put("Authorization", "Bearer " + token));

        Optional<JsonNode> model = HttpFetcher.getJsonIfPresent(ctx, URI.create(base + "/api/models/" + modelId), headers);
        if (model.isEmpty()) {
            return new ItemSnapshot(SourceKind.HUGGINGFACE, List.of(), ctx.clock().instant());
        }
        Optional<JsonNode> commits = HttpFetcher.getJsonIfPresent(
                ctx,
                URI.create(base + "/api/models/" + modelId + "/commits/main"),
                headers
        );

        List<Item> items = new ArrayList<>();
        items.add(modelItem(modelId, model.get()));
        if (commits.isPresent()) {
            for (JsonNode commit : commits.get()) {
                commitItem(modelId, commit).ifPresent(items::add);
            }
        }
        return new ItemSnapshot(SourceKind.HUGGINGFACE, items, ctx.clock().instant());
    }

    private Item modelItem(String modelId, JsonNode node) {
        String revision = node.path("sha").asText("");
        if (revision.isBlank()) {
            revision = node.path("lastModified").asText("");
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : node.path("tags")) {
            if (tags.size() == 5) {
                break;
            }
            tags.add(tag.asText());
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("downloads", node.path("downloads").asLong(0));
        metadata.put("likes", node.path("likes").asLong(0));
        metadata.put("pipelineTag", node.path("pipeline_tag").isTextual() ? node.path("pipeline_tag").asText() : null);
        metadata.put("tags", tags);
        metadata.put("lastModified", node.path("lastModified").asText(null));
        String created = node.hasNonNull("createdAt") ? node.path("createdAt").asText() : node.path("lastModified").asText(null);
        return new Item(
                "model:" + modelId,
                ItemCategory.MODEL,
                revision.isBlank() ? null : revision,
                modelId,
                base + "/" + modelId,
                parseTime(created),
                metadata
        );
    }

    private Optional<Item> commitItem(String modelId, JsonNode node) {
        String id = node.hasNonNull("id") ? node.path("id").asText() : node.path("sha").asText("");
        if (id.isBlank()) {
            return Optional.empty();
        }
        String date = node.hasNonNull("date") ? node.path("date").asText() : node.path("createdAt").asText(null);
        String title = node.path("title").asText("Update");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("commitId", id.length() > 7 ? id.substring(0, 7) : id);
        JsonNode authors = node.path("authors");
        if (authors.isArray() && !authors.isEmpty()) {
            metadata.put("author", authors.get(0).path("user").asText("Unknown"));
        }
        return Optional.of(new Item(
                id,
                ItemCategory.COMMIT,
                id,
                title.length() > 100 ? title.substring(0, 100) : title,
                base + "/" + modelId + "/commit/" + id,
                parseTime(date),
                metadata
        ));
    }

    private static Instant parseTime(String value) {
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
