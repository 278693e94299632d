package com.releasewatch.watchers.modelscope;

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
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ModelScopeWatcher implements SourceWatcher {
    public static final String DEFAULT_BASE = "https://modelscope.cn";
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String base;

    public ModelScopeWatcher() {
        this(DEFAULT_BASE);
    }

    public ModelScopeWatcher(String base) {
        this.base = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.MODELSCOPE;
    }

    @Override
    public ItemSnapshot fetch(WatchTarget target, WatchContext ctx) throws FetchException {
        String modelId = target.sourceId();
        Optional<JsonNode> response = HttpFetcher.getJsonIfPresent(
                ctx,
                URI.create(base + "/api/v1/models/" + modelId),
                Map.of("Accept", "application/json")
        );
        Instant fetchedAt = ctx.clock().instant();
        if (response.isEmpty()) {
            return new ItemSnapshot(SourceKind.MODELSCOPE, List.of(), fetchedAt);
        }
        JsonNode body = response.get();
        boolean success = body.path("Success").asBoolean(false) || body.path("Code").asInt(0) == 200;
        if (!success) {
            return new ItemSnapshot(SourceKind.MODELSCOPE, List.of(), fetchedAt);
        }
        JsonNode data = body.path("Data");
        JsonNode modified = data.hasNonNull("LastModifiedTime") ? data.path("LastModifiedTime") : data.path("GmtModified");
        JsonNode created = data.hasNonNull("GmtCreate") ? data.path("GmtCreate") : data.path("CreatedTime");
        String description = data.path("ChineseDescription").asText("");
        if (description.isBlank()) {
            description = data.path("Description").asText("");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("downloads", data.path("Downloads").asLong(0));
        metadata.put("likes", data.path("Likes").asLong(0));
        metadata.put("task", data.path("Task").isTextual() ? data.path("Task").asText() : null);
        metadata.put("description", description.length() > 300 ? description.substring(0, 300) : description);
        metadata.put("lastModified", modified.isMissingNode() || modified.isNull() ? null : modified.asText());

        Item item = new Item(
                "model:" + modelId,
                ItemCategory.MODEL,
                modified.isMissingNode() || modified.isNull() ? null : modified.asText(),
                modelId,
                base + "/models/" + modelId,
                parseTime(created),
                metadata
        );
        return new ItemSnapshot(SourceKind.MODELSCOPE, List.of(item), fetchedAt);
    }

    // Epoch seconds, ISO-8601 or "yyyy-MM-dd HH:mm:ss" in UTC depending on the endpoint version.
    static Instant parseTime(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Instant.EPOCH;
        }
        if (node.isNumber()) {
            return Instant.ofEpochSecond(node.asLong());
        }
        String value = node.asText("").trim();
        if (value.isEmpty()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value, LOCAL_TIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return Instant.EPOCH;
            }
        }
    }
}
