package com.releasewatch.core.model;

import com.releasewatch.core.util.MapUtils;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record Item(
        String id,
        ItemCategory category,
        String fingerprint,
        String title,
        String url,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public Item {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(category, "category is required");
        fingerprint = fingerprint == null ? id : fingerprint;
        title = title == null ? "" : title;
        url = url == null ? "" : url;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        metadata = MapUtils.compact(metadata);
    }

    public static Item of(String id, ItemCategory category, String title, String url, Instant timestamp) {
        return new Item(id, category, id, title, url, timestamp, Map.of());
    }
}
