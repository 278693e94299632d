package com.releasewatch.core.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A model on the watch-list together with the identifier it has on each source.
 */
public record WatchedEntity(String name, Map<SourceKind, String> sources, PriorityTier priority) {
    public WatchedEntity {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("entity name must not be blank");
        }
        EnumMap<SourceKind, String> copy = new EnumMap<>(SourceKind.class);
        if (sources != null) {
            sources.forEach((kind, id) -> {
                if (id != null && !id.isBlank()) {
                    copy.put(kind, id.trim());
                }
            });
        }
        sources = Map.copyOf(copy);
        priority = priority == null ? PriorityTier.NORMAL : priority;
    }

    /**
     * One target per configured source, in {@link SourceKind} declaration order.
     */
    public List<WatchTarget> targets() {
        List<WatchTarget> targets = new ArrayList<>();
        for (SourceKind kind : SourceKind.values()) {
            String sourceId = sources.get(kind);
            if (sourceId != null) {
                targets.add(new WatchTarget(name, kind, sourceId, priority));
            }
        }
        return targets;
    }
}
