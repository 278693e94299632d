package com.releasewatch.core.model;

import java.time.Instant;
import java.util.Objects;

public record StateRecord(
        String entityKey,
        SourceKind sourceKind,
        String fingerprint,
        StatePayload payload,
        Instant lastCheckedAt,
        Instant lastChangedAt
) {
    public StateRecord {
        Objects.requireNonNull(entityKey, "entityKey is required");
        Objects.requireNonNull(sourceKind, "sourceKind is required");
        payload = payload == null ? new StatePayload(null, null) : payload;
    }
}
