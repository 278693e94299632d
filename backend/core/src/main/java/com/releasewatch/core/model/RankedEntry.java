package com.releasewatch.core.model;

import java.util.Objects;

public record RankedEntry(String itemId, int rank, double score, String creator) {
    public RankedEntry {
        Objects.requireNonNull(itemId, "itemId is required");
        creator = creator == null ? "" : creator;
    }
}
