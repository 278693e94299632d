package com.releasewatch.core.diff;

import com.releasewatch.core.model.StateRecord;
import com.releasewatch.core.model.WatchEvent;

import java.util.List;
import java.util.Objects;

public record DiffResult(List<WatchEvent> events, StateRecord next) {
    public DiffResult {
        events = events == null ? List.of() : List.copyOf(events);
        Objects.requireNonNull(next, "next state is required");
    }

    public boolean changed() {
        return !events.isEmpty();
    }
}
