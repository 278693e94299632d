package com.releasewatch.core.diff;

import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.SourceKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which event kinds are still reported when a target is observed for the very first time.
 * Everything else found on first observation only seeds the stored state.
 */
public final class FirstObservationPolicy {
    private final Map<SourceKind, Set<EventKind>> notable;

    private FirstObservationPolicy(Map<SourceKind, Set<EventKind>> notable) {
        EnumMap<SourceKind, Set<EventKind>> copy = new EnumMap<>(SourceKind.class);
        notable.forEach((kind, kinds) -> copy.put(kind, kinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(kinds))));
        this.notable = copy;
    }

    public static FirstObservationPolicy suppressAll() {
        return new FirstObservationPolicy(Map.of());
    }

    public static FirstObservationPolicy of(Map<SourceKind, Set<EventKind>> notable) {
        return new FirstObservationPolicy(notable);
    }

    public Set<EventKind> notableOnFirstObservation(SourceKind kind) {
        return notable.getOrDefault(kind, Set.of());
    }
}
