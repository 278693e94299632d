package com.releasewatch.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class MapUtils {
    private MapUtils() {
    }

    /**
     * Immutable copy that drops null keys and values and keeps insertion order.
     */
    public static Map<String, Object> compact(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
