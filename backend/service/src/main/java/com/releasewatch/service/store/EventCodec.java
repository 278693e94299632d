package com.releasewatch.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.releasewatch.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends OutboxEntry>> TYPES = Map.of(
            "EventQueued", EventQueued.class,
            "EventDelivered", EventDelivered.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(OutboxEntry entry) {
        try {
            return MAPPER.writeValueAsString(new StoredEntry(entry.type(), entry.timestamp(), entry));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize outbox entry", e);
        }
    }

    public static OutboxEntry fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends OutboxEntry> entryClass = TYPES.get(type);
            if (entryClass == null) {
                throw new IllegalArgumentException("Unsupported outbox entry type: " + type);
            }
            return MAPPER.treeToValue(node.path("entry"), entryClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize outbox entry", e);
        }
    }

    private record StoredEntry(String type, Instant timestamp, OutboxEntry entry) {
    }
}
