package com.releasewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceKind {
    GITHUB("github"),
    HUGGINGFACE("huggingface"),
    MODELSCOPE("modelscope"),
    ARXIV("arxiv"),
    NEWS("news"),
    LEADERBOARD("leaderboard");

    private final String key;

    SourceKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SourceKind fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Source kind is required");
        }
        String lowered = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.key.equals(lowered)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + value);
    }
}
