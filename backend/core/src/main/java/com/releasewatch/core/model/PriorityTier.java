package com.releasewatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum PriorityTier {
    NORMAL,
    HIGH;

    @JsonCreator
    public static PriorityTier parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return "high".equals(value.trim().toLowerCase(Locale.ROOT)) ? HIGH : NORMAL;
    }
}
