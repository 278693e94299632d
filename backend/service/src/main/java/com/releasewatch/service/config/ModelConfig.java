package com.releasewatch.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.releasewatch.core.model.PriorityTier;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchedEntity;

import java.util.EnumMap;
import java.util.Map;

public record ModelConfig(
        String name,
        String github,
        String huggingface,
        String modelscope,
        @JsonProperty("arxiv_query") String arxivQuery,
        @JsonProperty("news_keywords") String newsKeywords,
        String priority
) {
    public WatchedEntity toEntity() {
        Map<SourceKind, String> sources = new EnumMap<>(SourceKind.class);
        put(sources, SourceKind.GITHUB, github);
        put(sources, SourceKind.HUGGINGFACE, huggingface);
        put(sources, SourceKind.MODELSCOPE, modelscope);
        put(sources, SourceKind.ARXIV, arxivQuery);
        put(sources, SourceKind.NEWS, newsKeywords);
        return new WatchedEntity(name, sources, PriorityTier.parse(priority));
    }

    private static void put(Map<SourceKind, String> sources, SourceKind kind, String value) {
        if (value != null && !value.isBlank()) {
            sources.put(kind, value);
        }
    }
}
