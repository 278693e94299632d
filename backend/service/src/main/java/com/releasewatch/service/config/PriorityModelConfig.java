package com.releasewatch.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriorityModelConfig(String name, @JsonProperty("mention_channel") Boolean mentionChannel) {
    public PriorityModelConfig {
        mentionChannel = mentionChannel == null ? Boolean.TRUE : mentionChannel;
    }
}
