package com.releasewatch.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.ReleaseStage;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.util.JsonUtils;
import com.releasewatch.watchers.leaderboard.LeaderboardWatcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class ConfigLoader {
    private static final ObjectMapper YAML = JsonUtils.configure(new ObjectMapper(new YAMLFactory()));

    private ConfigLoader() {
    }

    public static ReleaseWatchConfig load(Path path, Map<String, String> environment) {
        if (!Files.exists(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        ReleaseWatchConfig config;
        try {
            String content = Files.readString(path);
            config = content.isBlank() ? null : YAML.readValue(content, ReleaseWatchConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Failed loading config from " + path + ": " + e.getMessage(), e);
        }
        if (config == null) {
            config = new ReleaseWatchConfig(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
        ReleaseWatchConfig resolved = config.withEnvironment(environment);
        validate(resolved, path.toString());
        return resolved;
    }

    static void validate(ReleaseWatchConfig config, String source) {
        if (config.checkIntervalHours() < 1) {
            throw invalid(source, "check_interval_hours", "must be at least 1");
        }
        if (config.parallelism() < 1) {
            throw invalid(source, "parallelism", "must be at least 1");
        }
        if (config.seenRetention() < 1) {
            throw invalid(source, "seen_retention", "must be at least 1");
        }
        if (config.requestTimeoutSeconds() < 1) {
            throw invalid(source, "request_timeout_seconds", "must be at least 1");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < config.models().size(); i++) {
            ModelConfig model = config.models().get(i);
            if (model == null || model.name() == null || model.name().isBlank()) {
                throw invalid(source, "models[" + i + "].name", "is required");
            }
            if (!names.add(model.name().trim().toLowerCase(Locale.ROOT))) {
                throw invalid(source, "models[" + i + "].name", "duplicate model name " + model.name());
            }
        }
        for (int i = 0; i < config.priorityModels().size(); i++) {
            PriorityModelConfig priority = config.priorityModels().get(i);
            if (priority == null || priority.name() == null || priority.name().isBlank()) {
                throw invalid(source, "priority_models[" + i + "].name", "is required");
            }
        }
        LeaderboardsConfig leaderboards = config.leaderboards();
        if (leaderboards.maxRank() < 1) {
            throw invalid(source, "leaderboards.max_rank", "must be at least 1");
        }
        for (String board : leaderboards.boards().keySet()) {
            if (!LeaderboardWatcher.BOARDS.contains(board)) {
                throw invalid(source, "leaderboards.boards." + board, "unknown board");
            }
        }
        for (String key : config.notifications().mentionChannelFor()) {
            if (EventKind.find(key).isEmpty() && !isStageAlias(key)) {
                throw invalid(source, "notifications.mention_channel_for", "unknown event kind " + key);
            }
        }
        for (String key : config.notifications().eventRouting().keySet()) {
            if (EventKind.find(key).isEmpty() && !isStageAlias(key) && !isSourceKey(key)) {
                throw invalid(source, "notifications.event_routing." + key, "unknown event kind or source");
            }
        }
        config.firstObservationNotable().forEach((sourceKey, kinds) -> {
            if (!isSourceKey(sourceKey)) {
                throw invalid(source, "first_observation_notable." + sourceKey, "unknown source");
            }
            for (String kind : kinds) {
                if (EventKind.find(kind).isEmpty()) {
                    throw invalid(source, "first_observation_notable." + sourceKey, "unknown event kind " + kind);
                }
            }
        });
    }

    private static boolean isStageAlias(String key) {
        for (ReleaseStage stage : ReleaseStage.values()) {
            if (stage.alias().filter(key::equals).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSourceKey(String key) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    private static ConfigException invalid(String source, String field, String problem) {
        return new ConfigException("Invalid config " + source + ": " + field + " " + problem);
    }
}
