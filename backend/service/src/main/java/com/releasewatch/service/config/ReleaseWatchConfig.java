package com.releasewatch.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.releasewatch.core.diff.DiffEngine;
import com.releasewatch.core.diff.FirstObservationPolicy;
import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.PriorityTier;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.core.model.WatchedEntity;
import com.releasewatch.core.routing.RoutingPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root of {@code config.yaml}. Missing keys fall back to their defaults here; cross-field rules
 * are checked by {@link ConfigLoader}.
 */
public record ReleaseWatchConfig(
        @JsonProperty("check_interval_hours") Integer checkIntervalHours,
        @JsonProperty("state_path") String statePath,
        @JsonProperty("outbox_path") String outboxPath,
        Integer parallelism,
        @JsonProperty("seen_retention") Integer seenRetention,
        @JsonProperty("request_timeout_seconds") Integer requestTimeoutSeconds,
        @JsonProperty("slack_webhook_url") String slackWebhookUrl,
        @JsonProperty("slack_channels") Map<String, String> slackChannels,
        List<ModelConfig> models,
        @JsonProperty("priority_models") List<PriorityModelConfig> priorityModels,
        LeaderboardsConfig leaderboards,
        NotificationsConfig notifications,
        @JsonProperty("first_observation_notable") Map<String, List<String>> firstObservationNotable
) {
    public static final String ENV_SLACK_WEBHOOK_URL = "SLACK_WEBHOOK_URL";
    static final Map<String, String> CHANNEL_ENV = Map.of(
            "leaderboard", "SLACK_WEBHOOK_LEADERBOARD",
            "announcements", "SLACK_WEBHOOK_ANNOUNCEMENTS",
            "launches", "SLACK_WEBHOOK_LAUNCHES"
    );

    public ReleaseWatchConfig {
        checkIntervalHours = checkIntervalHours == null ? 1 : checkIntervalHours;
        statePath = statePath == null || statePath.isBlank() ? "data/watcher_state.json" : statePath;
        outboxPath = outboxPath == null || outboxPath.isBlank() ? "data/outbox.jsonl" : outboxPath;
        parallelism = parallelism == null ? 4 : parallelism;
        seenRetention = seenRetention == null ? DiffEngine.DEFAULT_RETENTION : seenRetention;
        requestTimeoutSeconds = requestTimeoutSeconds == null ? 30 : requestTimeoutSeconds;
        slackWebhookUrl = slackWebhookUrl == null ? "" : slackWebhookUrl.trim();
        slackChannels = slackChannels == null ? Map.of() : withoutBlankValues(slackChannels);
        models = models == null ? List.of() : List.copyOf(models);
        priorityModels = priorityModels == null ? List.of() : List.copyOf(priorityModels);
        leaderboards = leaderboards == null ? LeaderboardsConfig.defaults() : leaderboards;
        notifications = notifications == null ? NotificationsConfig.defaults() : notifications;
        firstObservationNotable = firstObservationNotable == null ? Map.of() : Map.copyOf(firstObservationNotable);
    }

    /**
     * Environment values win over the file for every webhook.
     */
    public ReleaseWatchConfig withEnvironment(Map<String, String> env) {
        String webhook = nonBlank(env.get(ENV_SLACK_WEBHOOK_URL)) ? env.get(ENV_SLACK_WEBHOOK_URL).trim() : slackWebhookUrl;
        Map<String, String> channels = new LinkedHashMap<>(slackChannels);
        CHANNEL_ENV.forEach((channel, variable) -> {
            if (nonBlank(env.get(variable))) {
                channels.put(channel, env.get(variable).trim());
            }
        });
        return new ReleaseWatchConfig(
                checkIntervalHours,
                statePath,
                outboxPath,
                parallelism,
                seenRetention,
                requestTimeoutSeconds,
                webhook,
                channels,
                models,
                priorityModels,
                leaderboards,
                notifications,
                firstObservationNotable
        );
    }

    public List<WatchedEntity> entities() {
        return models.stream().map(ModelConfig::toEntity).toList();
    }

    /**
     * Every (entity, source) pair followed by one target per enabled leaderboard board.
     */
    public List<WatchTarget> targets() {
        List<WatchTarget> targets = new ArrayList<>();
        for (WatchedEntity entity : entities()) {
            targets.addAll(entity.targets());
        }
        for (String board : leaderboards.enabledBoards()) {
            targets.add(WatchTarget.board(board));
        }
        return targets;
    }

    public RoutingPolicy routingPolicy() {
        Map<String, Boolean> overrides = new LinkedHashMap<>();
        for (PriorityModelConfig priority : priorityModels) {
            overrides.put(priority.name(), priority.mentionChannel());
        }
        Set<String> high = new HashSet<>();
        for (WatchedEntity entity : entities()) {
            if (entity.priority() == PriorityTier.HIGH) {
                high.add(entity.name());
            }
        }
        return new RoutingPolicy(
                notifications.eventRouting(),
                slackChannels.keySet(),
                RoutingPolicy.DEFAULT_CHANNEL,
                Set.copyOf(notifications.mentionChannelFor()),
                overrides,
                high
        );
    }

    public FirstObservationPolicy firstObservationPolicy() {
        Map<SourceKind, Set<EventKind>> notable = new EnumMap<>(SourceKind.class);
        firstObservationNotable.forEach((source, kinds) -> {
            Set<EventKind> parsed = new HashSet<>();
            for (String kind : kinds) {
                parsed.add(EventKind.fromKey(kind));
            }
            notable.put(SourceKind.fromKey(source), parsed);
        });
        return FirstObservationPolicy.of(notable);
    }

    public Duration checkInterval() {
        return Duration.ofHours(checkIntervalHours);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public Path statePathResolved() {
        return Path.of(statePath);
    }

    public Path outboxPathResolved() {
        return Path.of(outboxPath);
    }

    private static Map<String, String> withoutBlankValues(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && nonBlank(value)) {
                copy.put(key, value.trim());
            }
        });
        return Map.copyOf(copy);
    }

    private static boolean nonBlank(String value) {
        return value != null && !value.isBlank();
    }
}
