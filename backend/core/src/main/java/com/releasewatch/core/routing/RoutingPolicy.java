package com.releasewatch.core.routing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Routing and mention settings shared by every event of a run.
 *
 * @param eventRouting        event kind key, release stage alias or source key mapped to a channel name
 * @param channels            channel names that have a destination configured
 * @param defaultChannel      channel used when nothing else matches
 * @param mentionChannelFor   event kind keys and release stage aliases that always mention the channel
 * @param priorityOverrides   lower-cased model name mapped to its mention flag
 * @param highPriorityEntities lower-cased names of entities on the HIGH tier
 */
public record RoutingPolicy(
        Map<String, String> eventRouting,
        Set<String> channels,
        String defaultChannel,
        Set<String> mentionChannelFor,
        Map<String, Boolean> priorityOverrides,
        Set<String> highPriorityEntities
) {
    public static final String DEFAULT_CHANNEL = "default";
    public static final String LEADERBOARD_CHANNEL = "leaderboard";

    public RoutingPolicy {
        eventRouting = eventRouting == null ? Map.of() : Map.copyOf(eventRouting);
        channels = channels == null ? Set.of() : Set.copyOf(channels);
        defaultChannel = defaultChannel == null || defaultChannel.isBlank() ? DEFAULT_CHANNEL : defaultChannel;
        mentionChannelFor = mentionChannelFor == null ? Set.of() : Set.copyOf(mentionChannelFor);
        priorityOverrides = lowerKeys(priorityOverrides);
        highPriorityEntities = highPriorityEntities == null
                ? Set.of()
                : highPriorityEntities.stream().map(RoutingPolicy::normalize).collect(Collectors.toUnmodifiableSet());
    }

    public static RoutingPolicy defaults() {
        return new RoutingPolicy(
                Map.of(),
                Set.of(),
                DEFAULT_CHANNEL,
                Set.of("new_release", "new_model", "release_launched"),
                Map.of(),
                Set.of()
        );
    }

    public Optional<Boolean> overrideFor(String subject) {
        return subject == null ? Optional.empty() : Optional.ofNullable(priorityOverrides.get(normalize(subject)));
    }

    public boolean isHighPriority(String subject) {
        return subject != null && highPriorityEntities.contains(normalize(subject));
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Boolean> lowerKeys(Map<String, Boolean> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Boolean> copy = new LinkedHashMap<>();
        source.forEach((name, mention) -> {
            if (name != null && mention != null) {
                copy.put(normalize(name), mention);
            }
        });
        return Map.copyOf(copy);
    }
}
