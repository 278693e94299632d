package com.releasewatch.core.routing;

import com.releasewatch.core.model.RoutedEvent;
import com.releasewatch.core.model.WatchEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Derives the destination channel and the mention flag of an event. Holds no state beyond its
 * policy, so the same event always routes the same way.
 */
public final class EventRouter {
    private final RoutingPolicy policy;

    public EventRouter(RoutingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    public RoutedEvent route(WatchEvent event) {
        return new RoutedEvent(event, channelFor(event), mentionFor(event));
    }

    String channelFor(WatchEvent event) {
        if (event.kind().isLeaderboard() && policy.channels().contains(RoutingPolicy.LEADERBOARD_CHANNEL)) {
            return RoutingPolicy.LEADERBOARD_CHANNEL;
        }
        String byKind = policy.eventRouting().get(event.kind().key());
        if (byKind != null) {
            return byKind;
        }
        Optional<String> byStage = event.releaseStage().alias().map(policy.eventRouting()::get);
        if (byStage.isPresent()) {
            return byStage.get();
        }
        String bySource = event.source() == null ? null : policy.eventRouting().get(event.source().key());
        return bySource != null ? bySource : policy.defaultChannel();
    }

    boolean mentionFor(WatchEvent event) {
        if (policy.mentionChannelFor().contains(event.kind().key())) {
            return true;
        }
        Optional<String> alias = event.releaseStage().alias();
        if (alias.isPresent() && policy.mentionChannelFor().contains(alias.get())) {
            return true;
        }
        Optional<Boolean> override = policy.overrideFor(event.subject());
        if (override.isPresent()) {
            return override.get();
        }
        return policy.isHighPriority(event.subject());
    }
}
