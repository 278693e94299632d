package com.releasewatch.service.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.releasewatch.core.model.EventKind;
import com.releasewatch.core.model.Item;
import com.releasewatch.core.model.ItemCategory;
import com.releasewatch.core.model.ReleaseStage;
import com.releasewatch.core.model.RoutedEvent;
import com.releasewatch.core.model.SourceKind;
import com.releasewatch.core.model.WatchEvent;
import com.releasewatch.core.util.JsonUtils;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlackWebhookNotifierTest {
    private static final Instant NOW = Instant.parse("2026-03-03T12:00:00Z");

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            paths.add(exchange.getRequestURI().getPath());
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            int status = exchange.getRequestURI().getPath().startsWith("/broken") ? 500 : 200;
            byte[] reply = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, reply.length);
            exchange.getResponseBody().write(reply);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void postsToChannelWebhookWithMentionPrefix() throws Exception {
        SlackWebhookNotifier notifier = notifier("/default", Map.of("launches", url("/launches")));

        notifier.deliver(new RoutedEvent(releaseEvent(), "launches", true));

        assertEquals(List.of("/launches"), paths);
        JsonNode body = JsonUtils.objectMapper().readTree(bodies.get(0));
        String text = body.path("text").asText();
        assertTrue(text.startsWith("<!channel> [new_release] Qwen-Image: Release: v1.0"));
        assertTrue(text.contains("Stage: release_launched"));
        assertTrue(text.contains("https://github.com/QwenLM/Qwen-Image/releases/tag/v1.0"));
    }

    @Test
    void unknownChannelFallsBackToDefaultWebhookWithoutMention() throws Exception {
        SlackWebhookNotifier notifier = notifier("/default", Map.of("launches", url("/launches")));

        notifier.deliver(new RoutedEvent(releaseEvent(), "default", false));

        assertEquals(List.of("/default"), paths);
        assertFalse(bodies.get(0).contains("<!channel>"));
    }

    @Test
    void nonSuccessStatusRaisesDeliveryException() {
        SlackWebhookNotifier notifier = notifier("/broken", Map.of());

        DeliveryException ex = assertThrows(
                DeliveryException.class,
                () -> notifier.deliver(new RoutedEvent(releaseEvent(), "default", false))
        );
        assertTrue(ex.getMessage().contains("HTTP 500"));
    }

    @Test
    void missingWebhookRaisesDeliveryExceptionWithoutRequest() {
        SlackWebhookNotifier notifier = new SlackWebhookNotifier(HttpClient.newHttpClient(), Duration.ofSeconds(2), "", Map.of());

        DeliveryException ex = assertThrows(
                DeliveryException.class,
                () -> notifier.deliver(new RoutedEvent(releaseEvent(), "leaderboard", false))
        );
        assertTrue(ex.getMessage().contains("leaderboard"));
        assertTrue(paths.isEmpty());
    }

    @Test
    void testConnectionsPostsToDefaultThenEachChannelAndReportsFailures() {
        SlackWebhookNotifier notifier = notifier("/default", Map.of(
                "launches", url("/launches"),
                "leaderboard", url("/broken/leaderboard")
        ));

        List<SlackWebhookNotifier.WebhookCheck> checks = notifier.testConnections();

        assertEquals(List.of("/default", "/launches", "/broken/leaderboard"), paths);
        assertEquals(List.of("default", "launches", "leaderboard"), checks.stream().map(SlackWebhookNotifier.WebhookCheck::channel).toList());
        assertTrue(checks.get(0).ok());
        assertTrue(checks.get(1).ok());
        assertFalse(checks.get(2).ok());
        assertTrue(checks.get(2).detail().contains("HTTP 500"));
        assertTrue(bodies.get(0).contains("test notification"));
    }

    @Test
    void rankChangeMessageNamesBothRanks() {
        Item item = new Item("Model X", ItemCategory.MODEL, "rank:2", "Model X", "", NOW, Map.of());
        WatchEvent event = new WatchEvent(
                "id-1",
                EventKind.LEADERBOARD_RANK_CHANGE,
                "leaderboard:text-to-image",
                "text-to-image",
                SourceKind.LEADERBOARD,
                item,
                NOW,
                ReleaseStage.UNKNOWN,
                Map.of("board", "text-to-image", "previousRank", 5, "currentRank", 2, "direction", "up")
        );

        String text = MessageFormatter.format(new RoutedEvent(event, "leaderboard", false));

        assertEquals("[leaderboard_rank_change] text-to-image: Model X\nMoved up on text-to-image: #5 -> #2", text);
    }

    private SlackWebhookNotifier notifier(String defaultPath, Map<String, String> channels) {
        return new SlackWebhookNotifier(HttpClient.newHttpClient(), Duration.ofSeconds(2), url(defaultPath), channels);
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static WatchEvent releaseEvent() {
        Item item = Item.of(
                "release:1",
                ItemCategory.RELEASE,
                "Release: v1.0",
                "https://github.com/QwenLM/Qwen-Image/releases/tag/v1.0",
                NOW
        );
        return new WatchEvent(
                "evt-1",
                EventKind.NEW_RELEASE,
                "github:Qwen-Image",
                "Qwen-Image",
                SourceKind.GITHUB,
                item,
                NOW,
                ReleaseStage.LAUNCHED,
                Map.of()
        );
    }
}
