package com.releasewatch.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.releasewatch.core.model.RoutedEvent;
import com.releasewatch.core.routing.RoutingPolicy;
import com.releasewatch.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Posts a plain text message to an incoming webhook. The routed channel picks the webhook;
 * channels without their own webhook use the default one.
 */
public class SlackWebhookNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(SlackWebhookNotifier.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    static final String TEST_MESSAGE = "Release Watch test notification: this webhook is reachable.";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final String defaultWebhook;
    private final Map<String, String> channelWebhooks;

    public SlackWebhookNotifier(
            HttpClient httpClient,
            Duration timeout,
            String defaultWebhook,
            Map<String, String> channelWebhooks
    ) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.defaultWebhook = defaultWebhook == null ? "" : defaultWebhook;
        this.channelWebhooks = channelWebhooks == null ? Map.of() : Map.copyOf(channelWebhooks);
    }

    @Override
    public void deliver(RoutedEvent routed) throws DeliveryException {
        String webhook = webhookFor(routed.channel());
        if (webhook.isBlank()) {
            throw new DeliveryException("No webhook configured for channel " + routed.channel());
        }
        post(webhook, routed.channel(), MessageFormatter.format(routed));
        LOGGER.fine(() -> "Delivered " + routed.event().id() + " to " + routed.channel());
    }

    /**
     * Posts a test message through the default webhook and every channel webhook.
     *
     * @return one result per configured webhook, default first
     */
    public List<WebhookCheck> testConnections() {
        Map<String, String> targets = new LinkedHashMap<>();
        if (!defaultWebhook.isBlank()) {
            targets.put(RoutingPolicy.DEFAULT_CHANNEL, defaultWebhook);
        }
        new TreeMap<>(channelWebhooks).forEach(targets::putIfAbsent);
        List<WebhookCheck> results = new ArrayList<>();
        targets.forEach((channel, webhook) -> {
            try {
                post(webhook, channel, TEST_MESSAGE);
                results.add(new WebhookCheck(channel, true, "OK"));
            } catch (DeliveryException e) {
                LOGGER.warning(() -> "Test message failed for channel " + channel + ": " + e.getMessage());
                results.add(new WebhookCheck(channel, false, e.getMessage()));
            }
        });
        return results;
    }

    private void post(String webhook, String channel, String text) throws DeliveryException {
        String body;
        try {
            body = MAPPER.writeValueAsString(Map.of("text", text));
        } catch (IOException e) {
            throw new DeliveryException("Unable to encode message for channel " + channel, e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(webhook))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Webhook request failed for channel " + channel, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Interrupted while posting to channel " + channel, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new DeliveryException("Webhook returned HTTP " + response.statusCode() + " for channel " + channel);
        }
    }

    public record WebhookCheck(String channel, boolean ok, String detail) {
    }

    String webhookFor(String channel) {
        return channelWebhooks.getOrDefault(channel, defaultWebhook);
    }
}
