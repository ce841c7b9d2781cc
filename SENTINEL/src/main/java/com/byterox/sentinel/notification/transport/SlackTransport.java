package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.exception.TransportException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Slack incoming webhook. Uses {@code options.webhook_url}, falling back to the configured default.
 */
@Slf4j
@Component
public class SlackTransport extends AbstractHttpTransport {

    public SlackTransport(WebClient.Builder webClientBuilder, SentinelProperties properties) {
        super(webClientBuilder, properties);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SLACK;
    }

    @Override
    @CircuitBreaker(name = "notification-webhook")
    public Mono<Void> deliver(OutboundMessage message) {
        String webhookUrl = message.option("webhook_url");
        if (webhookUrl == null || webhookUrl.isBlank()) {
            webhookUrl = properties.getSlackWebhookUrl();
        }
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return Mono.error(new TransportException("slack", "Slack webhook URL not configured"));
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("text", message.getBody());
        String channel = message.option("channel");
        if (channel != null) {
            payload.put("channel", channel);
        }

        if (properties.isDryRun()) {
            log.info("DRY_RUN: Would post Slack message {} ({})", message.getNotificationId(), message.getType());
            return Mono.empty();
        }
        return post(webhookUrl, payload)
                .doOnSuccess(ignored -> log.debug("Slack message {} delivered", message.getNotificationId()));
    }
}
