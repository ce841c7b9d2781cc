package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.exception.TransportException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Generic JSON webhook posted to {@code options.webhook_url}.
 */
@Slf4j
@Component
public class WebhookTransport extends AbstractHttpTransport {

    public WebhookTransport(WebClient.Builder webClientBuilder, SentinelProperties properties) {
        super(webClientBuilder, properties);
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBHOOK;
    }

    @Override
    @CircuitBreaker(name = "notification-webhook")
    public Mono<Void> deliver(OutboundMessage message) {
        String webhookUrl = message.option("webhook_url");
        if (webhookUrl == null || webhookUrl.isBlank()) {
            return Mono.error(new TransportException("webhook", "Webhook URL not configured"));
        }

        if (properties.isDryRun()) {
            log.info("DRY_RUN: Would post webhook {} ({}) to {}",
                    message.getNotificationId(), message.getType(), webhookUrl);
            return Mono.empty();
        }
        return post(webhookUrl, payload(message))
                .doOnSuccess(ignored -> log.debug("Webhook {} delivered to {}", message.getNotificationId(), webhookUrl));
    }

    static Map<String, Object> payload(OutboundMessage message) {
        Instant timestamp = message.getCreatedAt() != null ? message.getCreatedAt() : Instant.now();
        Map<String, Object> payload = new HashMap<>();
        payload.put("notification_id", message.getNotificationId());
        payload.put("type", message.getType());
        payload.put("timestamp", timestamp.toString());
        payload.put("subject", message.getSubject());
        payload.put("message", message.getBody());
        payload.put("data", message.getData() != null ? message.getData() : Map.of());
        return payload;
    }
}
