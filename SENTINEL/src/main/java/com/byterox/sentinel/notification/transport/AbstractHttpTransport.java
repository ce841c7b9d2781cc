package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.exception.TransportException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * Shared JSON POST for transports that deliver over HTTP.
 */
abstract class AbstractHttpTransport implements NotificationTransport {

    protected final WebClient webClient;
    protected final SentinelProperties.Notification properties;

    protected AbstractHttpTransport(WebClient.Builder webClientBuilder, SentinelProperties properties) {
        this.properties = properties.getNotification();
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.USER_AGENT, this.properties.getUserAgent())
                .build();
    }

    /**
     * POST the body as JSON. Any non-2xx status or I/O failure becomes a {@link TransportException}.
     */
    protected Mono<Void> post(String url, Map<String, Object> body) {
        String channel = channel().value();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return Mono.error(new TransportException(channel, "Invalid " + channel + " URL: " + url, e));
        }
        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response ->
                        Mono.error(new TransportException(channel,
                                channel + " request failed with status " + response.statusCode().value())))
                .toBodilessEntity()
                .then()
                .onErrorMap(error -> !(error instanceof TransportException),
                        error -> new TransportException(channel,
                                channel + " request failed: " + error.getMessage(), error));
    }
}
