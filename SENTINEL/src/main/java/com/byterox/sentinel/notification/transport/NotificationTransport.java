package com.byterox.sentinel.notification.transport;

import com.byterox.sentinel.domain.model.NotificationChannel;
import reactor.core.publisher.Mono;

/**
 * Delivers a rendered notification over one channel.
 * <p>
 * The returned Mono completes when delivery finished, or errors with a
 * {@link com.byterox.sentinel.exception.TransportException}. Transports never retry.
 */
public interface NotificationTransport {

    NotificationChannel channel();

    Mono<Void> deliver(OutboundMessage message);
}
