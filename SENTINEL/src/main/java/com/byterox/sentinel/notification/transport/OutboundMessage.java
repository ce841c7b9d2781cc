package com.byterox.sentinel.notification.transport;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A rendered notification handed to a transport.
 */
@Value
@Builder
public class OutboundMessage {

    String notificationId;

    String type;

    String subject;

    String body;

    /** Data the template was rendered from */
    Map<String, Object> data;

    /** Channel options, e.g. to, webhook_url, phone_number */
    Map<String, Object> options;

    Instant createdAt;

    public String option(String key) {
        Object value = options != null ? options.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
