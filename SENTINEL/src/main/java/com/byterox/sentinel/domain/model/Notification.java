package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Audit record of one send attempt.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Notification {

    private String id;

    /** Notification type, e.g. scan_complete */
    private String type;

    private String channel;

    @Builder.Default
    private NotificationStatus status = NotificationStatus.PENDING;

    /** Rendered subject, when the channel has one */
    private String subject;

    /** Rendered body */
    private String message;

    /** Data the template was rendered from */
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    private String error;

    private Instant createdAt;

    private Instant sentAt;

    private Instant failedAt;
}
