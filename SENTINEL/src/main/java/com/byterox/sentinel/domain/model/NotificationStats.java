package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Delivery counts over the notification history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationStats {

    private long total;

    private long sent;

    private long failed;

    private long pending;

    /** channel -> {sent, failed} */
    @Builder.Default
    private Map<String, Map<String, Long>> byChannel = new HashMap<>();

    /** type -> {sent, failed} */
    @Builder.Default
    private Map<String, Map<String, Long>> byType = new HashMap<>();
}
