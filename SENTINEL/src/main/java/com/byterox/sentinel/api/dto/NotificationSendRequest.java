package com.byterox.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for sending a single notification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSendRequest {

    @NotBlank
    private String type;

    @NotBlank
    private String channel;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
