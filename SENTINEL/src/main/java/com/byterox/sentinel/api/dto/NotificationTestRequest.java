package com.byterox.sentinel.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for a channel test.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationTestRequest {

    @NotBlank
    private String channel;

    /** Transport options, e.g. to, webhook_url or phone_number */
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
