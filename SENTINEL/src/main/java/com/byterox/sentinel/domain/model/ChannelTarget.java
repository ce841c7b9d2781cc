package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A delivery channel plus its transport options (recipients, webhook URL, phone number).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelTarget {

    private String channel;

    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
