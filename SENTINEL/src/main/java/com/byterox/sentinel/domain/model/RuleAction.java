package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleAction {

    /** Handler key, e.g. send_alert */
    private String type;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();
}
