package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Named set of scan options that jobs can reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanProfile {

    private String id;

    private String name;

    private String description;

    /** Sections: enumeration, dns_analysis, http_analysis, plus optional extras */
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    private boolean defaultProfile;

    private Instant createdAt;

    private Instant updatedAt;
}
