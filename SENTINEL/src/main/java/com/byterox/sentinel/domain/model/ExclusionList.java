package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Targets that must never be scanned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExclusionList {

    private String id;

    private String name;

    private String description;

    /** global, service, environment or custom */
    @Builder.Default
    private String type = "custom";

    @Builder.Default
    private List<String> domains = new ArrayList<>();

    /** Exact addresses or IPv4 CIDR blocks */
    @Builder.Default
    private List<String> ips = new ArrayList<>();

    @Builder.Default
    private List<Integer> ports = new ArrayList<>();

    /** Wildcard host patterns, e.g. *.internal */
    @Builder.Default
    private List<String> patterns = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;

    private Instant updatedAt;
}
