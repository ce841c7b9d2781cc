package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of steps executed with a shared, accumulating context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workflow {

    private String id;

    private String name;

    private String description;

    /** Free-form label of what starts this workflow, e.g. manual or scan_complete */
    @Builder.Default
    private String trigger = "manual";

    @Builder.Default
    private List<WorkflowStep> steps = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    private long executionCount;

    private Instant createdAt;

    private Instant updatedAt;
}
