package com.byterox.sentinel.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * A recorded workflow step, either completed or the one that failed the execution.
 * Never modified after being recorded.
 */
@Getter
@Builder
public class StepRecord {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    private final int index;

    private final String name;

    private final String type;

    @Builder.Default
    private final String status = COMPLETED;

    private final Map<String, Object> output;

    /** Set only on a failed step */
    private final String error;

    private final Instant completedAt;
}
