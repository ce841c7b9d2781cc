package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * History entry for one tick of a scheduled job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRun {

    private String runId;

    private String jobId;

    private String jobName;

    /** runCount of the job after this tick */
    private long runNumber;

    private Instant startedAt;

    private Instant completedAt;

    @Builder.Default
    private List<TargetScanOutcome> results = new ArrayList<>();

    public long getSucceeded() {
        return results.stream().filter(TargetScanOutcome::isSuccess).count();
    }

    public long getFailed() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }
}
