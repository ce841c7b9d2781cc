package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.api.dto.ScheduleRequest;
import com.byterox.sentinel.api.dto.ScheduleUpdateRequest;
import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.ScheduledJob;
import com.byterox.sentinel.scheduler.ScanScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for scheduled scan jobs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "Cron-scheduled scan jobs")
public class ScheduleController {

    private final ScanScheduler scheduler;

    public ScheduleController(ScanScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping
    @Operation(summary = "Create schedule", description = "Create a scheduled job and arm its timer")
    public Mono<ResponseEntity<ScheduledJob>> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        return Mono.fromCallable(() -> scheduler.createJob(request.toJob(), request.inlineRules()))
                .map(job -> ResponseEntity.status(HttpStatus.CREATED).body(job));
    }

    @GetMapping
    @Operation(summary = "List schedules")
    public Mono<ResponseEntity<List<ScheduledJob>>> listSchedules() {
        return Mono.fromCallable(scheduler::listJobs)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get schedule")
    public Mono<ResponseEntity<ScheduledJob>> getSchedule(
            @Parameter(description = "Job ID") @PathVariable String id) {
        return Mono.fromCallable(() -> scheduler.getJob(id))
                .map(ResponseEntity::ok);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update schedule", description = "Patch a job and replace its timer")
    public Mono<ResponseEntity<ScheduledJob>> updateSchedule(
            @Parameter(description = "Job ID") @PathVariable String id,
            @RequestBody ScheduleUpdateRequest request) {
        return Mono.fromCallable(() -> scheduler.updateJob(id, request.toPatch()))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete schedule", description = "Stop the timer and remove the job")
    public Mono<ResponseEntity<Void>> deleteSchedule(
            @Parameter(description = "Job ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> scheduler.deleteJob(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{id}/run")
    @Operation(summary = "Run schedule now",
               description = "Run one tick immediately; 409 if a tick of the job is already running")
    public Mono<ResponseEntity<JobRun>> runSchedule(
            @Parameter(description = "Job ID") @PathVariable String id) {
        return scheduler.triggerNow(id)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @GetMapping("/{id}/runs")
    @Operation(summary = "Get run history", description = "Runs of a job, newest first")
    public Mono<ResponseEntity<List<JobRun>>> getRuns(
            @Parameter(description = "Job ID") @PathVariable String id,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> {
            scheduler.getJob(id);
            return ResponseEntity.ok(scheduler.getJobRuns(id, limit));
        });
    }
}
