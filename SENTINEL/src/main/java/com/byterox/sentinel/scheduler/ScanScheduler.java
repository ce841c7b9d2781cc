package com.byterox.sentinel.scheduler;

import com.byterox.sentinel.client.ScanProvider;
import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.ChannelTarget;
import com.byterox.sentinel.domain.model.ExclusionList;
import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.domain.model.ScanProfile;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.domain.model.ScheduledJob;
import com.byterox.sentinel.domain.model.TargetScanOutcome;
import com.byterox.sentinel.domain.repository.HistoryStore;
import com.byterox.sentinel.domain.repository.ScheduledJobRepository;
import com.byterox.sentinel.domain.service.ConfigurationStore;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.ScanProviderException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import com.byterox.sentinel.notification.NotificationDispatcher;
import com.byterox.sentinel.observability.SentinelMetrics;
import com.byterox.sentinel.observability.SentinelStructuredLogger;
import com.byterox.sentinel.observability.SentinelStructuredLogger.JobEventType;
import com.byterox.sentinel.rules.RuleEngine;
import com.byterox.sentinel.rules.RuleValidator;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;

/**
 * Cron-driven scan jobs.
 * <p>
 * Each enabled job owns one {@link JobHandle} that arms a one-shot timer for the next fire time
 * and re-arms itself on every fire. Create, update and delete replace the handle under the
 * job's lock, so a job never has two live timers.
 * <p>
 * A tick scans all targets with bounded parallelism, isolating per-target failures, then runs
 * the job's automation rules, detection classification and notifications before the run is
 * recorded. A fire that arrives while the previous tick of the same job is still running is
 * skipped.
 */
@Slf4j
@Service
public class ScanScheduler {

    static final String TRIGGER_SCAN_COMPLETE = "scan_complete";
    static final String TRIGGER_SCAN_FAILED = "scan_failed";

    private final ScheduledJobRepository jobRepository;
    private final HistoryStore historyStore;
    private final ScanProvider scanProvider;
    private final RuleEngine ruleEngine;
    private final ConfigurationStore configurationStore;
    private final NotificationDispatcher notificationDispatcher;
    private final AutomationEventProducer eventProducer;
    private final TaskScheduler taskScheduler;
    private final JobHandleRegistry handles;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final SentinelProperties.Scheduler properties;
    private final ZoneId zone;
    private final Clock clock;

    public ScanScheduler(ScheduledJobRepository jobRepository,
                         HistoryStore historyStore,
                         ScanProvider scanProvider,
                         RuleEngine ruleEngine,
                         ConfigurationStore configurationStore,
                         NotificationDispatcher notificationDispatcher,
                         AutomationEventProducer eventProducer,
                         TaskScheduler taskScheduler,
                         JobHandleRegistry handles,
                         SentinelMetrics metrics,
                         SentinelStructuredLogger structuredLogger,
                         SentinelProperties sentinelProperties,
                         Clock clock) {
        this.jobRepository = jobRepository;
        this.historyStore = historyStore;
        this.scanProvider = scanProvider;
        this.ruleEngine = ruleEngine;
        this.configurationStore = configurationStore;
        this.notificationDispatcher = notificationDispatcher;
        this.eventProducer = eventProducer;
        this.taskScheduler = taskScheduler;
        this.handles = handles;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = sentinelProperties.getScheduler();
        this.zone = ZoneId.of(properties.getZone());
        this.clock = clock;
    }

    // ========== Job Lifecycle ==========

    public ScheduledJob createJob(ScheduledJob job) {
        return createJob(job, List.of());
    }

    /**
     * Validate and store a job, creating its inline rules first, then arm its timer.
     *
     * @param inlineRules automation rules defined together with the job; their ids are added
     *                    to the job's rule list
     */
    public ScheduledJob createJob(ScheduledJob job, List<AutomationRule> inlineRules) {
        if (job == null) {
            throw ValidationException.of("scheduled job", List.of("job is required"));
        }
        List<AutomationRule> rules = inlineRules != null ? inlineRules : List.of();
        rules.forEach(configurationStore::validateAutomationRule);
        CronSchedule schedule = validate(job);

        job.setId(job.getId() != null && !job.getId().isBlank() ? job.getId() : UUID.randomUUID().toString());
        if (jobRepository.existsById(job.getId())) {
            throw new ValidationException("Scheduled job " + job.getId() + " already exists");
        }
        List<String> ruleIds = new ArrayList<>(job.getAutomationRuleIds() != null ? job.getAutomationRuleIds() : List.of());
        for (AutomationRule rule : rules) {
            ruleIds.add(configurationStore.createAutomationRule(rule).getId());
        }

        Instant now = clock.instant();
        job.setAutomationRuleIds(ruleIds);
        job.setRunCount(0);
        job.setLastRun(null);
        job.setNextRun(null);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);

        ScheduledJob created = handles.withLock(job.getId(), () -> {
            jobRepository.save(job);
            rearm(job, schedule);
            return job;
        });
        structuredLogger.logJobEvent(created.getId(), JobEventType.CREATED,
                "Created scheduled job '" + created.getName() + "'",
                Map.of("cron", created.getCronExpression(),
                        "targets", created.getTargets().size(),
                        "nextRun", String.valueOf(created.getNextRun())));
        return created;
    }

    /**
     * Apply a patch and atomically replace the job's timer. Concurrent updates of the same job
     * are serialized; the last one wins.
     */
    public ScheduledJob updateJob(String id, JobPatch patch) {
        ScheduledJob updated = handles.withLock(id, () -> {
            ScheduledJob existing = jobRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Scheduled job", id));
            ScheduledJob merged = merge(existing, patch);
            CronSchedule schedule = validate(merged);
            merged.setUpdatedAt(clock.instant());
            rearm(merged, schedule);
            return jobRepository.save(merged);
        });
        structuredLogger.logJobEvent(id, JobEventType.UPDATED, "Updated scheduled job '" + updated.getName() + "'",
                Map.of("cron", updated.getCronExpression(),
                        "enabled", updated.isEnabled(),
                        "nextRun", String.valueOf(updated.getNextRun())));
        return updated;
    }

    /**
     * Stop the job's timer and remove it. A running tick finishes and is recorded, but nothing
     * fires afterwards. Deleting an unknown job is a no-op.
     */
    public void deleteJob(String id) {
        boolean removed = handles.withLock(id, () -> {
            handles.replace(id, handles.current(id).orElse(null), null);
            jobRepository.findById(id).ifPresent(job -> job.setNextRun(null));
            return jobRepository.delete(id);
        });
        metrics.setActiveTimers(handles.activeCount());
        if (removed) {
            structuredLogger.logJobEvent(id, JobEventType.DELETED, "Deleted scheduled job",
                    Map.of("tickRunning", handles.isTickRunning(id)));
        }
    }

    public List<ScheduledJob> listJobs() {
        return jobRepository.findAll().stream()
                .sorted(Comparator.comparing(ScheduledJob::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public ScheduledJob getJob(String id) {
        return jobRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Scheduled job", id));
    }

    /**
     * Run history of a job, newest first.
     */
    public List<JobRun> getJobRuns(String jobId, int limit) {
        return historyStore.findJobRuns(jobId, limit);
    }

    /**
     * Run a tick now. Empty if a tick of the job is already running.
     * The tick runs to completion even if the caller cancels.
     */
    public Mono<JobRun> triggerNow(String id) {
        return Mono.defer(() -> {
            getJob(id);
            Mono<JobRun> tick = onTick(id).cache();
            tick.subscribe(
                    run -> log.debug("Job {} run {} recorded on demand", id, run.getRunNumber()),
                    error -> log.error("Manual tick of job {} failed", id, error));
            return tick;
        });
    }

    // ========== Ticks ==========

    /**
     * Execute one tick of the job.
     *
     * @return the recorded run, or empty when the job is gone or a tick is already running
     */
    public Mono<JobRun> onTick(String jobId) {
        return Mono.defer(() -> {
            Optional<ScheduledJob> found = jobRepository.findById(jobId);
            if (found.isEmpty()) {
                log.debug("Tick for unknown job {} ignored", jobId);
                return Mono.empty();
            }
            if (!handles.tryStartTick(jobId)) {
                metrics.recordTickSkipped();
                structuredLogger.logJobEvent(jobId, JobEventType.TICK_SKIPPED,
                        "Previous tick still running, skipping", Map.of());
                return Mono.empty();
            }

            ScheduledJob job = found.get();
            Timer.Sample sample = metrics.startTick();
            Instant startedAt = clock.instant();
            structuredLogger.logJobEvent(jobId, JobEventType.TICK_STARTED, "Tick started",
                    Map.of("targets", job.getTargets().size()));

            Map<String, Object> options = scanOptions(job);
            return Flux.fromIterable(job.getTargets())
                    .flatMapSequential(target -> scanTarget(target, options), properties.getScanConcurrency())
                    .collectList()
                    // Triggers and notifications start only once every scan of the batch finished
                    .flatMap(scanned -> Flux.fromIterable(scanned)
                            .concatMap(outcome -> afterScan(job, outcome, startedAt))
                            .collectList())
                    .map(outcomes -> completeRun(job, startedAt, outcomes, sample))
                    .doOnError(error -> {
                        metrics.recordTickAborted(sample);
                        structuredLogger.logJobEvent(jobId, JobEventType.TICK_FAILED,
                                "Tick failed: " + error.getMessage(), Map.of());
                    })
                    .doFinally(signal -> handles.finishTick(jobId));
        });
    }

    private Mono<TargetScanOutcome> scanTarget(String target, Map<String, Object> options) {
        return Mono.defer(() -> {
                    Optional<String> exclusion = configurationStore.findExclusion(target).map(ExclusionList::getName);
                    if (exclusion.isPresent()) {
                        return Mono.just(TargetScanOutcome.failed(target,
                                "Target excluded by exclusion list '" + exclusion.get() + "'"));
                    }
                    return scanProvider.runScan(target, options)
                            .timeout(properties.getScanTimeout())
                            .map(result -> TargetScanOutcome.succeeded(target, result))
                            .switchIfEmpty(Mono.fromSupplier(() ->
                                    TargetScanOutcome.failed(target, "Scan provider returned no result")));
                })
                .onErrorResume(error -> {
                    String message = error instanceof TimeoutException
                            ? "Scan timed out after " + properties.getScanTimeout()
                            : error.getMessage();
                    if (!(error instanceof ScanProviderException)) {
                        log.warn("Scan of {} failed unexpectedly: {}", target, message);
                    }
                    return Mono.just(TargetScanOutcome.failed(target, message));
                });
    }

    /**
     * Rules, detections and notifications for one entry. Never errors.
     */
    private Mono<TargetScanOutcome> afterScan(ScheduledJob job, TargetScanOutcome outcome, Instant startedAt) {
        if (!outcome.isSuccess()) {
            return notify(TRIGGER_SCAN_FAILED, job, failureData(job, outcome))
                    .thenReturn(outcome);
        }
        ScanResult result = outcome.getResult();
        return ruleEngine.checkTriggers(job, result)
                .onErrorResume(error -> {
                    log.error("Rule evaluation failed for job {} target {}: {}",
                            job.getId(), outcome.getTarget(), error.getMessage());
                    return Mono.just(List.of());
                })
                .flatMap(actions -> {
                    outcome.setActions(new ArrayList<>(actions));
                    outcome.setDetections(new ArrayList<>(ruleEngine.classifyDetections(result)));
                    Map<String, Object> data = resultData(job, result, startedAt);
                    return sendJobNotifications(job, data)
                            .then(notify(TRIGGER_SCAN_COMPLETE, job, data))
                            .thenReturn(outcome);
                });
    }

    private Mono<Void> sendJobNotifications(ScheduledJob job, Map<String, Object> data) {
        ScheduledJob.NotificationSettings settings = job.getNotificationSettings();
        if (settings == null || !settings.isEnabled() || settings.getChannels() == null) {
            return Mono.empty();
        }
        return Flux.fromIterable(settings.getChannels())
                .concatMap(channel -> notificationDispatcher
                        .send(settings.getType(), channel.getChannel(), data, channel.getOptions())
                        .onErrorResume(error -> {
                            log.warn("Job {} notification on {} failed: {}", job.getId(),
                                    channel.getChannel(), error.getMessage());
                            return Mono.empty();
                        }))
                .then();
    }

    private Mono<Void> notify(String trigger, ScheduledJob job, Map<String, Object> data) {
        return notificationDispatcher.processTrigger(trigger, data)
                .onErrorResume(error -> {
                    log.warn("Notification trigger {} for job {} failed: {}", trigger, job.getId(), error.getMessage());
                    return Mono.just(List.of());
                })
                .then();
    }

    private JobRun completeRun(ScheduledJob job, Instant startedAt, List<TargetScanOutcome> outcomes,
                               Timer.Sample sample) {
        Instant completedAt = clock.instant();
        long runNumber = handles.withLock(job.getId(), () -> {
            Optional<JobHandle> handle = handles.current(job.getId());
            Optional<ScheduledJob> updated = jobRepository.update(job.getId(), current -> {
                current.setRunCount(current.getRunCount() + 1);
                current.setLastRun(startedAt);
                current.setNextRun(handle.map(JobHandle::getNextFireTime).orElse(null));
                return current;
            });
            if (updated.isEmpty()) {
                job.setNextRun(null);
                log.info("Job {} was deleted during its tick; recording the run without rescheduling", job.getId());
                return job.getRunCount() + 1;
            }
            return updated.get().getRunCount();
        });

        JobRun run = JobRun.builder()
                .runId(UUID.randomUUID().toString())
                .jobId(job.getId())
                .jobName(job.getName())
                .runNumber(runNumber)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .results(outcomes)
                .build();
        historyStore.appendJobRun(run);
        eventProducer.publishJobRun(run);

        metrics.recordTickCompleted(sample, run.getSucceeded(), run.getFailed());
        structuredLogger.logJobEvent(job.getId(), JobEventType.TICK_COMPLETED, "Tick completed",
                Map.of("run", runNumber,
                        "succeeded", run.getSucceeded(),
                        "failed", run.getFailed(),
                        "durationMs", Duration.between(startedAt, completedAt).toMillis()));
        return run;
    }

    // ========== Timers ==========

    /**
     * Arm timers for jobs already present in the repository.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void armStoredJobs() {
        for (ScheduledJob job : jobRepository.findAll()) {
            if (job.isEnabled() && handles.current(job.getId()).isEmpty()) {
                try {
                    CronSchedule schedule = CronSchedule.parse(job.getCronExpression());
                    handles.withLock(job.getId(), () -> {
                        rearm(job, schedule);
                        return jobRepository.save(job);
                    });
                } catch (ValidationException e) {
                    log.error("Stored job {} has an invalid schedule and was not armed: {}", job.getId(), e.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        handles.handles().forEach(JobHandle::cancel);
        log.info("Scan scheduler stopped");
    }

    /**
     * Replace the job's handle. Caller holds the job lock.
     */
    private void rearm(ScheduledJob job, CronSchedule schedule) {
        JobHandle previous = handles.current(job.getId()).orElse(null);
        if (!job.isEnabled()) {
            handles.replace(job.getId(), previous, null);
            job.setNextRun(null);
        } else {
            JobHandle handle = new JobHandle(job.getId(), schedule);
            handles.replace(job.getId(), previous, handle);
            job.setNextRun(schedule(handle, clock.instant()));
        }
        metrics.setActiveTimers(handles.activeCount());
    }

    private Instant schedule(JobHandle handle, Instant after) {
        Instant next = handle.getSchedule().next(after, zone);
        if (next == null) {
            log.warn("Job {} has no further fire time", handle.getJobId());
            return null;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(handle), next);
        handle.arm(future, next);
        return next;
    }

    /**
     * Timer callback: re-arm for the next occurrence, then run the tick.
     * <p>
     * A timer may wake slightly before its fire time. The wake still counts as that fire time,
     * so the next occurrence is computed from the later of now and the armed time.
     */
    void fire(JobHandle handle) {
        String jobId = handle.getJobId();
        boolean live = handles.withLock(jobId, () -> {
            if (handle.isCancelled() || !handles.isCurrent(handle)) {
                return false;
            }
            Instant now = clock.instant();
            Instant armed = handle.getNextFireTime();
            Instant next = schedule(handle, armed != null && armed.isAfter(now) ? armed : now);
            jobRepository.update(jobId, job -> {
                job.setNextRun(next);
                return job;
            });
            return true;
        });
        if (!live) {
            log.debug("Stale timer for job {} ignored", jobId);
            return;
        }
        onTick(jobId).subscribe(
                run -> log.debug("Job {} run {} recorded", jobId, run.getRunNumber()),
                error -> log.error("Tick of job {} failed", jobId, error));
    }

    // ========== Private Methods ==========

    private CronSchedule validate(ScheduledJob job) {
        List<String> errors = new ArrayList<>();
        CronSchedule schedule = null;
        if (RuleValidator.isBlank(job.getName())) {
            errors.add("name is required");
        }
        if (job.getTargets() == null || job.getTargets().isEmpty()) {
            errors.add("at least one target is required");
        } else if (job.getTargets().stream().anyMatch(RuleValidator::isBlank)) {
            errors.add("targets must not be blank");
        }
        try {
            schedule = CronSchedule.parse(job.getCronExpression());
        } catch (ValidationException e) {
            errors.add(e.getMessage());
        }
        if (job.getScanProfileId() != null && !job.getScanProfileId().isBlank()) {
            try {
                configurationStore.getProfile(job.getScanProfileId());
            } catch (NotFoundException e) {
                errors.add("scanProfileId '" + job.getScanProfileId() + "' does not exist");
            }
        }
        if (job.getAutomationRuleIds() != null) {
            job.getAutomationRuleIds().stream()
                    .filter(ruleId -> configurationStore.findAutomationRule(ruleId).isEmpty())
                    .forEach(ruleId -> errors.add("automation rule '" + ruleId + "' does not exist"));
        }
        ScheduledJob.NotificationSettings settings = job.getNotificationSettings();
        if (settings != null && settings.getChannels() != null) {
            for (int i = 0; i < settings.getChannels().size(); i++) {
                ChannelTarget channel = settings.getChannels().get(i);
                if (channel == null || NotificationChannel.fromValue(channel.getChannel()).isEmpty()) {
                    errors.add("notificationSettings.channels[" + i + "] is not a known channel");
                }
            }
            if (settings.isEnabled() && RuleValidator.isBlank(settings.getType())) {
                errors.add("notificationSettings.type is required");
            }
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of("scheduled job", errors);
        }
        return schedule;
    }

    private static ScheduledJob merge(ScheduledJob existing, JobPatch patch) {
        ScheduledJob merged = ScheduledJob.builder()
                .id(existing.getId())
                .name(existing.getName())
                .targets(new ArrayList<>(existing.getTargets()))
                .cronExpression(existing.getCronExpression())
                .scanOptions(new HashMap<>(existing.getScanOptions()))
                .scanProfileId(existing.getScanProfileId())
                .automationRuleIds(new ArrayList<>(existing.getAutomationRuleIds()))
                .notificationSettings(existing.getNotificationSettings())
                .enabled(existing.isEnabled())
                .lastRun(existing.getLastRun())
                .nextRun(existing.getNextRun())
                .runCount(existing.getRunCount())
                .createdAt(existing.getCreatedAt())
                .updatedAt(existing.getUpdatedAt())
                .build();
        if (patch == null) {
            return merged;
        }
        if (patch.getName() != null) {
            merged.setName(patch.getName());
        }
        if (patch.getTargets() != null) {
            merged.setTargets(new ArrayList<>(patch.getTargets()));
        }
        if (patch.getCronExpression() != null) {
            merged.setCronExpression(patch.getCronExpression());
        }
        if (patch.getScanOptions() != null) {
            merged.setScanOptions(new HashMap<>(patch.getScanOptions()));
        }
        if (patch.getScanProfileId() != null) {
            merged.setScanProfileId(patch.getScanProfileId().isBlank() ? null : patch.getScanProfileId());
        }
        if (patch.getAutomationRuleIds() != null) {
            merged.setAutomationRuleIds(new ArrayList<>(patch.getAutomationRuleIds()));
        }
        if (patch.getNotificationSettings() != null) {
            merged.setNotificationSettings(patch.getNotificationSettings());
        }
        if (patch.getEnabled() != null) {
            merged.setEnabled(patch.getEnabled());
        }
        return merged;
    }

    /**
     * Profile configuration overlaid by the job's own options.
     */
    private Map<String, Object> scanOptions(ScheduledJob job) {
        Map<String, Object> options = new HashMap<>();
        if (job.getScanProfileId() != null) {
            try {
                ScanProfile profile = configurationStore.getProfile(job.getScanProfileId());
                if (profile.getConfig() != null) {
                    options.putAll(profile.getConfig());
                }
            } catch (NotFoundException e) {
                log.warn("Job {} references missing scan profile {}", job.getId(), job.getScanProfileId());
            }
        }
        if (job.getScanOptions() != null) {
            options.putAll(job.getScanOptions());
        }
        return options;
    }

    static Map<String, Object> resultData(ScheduledJob job, ScanResult result, Instant startedAt) {
        ScanResult.Summary summary = result.getSummary() != null ? result.getSummary() : new ScanResult.Summary();
        Map<String, Object> summaryMap = new LinkedHashMap<>();
        summaryMap.put("securityScore", summary.getSecurityScore());
        summaryMap.put("riskLevel", summary.getRiskLevel());
        summaryMap.put("totalFindings", summary.getTotalFindings());
        summaryMap.put("criticalFindings", summary.getCriticalFindings());
        summaryMap.put("highFindings", summary.getHighFindings());
        summaryMap.put("mediumFindings", summary.getMediumFindings());
        summaryMap.put("lowFindings", summary.getLowFindings());

        Map<String, Object> data = new HashMap<>();
        data.put("target", result.getTarget());
        data.put("scan_id", result.getScanId());
        data.put("job_id", job.getId());
        data.put("job_name", job.getName());
        data.put("security_score", summary.getSecurityScore());
        data.put("risk_level", summary.getRiskLevel());
        data.put("total_findings", summary.getTotalFindings());
        data.put("critical_issues", summary.getCriticalFindings());
        data.put("high_issues", summary.getHighFindings());
        data.put("medium_issues", summary.getMediumFindings());
        data.put("low_issues", summary.getLowFindings());
        data.put("completed_at", result.getCompletedAt() != null ? result.getCompletedAt().toString() : null);
        Instant begin = result.getStartedAt() != null ? result.getStartedAt() : startedAt;
        Instant end = result.getCompletedAt() != null ? result.getCompletedAt() : begin;
        data.put("scan_duration", Duration.between(begin, end).toMillis());
        data.put("summary", summaryMap);
        return data;
    }

    private static Map<String, Object> failureData(ScheduledJob job, TargetScanOutcome outcome) {
        Map<String, Object> data = new HashMap<>();
        data.put("target", outcome.getTarget());
        data.put("job_id", job.getId());
        data.put("job_name", job.getName());
        data.put("error", outcome.getError());
        return data;
    }
}
