package com.byterox.sentinel.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for SENTINEL service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Scheduled job ticks (runs, skips, per-target outcomes, duration)</li>
 *     <li>Rule triggers and action dispatch</li>
 *     <li>Workflow executions</li>
 *     <li>Notification delivery by channel</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Scheduler metrics
    @Getter
    private final Counter ticksCompleted;
    @Getter
    private final Counter ticksSkipped;
    @Getter
    private final Counter targetsSucceeded;
    @Getter
    private final Counter targetsFailed;
    private final Timer tickDuration;
    @Getter
    private final AtomicInteger activeTimers;
    @Getter
    private final AtomicInteger runningTicks;

    // Rule metrics
    @Getter
    private final Counter rulesTriggered;
    @Getter
    private final Counter detectionsMatched;
    private final Map<String, Counter> actionsDispatched = new ConcurrentHashMap<>();
    private final Map<String, Counter> actionsFailed = new ConcurrentHashMap<>();

    // Workflow metrics
    @Getter
    private final Counter executionsStarted;
    @Getter
    private final Counter executionsCompleted;
    @Getter
    private final Counter executionsFailed;
    private final Timer executionDuration;
    @Getter
    private final AtomicInteger runningExecutions;

    // Notification metrics
    private final Map<String, Counter> notificationsSent = new ConcurrentHashMap<>();
    private final Map<String, Counter> notificationsFailed = new ConcurrentHashMap<>();

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ticksCompleted = Counter.builder("sentinel.jobs.ticks")
                .description("Scheduled job ticks completed")
                .register(meterRegistry);
        this.ticksSkipped = Counter.builder("sentinel.jobs.ticks.skipped")
                .description("Ticks skipped because the previous tick was still running")
                .register(meterRegistry);
        this.targetsSucceeded = Counter.builder("sentinel.jobs.targets.succeeded")
                .description("Target scans that produced a result")
                .register(meterRegistry);
        this.targetsFailed = Counter.builder("sentinel.jobs.targets.failed")
                .description("Target scans that failed or were excluded")
                .register(meterRegistry);
        this.tickDuration = Timer.builder("sentinel.jobs.tick.duration")
                .description("Duration of a full job tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.activeTimers = meterRegistry.gauge("sentinel.jobs.timers.active", new AtomicInteger(0));
        this.runningTicks = meterRegistry.gauge("sentinel.jobs.ticks.running", new AtomicInteger(0));

        this.rulesTriggered = Counter.builder("sentinel.rules.triggered")
                .description("Automation rules whose condition held")
                .register(meterRegistry);
        this.detectionsMatched = Counter.builder("sentinel.rules.detections")
                .description("Detection rule matches")
                .register(meterRegistry);

        this.executionsStarted = Counter.builder("sentinel.workflows.executions.started")
                .description("Workflow executions started")
                .register(meterRegistry);
        this.executionsCompleted = Counter.builder("sentinel.workflows.executions.completed")
                .description("Workflow executions completed")
                .register(meterRegistry);
        this.executionsFailed = Counter.builder("sentinel.workflows.executions.failed")
                .description("Workflow executions failed")
                .register(meterRegistry);
        this.executionDuration = Timer.builder("sentinel.workflows.executions.duration")
                .description("Workflow execution duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.runningExecutions = meterRegistry.gauge("sentinel.workflows.executions.running",
                new AtomicInteger(0));
    }

    // ========== Scheduler Methods ==========

    public Timer.Sample startTick() {
        runningTicks.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordTickCompleted(Timer.Sample sample, long succeeded, long failed) {
        sample.stop(tickDuration);
        runningTicks.decrementAndGet();
        ticksCompleted.increment();
        targetsSucceeded.increment(succeeded);
        targetsFailed.increment(failed);
    }

    public void recordTickAborted(Timer.Sample sample) {
        sample.stop(tickDuration);
        runningTicks.decrementAndGet();
    }

    public void recordTickSkipped() {
        ticksSkipped.increment();
    }

    public void setActiveTimers(int count) {
        activeTimers.set(count);
    }

    // ========== Rule Methods ==========

    public void recordRuleTriggered() {
        rulesTriggered.increment();
    }

    public void recordDetection() {
        detectionsMatched.increment();
    }

    public void recordActionDispatched(String actionType) {
        counter(actionsDispatched, "sentinel.actions.dispatched", "action_type", actionType).increment();
    }

    public void recordActionFailed(String actionType) {
        counter(actionsFailed, "sentinel.actions.failed", "action_type", actionType).increment();
    }

    // ========== Workflow Methods ==========

    public Timer.Sample startExecution() {
        executionsStarted.increment();
        runningExecutions.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordExecutionFinished(Timer.Sample sample, boolean completed) {
        sample.stop(executionDuration);
        runningExecutions.decrementAndGet();
        if (completed) {
            executionsCompleted.increment();
        } else {
            executionsFailed.increment();
        }
    }

    // ========== Notification Methods ==========

    public void recordNotificationSent(String channel) {
        counter(notificationsSent, "sentinel.notifications.sent", "channel", channel).increment();
    }

    public void recordNotificationFailed(String channel) {
        counter(notificationsFailed, "sentinel.notifications.failed", "channel", channel).increment();
    }

    private Counter counter(Map<String, Counter> cache, String name, String tag, String value) {
        String key = value != null ? value : "unknown";
        return cache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .tag(tag, k)
                        .register(meterRegistry));
    }
}
