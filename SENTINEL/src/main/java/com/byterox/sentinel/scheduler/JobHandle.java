package com.byterox.sentinel.scheduler;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The timer registration of one scheduled job. Each fire re-arms the same handle with the
 * next one-shot timer; cancelling the handle stops the chain.
 */
public class JobHandle {

    @Getter
    private final String jobId;

    /** Distinguishes this registration from earlier ones of the same job */
    @Getter
    private final String token = UUID.randomUUID().toString();

    @Getter
    private final CronSchedule schedule;

    private final AtomicReference<ScheduledFuture<?>> future = new AtomicReference<>();
    private final AtomicReference<Instant> nextFireTime = new AtomicReference<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public JobHandle(String jobId, CronSchedule schedule) {
        this.jobId = jobId;
        this.schedule = schedule;
    }

    void arm(ScheduledFuture<?> scheduled, Instant fireTime) {
        nextFireTime.set(fireTime);
        ScheduledFuture<?> previous = future.getAndSet(scheduled);
        if (cancelled.get()) {
            scheduled.cancel(false);
        } else if (previous != null && !previous.isDone()) {
            previous.cancel(false);
        }
    }

    /**
     * Stop the timer. A tick that is already running is not interrupted.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            nextFireTime.set(null);
            ScheduledFuture<?> current = future.get();
            if (current != null) {
                current.cancel(false);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Instant getNextFireTime() {
        return nextFireTime.get();
    }
}
