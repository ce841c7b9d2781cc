package com.byterox.sentinel.scheduler;

import com.byterox.sentinel.exception.TimerRaceException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Job handles by job id, with one writer lock per job.
 * <p>
 * A handle is only ever replaced while its job's lock is held. Replacing it without the lock,
 * or replacing a handle other than the one the caller last saw, raises
 * {@link TimerRaceException}.
 */
@Component
public class JobHandleRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, JobHandle> handles = new ConcurrentHashMap<>();
    private final Set<String> runningTicks = ConcurrentHashMap.newKeySet();

    public <T> T withLock(String jobId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobHandle> current(String jobId) {
        return Optional.ofNullable(handles.get(jobId));
    }

    public boolean isCurrent(JobHandle handle) {
        return handle != null && handles.get(handle.getJobId()) == handle;
    }

    /**
     * Swap the job's handle. The previous handle is cancelled. Passing a null replacement
     * removes the job's timer.
     *
     * @param expected the handle the caller observed under the same lock
     */
    public void replace(String jobId, JobHandle expected, JobHandle replacement) {
        ReentrantLock lock = locks.get(jobId);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new TimerRaceException(jobId);
        }
        JobHandle actual = handles.get(jobId);
        if (actual != expected) {
            throw new TimerRaceException(jobId);
        }
        if (replacement == null) {
            handles.remove(jobId);
        } else {
            handles.put(jobId, replacement);
        }
        if (actual != null) {
            actual.cancel();
        }
    }

    /**
     * @return false if a tick of the job is already running
     */
    public boolean tryStartTick(String jobId) {
        return runningTicks.add(jobId);
    }

    public void finishTick(String jobId) {
        runningTicks.remove(jobId);
    }

    public boolean isTickRunning(String jobId) {
        return runningTicks.contains(jobId);
    }

    public int activeCount() {
        return handles.size();
    }

    public int runningTickCount() {
        return runningTicks.size();
    }

    public Collection<JobHandle> handles() {
        return List.copyOf(handles.values());
    }
}
