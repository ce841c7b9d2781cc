package com.byterox.sentinel.workflow;

import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cancellation handle of one running execution.
 */
public class ExecutionScope {

    @Getter
    private final String executionId;

    @Getter
    private final String workflowId;

    private final Sinks.One<Boolean> cancelSink = Sinks.one();

    private volatile boolean cancelled;

    public ExecutionScope(String executionId, String workflowId) {
        this.executionId = executionId;
        this.workflowId = workflowId;
    }

    /**
     * Emits once when the execution is cancelled. Suspended steps race against it.
     */
    public Mono<Boolean> cancellation() {
        return cancelSink.asMono();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
        cancelSink.tryEmitValue(Boolean.TRUE);
    }
}
