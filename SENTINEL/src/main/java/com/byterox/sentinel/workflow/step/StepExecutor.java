package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.workflow.ExecutionScope;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Executes one kind of workflow step.
 */
public interface StepExecutor {

    StepType type();

    /**
     * Check the step configuration when the workflow is created.
     *
     * @param path prefix for error messages, e.g. {@code steps[2]}
     */
    void validate(WorkflowStep step, String path, List<String> errors);

    /**
     * @param context snapshot of the execution context before this step
     */
    Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope);
}
