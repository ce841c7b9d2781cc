package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.rules.action.ActionConfigs;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Suspends the execution without holding a thread. Cancelled when the workflow is deleted.
 */
@Component
public class WaitStepExecutor implements StepExecutor {

    public static final String CANCELLED_MESSAGE = "Workflow deleted during execution";

    private final Duration maxWait;

    public WaitStepExecutor(SentinelProperties properties) {
        this.maxWait = properties.getWorkflow().getMaxWait();
    }

    @Override
    public StepType type() {
        return StepType.WAIT;
    }

    @Override
    public void validate(WorkflowStep step, String path, List<String> errors) {
        Duration duration;
        try {
            duration = ActionConfigs.duration(step.getConfig().get("duration"));
        } catch (IllegalArgumentException e) {
            errors.add(path + ".config.duration: " + e.getMessage());
            return;
        }
        if (duration == null) {
            errors.add(path + ".config.duration is required");
        } else if (duration.isNegative() || duration.isZero()) {
            errors.add(path + ".config.duration must be positive");
        } else if (duration.compareTo(maxWait) > 0) {
            errors.add(path + ".config.duration exceeds the maximum of " + maxWait);
        }
    }

    @Override
    public Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope) {
        Duration duration = ActionConfigs.duration(step.getConfig().get("duration"));
        return Mono.delay(duration)
                .map(tick -> StepResult.success(Map.of(
                        "wait_completed", true,
                        "waited_ms", duration.toMillis())))
                .takeUntilOther(scope.cancellation())
                .switchIfEmpty(Mono.fromSupplier(() -> StepResult.failure(CANCELLED_MESSAGE)));
    }
}
