package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.rules.action.ActionConfigs;
import com.byterox.sentinel.rules.action.ActionContext;
import com.byterox.sentinel.rules.action.ActionRegistry;
import com.byterox.sentinel.rules.action.ActionType;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches {@code config.actionType} through the action registry with the context as data.
 */
@Component
public class ActionStepExecutor implements StepExecutor {

    private final ActionRegistry actionRegistry;

    public ActionStepExecutor(ActionRegistry actionRegistry) {
        this.actionRegistry = actionRegistry;
    }

    @Override
    public StepType type() {
        return StepType.ACTION;
    }

    @Override
    public void validate(WorkflowStep step, String path, List<String> errors) {
        String actionType = ActionConfigs.string(step.getConfig(), "actionType", null);
        if (actionType == null) {
            errors.add(path + ".config.actionType is required");
        } else if (ActionType.fromValue(actionType).isEmpty()) {
            errors.add(path + ".config.actionType '" + actionType + "' is not a known action");
        }
        Object config = step.getConfig().get("config");
        if (config != null && !(config instanceof Map)) {
            errors.add(path + ".config.config must be an object");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope) {
        String actionType = ActionConfigs.string(step.getConfig(), "actionType", null);
        Map<String, Object> actionConfig = step.getConfig().get("config") instanceof Map<?, ?> map
                ? (Map<String, Object>) map : Map.of();

        ActionContext actionContext = ActionContext.builder()
                .ruleName(step.displayName())
                .target(ActionConfigs.string(context, "target", null))
                .data(context)
                .config(actionConfig)
                .build();

        return actionRegistry.dispatch(actionType, actionContext)
                .map(outcome -> {
                    if (!outcome.isSuccess()) {
                        return StepResult.failure("Action " + actionType + " failed: " + outcome.getMessage());
                    }
                    Map<String, Object> output = new HashMap<>();
                    if (outcome.getDetails() != null) {
                        output.putAll(outcome.getDetails());
                    }
                    output.put("action_executed", true);
                    output.put("action_type", actionType);
                    return StepResult.success(output);
                })
                .onErrorResume(error -> Mono.just(StepResult.failure(error.getMessage())));
    }
}
