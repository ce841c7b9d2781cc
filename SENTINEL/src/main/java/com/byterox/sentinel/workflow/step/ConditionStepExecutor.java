package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.rules.ConditionEvaluator;
import com.byterox.sentinel.rules.RuleValidator;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Evaluates conditions against the context and forwards the boolean as {@code condition_result}.
 * Never fails: a false condition is a result, not an error.
 */
@Component
public class ConditionStepExecutor implements StepExecutor {

    @Override
    public StepType type() {
        return StepType.CONDITION;
    }

    @Override
    public void validate(WorkflowStep step, String path, List<String> errors) {
        Object nested = step.getConfig().get("conditions");
        if (nested != null && !(nested instanceof Collection)) {
            errors.add(path + ".config.conditions must be a list");
            return;
        }
        List<RuleCondition> conditions = conditions(step.getConfig());
        if (conditions.isEmpty()) {
            errors.add(path + ".config requires field, operator and threshold, or conditions");
        }
        for (int i = 0; i < conditions.size(); i++) {
            String conditionPath = nested != null ? path + ".config.conditions[" + i + "]" : path + ".config";
            RuleValidator.validateCondition(conditions.get(i), conditionPath, false, errors);
        }
    }

    @Override
    public Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope) {
        boolean result = ConditionEvaluator.evaluateAll(conditions(step.getConfig()), context);
        return Mono.just(StepResult.success(Map.of("condition_result", result)));
    }

    static List<RuleCondition> conditions(Map<String, Object> config) {
        List<RuleCondition> conditions = new ArrayList<>();
        if (config.get("conditions") instanceof Collection<?> entries) {
            for (Object entry : entries) {
                conditions.add(entry instanceof Map<?, ?> map ? toCondition(map) : null);
            }
        } else if (config.containsKey("field") || config.containsKey("operator")) {
            conditions.add(toCondition(config));
        }
        return conditions;
    }

    private static RuleCondition toCondition(Map<?, ?> map) {
        Object threshold = map.containsKey("threshold") ? map.get("threshold") : map.get("value");
        return RuleCondition.builder()
                .field(map.get("field") != null ? map.get("field").toString() : null)
                .operator(map.get("operator") != null ? map.get("operator").toString() : null)
                .threshold(threshold)
                .build();
    }
}
