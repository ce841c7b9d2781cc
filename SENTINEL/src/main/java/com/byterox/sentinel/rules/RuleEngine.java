package com.byterox.sentinel.rules;

import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.DetectionRule;
import com.byterox.sentinel.domain.model.RuleAction;
import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.domain.model.ScheduledJob;
import com.byterox.sentinel.domain.service.ConfigurationStore;
import com.byterox.sentinel.exception.ActionNotSupportedException;
import com.byterox.sentinel.observability.SentinelMetrics;
import com.byterox.sentinel.observability.SentinelStructuredLogger;
import com.byterox.sentinel.observability.SentinelStructuredLogger.RuleEventType;
import com.byterox.sentinel.rules.action.ActionContext;
import com.byterox.sentinel.rules.action.ActionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates automation rules against scan results and dispatches their actions.
 * <p>
 * Rules of a job are processed one after another. A rule whose condition holds is marked
 * triggered before its action runs, so the counter is independent of the handler's success.
 * Failed actions are logged and reported as failed outcomes; they are never retried.
 */
@Slf4j
@Service
public class RuleEngine {

    private final ConfigurationStore configurationStore;
    private final ActionRegistry actionRegistry;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    public RuleEngine(ConfigurationStore configurationStore,
                      ActionRegistry actionRegistry,
                      SentinelMetrics metrics,
                      SentinelStructuredLogger structuredLogger,
                      Clock clock) {
        this.configurationStore = configurationStore;
        this.actionRegistry = actionRegistry;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Changes no state. A disabled rule or an unknown operator evaluates to false; the
     * latter is logged.
     */
    public boolean evaluate(AutomationRule rule, ScanResult result) {
        if (rule == null || !rule.isEnabled() || result == null) {
            return false;
        }
        if (!knownOperator(rule.getId(), rule.getCondition())) {
            return false;
        }
        return ConditionEvaluator.evaluate(rule.getCondition(), result);
    }

    /**
     * Run every enabled rule of the job against one result, each at most once.
     *
     * @return the outcomes of the dispatched actions, in rule order
     */
    public Mono<List<ActionOutcome>> checkTriggers(ScheduledJob job, ScanResult result) {
        List<AutomationRule> rules = rulesOf(job);
        return Flux.fromIterable(rules)
                .filter(rule -> evaluate(rule, result))
                .concatMap(rule -> fire(job, rule, result))
                .collectList();
    }

    /**
     * Dispatch one action. Errors are returned as a failed outcome.
     */
    public Mono<ActionOutcome> dispatchAction(RuleAction action, ActionContext context) {
        String actionType = action != null ? action.getType() : null;
        return actionRegistry.dispatch(actionType, context)
                .map(outcome -> {
                    outcome.setRuleId(context.getRuleId());
                    outcome.setRuleName(context.getRuleName());
                    if (outcome.isSuccess()) {
                        metrics.recordActionDispatched(actionType);
                        structuredLogger.logRuleEvent(context.getRuleId(), RuleEventType.ACTION_DISPATCHED,
                                "Action " + actionType + " completed", Map.of("target", nullSafe(context.getTarget())));
                    } else {
                        metrics.recordActionFailed(actionType);
                        structuredLogger.logRuleEvent(context.getRuleId(), RuleEventType.ACTION_FAILED,
                                "Action " + actionType + " reported failure: " + outcome.getMessage(),
                                Map.of("target", nullSafe(context.getTarget())));
                    }
                    return outcome;
                })
                .onErrorResume(error -> {
                    metrics.recordActionFailed(actionType);
                    RuleEventType eventType = error instanceof ActionNotSupportedException
                            ? RuleEventType.ACTION_UNSUPPORTED : RuleEventType.ACTION_FAILED;
                    structuredLogger.logRuleEvent(context.getRuleId(), eventType,
                            "Action " + actionType + " failed: " + error.getMessage(),
                            Map.of("target", nullSafe(context.getTarget())));
                    ActionOutcome failure = ActionOutcome.failure(actionType, error.getMessage(), clock.instant());
                    failure.setRuleId(context.getRuleId());
                    failure.setRuleName(context.getRuleName());
                    return Mono.just(failure);
                });
    }

    /**
     * Classify a result against the enabled detection rules. Matching rules are counted;
     * no actions are dispatched.
     *
     * @return ids of the matching detection rules
     */
    public List<String> classifyDetections(ScanResult result) {
        if (result == null) {
            return List.of();
        }
        List<String> matched = new ArrayList<>();
        for (DetectionRule rule : configurationStore.listEnabledDetectionRules()) {
            if (rule.getConditions() == null || rule.getConditions().isEmpty()
                    || !rule.getConditions().stream().allMatch(condition -> knownOperator(rule.getId(), condition))) {
                continue;
            }
            if (ConditionEvaluator.evaluateAll(rule.getConditions(), result)) {
                configurationStore.recordDetectionTriggered(rule.getId());
                metrics.recordDetection();
                matched.add(rule.getId());
                structuredLogger.logRuleEvent(rule.getId(), RuleEventType.DETECTION_MATCHED,
                        "Detection rule '" + rule.getName() + "' matched " + result.getTarget(),
                        Map.of("severity", nullSafe(rule.getSeverity()), "target", nullSafe(result.getTarget())));
            }
        }
        return matched;
    }

    // ========== Private Methods ==========

    private Mono<ActionOutcome> fire(ScheduledJob job, AutomationRule rule, ScanResult result) {
        configurationStore.recordRuleTriggered(rule.getId());
        metrics.recordRuleTriggered();
        structuredLogger.logRuleEvent(rule.getId(), RuleEventType.TRIGGERED,
                "Automation rule '" + rule.getName() + "' triggered for " + result.getTarget(),
                Map.of("jobId", nullSafe(job.getId()), "target", nullSafe(result.getTarget())));

        RuleAction action = rule.getAction();
        Map<String, Object> config = action != null && action.getConfig() != null
                ? action.getConfig() : Map.of();
        Map<String, Object> data = new HashMap<>();
        data.put("target", result.getTarget());
        data.put("job_id", job.getId());
        data.put("job_name", job.getName());

        ActionContext context = ActionContext.builder()
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .jobId(job.getId())
                .target(result.getTarget())
                .scanResult(result)
                .data(data)
                .config(config)
                .build();
        return dispatchAction(action, context);
    }

    private boolean knownOperator(String ruleId, RuleCondition condition) {
        if (condition == null || ConditionOperator.fromValue(condition.getOperator()).isPresent()) {
            return true;
        }
        structuredLogger.logRuleEvent(ruleId, RuleEventType.UNKNOWN_OPERATOR,
                "Unknown operator '" + condition.getOperator() + "', condition evaluates to false",
                Map.of("field", nullSafe(condition.getField())));
        return false;
    }

    private List<AutomationRule> rulesOf(ScheduledJob job) {
        if (job == null || job.getAutomationRuleIds() == null) {
            return List.of();
        }
        return job.getAutomationRuleIds().stream()
                .distinct()
                .map(id -> {
                    Optional<AutomationRule> rule = configurationStore.findAutomationRule(id);
                    if (rule.isEmpty()) {
                        log.warn("Job {} references unknown automation rule {}", job.getId(), id);
                    }
                    return rule.orElse(null);
                })
                .filter(Objects::nonNull)
                .toList();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }
}
