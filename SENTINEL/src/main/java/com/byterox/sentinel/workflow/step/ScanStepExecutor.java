package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.client.ScanProvider;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.rules.action.ActionConfigs;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans {@code config.target}, or {@code context.target} when the step names none.
 */
@Component
public class ScanStepExecutor implements StepExecutor {

    private final ScanProvider scanProvider;

    public ScanStepExecutor(ScanProvider scanProvider) {
        this.scanProvider = scanProvider;
    }

    @Override
    public StepType type() {
        return StepType.SCAN;
    }

    @Override
    public void validate(WorkflowStep step, String path, List<String> errors) {
        Object options = step.getConfig().get("options");
        if (options != null && !(options instanceof Map)) {
            errors.add(path + ".config.options must be an object");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StepResult> execute(WorkflowStep step, Map<String, Object> context, ExecutionScope scope) {
        String target = ActionConfigs.string(step.getConfig(), "target", ActionConfigs.string(context, "target", null));
        if (target == null) {
            return Mono.just(StepResult.failure("No target for scan step"));
        }
        Object options = step.getConfig().get("options");
        Map<String, Object> scanOptions = options instanceof Map<?, ?> map
                ? new HashMap<>((Map<String, Object>) map) : new HashMap<>();

        return scanProvider.runScan(target, scanOptions)
                .map(result -> StepResult.success(output(target, result)))
                .onErrorResume(error -> Mono.just(StepResult.failure(error.getMessage())));
    }

    static Map<String, Object> output(String target, ScanResult result) {
        ScanResult.Summary summary = result.getSummary();
        Map<String, Object> output = new HashMap<>();
        output.put("scan_completed", true);
        output.put("target", target);
        output.put("security_score", summary.getSecurityScore());
        output.put("risk_level", summary.getRiskLevel());
        output.put("total_findings", summary.getTotalFindings());
        output.put("critical_findings", summary.getCriticalFindings());
        output.put("high_findings", summary.getHighFindings());
        output.put("medium_findings", summary.getMediumFindings());
        output.put("low_findings", summary.getLowFindings());
        return output;
    }
}
