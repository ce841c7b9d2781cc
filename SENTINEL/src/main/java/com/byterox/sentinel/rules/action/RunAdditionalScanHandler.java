package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.client.ScanProvider;
import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.exception.ActionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs a follow-up scan of the target. The result is reported in the outcome only and is
 * not fed back into rule evaluation.
 */
@Slf4j
@Component
public class RunAdditionalScanHandler implements ActionHandler {

    static final String DEFAULT_SCAN_TYPE = "focused";

    private final ScanProvider scanProvider;
    private final Clock clock;

    public RunAdditionalScanHandler(ScanProvider scanProvider, Clock clock) {
        this.scanProvider = scanProvider;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.RUN_ADDITIONAL_SCAN;
    }

    @Override
    public Mono<ActionOutcome> handle(ActionContext context) {
        String target = ActionConfigs.string(context.getConfig(), "target", context.getTarget());
        if (target == null) {
            return Mono.error(new ActionException(type().value(), "No target for additional scan"));
        }
        Map<String, Object> options = new HashMap<>();
        options.put("scan_type", ActionConfigs.string(context.getConfig(), "scanType", DEFAULT_SCAN_TYPE));
        options.put("triggered_by", context.source());
        log.info("Running additional {} scan of {} for {}", options.get("scan_type"), target, context.source());

        return scanProvider.runScan(target, options)
                .map(result -> {
                    Map<String, Object> details = new HashMap<>();
                    details.put("target", target);
                    details.put("scanId", result.getScanId());
                    details.put("scanType", options.get("scan_type"));
                    details.put("securityScore", result.getSummary().getSecurityScore());
                    details.put("riskLevel", result.getSummary().getRiskLevel());
                    details.put("totalFindings", result.getSummary().getTotalFindings());
                    return ActionOutcome.builder()
                            .actionType(type().value())
                            .success(true)
                            .message("Additional scan of " + target + " completed")
                            .details(details)
                            .executedAt(clock.instant())
                            .build();
                })
                .onErrorMap(error -> new ActionException(type().value(),
                        "Additional scan of " + target + " failed: " + error.getMessage(), error));
    }
}
