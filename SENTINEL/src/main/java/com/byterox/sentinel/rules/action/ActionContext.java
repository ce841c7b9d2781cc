package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.domain.model.ScanResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything an action handler may read. Rules supply a scan result, workflow steps
 * supply their context as {@code data}.
 */
@Value
@Builder
public class ActionContext {

    String ruleId;

    String ruleName;

    String jobId;

    String target;

    /** Null when dispatched from a workflow */
    ScanResult scanResult;

    @Builder.Default
    Map<String, Object> data = Map.of();

    @Builder.Default
    Map<String, Object> config = Map.of();

    /**
     * Name used in alert text and incident titles.
     */
    public String source() {
        return ruleName != null ? ruleName : "workflow action";
    }
}
