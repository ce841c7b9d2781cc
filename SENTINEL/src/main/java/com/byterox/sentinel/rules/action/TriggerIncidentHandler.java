package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.exception.ActionException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Opens an incident on the incidents topic.
 */
@Slf4j
@Component
public class TriggerIncidentHandler implements ActionHandler {

    private final AutomationEventProducer eventProducer;
    private final Clock clock;

    public TriggerIncidentHandler(AutomationEventProducer eventProducer, Clock clock) {
        this.eventProducer = eventProducer;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.TRIGGER_INCIDENT;
    }

    @Override
    public Mono<ActionOutcome> handle(ActionContext context) {
        Map<String, Object> incident = incident(context, clock.instant());
        String incidentId = (String) incident.get("id");

        return eventProducer.publishIncident(incidentId, incident)
                .then(Mono.fromCallable(() -> ActionOutcome.builder()
                        .actionType(type().value())
                        .success(true)
                        .message("Incident " + incidentId + " created")
                        .details(Map.of("incidentId", incidentId, "severity", incident.get("severity")))
                        .executedAt(clock.instant())
                        .build()))
                .onErrorMap(error -> new ActionException(type().value(),
                        "Incident publication failed: " + error.getMessage(), error));
    }

    static Map<String, Object> incident(ActionContext context, Instant now) {
        Map<String, Object> incident = new HashMap<>();
        incident.put("id", "INC-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT));
        incident.put("title", "Automated Detection: " + context.source());
        incident.put("severity", ActionConfigs.string(context.getConfig(), "severity", "high"));
        incident.put("target", context.getTarget());
        incident.put("status", "open");
        incident.put("ruleId", context.getRuleId());
        incident.put("jobId", context.getJobId());
        incident.put("createdAt", now.toString());

        ScanResult result = context.getScanResult();
        String description = ActionConfigs.string(context.getConfig(), "description", null);
        if (description == null) {
            description = "Rule '" + context.source() + "' matched " + context.getTarget();
            if (result != null && result.getSummary() != null) {
                description += " with security score " + result.getSummary().getSecurityScore()
                        + "% and risk level " + result.getSummary().getRiskLevel();
                incident.put("scanId", result.getScanId());
            }
        }
        incident.put("description", description);
        return incident;
    }
}
