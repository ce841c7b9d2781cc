package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.client.MitigationConnectorClient;
import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.exception.ActionException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds {@code config.entries} (default: the target) to the shared blocklist.
 */
@Component
public class UpdateBlocklistHandler implements ActionHandler {

    private final MitigationConnectorClient mitigationClient;
    private final Clock clock;

    public UpdateBlocklistHandler(MitigationConnectorClient mitigationClient, Clock clock) {
        this.mitigationClient = mitigationClient;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.UPDATE_BLOCKLIST;
    }

    @Override
    public Mono<ActionOutcome> handle(ActionContext context) {
        List<String> entries = ActionConfigs.strings(context.getConfig(), "entries");
        if (entries.isEmpty() && context.getTarget() != null) {
            entries = List.of(context.getTarget());
        }
        if (entries.isEmpty()) {
            return Mono.error(new ActionException(type().value(), "No blocklist entries and no target"));
        }
        List<String> added = entries;
        String reason = ActionConfigs.string(context.getConfig(), "reason",
                "Automation rule '" + context.source() + "'");

        return mitigationClient.updateBlocklist(added, reason)
                .map(result -> {
                    if (!result.isSuccess()) {
                        throw new ActionException(type().value(), "Gateway rejected blocklist update: " + result.getMessage());
                    }
                    Map<String, Object> details = new HashMap<>();
                    details.put("entries", added);
                    details.put("referenceId", result.getReferenceId());
                    details.put("dryRun", result.isDryRun());
                    return ActionOutcome.builder()
                            .actionType(type().value())
                            .success(true)
                            .message("Added " + added.size() + " blocklist entr" + (added.size() == 1 ? "y" : "ies"))
                            .details(details)
                            .executedAt(clock.instant())
                            .build();
                })
                .onErrorMap(error -> !(error instanceof ActionException),
                        error -> new ActionException(type().value(), "Blocklist update failed: " + error.getMessage(), error));
    }
}
