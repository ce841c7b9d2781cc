package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.client.MitigationConnectorClient;
import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.exception.ActionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocks {@code config.ips} (or {@code ips} from the context data) at the firewall gateway.
 */
@Slf4j
@Component
public class BlockIpsHandler implements ActionHandler {

    private final MitigationConnectorClient mitigationClient;
    private final Clock clock;

    public BlockIpsHandler(MitigationConnectorClient mitigationClient, Clock clock) {
        this.mitigationClient = mitigationClient;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.BLOCK_IPS;
    }

    @Override
    public Mono<ActionOutcome> handle(ActionContext context) {
        List<String> ips = ActionConfigs.strings(context.getConfig(), "ips");
        if (ips.isEmpty()) {
            ips = ActionConfigs.strings(context.getData(), "ips");
        }
        if (ips.isEmpty()) {
            return Mono.just(ActionOutcome.builder()
                    .actionType(type().value())
                    .success(true)
                    .message("No IPs to block")
                    .executedAt(clock.instant())
                    .build());
        }

        Duration duration;
        try {
            duration = ActionConfigs.duration(context.getConfig().get("duration"));
        } catch (IllegalArgumentException e) {
            return Mono.error(new ActionException(type().value(), e.getMessage(), e));
        }
        String reason = "Automation rule '" + context.source() + "' triggered for " + context.getTarget();
        List<String> blocked = ips;

        return mitigationClient.blockIps(blocked, duration, reason)
                .map(result -> {
                    if (!result.isSuccess()) {
                        throw new ActionException(type().value(), "Gateway rejected block request: " + result.getMessage());
                    }
                    Map<String, Object> details = new HashMap<>();
                    details.put("ips", blocked);
                    details.put("referenceId", result.getReferenceId());
                    details.put("dryRun", result.isDryRun());
                    return ActionOutcome.builder()
                            .actionType(type().value())
                            .success(true)
                            .message("Blocked " + blocked.size() + " IP(s)")
                            .details(details)
                            .executedAt(clock.instant())
                            .build();
                })
                .onErrorMap(error -> !(error instanceof ActionException),
                        error -> new ActionException(type().value(), "Blocking IPs failed: " + error.getMessage(), error));
    }
}
