package com.byterox.sentinel.health;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.scheduler.JobHandleRegistry;
import com.byterox.sentinel.workflow.WorkflowEngine;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for SENTINEL service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Armed job timers and running ticks</li>
 *     <li>Running workflow executions</li>
 *     <li>Dry-run state of notifications and mitigation</li>
 *     <li>Scan provider circuit breaker</li>
 * </ul>
 * An open scan provider circuit reports DOWN; scheduled ticks would fail every target.
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    static final String SCAN_PROVIDER_BREAKER = "scan-provider";

    private final JobHandleRegistry handles;
    private final WorkflowEngine workflowEngine;
    private final SentinelProperties properties;
    private final ObjectProvider<CircuitBreakerRegistry> circuitBreakers;

    public SentinelHealthIndicator(JobHandleRegistry handles,
                                   WorkflowEngine workflowEngine,
                                   SentinelProperties properties,
                                   ObjectProvider<CircuitBreakerRegistry> circuitBreakers) {
        this.handles = handles;
        this.workflowEngine = workflowEngine;
        this.properties = properties;
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        details.put("activeTimers", handles.activeCount());
        details.put("runningTicks", handles.runningTickCount());
        details.put("runningExecutions", workflowEngine.runningCount());
        details.put("notificationDryRun", properties.getNotification().isDryRun());
        details.put("mitigationMode", properties.getMitigation().getMode().name());
        details.put("kafkaEnabled", properties.getKafka().isEnabled());

        CircuitBreakerRegistry registry = circuitBreakers.getIfAvailable();
        if (registry != null) {
            CircuitBreaker.State state = registry.find(SCAN_PROVIDER_BREAKER)
                    .map(CircuitBreaker::getState)
                    .orElse(CircuitBreaker.State.CLOSED);
            details.put("scanProvider.circuit", state.name());
            if (state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN) {
                healthy = false;
                details.put("scanProvider.error", "Scan provider circuit is " + state);
            }
        } else {
            details.put("scanProvider.circuit", "UNKNOWN");
        }

        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }
}
