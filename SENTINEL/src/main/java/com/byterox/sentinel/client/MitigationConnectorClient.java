package com.byterox.sentinel.client;

import com.byterox.sentinel.config.SentinelProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Client for the firewall and blocklist gateway used by mitigation actions.
 * <p>
 * In DRY_RUN mode (the default) requests are logged and answered locally.
 */
@Slf4j
@Component
public class MitigationConnectorClient {

    private final WebClient webClient;
    private final SentinelProperties properties;
    private final Clock clock;

    public MitigationConnectorClient(WebClient.Builder webClientBuilder, SentinelProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(properties.getMitigation().getUrl())
                .build();
    }

    /**
     * Block the given addresses at the firewall.
     */
    @CircuitBreaker(name = "mitigation-gateway")
    public Mono<MitigationResult> blockIps(List<String> ips, Duration duration, String reason) {
        Duration effective = duration != null ? duration : properties.getMitigation().getDefaultBlockDuration();
        Map<String, Object> request = new HashMap<>();
        request.put("ips", ips);
        request.put("durationSeconds", effective.toSeconds());
        request.put("reason", reason);
        return execute("/api/v1/firewall/blocks", "block_ips", request);
    }

    /**
     * Add entries (domains or addresses) to the shared blocklist.
     */
    @CircuitBreaker(name = "mitigation-gateway")
    public Mono<MitigationResult> updateBlocklist(List<String> entries, String reason) {
        Map<String, Object> request = new HashMap<>();
        request.put("entries", entries);
        request.put("reason", reason);
        return execute("/api/v1/blocklist/entries", "update_blocklist", request);
    }

    // ========== Private Methods ==========

    private Mono<MitigationResult> execute(String path, String operation, Map<String, Object> request) {
        if (properties.getMitigation().getMode() == SentinelProperties.ExecutionMode.DRY_RUN) {
            return executeDryRun(operation, request);
        }

        log.info("Calling mitigation gateway: operation={}, request={}", operation, request);
        return webClient.post()
                .uri(path)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GatewayResponse.class)
                .map(response -> MitigationResult.builder()
                        .success(response.isSuccess())
                        .referenceId(response.getId())
                        .message(response.getMessage())
                        .executedAt(clock.instant())
                        .details(request)
                        .build())
                .doOnSuccess(result -> log.info("Mitigation {} result: success={}, reference={}",
                        operation, result.isSuccess(), result.getReferenceId()))
                .doOnError(error -> log.error("Mitigation {} failed: {}", operation, error.getMessage()));
    }

    private Mono<MitigationResult> executeDryRun(String operation, Map<String, Object> request) {
        log.info("DRY_RUN: Would execute {} with {}", operation, request);

        return Mono.just(MitigationResult.builder()
                .success(true)
                .referenceId("DRY-RUN-" + UUID.randomUUID().toString().substring(0, 8))
                .message("Dry run completed successfully")
                .executedAt(clock.instant())
                .dryRun(true)
                .details(request)
                .build());
    }

    // ========== DTOs ==========

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MitigationResult {
        private boolean success;
        private String referenceId;
        private String message;
        private Instant executedAt;
        private boolean dryRun;
        private Map<String, Object> details;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GatewayResponse {
        private String id;
        private boolean success;
        private String message;
    }
}
