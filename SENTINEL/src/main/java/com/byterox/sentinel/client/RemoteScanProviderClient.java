package com.byterox.sentinel.client;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.exception.ScanProviderException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Client for the scan provider's REST API.
 * <p>
 * Every response is checked against the normalized result shape before it reaches the
 * rule engine. No retries: a failed target is recorded and the next tick tries again.
 */
@Slf4j
@Component
public class RemoteScanProviderClient implements ScanProvider {

    private final WebClient webClient;
    private final Duration timeout;

    public RemoteScanProviderClient(WebClient.Builder webClientBuilder, SentinelProperties properties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getScanProvider().getUrl())
                .build();
        this.timeout = properties.getScanProvider().getTimeout();
    }

    @Override
    @CircuitBreaker(name = "scan-provider")
    public Mono<ScanResult> runScan(String target, Map<String, Object> options) {
        log.debug("Requesting scan of {} with options {}", target, options != null ? options.keySet() : "none");

        Map<String, Object> request = new HashMap<>();
        request.put("target", target);
        request.put("options", options != null ? options : Map.of());

        return webClient.post()
                .uri("/api/v1/scans")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ScanResult.class)
                .timeout(timeout)
                .map(result -> normalize(target, result))
                .onErrorMap(error -> !(error instanceof ScanProviderException), error -> wrap(target, error))
                .doOnError(error -> log.warn("Scan of {} failed: {}", target, error.getMessage()));
    }

    /**
     * Check scan provider health.
     */
    public Mono<Boolean> isHealthy() {
        return webClient.get()
                .uri("/actuator/health")
                .retrieve()
                .bodyToMono(Map.class)
                .map(response -> "UP".equals(response.get("status")))
                .onErrorReturn(false);
    }

    // ========== Private Methods ==========

    static ScanResult normalize(String target, ScanResult result) {
        if (result == null || result.getSummary() == null) {
            throw new ScanProviderException(target, "Scan provider returned no summary for " + target);
        }
        int score = result.getSummary().getSecurityScore();
        if (score < 0 || score > 100) {
            throw new ScanProviderException(target, "Security score out of range for " + target + ": " + score);
        }
        if (result.getTarget() == null) {
            result.setTarget(target);
        }
        return result;
    }

    private ScanProviderException wrap(String target, Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return new ScanProviderException(target,
                    "Scan provider responded " + response.getStatusCode().value() + " for " + target, error);
        }
        return new ScanProviderException(target, "Scan of " + target + " failed: " + error.getMessage(), error);
    }
}
