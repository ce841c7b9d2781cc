package com.byterox.sentinel.client;

import com.byterox.sentinel.domain.model.ScanResult;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * The external subsystem that performs reconnaissance and analysis of one target.
 * <p>
 * Implementations emit a normalized {@link ScanResult} or fail with a
 * {@link com.byterox.sentinel.exception.ScanProviderException}.
 */
public interface ScanProvider {

    Mono<ScanResult> runScan(String target, Map<String, Object> options);
}
