package com.byterox.sentinel.rules;

import com.byterox.sentinel.domain.model.ScanResult;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The closed set of paths a rule may reference on a {@link ScanResult}.
 */
public enum ScanResultField {
    TARGET("target", ScanResult::getTarget),
    STARTED_AT("startedAt", ScanResult::getStartedAt),
    COMPLETED_AT("completedAt", ScanResult::getCompletedAt),
    SECURITY_SCORE("summary.securityScore", summary(ScanResult.Summary::getSecurityScore)),
    RISK_LEVEL("summary.riskLevel", summary(ScanResult.Summary::getRiskLevel)),
    TOTAL_FINDINGS("summary.totalFindings", summary(ScanResult.Summary::getTotalFindings)),
    CRITICAL_FINDINGS("summary.criticalFindings", summary(ScanResult.Summary::getCriticalFindings)),
    HIGH_FINDINGS("summary.highFindings", summary(ScanResult.Summary::getHighFindings)),
    MEDIUM_FINDINGS("summary.mediumFindings", summary(ScanResult.Summary::getMediumFindings)),
    LOW_FINDINGS("summary.lowFindings", summary(ScanResult.Summary::getLowFindings));

    private final String path;
    private final Function<ScanResult, Object> extractor;

    ScanResultField(String path, Function<ScanResult, Object> extractor) {
        this.path = path;
        this.extractor = extractor;
    }

    public String path() {
        return path;
    }

    public Object extract(ScanResult result) {
        return result == null ? null : extractor.apply(result);
    }

    public static Optional<ScanResultField> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String trimmed = path.trim();
        return Arrays.stream(values())
                .filter(field -> field.path.equals(trimmed))
                .findFirst();
    }

    public static List<String> paths() {
        return Arrays.stream(values()).map(ScanResultField::path).toList();
    }

    private static Function<ScanResult, Object> summary(Function<ScanResult.Summary, Object> getter) {
        return result -> result.getSummary() == null ? null : getter.apply(result.getSummary());
    }
}
