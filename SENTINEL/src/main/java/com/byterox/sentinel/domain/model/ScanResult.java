package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Normalized result document returned by the scan provider for one target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    /** Provider-assigned scan identifier, if any */
    private String scanId;

    /** Scanned target (domain or IP) */
    private String target;

    private Summary summary;

    private Instant startedAt;

    private Instant completedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        /** 0-100, higher is safer */
        private int securityScore;
        private String riskLevel;
        private int totalFindings;
        private int criticalFindings;
        private int highFindings;
        private int mediumFindings;
        private int lowFindings;
    }
}
