package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a job run: either a scan result or the error that replaced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetScanOutcome {

    private String target;

    private boolean success;

    private ScanResult result;

    private String error;

    /** Ids of detection rules matched by the result */
    @Builder.Default
    private List<String> detections = new ArrayList<>();

    @Builder.Default
    private List<ActionOutcome> actions = new ArrayList<>();

    public static TargetScanOutcome succeeded(String target, ScanResult result) {
        return TargetScanOutcome.builder()
                .target(target)
                .success(true)
                .result(result)
                .build();
    }

    public static TargetScanOutcome failed(String target, String error) {
        return TargetScanOutcome.builder()
                .target(target)
                .success(false)
                .error(error)
                .build();
    }
}
