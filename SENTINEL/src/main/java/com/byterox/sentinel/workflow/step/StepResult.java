package com.byterox.sentinel.workflow.step;

import lombok.Value;

import java.util.Map;

/**
 * Outcome of one workflow step. On success the output is merged into the execution context.
 */
@Value
public class StepResult {

    boolean success;

    Map<String, Object> output;

    String error;

    public static StepResult success(Map<String, Object> output) {
        return new StepResult(true, output != null ? output : Map.of(), null);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, Map.of(), error);
    }
}
