package com.byterox.sentinel.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for SENTINEL service.
 * <p>
 * Every event is written as {@code message | data={json}} inside an MDC scope carrying
 * the job, workflow or execution identifier.
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_WORKFLOW_ID = "workflowId";
    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    /**
     * Log a scheduled job event.
     */
    public void logJobEvent(String jobId, JobEventType eventType, String message,
                            Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_JOB_ID, nullToEmpty(jobId)))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("jobId", jobId);

            switch (eventType) {
                case TICK_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case TICK_SKIPPED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a rule evaluation or action event.
     */
    public void logRuleEvent(String ruleId, RuleEventType eventType, String message,
                             Map<String, Object> details) {
        Map<String, Object> logData = baseData(eventType.name(), details);
        logData.put("ruleId", ruleId);

        switch (eventType) {
            case ACTION_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
            case ACTION_UNSUPPORTED, UNKNOWN_OPERATOR -> log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a workflow execution event.
     */
    public void logWorkflowEvent(String workflowId, String executionId, WorkflowEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_WORKFLOW_ID, nullToEmpty(workflowId),
                MDC_EXECUTION_ID, nullToEmpty(executionId)))) {

            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("workflowId", workflowId);
            if (executionId != null) {
                logData.put("executionId", executionId);
            }

            switch (eventType) {
                case STEP_FAILED, FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case CANCELLED -> log.warn("{} | data={}", message, formatLogData(logData));
                case STEP_COMPLETED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a notification delivery event.
     */
    public void logNotificationEvent(String notificationId, NotificationEventType eventType,
                                     String message, Map<String, Object> details) {
        Map<String, Object> logData = baseData(eventType.name(), details);
        logData.put("notificationId", notificationId);

        switch (eventType) {
            case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
            case TEMPLATE_MISSING -> log.warn("{} | data={}", message, formatLogData(logData));
            default -> log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> baseData(String event, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : new HashMap<>(data).entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum JobEventType {
        CREATED, UPDATED, DELETED, TICK_STARTED, TICK_COMPLETED, TICK_SKIPPED, TICK_FAILED
    }

    public enum RuleEventType {
        TRIGGERED, DETECTION_MATCHED, ACTION_DISPATCHED, ACTION_FAILED, ACTION_UNSUPPORTED, UNKNOWN_OPERATOR
    }

    public enum WorkflowEventType {
        STARTED, STEP_COMPLETED, STEP_FAILED, COMPLETED, FAILED, CANCELLED
    }

    public enum NotificationEventType {
        SENT, FAILED, TEMPLATE_MISSING
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
