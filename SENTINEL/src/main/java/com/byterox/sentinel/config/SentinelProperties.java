package com.byterox.sentinel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for SENTINEL service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Scheduler concurrency and timeouts</li>
 *     <li>Scan provider and mitigation gateway clients</li>
 *     <li>Workflow limits</li>
 *     <li>Notification transports and template overrides</li>
 *     <li>Kafka topics and history retention</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private final Scheduler scheduler = new Scheduler();
    private final ScanProvider scanProvider = new ScanProvider();
    private final Workflow workflow = new Workflow();
    private final Notification notification = new Notification();
    private final Mitigation mitigation = new Mitigation();
    private final Kafka kafka = new Kafka();
    private final History history = new History();
    private final Store configuration = new Store();

    /**
     * Cron scheduling of scan jobs.
     */
    @Data
    public static class Scheduler {
        /** Maximum number of targets scanned in parallel within one tick */
        @Positive
        private int scanConcurrency = 4;

        /** Upper bound for a single target scan */
        private Duration scanTimeout = Duration.ofMinutes(10);

        /** Threads backing the job timers */
        @Positive
        private int poolSize = 4;

        /** Zone used to interpret cron expressions */
        @NotBlank
        private String zone = "UTC";
    }

    /**
     * External scan provider.
     */
    @Data
    public static class ScanProvider {
        private String url = "http://localhost:8090";
        private Duration timeout = Duration.ofMinutes(5);
    }

    /**
     * Workflow execution limits.
     */
    @Data
    public static class Workflow {
        /** Longest accepted wait step */
        private Duration maxWait = Duration.ofHours(24);
    }

    @Data
    public static class Notification {
        /** Validate and log deliveries without contacting external systems */
        private boolean dryRun = true;

        private String fromAddress = "alerts@byterox.io";
        private String slackWebhookUrl;
        private String smsGatewayUrl;
        private String userAgent = "ByteRox-Sentinel/1.0";
        private String dashboardUrl = "http://localhost:3000/dashboard";

        /** Channels used by send_alert when a rule names none */
        private List<String> defaultAlertChannels = new ArrayList<>(List.of("slack"));

        /** Maximum parsed templates held in memory */
        @Positive
        private int templateCacheSize = 256;

        /** Overrides and additions keyed by channel_type */
        private Map<String, Template> templates = new HashMap<>();

        @Data
        public static class Template {
            private String subject;
            private String body;
        }
    }

    /**
     * Firewall and blocklist gateway used by mitigation actions.
     */
    @Data
    public static class Mitigation {
        private String url = "http://localhost:8095";
        private ExecutionMode mode = ExecutionMode.DRY_RUN;
        private Duration defaultBlockDuration = Duration.ofHours(24);
    }

    @Data
    public static class Kafka {
        /** Mirror history and incidents to Kafka */
        private boolean enabled = false;

        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String jobRuns = "sentinel.jobs.runs";
            private String workflowExecutions = "sentinel.workflows.executions";
            private String notifications = "sentinel.notifications";
            private String incidents = "sentinel.incidents";
        }
    }

    @Data
    public static class History {
        /** Entries retained per log before the oldest are dropped */
        @Positive
        private int maxEntries = 10_000;
    }

    @Data
    public static class Store {
        /** Seed default profiles, detection rules and exclusion lists on startup */
        private boolean seedDefaults = true;
    }

    /**
     * Execution mode for mitigation calls.
     */
    public enum ExecutionMode {
        /** Simulate without executing */
        DRY_RUN,
        /** Call the gateway */
        PRODUCTION
    }
}
