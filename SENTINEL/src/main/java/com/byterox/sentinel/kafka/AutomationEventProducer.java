package com.byterox.sentinel.kafka;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.WorkflowExecution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer mirroring history entries and raising incidents.
 * <p>
 * History events are fire-and-forget and only sent when {@code sentinel.kafka.enabled} is set.
 * Incidents always complete; with Kafka disabled they are logged only.
 */
@Component
@Slf4j
public class AutomationEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final SentinelProperties.Kafka kafka;
    private final Counter eventsProducedCounter;
    private final Counter eventsFailedCounter;

    public AutomationEventProducer(
            KafkaTemplate<String, Object> kafkaTemplate,
            SentinelProperties sentinelProperties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafka = sentinelProperties.getKafka();

        this.eventsProducedCounter = Counter.builder("sentinel.kafka.events.produced").register(meterRegistry);
        this.eventsFailedCounter = Counter.builder("sentinel.kafka.events.failed").register(meterRegistry);
    }

    public boolean isEnabled() {
        return kafka.isEnabled();
    }

    /**
     * Publish a finished job tick to the job runs topic.
     */
    public void publishJobRun(JobRun run) {
        if (!kafka.isEnabled()) {
            return;
        }
        Map<String, Object> message = new HashMap<>();
        message.put("runId", run.getRunId());
        message.put("jobId", run.getJobId());
        message.put("jobName", run.getJobName());
        message.put("runNumber", run.getRunNumber());
        message.put("succeeded", run.getSucceeded());
        message.put("failed", run.getFailed());
        message.put("targets", run.getResults().stream().map(r -> r.getTarget()).toList());
        message.put("startedAt", epochMillis(run.getStartedAt()));
        message.put("completedAt", epochMillis(run.getCompletedAt()));

        send(kafka.getTopics().getJobRuns(), run.getJobId(), message, "job run " + run.getRunId());
    }

    /**
     * Publish a terminal workflow execution to the executions topic.
     */
    public void publishExecution(WorkflowExecution execution) {
        if (!kafka.isEnabled()) {
            return;
        }
        Map<String, Object> message = new HashMap<>();
        message.put("executionId", execution.getExecutionId());
        message.put("workflowId", execution.getWorkflowId());
        message.put("workflowName", execution.getWorkflowName());
        message.put("status", execution.getStatus().name());
        message.put("stepsCompleted", execution.getStepsCompleted().size());
        message.put("totalSteps", execution.getTotalSteps());
        message.put("error", execution.getError());
        message.put("failedStepIndex", execution.getFailedStepIndex());
        message.put("startedAt", epochMillis(execution.getStartedAt()));
        message.put("completedAt", epochMillis(execution.getCompletedAt() != null
                ? execution.getCompletedAt() : execution.getFailedAt()));

        send(kafka.getTopics().getWorkflowExecutions(), execution.getWorkflowId(), message,
                "execution " + execution.getExecutionId());
    }

    /**
     * Publish a notification audit record.
     */
    public void publishNotification(Notification notification) {
        if (!kafka.isEnabled()) {
            return;
        }
        Map<String, Object> message = new HashMap<>();
        message.put("id", notification.getId());
        message.put("type", notification.getType());
        message.put("channel", notification.getChannel());
        message.put("status", notification.getStatus().name());
        message.put("subject", notification.getSubject());
        message.put("error", notification.getError());
        message.put("createdAt", epochMillis(notification.getCreatedAt()));

        send(kafka.getTopics().getNotifications(), notification.getChannel(), message,
                "notification " + notification.getId());
    }

    /**
     * Raise an incident. Completes once the broker acknowledged the record, or immediately
     * when Kafka is disabled.
     */
    public Mono<Void> publishIncident(String incidentId, Map<String, Object> incident) {
        if (!kafka.isEnabled()) {
            log.info("Kafka disabled, incident {} logged only: {}", incidentId, incident.get("title"));
            return Mono.empty();
        }
        return Mono.fromFuture(() -> kafkaTemplate.send(kafka.getTopics().getIncidents(), incidentId, incident))
                .doOnNext(result -> {
                    eventsProducedCounter.increment();
                    log.info("Published incident {} to partition {} offset {}", incidentId,
                            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                })
                .doOnError(ex -> {
                    eventsFailedCounter.increment();
                    log.error("Failed to publish incident {}: {}", incidentId, ex.getMessage());
                })
                .then();
    }

    private void send(String topic, String key, Map<String, Object> message, String description) {
        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, message);

        future.whenComplete((sendResult, ex) -> {
            if (ex != null) {
                eventsFailedCounter.increment();
                log.error("Failed to publish {}: {}", description, ex.getMessage());
            } else {
                eventsProducedCounter.increment();
                log.debug("Published {} to partition {} offset {}", description,
                        sendResult.getRecordMetadata().partition(),
                        sendResult.getRecordMetadata().offset());
            }
        });
    }

    private static long epochMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : 0L;
    }
}
