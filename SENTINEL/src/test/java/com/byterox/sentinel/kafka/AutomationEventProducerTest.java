package com.byterox.sentinel.kafka;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutomationEventProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SentinelProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private AutomationEventProducer producer;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        meterRegistry = new SimpleMeterRegistry();
        producer = new AutomationEventProducer(kafkaTemplate, properties, meterRegistry);
    }

    private static Notification notification() {
        return Notification.builder()
                .id("notif_1")
                .type("scan_complete")
                .channel("slack")
                .status(NotificationStatus.SENT)
                .createdAt(Instant.parse("2024-05-01T08:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("should not touch Kafka when disabled")
    void disabled() {
        producer.publishNotification(notification());

        StepVerifier.create(producer.publishIncident("inc_1", Map.of("title", "Critical findings")))
                .verifyComplete();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should key notification records by channel when enabled")
    void publishesNotification() {
        properties.getKafka().setEnabled(true);
        CompletableFuture<SendResult<String, Object>> pending = new CompletableFuture<>();
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(pending);

        producer.publishNotification(notification());

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("sentinel.notifications"), eq("slack"), message.capture());
        assertThat((Map<String, Object>) message.getValue())
                .containsEntry("id", "notif_1")
                .containsEntry("status", "SENT")
                .containsEntry("createdAt", 1714550400000L);
    }

    @Test
    @DisplayName("should count failed sends")
    void countsFailures() {
        properties.getKafka().setEnabled(true);
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        producer.publishNotification(notification());

        assertThat(meterRegistry.counter("sentinel.kafka.events.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should surface incident publish failures")
    void incidentFailure() {
        properties.getKafka().setEnabled(true);
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        StepVerifier.create(producer.publishIncident("inc_1", Map.of("title", "Critical findings")))
                .expectError(IllegalStateException.class)
                .verify();
    }
}
