package com.byterox.sentinel.rules.action;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.exception.ActionException;
import com.byterox.sentinel.exception.TemplateException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import com.byterox.sentinel.notification.NotificationDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertAndIncidentHandlerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private AutomationEventProducer eventProducer;

    private static ActionContext context(Map<String, Object> config) {
        return ActionContext.builder()
                .ruleId("rule-1")
                .ruleName("Weak score")
                .jobId("job-1")
                .target("a.com")
                .scanResult(ScanResult.builder()
                        .scanId("scan-9")
                        .target("a.com")
                        .summary(ScanResult.Summary.builder().securityScore(42).riskLevel("High").build())
                        .build())
                .config(config)
                .build();
    }

    @Nested
    @DisplayName("send_alert")
    class SendAlertTests {

        @Test
        @DisplayName("should format the alert message with the score")
        void alertMessage() {
            assertThat(SendAlertHandler.alertMessage("Weak score", "a.com", 42))
                    .isEqualTo("Automation rule 'Weak score' triggered for a.com. Security score: 42%");
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should fall back to the default alert channels")
        void defaultChannels() {
            when(dispatcher.send(eq(SendAlertHandler.DEFAULT_TEMPLATE), eq("slack"), anyMap(), anyMap()))
                    .thenReturn(Mono.just(Notification.builder().id("notif_1").channel("slack")
                            .status(NotificationStatus.SENT).build()));
            SendAlertHandler handler = new SendAlertHandler(dispatcher, new SentinelProperties(), CLOCK);

            StepVerifier.create(handler.handle(context(Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.isSuccess()).isTrue();
                        assertThat(outcome.getMessage()).isEqualTo("Alert sent on 1 channel(s)");
                        assertThat(outcome.getExecutedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
            verify(dispatcher).send(eq(SendAlertHandler.DEFAULT_TEMPLATE), eq("slack"), data.capture(), anyMap());
            assertThat(data.getValue())
                    .containsEntry("security_score", 42)
                    .containsEntry("risk_level", "High")
                    .containsEntry("message", "Automation rule 'Weak score' triggered for a.com. Security score: 42%");
        }

        @Test
        @DisplayName("should report failure when a channel has no template")
        void missingTemplate() {
            when(dispatcher.send(anyString(), anyString(), anyMap(), anyMap()))
                    .thenReturn(Mono.error(new TemplateException("sms_vulnerability_alert")));
            SendAlertHandler handler = new SendAlertHandler(dispatcher, new SentinelProperties(), CLOCK);

            StepVerifier.create(handler.handle(context(Map.of("channels", List.of("sms")))))
                    .assertNext(outcome -> {
                        assertThat(outcome.isSuccess()).isFalse();
                        assertThat(outcome.getMessage()).isEqualTo("Alert delivery failed on one or more channels");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("trigger_incident")
    class TriggerIncidentTests {

        @Test
        @DisplayName("should describe the incident from the scan summary")
        void incidentDocument() {
            Map<String, Object> incident = TriggerIncidentHandler.incident(context(Map.of("severity", "critical")), NOW);

            assertThat((String) incident.get("id")).startsWith("INC-").hasSize(12);
            assertThat(incident)
                    .containsEntry("title", "Automated Detection: Weak score")
                    .containsEntry("severity", "critical")
                    .containsEntry("status", "open")
                    .containsEntry("createdAt", "2024-03-01T10:15:00Z")
                    .containsEntry("scanId", "scan-9")
                    .containsEntry("description",
                            "Rule 'Weak score' matched a.com with security score 42% and risk level High");
        }

        @Test
        @DisplayName("should wrap publication failures in an action exception")
        void publicationFailure() {
            when(eventProducer.publishIncident(anyString(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("broker down")));

            StepVerifier.create(new TriggerIncidentHandler(eventProducer, CLOCK).handle(context(Map.of())))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(ActionException.class)
                            .hasMessageContaining("broker down"))
                    .verify();
        }

        @Test
        @DisplayName("should return the incident id on success")
        void success() {
            when(eventProducer.publishIncident(anyString(), any())).thenReturn(Mono.empty());

            StepVerifier.create(new TriggerIncidentHandler(eventProducer, CLOCK).handle(context(Map.of())))
                    .assertNext(outcome -> {
                        assertThat(outcome.isSuccess()).isTrue();
                        assertThat((String) outcome.getDetails().get("incidentId")).startsWith("INC-");
                        assertThat(outcome.getExecutedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
        }
    }
}
