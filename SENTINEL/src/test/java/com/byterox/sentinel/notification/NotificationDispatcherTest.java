package com.byterox.sentinel.notification;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.ChannelTarget;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationChannel;
import com.byterox.sentinel.domain.model.NotificationRule;
import com.byterox.sentinel.domain.model.NotificationStats;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.model.RuleCondition;
import com.byterox.sentinel.domain.repository.InMemoryHistoryStore;
import com.byterox.sentinel.domain.repository.InMemoryNotificationRuleRepository;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.TemplateException;
import com.byterox.sentinel.exception.TransportException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import com.byterox.sentinel.notification.template.TemplateRegistry;
import com.byterox.sentinel.notification.transport.NotificationTransport;
import com.byterox.sentinel.notification.transport.OutboundMessage;
import com.byterox.sentinel.observability.SentinelMetrics;
import com.byterox.sentinel.observability.SentinelStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private RecordingTransport slack;
    private RecordingTransport webhook;
    private InMemoryHistoryStore historyStore;
    private InMemoryNotificationRuleRepository ruleRepository;
    private AutomationEventProducer eventProducer;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        slack = new RecordingTransport(NotificationChannel.SLACK, null);
        webhook = new RecordingTransport(NotificationChannel.WEBHOOK,
                new TransportException("webhook", "webhook request failed with status 500"));
        historyStore = new InMemoryHistoryStore(properties);
        ruleRepository = new InMemoryNotificationRuleRepository();
        eventProducer = mock(AutomationEventProducer.class);

        dispatcher = new NotificationDispatcher(new TemplateRegistry(properties), List.of(slack, webhook),
                ruleRepository, historyStore, eventProducer, new SentinelMetrics(new SimpleMeterRegistry()),
                new SentinelStructuredLogger(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> scanData(String target, int score) {
        return Map.of("target", target, "security_score", score, "risk_level", "Medium");
    }

    @Nested
    @DisplayName("Sending")
    class SendingTests {

        @Test
        @DisplayName("should render the channel template and record a sent notification")
        void sends() {
            StepVerifier.create(dispatcher.send("scan_complete", "slack", scanData("a.com", 72), Map.of()))
                    .assertNext(notification -> {
                        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.SENT);
                        assertThat(notification.getId()).startsWith("notif_");
                        assertThat(notification.getMessage()).contains("a.com").contains("72");
                        assertThat(notification.getSentAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            assertThat(slack.messages).singleElement()
                    .satisfies(message -> assertThat(message.getData()).containsEntry("target", "a.com"));
            assertThat(dispatcher.getHistory("slack", null, NotificationStatus.SENT, 10)).hasSize(1);
            verify(eventProducer).publishNotification(any());
        }

        @Test
        @DisplayName("should record an unknown channel as failed without raising")
        void unknownChannel() {
            StepVerifier.create(dispatcher.send("scan_complete", "pager", scanData("a.com", 72), Map.of()))
                    .assertNext(notification -> {
                        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.FAILED);
                        assertThat(notification.getError()).isEqualTo("Unknown notification channel: pager");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should record and raise a missing template")
        void missingTemplate() {
            StepVerifier.create(dispatcher.send("weekly_digest", "slack", Map.of(), Map.of()))
                    .expectError(TemplateException.class)
                    .verify();

            assertThat(dispatcher.getHistory(null, "weekly_digest", NotificationStatus.FAILED, 10))
                    .singleElement()
                    .satisfies(n -> assertThat(n.getError()).isEqualTo("Template not found: slack_weekly_digest"));
            assertThat(slack.messages).isEmpty();
        }

        @Test
        @DisplayName("should record a transport failure without retrying")
        void transportFailure() {
            StepVerifier.create(dispatcher.send("scan_complete", "webhook", scanData("a.com", 72),
                            Map.of("webhook_url", "http://hooks.local/x")))
                    .assertNext(notification -> {
                        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.FAILED);
                        assertThat(notification.getError()).contains("status 500");
                        assertThat(notification.getFailedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            assertThat(webhook.messages).hasSize(1);
        }

        @Test
        @DisplayName("should send the test type with sample data")
        void sendTest() {
            StepVerifier.create(dispatcher.sendTest("slack", Map.of()))
                    .assertNext(notification -> {
                        assertThat(notification.getType()).isEqualTo(NotificationDispatcher.TEST_TYPE);
                        assertThat(notification.getStatus()).isEqualTo(NotificationStatus.SENT);
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Triggers")
    class TriggerTests {

        private NotificationRule weakScoreRule() {
            return dispatcher.createRule(NotificationRule.builder()
                    .name("Weak score")
                    .trigger("scan_complete")
                    .conditions(new ArrayList<>(List.of(RuleCondition.builder()
                            .field("security_score").operator("less_than").threshold(50).build())))
                    .channels(new ArrayList<>(List.of(
                            ChannelTarget.builder().channel("slack").build(),
                            ChannelTarget.builder().channel("webhook")
                                    .options(Map.of("webhook_url", "http://hooks.local/x")).build())))
                    .build());
        }

        @Test
        @DisplayName("should send once per channel and count the rule once")
        void fansOut() {
            NotificationRule rule = weakScoreRule();

            StepVerifier.create(dispatcher.processTrigger("scan_complete", scanData("a.com", 30)))
                    .assertNext(notifications -> assertThat(notifications)
                            .extracting(Notification::getChannel)
                            .containsExactly("slack", "webhook"))
                    .verifyComplete();

            assertThat(dispatcher.getRule(rule.getId()).getTriggeredCount()).isEqualTo(1);
            assertThat(dispatcher.getRule(rule.getId()).getLastTriggeredAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("should skip rules whose conditions or trigger do not match")
        void noMatch() {
            NotificationRule rule = weakScoreRule();

            StepVerifier.create(dispatcher.processTrigger("scan_complete", scanData("a.com", 90)))
                    .assertNext(notifications -> assertThat(notifications).isEmpty())
                    .verifyComplete();
            StepVerifier.create(dispatcher.processTrigger("scan_failed", scanData("a.com", 10)))
                    .assertNext(notifications -> assertThat(notifications).isEmpty())
                    .verifyComplete();

            assertThat(dispatcher.getRule(rule.getId()).getTriggeredCount()).isZero();
        }

        @Test
        @DisplayName("should skip channels without a template for the trigger")
        void skipsMissingTemplate() {
            dispatcher.createRule(NotificationRule.builder()
                    .name("Digest")
                    .trigger("weekly_digest")
                    .channels(new ArrayList<>(List.of(ChannelTarget.builder().channel("slack").build())))
                    .build());

            StepVerifier.create(dispatcher.processTrigger("weekly_digest", Map.of()))
                    .assertNext(notifications -> assertThat(notifications).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Rules and statistics")
    class RuleAndStatsTests {

        @Test
        @DisplayName("should reject rules with unknown channels")
        void rejectsUnknownChannel() {
            NotificationRule rule = NotificationRule.builder()
                    .name("Bad")
                    .trigger("scan_complete")
                    .channels(new ArrayList<>(List.of(ChannelTarget.builder().channel("pager").build())))
                    .build();

            assertThatThrownBy(() -> dispatcher.createRule(rule)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> dispatcher.deleteRule("missing")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should break statistics down by channel and type")
        void stats() {
            dispatcher.send("scan_complete", "slack", scanData("a.com", 72), Map.of()).block();
            dispatcher.send("scan_complete", "slack", scanData("b.com", 40), Map.of()).block();
            dispatcher.send("scan_complete", "webhook", scanData("a.com", 72),
                    Map.of("webhook_url", "http://hooks.local/x")).block();

            NotificationStats stats = dispatcher.getStats();

            assertThat(stats.getTotal()).isEqualTo(3);
            assertThat(stats.getSent()).isEqualTo(2);
            assertThat(stats.getFailed()).isEqualTo(1);
            assertThat(stats.getByChannel().get("slack")).containsEntry("sent", 2L).containsEntry("failed", 0L);
            assertThat(stats.getByChannel().get("webhook")).containsEntry("failed", 1L);
            assertThat(stats.getByType().get("scan_complete")).containsEntry("sent", 2L);
            verify(eventProducer, times(3)).publishNotification(any());
        }
    }

    private static final class RecordingTransport implements NotificationTransport {

        private final NotificationChannel channel;
        private final RuntimeException failure;
        private final List<OutboundMessage> messages = new CopyOnWriteArrayList<>();

        RecordingTransport(NotificationChannel channel, RuntimeException failure) {
            this.channel = channel;
            this.failure = failure;
        }

        @Override
        public NotificationChannel channel() {
            return channel;
        }

        @Override
        public Mono<Void> deliver(OutboundMessage message) {
            messages.add(message);
            return failure != null ? Mono.error(failure) : Mono.empty();
        }
    }
}
