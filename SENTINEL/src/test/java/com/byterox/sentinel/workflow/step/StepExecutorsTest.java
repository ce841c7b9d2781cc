package com.byterox.sentinel.workflow.step;

import com.byterox.sentinel.client.ScanProvider;
import com.byterox.sentinel.domain.model.ActionOutcome;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.NotificationStatus;
import com.byterox.sentinel.domain.model.ScanResult;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.exception.ScanProviderException;
import com.byterox.sentinel.notification.NotificationDispatcher;
import com.byterox.sentinel.rules.action.ActionContext;
import com.byterox.sentinel.rules.action.ActionHandler;
import com.byterox.sentinel.rules.action.ActionRegistry;
import com.byterox.sentinel.rules.action.ActionType;
import com.byterox.sentinel.workflow.ExecutionScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StepExecutorsTest {

    private static final ExecutionScope SCOPE = new ExecutionScope("exec-1", "wf-1");

    @Mock
    private ScanProvider scanProvider;

    @Mock
    private NotificationDispatcher dispatcher;

    private static WorkflowStep step(String type, Map<String, Object> config) {
        return WorkflowStep.builder().type(type).config(new HashMap<>(config)).build();
    }

    @Nested
    @DisplayName("scan step")
    class ScanStepTests {

        @Test
        @DisplayName("should scan the context target and expose the summary")
        void scansContextTarget() {
            when(scanProvider.runScan(eq("a.com"), anyMap())).thenReturn(Mono.just(ScanResult.builder()
                    .scanId("scan-1")
                    .target("a.com")
                    .summary(ScanResult.Summary.builder()
                            .securityScore(42).riskLevel("High").totalFindings(7).criticalFindings(1).build())
                    .build()));
            ScanStepExecutor executor = new ScanStepExecutor(scanProvider);

            StepVerifier.create(executor.execute(step("scan", Map.of()), Map.of("target", "a.com"), SCOPE))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getOutput())
                                .containsEntry("scan_completed", true)
                                .containsEntry("target", "a.com")
                                .containsEntry("security_score", 42)
                                .containsEntry("risk_level", "High")
                                .containsEntry("critical_findings", 1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should prefer the configured target and pass scan options through")
        @SuppressWarnings("unchecked")
        void configuredTarget() {
            when(scanProvider.runScan(eq("b.com"), anyMap())).thenReturn(Mono.just(ScanResult.builder()
                    .target("b.com")
                    .summary(ScanResult.Summary.builder().securityScore(90).riskLevel("Low").build())
                    .build()));
            WorkflowStep step = step("scan", Map.of("target", "b.com", "options", Map.of("scan_type", "quick")));

            StepVerifier.create(new ScanStepExecutor(scanProvider).execute(step, Map.of("target", "a.com"), SCOPE))
                    .assertNext(result -> assertThat(result.getOutput()).containsEntry("target", "b.com"))
                    .verifyComplete();

            ArgumentCaptor<Map<String, Object>> options = ArgumentCaptor.forClass(Map.class);
            verify(scanProvider).runScan(eq("b.com"), options.capture());
            assertThat(options.getValue()).containsEntry("scan_type", "quick");
        }

        @Test
        @DisplayName("should fail without a target and on provider errors")
        void failures() {
            ScanStepExecutor executor = new ScanStepExecutor(scanProvider);
            StepVerifier.create(executor.execute(step("scan", Map.of()), Map.of(), SCOPE))
                    .assertNext(result -> assertThat(result.getError()).isEqualTo("No target for scan step"))
                    .verifyComplete();

            when(scanProvider.runScan(eq("a.com"), anyMap()))
                    .thenReturn(Mono.error(new ScanProviderException("a.com", "timeout")));
            StepVerifier.create(executor.execute(step("scan", Map.of("target", "a.com")), Map.of(), SCOPE))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.getError()).contains("timeout");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("notify step")
    class NotifyStepTests {

        @Test
        @DisplayName("should render with the execution context plus extra data")
        @SuppressWarnings("unchecked")
        void rendersWithContext() {
            when(dispatcher.send(eq("scan_complete"), eq("slack"), anyMap(), anyMap()))
                    .thenReturn(Mono.just(Notification.builder()
                            .id("notif_1").channel("slack").status(NotificationStatus.SENT).build()));
            WorkflowStep step = step("notify", Map.of(
                    "type", "scan_complete",
                    "channel", "slack",
                    "data", Map.of("team", "blue"),
                    "options", Map.of("channel", "#alerts")));

            StepVerifier.create(new NotifyStepExecutor(dispatcher)
                            .execute(step, Map.of("target", "a.com", "security_score", 42), SCOPE))
                    .assertNext(result -> assertThat(result.getOutput())
                            .containsEntry("notification_sent", true)
                            .containsEntry("notification_id", "notif_1"))
                    .verifyComplete();

            ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
            ArgumentCaptor<Map<String, Object>> options = ArgumentCaptor.forClass(Map.class);
            verify(dispatcher).send(eq("scan_complete"), eq("slack"), data.capture(), options.capture());
            assertThat(data.getValue())
                    .containsEntry("target", "a.com")
                    .containsEntry("security_score", 42)
                    .containsEntry("team", "blue");
            assertThat(options.getValue()).containsEntry("channel", "#alerts");
        }

        @Test
        @DisplayName("should fail when the notification was not sent")
        void notSent() {
            when(dispatcher.send(eq("scan_complete"), eq("email"), anyMap(), anyMap()))
                    .thenReturn(Mono.just(Notification.builder()
                            .id("notif_2").channel("email").status(NotificationStatus.FAILED)
                            .error("no recipients").build()));
            WorkflowStep step = step("notify", Map.of("type", "scan_complete", "channel", "email"));

            StepVerifier.create(new NotifyStepExecutor(dispatcher).execute(step, Map.of(), SCOPE))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.getError()).isEqualTo("Notification notif_2 failed: no recipients");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should require a type and a known channel")
        void validation() {
            List<String> errors = new ArrayList<>();

            new NotifyStepExecutor(dispatcher).validate(step("notify", Map.of("channel", "pager")), "steps[1]", errors);

            assertThat(errors).containsExactly(
                    "steps[1].config.type is required",
                    "steps[1].config.channel 'pager' is not a known channel");
        }
    }

    @Nested
    @DisplayName("action step")
    class ActionStepTests {

        @Test
        @DisplayName("should dispatch with the context as data and merge the outcome details")
        void dispatchesAction() {
            List<ActionContext> seen = new ArrayList<>();
            ActionRegistry registry = new ActionRegistry(List.of(handler(ActionType.UPDATE_BLOCKLIST, context -> {
                seen.add(context);
                return Mono.just(ActionOutcome.builder()
                        .actionType("update_blocklist")
                        .success(true)
                        .details(new HashMap<>(Map.of("referenceId", "ref-7")))
                        .executedAt(Instant.EPOCH)
                        .build());
            })));
            WorkflowStep step = WorkflowStep.builder()
                    .name("Blocklist target")
                    .type("action")
                    .config(new HashMap<>(Map.of("actionType", "update_blocklist",
                            "config", Map.of("reason", "weak score"))))
                    .build();

            StepVerifier.create(new ActionStepExecutor(registry)
                            .execute(step, Map.of("target", "a.com", "security_score", 12), SCOPE))
                    .assertNext(result -> assertThat(result.getOutput())
                            .containsEntry("action_executed", true)
                            .containsEntry("action_type", "update_blocklist")
                            .containsEntry("referenceId", "ref-7"))
                    .verifyComplete();

            assertThat(seen).singleElement().satisfies(context -> {
                assertThat(context.getTarget()).isEqualTo("a.com");
                assertThat(context.source()).isEqualTo("Blocklist target");
                assertThat(context.getData()).containsEntry("security_score", 12);
                assertThat(context.getConfig()).containsEntry("reason", "weak score");
            });
        }

        @Test
        @DisplayName("should fail on an unsuccessful outcome or a missing handler")
        void failures() {
            ActionRegistry registry = new ActionRegistry(List.of(handler(ActionType.BLOCK_IPS,
                    context -> Mono.just(ActionOutcome.builder()
                            .actionType("block_ips").success(false).message("gateway busy").build()))));
            ActionStepExecutor executor = new ActionStepExecutor(registry);

            StepVerifier.create(executor.execute(step("action", Map.of("actionType", "block_ips")), Map.of(), SCOPE))
                    .assertNext(result -> assertThat(result.getError()).isEqualTo("Action block_ips failed: gateway busy"))
                    .verifyComplete();
            StepVerifier.create(executor.execute(step("action", Map.of("actionType", "trigger_incident")), Map.of(), SCOPE))
                    .assertNext(result -> assertThat(result.isSuccess()).isFalse())
                    .verifyComplete();
        }
    }

    private static ActionHandler handler(ActionType type,
                                         Function<ActionContext, Mono<ActionOutcome>> behaviour) {
        return new ActionHandler() {
            @Override
            public ActionType type() {
                return type;
            }

            @Override
            public Mono<ActionOutcome> handle(ActionContext context) {
                return behaviour.apply(context);
            }
        };
    }
}
