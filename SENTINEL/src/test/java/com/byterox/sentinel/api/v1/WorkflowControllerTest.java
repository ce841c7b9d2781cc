package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.config.SecurityConfig;
import com.byterox.sentinel.domain.model.StepRecord;
import com.byterox.sentinel.domain.model.Workflow;
import com.byterox.sentinel.domain.model.WorkflowExecution;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.exception.GlobalExceptionHandler;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.workflow.WorkflowEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = WorkflowController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class WorkflowControllerTest {

    private static final Instant STARTED = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WorkflowEngine workflowEngine;

    private static WorkflowExecution failedExecution() {
        WorkflowExecution execution = new WorkflowExecution("exec-1", "wf-1", "Respond", 2,
                Map.of("target", "a.com"), STARTED);
        execution.recordStep(StepRecord.builder()
                .index(0).name("scan").type("scan")
                .output(Map.of("security_score", 40))
                .completedAt(STARTED.plusSeconds(5))
                .build(), Map.of("security_score", 40));
        execution.fail(StepRecord.builder()
                .index(1).name("notify").type("notify")
                .status(StepRecord.FAILED).error("smtp down")
                .completedAt(STARTED.plusSeconds(6))
                .build(), "smtp down", STARTED.plusSeconds(6));
        return execution;
    }

    @Nested
    @DisplayName("POST /api/v1/workflows")
    class CreateTests {

        @Test
        @DisplayName("should map the request onto a workflow and return 201")
        void creates() {
            when(workflowEngine.createWorkflow(any(Workflow.class))).thenAnswer(invocation -> {
                Workflow workflow = invocation.getArgument(0);
                workflow.setId("wf-1");
                return workflow;
            });

            webTestClient.post()
                    .uri("/api/v1/workflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "name", "Respond",
                            "steps", List.of(
                                    Map.of("type", "scan", "config", Map.of("target", "a.com")),
                                    Map.of("name", "Tell the team", "type", "notify",
                                            "config", Map.of("type", "scan_complete", "channel", "slack")))))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo("wf-1")
                    .jsonPath("$.trigger").isEqualTo("manual")
                    .jsonPath("$.enabled").isEqualTo(true)
                    .jsonPath("$.steps.length()").isEqualTo(2)
                    .jsonPath("$.steps[1].name").isEqualTo("Tell the team");

            ArgumentCaptor<Workflow> workflow = ArgumentCaptor.forClass(Workflow.class);
            verify(workflowEngine).createWorkflow(workflow.capture());
            assertThat(workflow.getValue().getSteps())
                    .extracting(WorkflowStep::getType)
                    .containsExactly("scan", "notify");
            assertThat(workflow.getValue().getSteps().get(0).getConfig()).containsEntry("target", "a.com");
        }

        @Test
        @DisplayName("should reject a workflow without steps before reaching the engine")
        void rejectsEmptySteps() {
            webTestClient.post()
                    .uri("/api/v1/workflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "Empty", "steps", List.of()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("validation_error");

            verify(workflowEngine, never()).createWorkflow(any(Workflow.class));
        }

        @Test
        @DisplayName("should map step validation errors to 400 with details")
        void stepErrors() {
            when(workflowEngine.createWorkflow(any(Workflow.class)))
                    .thenThrow(ValidationException.of("workflow", List.of("steps[0].type 'teleport' is not one of [scan]")));

            webTestClient.post()
                    .uri("/api/v1/workflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "Broken", "steps", List.of(Map.of("type", "teleport"))))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.details[0]").isEqualTo("steps[0].type 'teleport' is not one of [scan]");
        }
    }

    @Nested
    @DisplayName("Executions")
    class ExecutionTests {

        @Test
        @DisplayName("should pass the request body as the initial context")
        void executesWithContext() {
            when(workflowEngine.execute(eq("wf-1"), anyMap())).thenReturn(Mono.just(failedExecution()));

            webTestClient.post()
                    .uri("/api/v1/workflows/wf-1/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("target", "a.com"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.executionId").isEqualTo("exec-1")
                    .jsonPath("$.status").isEqualTo("FAILED")
                    .jsonPath("$.failedStepIndex").isEqualTo(1)
                    .jsonPath("$.stepsCompleted.length()").isEqualTo(2)
                    .jsonPath("$.stepsCompleted[0].status").isEqualTo("completed")
                    .jsonPath("$.stepsCompleted[1].status").isEqualTo("failed")
                    .jsonPath("$.stepsCompleted[1].error").isEqualTo("smtp down")
                    .jsonPath("$.context.security_score").isEqualTo(40)
                    .jsonPath("$.startedAt").isEqualTo("2024-01-01T00:00:00Z");

            verify(workflowEngine).execute("wf-1", Map.of("target", "a.com"));
        }

        @Test
        @DisplayName("should start with an empty context when no body is sent")
        void executesWithoutBody() {
            when(workflowEngine.execute(eq("wf-1"), anyMap())).thenReturn(Mono.just(failedExecution()));

            webTestClient.post()
                    .uri("/api/v1/workflows/wf-1/execute")
                    .exchange()
                    .expectStatus().isOk();

            verify(workflowEngine).execute("wf-1", Map.of());
        }

        @Test
        @DisplayName("should return 404 for an unknown workflow or execution")
        void unknown() {
            when(workflowEngine.execute(eq("missing"), anyMap()))
                    .thenReturn(Mono.error(new NotFoundException("Workflow", "missing")));
            when(workflowEngine.getExecution("nope")).thenThrow(new NotFoundException("Workflow execution", "nope"));

            webTestClient.post()
                    .uri("/api/v1/workflows/missing/execute")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Workflow not found: missing");
            webTestClient.get()
                    .uri("/api/v1/workflows/executions/nope")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should list executions with the requested limit")
        void listsExecutions() {
            when(workflowEngine.listExecutions("wf-1", 5)).thenReturn(List.of(failedExecution()));

            webTestClient.get()
                    .uri("/api/v1/workflows/wf-1/executions?limit=5")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].progress").isEqualTo(100);
        }

        @Test
        @DisplayName("should delete with 204 and 404 when absent")
        void deletes() {
            webTestClient.delete()
                    .uri("/api/v1/workflows/wf-1")
                    .exchange()
                    .expectStatus().isNoContent();
            verify(workflowEngine).deleteWorkflow("wf-1");

            doThrow(new NotFoundException("Workflow", "gone")).when(workflowEngine).deleteWorkflow("gone");
            webTestClient.delete()
                    .uri("/api/v1/workflows/gone")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }
}
