package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.api.dto.ScheduleRequest;
import com.byterox.sentinel.config.SecurityConfig;
import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.ScheduledJob;
import com.byterox.sentinel.exception.GlobalExceptionHandler;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.scheduler.JobPatch;
import com.byterox.sentinel.scheduler.ScanScheduler;
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
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ScheduleController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class ScheduleControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ScanScheduler scheduler;

    private static ScheduledJob job(String id) {
        return ScheduledJob.builder()
                .id(id)
                .name("Nightly")
                .targets(List.of("a.com", "b.com"))
                .cronExpression("0 2 * * *")
                .nextRun(Instant.parse("2024-01-02T02:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/schedules")
    class CreateTests {

        @Test
        @DisplayName("should create a job and return 201")
        void creates() {
            when(scheduler.createJob(any(ScheduledJob.class), anyList())).thenReturn(job("job-1"));

            webTestClient.post()
                    .uri("/api/v1/schedules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ScheduleRequest.builder()
                            .name("Nightly")
                            .targets(List.of("a.com", "b.com"))
                            .cronExpression("0 2 * * *")
                            .build())
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo("job-1")
                    .jsonPath("$.targets.length()").isEqualTo(2);
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should map the request body onto the job and its inline rules")
        void mapsRequest() {
            when(scheduler.createJob(any(ScheduledJob.class), anyList())).thenReturn(job("job-1"));

            webTestClient.post()
                    .uri("/api/v1/schedules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "name", "Nightly",
                            "targets", List.of("a.com"),
                            "cronExpression", "0 2 * * *",
                            "scanOptions", Map.of("scan_type", "full"),
                            "automationRuleIds", List.of("low-score"),
                            "automationRules", List.of(Map.of(
                                    "name", "Critical present",
                                    "condition", Map.of("field", "summary.criticalFindings",
                                            "operator", "greater_than", "value", 0),
                                    "action", Map.of("type", "trigger_incident")))))
                    .exchange()
                    .expectStatus().isCreated();

            ArgumentCaptor<ScheduledJob> job = ArgumentCaptor.forClass(ScheduledJob.class);
            ArgumentCaptor<List<AutomationRule>> rules = ArgumentCaptor.forClass(List.class);
            verify(scheduler).createJob(job.capture(), rules.capture());
            assertThat(job.getValue().getName()).isEqualTo("Nightly");
            assertThat(job.getValue().getTargets()).containsExactly("a.com");
            assertThat(job.getValue().getScanOptions()).containsEntry("scan_type", "full");
            assertThat(job.getValue().getAutomationRuleIds()).containsExactly("low-score");
            assertThat(job.getValue().isEnabled()).isTrue();
            assertThat(rules.getValue()).singleElement().satisfies(rule -> {
                assertThat(rule.getCondition().getOperator()).isEqualTo("greater_than");
                assertThat(rule.getCondition().getThreshold()).isEqualTo(0);
                assertThat(rule.getAction().getType()).isEqualTo("trigger_incident");
            });
        }

        @Test
        @DisplayName("should reject a request without targets")
        void rejectsMissingTargets() {
            webTestClient.post()
                    .uri("/api/v1/schedules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("name", "Nightly", "cronExpression", "0 2 * * *"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("validation_error");

            verify(scheduler, never()).createJob(any(ScheduledJob.class), anyList());
        }

        @Test
        @DisplayName("should map an invalid cron expression to 400 with details")
        void rejectsInvalidCron() {
            when(scheduler.createJob(any(ScheduledJob.class), anyList()))
                    .thenThrow(ValidationException.of("scheduled job", List.of("cronExpression 'every day' is invalid")));

            webTestClient.post()
                    .uri("/api/v1/schedules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ScheduleRequest.builder()
                            .name("Nightly")
                            .targets(List.of("a.com"))
                            .cronExpression("every day")
                            .build())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.details[0]").isEqualTo("cronExpression 'every day' is invalid");
        }
    }

    @Nested
    @DisplayName("Job endpoints")
    class JobTests {

        @Test
        @DisplayName("should return 404 for an unknown job")
        void unknownJob() {
            when(scheduler.getJob("missing")).thenThrow(new NotFoundException("Scheduled job", "missing"));

            webTestClient.get()
                    .uri("/api/v1/schedules/missing")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Scheduled job not found: missing");
        }

        @Test
        @DisplayName("should pass only the supplied fields as a patch")
        void patches() {
            ScheduledJob updated = job("job-1");
            updated.setCronExpression("0 4 * * *");
            when(scheduler.updateJob(eq("job-1"), any(JobPatch.class))).thenReturn(updated);

            webTestClient.patch()
                    .uri("/api/v1/schedules/job-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("cronExpression", "0 4 * * *", "enabled", false))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.cronExpression").isEqualTo("0 4 * * *")
                    .jsonPath("$.nextRun").isEqualTo("2024-01-02T02:00:00Z");

            ArgumentCaptor<JobPatch> patch = ArgumentCaptor.forClass(JobPatch.class);
            verify(scheduler).updateJob(eq("job-1"), patch.capture());
            assertThat(patch.getValue().getCronExpression()).isEqualTo("0 4 * * *");
            assertThat(patch.getValue().getEnabled()).isFalse();
            assertThat(patch.getValue().getName()).isNull();
            assertThat(patch.getValue().getTargets()).isNull();
        }

        @Test
        @DisplayName("should delete with 204 and 404 when absent")
        void deletes() {
            webTestClient.delete()
                    .uri("/api/v1/schedules/job-1")
                    .exchange()
                    .expectStatus().isNoContent();

            doThrow(new NotFoundException("Scheduled job", "gone")).when(scheduler).deleteJob("gone");
            webTestClient.delete()
                    .uri("/api/v1/schedules/gone")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should run a tick on demand")
        void runsNow() {
            JobRun run = JobRun.builder()
                    .runId("run-1")
                    .jobId("job-1")
                    .jobName("Nightly")
                    .runNumber(1)
                    .build();
            when(scheduler.triggerNow("job-1")).thenReturn(Mono.just(run));

            webTestClient.post()
                    .uri("/api/v1/schedules/job-1/run")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.runId").isEqualTo("run-1")
                    .jsonPath("$.runNumber").isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 409 when a tick is already in flight")
        void conflictsWhileRunning() {
            when(scheduler.triggerNow("job-1")).thenReturn(Mono.empty());

            webTestClient.post()
                    .uri("/api/v1/schedules/job-1/run")
                    .exchange()
                    .expectStatus().isEqualTo(409);
        }

        @Test
        @DisplayName("should list runs with the requested limit")
        void listsRuns() {
            when(scheduler.getJob("job-1")).thenReturn(job("job-1"));
            when(scheduler.getJobRuns("job-1", 5)).thenReturn(List.of(
                    JobRun.builder().runId("run-2").jobId("job-1").runNumber(2).build(),
                    JobRun.builder().runId("run-1").jobId("job-1").runNumber(1).build()));

            webTestClient.get()
                    .uri("/api/v1/schedules/job-1/runs?limit=5")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(2)
                    .jsonPath("$[0].runId").isEqualTo("run-2");
        }
    }
}
