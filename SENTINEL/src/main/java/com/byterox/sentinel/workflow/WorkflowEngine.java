package com.byterox.sentinel.workflow;

import com.byterox.sentinel.domain.model.ExecutionStatus;
import com.byterox.sentinel.domain.model.StepRecord;
import com.byterox.sentinel.domain.model.StepType;
import com.byterox.sentinel.domain.model.Workflow;
import com.byterox.sentinel.domain.model.WorkflowExecution;
import com.byterox.sentinel.domain.model.WorkflowStep;
import com.byterox.sentinel.domain.repository.HistoryStore;
import com.byterox.sentinel.domain.repository.WorkflowRepository;
import com.byterox.sentinel.exception.NotFoundException;
import com.byterox.sentinel.exception.ValidationException;
import com.byterox.sentinel.kafka.AutomationEventProducer;
import com.byterox.sentinel.observability.SentinelMetrics;
import com.byterox.sentinel.observability.SentinelStructuredLogger;
import com.byterox.sentinel.observability.SentinelStructuredLogger.WorkflowEventType;
import com.byterox.sentinel.rules.RuleValidator;
import com.byterox.sentinel.workflow.step.StepExecutor;
import com.byterox.sentinel.workflow.step.StepResult;
import com.byterox.sentinel.workflow.step.WaitStepExecutor;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Runs workflows: ordered steps sharing one accumulating context.
 * <p>
 * Steps of an execution run strictly one after another; a step only starts once the previous
 * one recorded its output. The first failing step ends the execution as FAILED and nothing
 * after it runs. Effects of earlier steps are not rolled back.
 */
@Slf4j
@Service
public class WorkflowEngine {

    private final WorkflowRepository workflowRepository;
    private final HistoryStore historyStore;
    private final Map<StepType, StepExecutor> executors = new EnumMap<>(StepType.class);
    private final AutomationEventProducer eventProducer;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    /** Executions still running, by execution id */
    private final Map<String, RunningExecution> running = new ConcurrentHashMap<>();

    public WorkflowEngine(WorkflowRepository workflowRepository,
                          HistoryStore historyStore,
                          List<StepExecutor> executors,
                          AutomationEventProducer eventProducer,
                          SentinelMetrics metrics,
                          SentinelStructuredLogger structuredLogger,
                          Clock clock) {
        this.workflowRepository = workflowRepository;
        this.historyStore = historyStore;
        executors.forEach(executor -> this.executors.put(executor.type(), executor));
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    // ========== Workflow Definitions ==========

    public Workflow createWorkflow(Workflow workflow) {
        validate(workflow);
        Instant now = clock.instant();
        workflow.setId(workflow.getId() != null && !workflow.getId().isBlank()
                ? workflow.getId() : UUID.randomUUID().toString());
        workflow.setExecutionCount(0);
        workflow.setCreatedAt(now);
        workflow.setUpdatedAt(now);
        log.info("Created workflow {} ({}) with {} steps", workflow.getId(), workflow.getName(),
                workflow.getSteps().size());
        return workflowRepository.save(workflow);
    }

    public List<Workflow> listWorkflows() {
        return workflowRepository.findAll().stream()
                .sorted(Comparator.comparing(Workflow::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public Workflow getWorkflow(String id) {
        return workflowRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Workflow", id));
    }

    /**
     * Remove a workflow. Running executions have their pending wait cancelled and end FAILED;
     * steps they already recorded stay.
     */
    public void deleteWorkflow(String id) {
        if (!workflowRepository.delete(id)) {
            throw new NotFoundException("Workflow", id);
        }
        running.values().stream()
                .filter(execution -> id.equals(execution.scope().getWorkflowId()))
                .forEach(execution -> {
                    structuredLogger.logWorkflowEvent(id, execution.scope().getExecutionId(),
                            WorkflowEventType.CANCELLED, "Cancelling execution of deleted workflow", Map.of());
                    execution.scope().cancel();
                });
        log.info("Deleted workflow {}", id);
    }

    // ========== Executions ==========

    /**
     * Start a fresh execution. The returned Mono completes with the terminal execution.
     * An unknown or disabled workflow is rejected before anything runs. Cancelling the
     * returned Mono does not stop the execution.
     */
    public Mono<WorkflowExecution> execute(String workflowId, Map<String, Object> initialContext) {
        return Mono.defer(() -> {
            Workflow workflow = getWorkflow(workflowId);
            if (!workflow.isEnabled()) {
                return Mono.error(new ValidationException("Workflow " + workflowId + " is disabled"));
            }
            workflowRepository.update(workflowId, current -> {
                current.setExecutionCount(current.getExecutionCount() + 1);
                return current;
            });

            List<WorkflowStep> steps = List.copyOf(workflow.getSteps());
            WorkflowExecution execution = new WorkflowExecution(UUID.randomUUID().toString(), workflow.getId(),
                    workflow.getName(), steps.size(), initialContext, clock.instant());
            ExecutionScope scope = new ExecutionScope(execution.getExecutionId(), workflow.getId());
            running.put(execution.getExecutionId(), new RunningExecution(execution, scope));
            Timer.Sample sample = metrics.startExecution();

            structuredLogger.logWorkflowEvent(workflow.getId(), execution.getExecutionId(), WorkflowEventType.STARTED,
                    "Executing workflow '" + workflow.getName() + "'", Map.of("steps", steps.size()));

            // Runs detached from the caller: only deleting the workflow cancels an execution.
            Mono<WorkflowExecution> run = runStep(execution, steps, 0, scope)
                    .doOnNext(terminal -> finish(terminal, sample))
                    .doOnError(error -> running.remove(execution.getExecutionId()))
                    .cache();
            run.subscribe(
                    terminal -> log.debug("Execution {} ended {}", terminal.getExecutionId(), terminal.getStatus()),
                    error -> log.error("Execution {} of workflow {} aborted", execution.getExecutionId(),
                            workflow.getId(), error));
            return run;
        });
    }

    public WorkflowExecution getExecution(String executionId) {
        RunningExecution active = running.get(executionId);
        if (active != null) {
            return active.execution();
        }
        return historyStore.findExecution(executionId)
                .orElseThrow(() -> new NotFoundException("Workflow execution", executionId));
    }

    /**
     * Running and finished executions of a workflow, newest first.
     */
    public List<WorkflowExecution> listExecutions(String workflowId, int limit) {
        Stream<WorkflowExecution> active = running.values().stream()
                .map(RunningExecution::execution)
                .filter(execution -> execution.getWorkflowId().equals(workflowId));
        return Stream.concat(active, historyStore.findExecutions(workflowId, limit).stream())
                .sorted(Comparator.comparing(WorkflowExecution::getStartedAt).reversed())
                .limit(limit > 0 ? limit : Long.MAX_VALUE)
                .toList();
    }

    public int runningCount() {
        return running.size();
    }

    // ========== Private Methods ==========

    private Mono<WorkflowExecution> runStep(WorkflowExecution execution, List<WorkflowStep> steps,
                                            int index, ExecutionScope scope) {
        if (index >= steps.size()) {
            execution.complete(clock.instant());
            return Mono.just(execution);
        }
        WorkflowStep step = steps.get(index);
        if (scope.isCancelled()) {
            return Mono.just(failStep(execution, index, step, WaitStepExecutor.CANCELLED_MESSAGE));
        }

        StepExecutor executor = StepType.fromValue(step.getType()).map(executors::get).orElse(null);
        if (executor == null) {
            return Mono.just(failStep(execution, index, step, "No executor for step type " + step.getType()));
        }

        return Mono.defer(() -> executor.execute(step, execution.getContext(), scope))
                .onErrorResume(error -> Mono.just(StepResult.failure(error.getMessage())))
                .switchIfEmpty(Mono.fromSupplier(() -> StepResult.failure("Step produced no result")))
                .flatMap(result -> {
                    if (!result.isSuccess()) {
                        return Mono.just(failStep(execution, index, step, result.getError()));
                    }
                    execution.recordStep(StepRecord.builder()
                            .index(index)
                            .name(step.displayName())
                            .type(step.getType())
                            .output(result.getOutput())
                            .completedAt(clock.instant())
                            .build(), result.getOutput());
                    structuredLogger.logWorkflowEvent(execution.getWorkflowId(), execution.getExecutionId(),
                            WorkflowEventType.STEP_COMPLETED, "Step " + index + " (" + step.displayName() + ") completed",
                            Map.of("type", String.valueOf(step.getType())));
                    return runStep(execution, steps, index + 1, scope);
                });
    }

    private WorkflowExecution failStep(WorkflowExecution execution, int index, WorkflowStep step, String error) {
        Instant now = clock.instant();
        execution.fail(StepRecord.builder()
                .index(index)
                .name(step.displayName())
                .type(step.getType())
                .status(StepRecord.FAILED)
                .error(error)
                .completedAt(now)
                .build(), error, now);
        structuredLogger.logWorkflowEvent(execution.getWorkflowId(), execution.getExecutionId(),
                WorkflowEventType.STEP_FAILED, "Step " + index + " (" + step.displayName() + ") failed: " + error,
                Map.of("type", String.valueOf(step.getType())));
        return execution;
    }

    private void finish(WorkflowExecution execution, Timer.Sample sample) {
        if (running.remove(execution.getExecutionId()) == null) {
            return;
        }
        boolean completed = execution.getStatus() == ExecutionStatus.COMPLETED;
        metrics.recordExecutionFinished(sample, completed);
        historyStore.appendExecution(execution);
        eventProducer.publishExecution(execution);
        structuredLogger.logWorkflowEvent(execution.getWorkflowId(), execution.getExecutionId(),
                completed ? WorkflowEventType.COMPLETED : WorkflowEventType.FAILED,
                "Workflow execution " + execution.getStatus().name().toLowerCase(Locale.ROOT),
                Map.of("stepsCompleted", execution.getStepsCompleted().size(),
                        "error", execution.getError() != null ? execution.getError() : ""));
    }

    private void validate(Workflow workflow) {
        if (workflow == null) {
            throw ValidationException.of("workflow", List.of("workflow is required"));
        }
        List<String> errors = new ArrayList<>();
        if (RuleValidator.isBlank(workflow.getName())) {
            errors.add("name is required");
        }
        if (workflow.getSteps() == null || workflow.getSteps().isEmpty()) {
            errors.add("at least one step is required");
        } else {
            for (int i = 0; i < workflow.getSteps().size(); i++) {
                validateStep(workflow.getSteps().get(i), "steps[" + i + "]", errors);
            }
        }
        if (!errors.isEmpty()) {
            throw ValidationException.of("workflow", errors);
        }
    }

    private void validateStep(WorkflowStep step, String path, List<String> errors) {
        if (step == null) {
            errors.add(path + " is required");
            return;
        }
        Optional<StepExecutor> executor = StepType.fromValue(step.getType()).map(executors::get);
        if (executor.isEmpty()) {
            errors.add(path + ".type '" + step.getType() + "' is not one of "
                    + Stream.of(StepType.values()).map(StepType::value).toList());
            return;
        }
        if (step.getConfig() == null) {
            step.setConfig(new HashMap<>());
        }
        executor.get().validate(step, path, errors);
    }

    private record RunningExecution(WorkflowExecution execution, ExecutionScope scope) {
    }
}
