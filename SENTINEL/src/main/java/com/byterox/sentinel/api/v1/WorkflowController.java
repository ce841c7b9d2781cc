package com.byterox.sentinel.api.v1;

import com.byterox.sentinel.api.dto.WorkflowRequest;
import com.byterox.sentinel.domain.model.Workflow;
import com.byterox.sentinel.domain.model.WorkflowExecution;
import com.byterox.sentinel.workflow.WorkflowEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST API controller for workflows and their executions.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
@Tag(name = "Workflows", description = "Multi-step workflows and executions")
public class WorkflowController {

    private final WorkflowEngine workflowEngine;

    public WorkflowController(WorkflowEngine workflowEngine) {
        this.workflowEngine = workflowEngine;
    }

    @PostMapping
    @Operation(summary = "Create workflow", description = "Validate and store a workflow")
    public Mono<ResponseEntity<Workflow>> createWorkflow(@Valid @RequestBody WorkflowRequest request) {
        return Mono.fromCallable(() -> workflowEngine.createWorkflow(request.toWorkflow()))
                .map(workflow -> ResponseEntity.status(HttpStatus.CREATED).body(workflow));
    }

    @GetMapping
    @Operation(summary = "List workflows")
    public Mono<ResponseEntity<List<Workflow>>> listWorkflows() {
        return Mono.fromCallable(workflowEngine::listWorkflows)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get workflow")
    public Mono<ResponseEntity<Workflow>> getWorkflow(
            @Parameter(description = "Workflow ID") @PathVariable String id) {
        return Mono.fromCallable(() -> workflowEngine.getWorkflow(id))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete workflow", description = "Remove a workflow and cancel its running executions")
    public Mono<ResponseEntity<Void>> deleteWorkflow(
            @Parameter(description = "Workflow ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> workflowEngine.deleteWorkflow(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{id}/execute")
    @Operation(summary = "Execute workflow",
               description = "Run a fresh execution and return it once it reached a terminal state")
    public Mono<ResponseEntity<WorkflowExecution>> executeWorkflow(
            @Parameter(description = "Workflow ID") @PathVariable String id,
            @RequestBody(required = false) Map<String, Object> context) {
        return workflowEngine.execute(id, context != null ? context : Map.of())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/executions")
    @Operation(summary = "List executions", description = "Running and finished executions, newest first")
    public Mono<ResponseEntity<List<WorkflowExecution>>> listExecutions(
            @Parameter(description = "Workflow ID") @PathVariable String id,
            @Parameter(description = "Maximum entries") @RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> workflowEngine.listExecutions(id, limit))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/executions/{executionId}")
    @Operation(summary = "Get execution")
    public Mono<ResponseEntity<WorkflowExecution>> getExecution(
            @Parameter(description = "Execution ID") @PathVariable String executionId) {
        return Mono.fromCallable(() -> workflowEngine.getExecution(executionId))
                .map(ResponseEntity::ok);
    }
}
