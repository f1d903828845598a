package com.agentflow.api.rest;

import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepResult;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.service.WorkflowService.ExecutionDetails;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for observing and steering executions.
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final WorkflowService workflowService;

    public ExecutionController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> listExecutions(
            @RequestParam(name = "workflow_id", required = false) String workflowId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        List<WorkflowExecution> executions = workflowService.listExecutions(
            new ExecutionQuery(workflowId, ExecutionStatus.fromValue(status), limit, offset));

        return ResponseEntity.ok(executions.stream().map(ExecutionResponse::from).toList());
    }

    /**
     * Get an execution with its step results and every attempt of every step.
     */
    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionDetailResponse> getExecution(@PathVariable UUID executionId) {
        return ResponseEntity.ok(ExecutionDetailResponse.from(workflowService.getExecution(executionId)));
    }

    /**
     * Cancel a pending or running execution. Steps not yet finished are skipped.
     */
    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<ExecutionResponse> cancelExecution(
            @PathVariable UUID executionId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null ? request.reason() : null;
        WorkflowExecution execution = workflowService.cancelExecution(executionId, reason);
        return ResponseEntity.ok(ExecutionResponse.from(execution));
    }

    /**
     * Deliver a named event to an event-driven execution.
     */
    @PostMapping("/{executionId}/events")
    public ResponseEntity<EventAccepted> signalExecution(
            @PathVariable UUID executionId,
            @RequestBody EventRequest request) {

        workflowService.signalExecution(executionId, request.name(), request.payload());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new EventAccepted(true, request.name()));
    }

    // ========== DTOs ==========

    public record CancelRequest(String reason) {}

    public record EventRequest(String name, JsonNode payload) {}

    public record EventAccepted(boolean accepted, String name) {}

    public record ExecutionResponse(
        UUID id,
        String workflowId,
        int workflowVersion,
        ExecutionStatus status,
        JsonNode inputData,
        JsonNode outputData,
        Map<String, StepResult> stepResults,
        String error,
        String errorCode,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Double durationSeconds
    ) {
        public static ExecutionResponse from(WorkflowExecution execution) {
            return new ExecutionResponse(
                execution.id(),
                execution.workflowId(),
                execution.workflowVersion(),
                execution.status(),
                execution.inputData(),
                execution.outputData(),
                execution.stepResults(),
                execution.error(),
                execution.errorCode(),
                execution.createdAt(),
                execution.startedAt(),
                execution.completedAt(),
                execution.durationSeconds()
            );
        }
    }

    public record ExecutionDetailResponse(
        ExecutionResponse execution,
        Map<String, JsonNode> receivedEvents,
        List<AttemptResponse> steps
    ) {
        public static ExecutionDetailResponse from(ExecutionDetails details) {
            return new ExecutionDetailResponse(
                ExecutionResponse.from(details.execution()),
                details.execution().receivedEvents(),
                details.steps().stream().map(AttemptResponse::from).toList()
            );
        }
    }

    public record AttemptResponse(
        UUID id,
        String stepId,
        String stepName,
        int iteration,
        int attempt,
        StepStatus status,
        JsonNode result,
        String error,
        String errorCode,
        Instant dispatchedAt,
        Instant deadline,
        Instant startedAt,
        Instant completedAt
    ) {
        public static AttemptResponse from(StepExecution step) {
            return new AttemptResponse(
                step.id(),
                step.stepId(),
                step.stepName(),
                step.iteration(),
                step.attempt(),
                step.status(),
                step.result(),
                step.error(),
                step.errorCode(),
                step.dispatchedAt(),
                step.deadline(),
                step.startedAt(),
                step.completedAt()
            );
        }
    }
}
