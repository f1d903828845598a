package com.agentflow.api.rest;

import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.WorkflowQuery;
import com.agentflow.engine.service.WorkflowService;
import com.agentflow.engine.service.WorkflowService.StepRequest;
import com.agentflow.engine.service.WorkflowService.WorkflowRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for workflow definitions and triggering executions.
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Create a workflow. The full violation list is returned when the definition is invalid.
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> createWorkflow(@RequestBody WorkflowRequestDto request) {
        Workflow workflow = workflowService.createWorkflow(request.toRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(workflow));
    }

    /**
     * List workflows. {@code tags} is comma-separated; a workflow matches when it carries any of them.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> listWorkflows(
            @RequestParam(name = "workflow_type", required = false) String workflowType,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String tags,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        List<Workflow> workflows = workflowService.listWorkflows(new WorkflowQuery(
            WorkflowType.fromValue(workflowType),
            WorkflowStatus.fromValue(status),
            splitTags(tags),
            limit,
            offset
        ));

        return ResponseEntity.ok(workflows.stream().map(WorkflowResponse::from).toList());
    }

    private static List<String> splitTags(String tags) {
        if (tags == null) {
            return null;
        }
        return Arrays.stream(tags.split(","))
            .map(String::trim)
            .filter(tag -> !tag.isEmpty())
            .toList();
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable String workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(workflowService.getWorkflow(workflowId)));
    }

    /**
     * Replace a workflow definition. Executions already running keep the version they started with.
     */
    @PutMapping("/{workflowId}")
    public ResponseEntity<WorkflowResponse> updateWorkflow(
            @PathVariable String workflowId,
            @RequestBody WorkflowRequestDto request) {

        Workflow workflow = workflowService.updateWorkflow(workflowId, request.toRequest());
        return ResponseEntity.ok(WorkflowResponse.from(workflow));
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable String workflowId) {
        workflowService.deleteWorkflow(workflowId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Start an execution. Returns immediately; progress is observed through {@code GET /executions/{id}}.
     */
    @PostMapping("/{workflowId}/execute")
    public ResponseEntity<ExecuteResponse> executeWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) ExecuteRequest request) {

        JsonNode input = request != null ? request.inputData() : null;
        UUID executionId = workflowService.executeWorkflow(workflowId, input);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ExecuteResponse(executionId));
    }

    // ========== DTOs ==========

    public record WorkflowRequestDto(
        String id,
        String name,
        String description,
        WorkflowType workflowType,
        WorkflowStatus status,
        JsonNode config,
        JsonNode metadata,
        List<String> tags,
        List<StepRequestDto> steps
    ) {
        WorkflowRequest toRequest() {
            return new WorkflowRequest(
                id, name, description, workflowType, status, config, metadata, tags,
                steps == null ? List.of() : steps.stream().map(StepRequestDto::toRequest).toList()
            );
        }
    }

    public record StepRequestDto(
        String id,
        String name,
        String stepType,
        String agentRef,
        JsonNode config,
        List<String> dependencies,
        Integer timeoutSeconds,
        Integer retryCount
    ) {
        StepRequest toRequest() {
            return new StepRequest(id, name, stepType, agentRef, config, dependencies, timeoutSeconds, retryCount);
        }
    }

    public record ExecuteRequest(JsonNode inputData) {}

    public record ExecuteResponse(UUID executionId) {}

    public record WorkflowResponse(
        String id,
        String name,
        String description,
        WorkflowType workflowType,
        WorkflowStatus status,
        JsonNode config,
        JsonNode metadata,
        Set<String> tags,
        List<StepResponse> steps,
        int version,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static WorkflowResponse from(Workflow workflow) {
            return new WorkflowResponse(
                workflow.id(),
                workflow.name(),
                workflow.description(),
                workflow.workflowType(),
                workflow.status(),
                workflow.config(),
                workflow.metadata(),
                workflow.tags(),
                workflow.steps().stream().map(StepResponse::from).toList(),
                workflow.version(),
                workflow.createdAt(),
                workflow.updatedAt()
            );
        }
    }

    public record StepResponse(
        String id,
        String name,
        String stepType,
        String agentRef,
        JsonNode config,
        List<String> dependencies,
        int timeoutSeconds,
        int retryCount
    ) {
        public static StepResponse from(WorkflowStep step) {
            return new StepResponse(
                step.id(),
                step.name(),
                step.stepType(),
                step.agentRef(),
                step.config(),
                step.dependencies(),
                step.timeoutSeconds(),
                step.retryCount()
            );
        }
    }
}
