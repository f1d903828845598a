package com.agentflow.engine.service;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.SystemStatistics;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.StepExecutionRepository;
import com.agentflow.core.repository.WorkflowQuery;
import com.agentflow.core.repository.WorkflowRepository;
import com.agentflow.core.validation.ValidationResult;
import com.agentflow.core.validation.ViolationCode;
import com.agentflow.core.validation.WorkflowValidator;
import com.agentflow.engine.execution.EngineSettings;
import com.agentflow.engine.execution.ExecutionPlanCache;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.state.StoreRetrier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Default {@link WorkflowService}: shapes requests into domain objects, validates them and
 * delegates to the store and the execution service. Store calls go through the
 * {@link StoreRetrier}.
 */
public class WorkflowManager implements WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowManager.class);

    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final StepExecutionRepository stepRepository;
    private final WorkflowValidator validator;
    private final ExecutionService executionService;
    private final ExecutionPlanCache plans;
    private final EngineSettings settings;
    private final StoreRetrier retrier;
    private final Clock clock;

    public WorkflowManager(
        WorkflowRepository workflowRepository,
        ExecutionRepository executionRepository,
        StepExecutionRepository stepRepository,
        WorkflowValidator validator,
        ExecutionService executionService,
        ExecutionPlanCache plans,
        EngineSettings settings,
        StoreRetrier retrier,
        Clock clock
    ) {
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.stepRepository = stepRepository;
        this.validator = validator;
        this.executionService = executionService;
        this.plans = plans;
        this.settings = settings;
        this.retrier = retrier;
        this.clock = clock;
    }

    @Override
    public Workflow createWorkflow(WorkflowRequest request) {
        Instant now = clock.instant();
        Workflow workflow = toWorkflow(request, request.status() != null ? request.status() : WorkflowStatus.DRAFT, now);
        requireValid(validator.validate(workflow));
        retrier.run("save workflow", () -> workflowRepository.save(workflow));
        log.info("Created workflow {} ({}, {} steps)", workflow.id(), workflow.workflowType().value(),
            workflow.steps().size());
        return workflow;
    }

    @Override
    public Workflow updateWorkflow(String workflowId, WorkflowRequest request) {
        Workflow existing = getWorkflow(workflowId);
        Instant now = clock.instant();
        Workflow proposed = toWorkflow(withId(request, workflowId), request.status(), now);
        Workflow updated = existing.nextVersion(proposed, now);
        requireValid(validator.validate(updated));
        retrier.run("update workflow", () -> workflowRepository.update(updated));
        log.info("Updated workflow {} to version {}", workflowId, updated.version());
        return updated;
    }

    @Override
    public void deleteWorkflow(String workflowId) {
        getWorkflow(workflowId);
        long active = retrier.call("count active executions", () -> executionRepository.countActive(workflowId));
        if (active > 0) {
            throw new ConflictException("Workflow " + workflowId + " has " + active
                + " pending or running executions");
        }
        boolean deleted = retrier.call("delete workflow", () -> workflowRepository.delete(workflowId));
        if (!deleted) {
            throw new NotFoundException("Workflow", workflowId);
        }
        plans.evict(workflowId);
        log.info("Deleted workflow {}", workflowId);
    }

    @Override
    public Workflow getWorkflow(String workflowId) {
        return retrier.call("find workflow", () -> workflowRepository.findById(workflowId))
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    @Override
    public List<Workflow> listWorkflows(WorkflowQuery query) {
        requireValid(validator.validatePage(query.limit(), query.offset()));
        return retrier.call("find workflows", () -> workflowRepository.find(query));
    }

    @Override
    public UUID executeWorkflow(String workflowId, JsonNode inputData) {
        JsonNode input = inputData == null || inputData.isNull()
            ? JsonNodeFactory.instance.objectNode()
            : inputData;
        requireValid(validator.validateInput(input));
        Workflow workflow = getWorkflow(workflowId);
        UUID executionId = executionService.execute(workflow, input);
        try (LoggingContext lc = LoggingContext.forExecution(executionId, workflowId)) {
            log.info("Execution {} requested for workflow {} v{}", executionId, workflowId, workflow.version());
        }
        return executionId;
    }

    @Override
    public ExecutionDetails getExecution(UUID executionId) {
        WorkflowExecution execution = executionService.getStatus(executionId);
        return new ExecutionDetails(execution,
            retrier.call("find step executions", () -> stepRepository.findByExecution(executionId)));
    }

    @Override
    public List<WorkflowExecution> listExecutions(ExecutionQuery query) {
        requireValid(validator.validatePage(query.limit(), query.offset()));
        return retrier.call("find executions", () -> executionRepository.find(query));
    }

    @Override
    public WorkflowExecution cancelExecution(UUID executionId, String reason) {
        return executionService.cancel(executionId, reason);
    }

    @Override
    public void signalExecution(UUID executionId, String eventName, JsonNode payload) {
        if (eventName == null || eventName.isBlank()) {
            throw new WorkflowValidationException(ValidationResult.valid()
                .add(ViolationCode.REQUIRED, "name", "Event name is required"));
        }
        executionService.signal(executionId, eventName.trim(), payload);
    }

    @Override
    public ExecutionStatistics getWorkflowStatistics(String workflowId) {
        getWorkflow(workflowId);
        return retrier.call("execution statistics", () -> executionRepository.statistics(workflowId));
    }

    @Override
    public SystemStatistics getSystemStatistics() {
        return new SystemStatistics(
            retrier.call("count workflows", workflowRepository::count),
            retrier.call("count workflows by type", workflowRepository::countByType),
            retrier.call("count workflows by status", workflowRepository::countByStatus),
            retrier.call("execution statistics", () -> executionRepository.statistics(null))
        );
    }

    // ========== Internal Methods ==========

    private Workflow toWorkflow(WorkflowRequest request, WorkflowStatus status, Instant now) {
        List<WorkflowStep> steps = new ArrayList<>();
        if (request.steps() != null) {
            for (StepRequest step : request.steps()) {
                steps.add(toStep(step));
            }
        }
        return Workflow.builder()
            .id(trim(request.id()))
            .name(trim(request.name()))
            .description(trim(request.description()))
            .workflowType(request.workflowType())
            .status(status)
            .config(request.config())
            .metadata(request.metadata())
            .tags(trimAll(request.tags()))
            .steps(steps)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    private WorkflowStep toStep(StepRequest request) {
        return WorkflowStep.builder()
            .id(trim(request.id()))
            .name(trim(request.name()))
            .stepType(request.stepType() != null ? trim(request.stepType()) : "agent")
            .agentRef(trim(request.agentRef()))
            .config(request.config())
            .dependencies(request.dependencies() != null
                ? request.dependencies().stream().map(WorkflowManager::trim).toList()
                : List.of())
            .timeoutSeconds(request.timeoutSeconds() != null ? request.timeoutSeconds() : settings.defaultTimeoutSeconds())
            .retryCount(request.retryCount() != null ? request.retryCount() : settings.defaultRetryCount())
            .build();
    }

    private static WorkflowRequest withId(WorkflowRequest request, String workflowId) {
        return new WorkflowRequest(workflowId, request.name(), request.description(), request.workflowType(),
            request.status(), request.config(), request.metadata(), request.tags(), request.steps());
    }

    private static void requireValid(ValidationResult result) {
        if (!result.isValid()) {
            throw new WorkflowValidationException(result);
        }
    }

    private static Set<String> trimAll(List<String> values) {
        Set<String> trimmed = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                trimmed.add(value == null ? "" : value.trim());
            }
        }
        return trimmed;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
