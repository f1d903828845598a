package com.agentflow.engine.service;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.WorkflowValidationException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.StepExecutionRepository;
import com.agentflow.core.repository.WorkflowRepository;
import com.agentflow.core.validation.ViolationCode;
import com.agentflow.core.validation.WorkflowValidator;
import com.agentflow.engine.execution.EngineSettings;
import com.agentflow.engine.execution.ExecutionPlanCache;
import com.agentflow.engine.service.WorkflowService.StepRequest;
import com.agentflow.engine.service.WorkflowService.WorkflowRequest;
import com.agentflow.engine.state.StoreRetrier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private WorkflowRepository workflowRepository;

    @Mock
    private ExecutionRepository executionRepository;

    @Mock
    private StepExecutionRepository stepRepository;

    @Mock
    private ExecutionService executionService;

    private ExecutionPlanCache plans;
    private WorkflowManager manager;

    @BeforeEach
    void setUp() {
        ConditionEvaluator conditions = new ConditionEvaluator();
        plans = new ExecutionPlanCache(conditions);
        manager = new WorkflowManager(workflowRepository, executionRepository, stepRepository,
            new WorkflowValidator(), executionService, plans, EngineSettings.defaults(),
            StoreRetrier.noRetry(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A valid workflow is stored as a draft at version 1 with engine defaults applied")
    void createWorkflow() {
        Workflow created = manager.createWorkflow(request("  research ", null,
            step("fetch"), step("summarize", "fetch")));

        ArgumentCaptor<Workflow> saved = ArgumentCaptor.forClass(Workflow.class);
        verify(workflowRepository).save(saved.capture());
        assertThat(saved.getValue()).isEqualTo(created);
        assertThat(created.name()).isEqualTo("research");
        assertThat(created.status()).isEqualTo(WorkflowStatus.DRAFT);
        assertThat(created.version()).isEqualTo(1);
        assertThat(created.createdAt()).isEqualTo(NOW);
        assertThat(created.steps().get(1).timeoutSeconds()).isEqualTo(EngineSettings.defaults().defaultTimeoutSeconds());
        assertThat(created.steps().get(1).retryCount()).isEqualTo(EngineSettings.defaults().defaultRetryCount());
        assertThat(created.steps()).allSatisfy(step -> assertThat(step.workflowId()).isEqualTo(created.id()));
    }

    @Test
    @DisplayName("An invalid workflow is rejected with every violation and nothing is stored")
    void createInvalidWorkflow() {
        WorkflowRequest cyclic = request("", null, step("a", "b"), step("b", "a"));

        assertThatThrownBy(() -> manager.createWorkflow(cyclic))
            .isInstanceOf(WorkflowValidationException.class)
            .satisfies(e -> {
                WorkflowValidationException validation = (WorkflowValidationException) e;
                assertThat(validation.getResult().hasViolation(ViolationCode.REQUIRED)).isTrue();
                assertThat(validation.getResult().hasViolation(ViolationCode.CYCLE)).isTrue();
            });
        verify(workflowRepository, never()).save(any());
    }

    @Test
    @DisplayName("Updating bumps the version and keeps identity and creation time")
    void updateWorkflow() {
        Workflow existing = manager.createWorkflow(request("research", null, step("fetch")));
        when(workflowRepository.findById(existing.id())).thenReturn(Optional.of(existing));

        Workflow updated = manager.updateWorkflow(existing.id(),
            request("research v2", WorkflowStatus.ACTIVE, step("fetch"), step("store", "fetch")));

        verify(workflowRepository).update(updated);
        assertThat(updated.id()).isEqualTo(existing.id());
        assertThat(updated.version()).isEqualTo(2);
        assertThat(updated.status()).isEqualTo(WorkflowStatus.ACTIVE);
        assertThat(updated.steps()).hasSize(2);
    }

    @Test
    @DisplayName("A workflow with active executions cannot be deleted")
    void deleteWithActiveExecutions() {
        Workflow existing = manager.createWorkflow(request("research", null, step("fetch")));
        when(workflowRepository.findById(existing.id())).thenReturn(Optional.of(existing));
        when(executionRepository.countActive(existing.id())).thenReturn(2L);

        assertThatThrownBy(() -> manager.deleteWorkflow(existing.id()))
            .isInstanceOf(ConflictException.class);
        verify(workflowRepository, never()).delete(any());
    }

    @Test
    @DisplayName("Deleting a workflow drops its cached plan")
    void deleteEvictsPlan() {
        Workflow existing = manager.createWorkflow(request("research", null, step("fetch")));
        plans.planFor(existing);
        when(workflowRepository.findById(existing.id())).thenReturn(Optional.of(existing));
        when(workflowRepository.delete(existing.id())).thenReturn(true);

        manager.deleteWorkflow(existing.id());

        assertThat(plans.size()).isZero();
    }

    @Test
    @DisplayName("Unknown workflows are reported as not found")
    void unknownWorkflow() {
        when(workflowRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> manager.getWorkflow("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.executeWorkflow("missing", null)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Executing without input passes an empty object to the engine")
    void executeWithoutInput() {
        Workflow existing = manager.createWorkflow(request("research", null, step("fetch")));
        when(workflowRepository.findById(existing.id())).thenReturn(Optional.of(existing));
        UUID executionId = UUID.randomUUID();
        when(executionService.execute(eq(existing), any())).thenReturn(executionId);

        assertThat(manager.executeWorkflow(existing.id(), null)).isEqualTo(executionId);

        ArgumentCaptor<JsonNode> input = ArgumentCaptor.forClass(JsonNode.class);
        verify(executionService).execute(eq(existing), input.capture());
        assertThat(input.getValue().isObject()).isTrue();
        assertThat(input.getValue().size()).isZero();
    }

    @Test
    @DisplayName("Input that is not a JSON object is rejected before the engine sees it")
    void executeWithInvalidInput() {
        assertThatThrownBy(() -> manager.executeWorkflow("any", JsonNodeFactory.instance.arrayNode()))
            .isInstanceOf(WorkflowValidationException.class);
        verify(executionService, never()).execute(any(), any());
    }

    @Test
    @DisplayName("Listing rejects page sizes out of range")
    void listPaging() {
        assertThatThrownBy(() -> manager.listExecutions(new ExecutionQuery(null, null, 0, 0)))
            .isInstanceOf(WorkflowValidationException.class);
        assertThatThrownBy(() -> manager.listExecutions(new ExecutionQuery(null, null, 10, -1)))
            .isInstanceOf(WorkflowValidationException.class);
    }

    @Test
    @DisplayName("Events need a name")
    void signalWithoutName() {
        assertThatThrownBy(() -> manager.signalExecution(UUID.randomUUID(), " ", null))
            .isInstanceOf(WorkflowValidationException.class);
        verify(executionService, never()).signal(any(), any(), any());
    }

    private static WorkflowRequest request(String name, WorkflowStatus status, StepRequest... steps) {
        return new WorkflowRequest(null, name, null, WorkflowType.SEQUENTIAL, status, null, null,
            List.of("research"), List.of(steps));
    }

    private static StepRequest step(String name, String... dependsOn) {
        return new StepRequest(null, name, "task", null, null, List.of(dependsOn), null, null);
    }
}
