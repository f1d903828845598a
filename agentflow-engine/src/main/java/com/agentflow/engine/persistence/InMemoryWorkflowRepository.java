package com.agentflow.engine.persistence;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.OptimisticLockException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.WorkflowQuery;
import com.agentflow.core.repository.WorkflowRepository;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowRepository.
 * Deleting a workflow also drops its executions from the companion execution repository.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();
    private final InMemoryExecutionRepository executions;

    public InMemoryWorkflowRepository(InMemoryExecutionRepository executions) {
        this.executions = executions;
    }

    @Override
    public void save(Workflow workflow) {
        if (workflows.putIfAbsent(workflow.id(), workflow) != null) {
            throw new ConflictException("Workflow already exists: " + workflow.id());
        }
    }

    @Override
    public void update(Workflow workflow) {
        workflows.compute(workflow.id(), (id, stored) -> {
            if (stored == null || stored.version() != workflow.version() - 1) {
                throw new OptimisticLockException("Workflow", id, workflow.version() - 1);
            }
            return workflow;
        });
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public List<Workflow> find(WorkflowQuery query) {
        return workflows.values().stream()
            .filter(w -> query.workflowType() == null || w.workflowType() == query.workflowType())
            .filter(w -> query.status() == null || w.status() == query.status())
            .filter(w -> query.tags() == null || query.tags().stream().anyMatch(w.tags()::contains))
            .sorted(Comparator.comparing(Workflow::updatedAt).reversed())
            .skip(query.offset())
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String workflowId) {
        if (workflows.remove(workflowId) == null) {
            return false;
        }
        executions.deleteByWorkflow(workflowId);
        return true;
    }

    @Override
    public long count() {
        return workflows.size();
    }

    @Override
    public Map<WorkflowType, Long> countByType() {
        Map<WorkflowType, Long> counts = new EnumMap<>(WorkflowType.class);
        workflows.values().forEach(w -> counts.merge(w.workflowType(), 1L, Long::sum));
        return counts;
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
        workflows.values().forEach(w -> counts.merge(w.status(), 1L, Long::sum));
        return counts;
    }
}
