package com.agentflow.engine.persistence;

import com.agentflow.core.exception.OptimisticLockException;
import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ExecutionRepository with the same optimistic versioning as the
 * JDBC store. Used for tests and single-process deployments.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<UUID, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final InMemoryStepExecutionRepository steps;

    public InMemoryExecutionRepository(InMemoryStepExecutionRepository steps) {
        this.steps = steps;
    }

    @Override
    public void save(WorkflowExecution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public void update(WorkflowExecution execution) {
        executions.compute(execution.id(), (id, stored) -> {
            if (stored == null || stored.version() != execution.version() - 1) {
                throw new OptimisticLockException("WorkflowExecution", id, execution.version() - 1);
            }
            return execution;
        });
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> find(ExecutionQuery query) {
        return executions.values().stream()
            .filter(e -> query.workflowId() == null || query.workflowId().equals(e.workflowId()))
            .filter(e -> query.status() == null || query.status() == e.status())
            .sorted(Comparator.comparing(InMemoryExecutionRepository::startedOrMin).reversed()
                .thenComparing(WorkflowExecution::createdAt, Comparator.reverseOrder()))
            .skip(query.offset())
            .limit(query.limit())
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findNonTerminal() {
        return executions.values().stream()
            .filter(e -> !e.status().isTerminal())
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public long countActive(String workflowId) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .filter(e -> !e.status().isTerminal())
            .count();
    }

    @Override
    public ExecutionStatistics statistics(String workflowId) {
        List<WorkflowExecution> matching = executions.values().stream()
            .filter(e -> workflowId == null || workflowId.equals(e.workflowId()))
            .collect(Collectors.toList());
        double averageDuration = matching.stream()
            .filter(e -> e.durationSeconds() != null)
            .mapToDouble(WorkflowExecution::durationSeconds)
            .average()
            .orElse(0.0);
        return new ExecutionStatistics(
            workflowId,
            matching.size(),
            count(matching, ExecutionStatus.SUCCEEDED),
            count(matching, ExecutionStatus.FAILED),
            count(matching, ExecutionStatus.CANCELLED),
            count(matching, ExecutionStatus.RUNNING),
            averageDuration
        );
    }

    void deleteByWorkflow(String workflowId) {
        executions.values().removeIf(e -> {
            if (e.workflowId().equals(workflowId)) {
                steps.deleteByExecution(e.id());
                return true;
            }
            return false;
        });
    }

    private static long count(List<WorkflowExecution> executions, ExecutionStatus status) {
        return executions.stream().filter(e -> e.status() == status).count();
    }

    private static Instant startedOrMin(WorkflowExecution execution) {
        return execution.startedAt() != null ? execution.startedAt() : Instant.MIN;
    }
}
