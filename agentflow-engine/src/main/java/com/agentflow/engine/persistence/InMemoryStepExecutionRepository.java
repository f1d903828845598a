package com.agentflow.engine.persistence;

import com.agentflow.core.model.StepExecution;
import com.agentflow.core.repository.StepExecutionRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StepExecutionRepository.
 * Keeps attempts per execution in creation order.
 */
public class InMemoryStepExecutionRepository implements StepExecutionRepository {

    private final Map<UUID, List<StepExecution>> byExecution = new ConcurrentHashMap<>();

    @Override
    public void save(StepExecution stepExecution) {
        List<StepExecution> attempts = byExecution.computeIfAbsent(stepExecution.executionId(), id -> new ArrayList<>());
        synchronized (attempts) {
            attempts.add(stepExecution);
        }
    }

    @Override
    public void saveAll(List<StepExecution> stepExecutions) {
        stepExecutions.forEach(this::save);
    }

    @Override
    public void update(StepExecution stepExecution) {
        List<StepExecution> attempts = byExecution.get(stepExecution.executionId());
        if (attempts == null) {
            throw new IllegalStateException("Unknown step execution: " + stepExecution.id());
        }
        synchronized (attempts) {
            for (int i = 0; i < attempts.size(); i++) {
                if (attempts.get(i).id().equals(stepExecution.id())) {
                    attempts.set(i, stepExecution);
                    return;
                }
            }
        }
        throw new IllegalStateException("Unknown step execution: " + stepExecution.id());
    }

    @Override
    public List<StepExecution> findByExecution(UUID executionId) {
        List<StepExecution> attempts = byExecution.get(executionId);
        if (attempts == null) {
            return List.of();
        }
        synchronized (attempts) {
            return List.copyOf(attempts);
        }
    }

    void deleteByExecution(UUID executionId) {
        byExecution.remove(executionId);
    }
}
