package com.agentflow.engine.execution;

import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepKey;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.worker.CancellationSignal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory state of one live execution: the latest attempt of every step key, in-flight
 * worker futures and pending timers.
 *
 * Every read and write happens while holding {@link #lock()}; the context itself does no
 * synchronization beyond that lock.
 */
public final class ExecutionContext {

    private final UUID executionId;
    private final ExecutionPlan plan;
    private final ReentrantLock lock = new ReentrantLock();
    private final CancellationSignal cancellation = new CancellationSignal();

    private final Map<StepKey, StepExecution> latest = new LinkedHashMap<>();
    private final Map<StepKey, Future<?>> running = new HashMap<>();
    private final Map<StepKey, UUID> deadlineTimers = new HashMap<>();
    private final Map<StepKey, UUID> retryTimers = new HashMap<>();

    private WorkflowExecution execution;
    private int iteration;
    private boolean loopComplete;
    private boolean closed;

    public ExecutionContext(WorkflowExecution execution, ExecutionPlan plan) {
        this.executionId = execution.id();
        this.execution = execution;
        this.plan = plan;
        this.loopComplete = !plan.isLoop();
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public UUID executionId() {
        return executionId;
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public WorkflowExecution execution() {
        return execution;
    }

    public void update(WorkflowExecution updated) {
        this.execution = updated;
    }

    // ========== Attempts ==========

    public StepExecution latest(StepKey key) {
        return latest.get(key);
    }

    /**
     * Record an attempt, replacing the previous attempt of the same key.
     */
    public void record(StepExecution attempt) {
        latest.put(attempt.key(), attempt);
    }

    /**
     * Key of the step in the current loop iteration, iteration 0 for steps outside the loop.
     */
    public StepKey currentKey(String stepId) {
        return new StepKey(stepId, plan.isLoopStep(stepId) ? iteration : 0);
    }

    public StepExecution current(String stepId) {
        return latest.get(currentKey(stepId));
    }

    /**
     * Latest attempt of a step across iterations.
     */
    public Optional<StepExecution> mostRecent(String stepId) {
        StepExecution found = null;
        for (StepExecution attempt : latest.values()) {
            if (attempt.stepId().equals(stepId) && (found == null || attempt.iteration() > found.iteration())) {
                found = attempt;
            }
        }
        return Optional.ofNullable(found);
    }

    public Collection<StepExecution> allLatest() {
        return latest.values();
    }

    public int inFlightCount() {
        int count = 0;
        for (String stepId : plan.stepIds()) {
            StepExecution attempt = current(stepId);
            if (attempt != null && attempt.status().isInFlight()) {
                count++;
            }
        }
        return count;
    }

    // ========== Loop ==========

    public int iteration() {
        return iteration;
    }

    public void setIteration(int iteration) {
        this.iteration = iteration;
    }

    public boolean isLoopComplete() {
        return loopComplete;
    }

    public void markLoopComplete() {
        this.loopComplete = true;
    }

    // ========== Workers and timers ==========

    public void trackAttempt(StepKey key, Future<?> future, UUID deadlineTimer) {
        running.put(key, future);
        deadlineTimers.put(key, deadlineTimer);
    }

    public void replaceDeadlineTimer(StepKey key, UUID deadlineTimer) {
        deadlineTimers.put(key, deadlineTimer);
    }

    /**
     * Forget the worker and deadline timer of a settled attempt.
     *
     * @return the worker future and timer that were tracked, for the caller to cancel
     */
    public SettledAttempt settle(StepKey key) {
        return new SettledAttempt(running.remove(key), deadlineTimers.remove(key));
    }

    public void setRetryTimer(StepKey key, UUID timerId) {
        retryTimers.put(key, timerId);
    }

    public UUID clearRetryTimer(StepKey key) {
        return retryTimers.remove(key);
    }

    public boolean hasRetryTimer(StepKey key) {
        return retryTimers.containsKey(key);
    }

    public int runningWorkers() {
        int count = 0;
        for (Future<?> future : running.values()) {
            if (!future.isDone()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Drain all worker futures and timer ids, used when the execution is finished.
     */
    public Released release() {
        List<Future<?>> futures = new ArrayList<>(running.values());
        List<UUID> timers = new ArrayList<>(deadlineTimers.values());
        timers.addAll(retryTimers.values());
        running.clear();
        deadlineTimers.clear();
        retryTimers.clear();
        return new Released(futures, timers);
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        this.closed = true;
    }

    public record SettledAttempt(Future<?> worker, UUID deadlineTimer) {
    }

    public record Released(List<Future<?>> workers, List<UUID> timers) {
    }
}
