package com.agentflow.engine.state;

import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.ErrorCodes;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepKey;
import com.agentflow.core.model.StepResult;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.repository.ExecutionRepository;
import com.agentflow.core.repository.StepExecutionRepository;
import com.agentflow.engine.execution.ExecutionContext;
import com.agentflow.engine.execution.ExecutionPlan;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Single owner of execution and step state.
 *
 * Every transition is checked against the status machines, persisted (with store retries) and
 * only then applied to the in-memory context and published to listeners. All methods taking a
 * context lock it for the duration of the transition; the lock is re-entrant so callers that
 * already hold it may group several transitions.
 *
 * Signals carry the attempt number they refer to. A signal for an attempt that is no longer
 * current, or no longer awaiting a result, is discarded and reported as stale.
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    private final ExecutionRepository executionRepository;
    private final StepExecutionRepository stepRepository;
    private final StoreRetrier retrier;
    private final Clock clock;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public StateManager(
        ExecutionRepository executionRepository,
        StepExecutionRepository stepRepository,
        StoreRetrier retrier,
        Clock clock
    ) {
        this.executionRepository = executionRepository;
        this.stepRepository = stepRepository;
        this.retrier = retrier;
        this.clock = clock;
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(listener);
    }

    // ========== Executions ==========

    /**
     * Persist a new PENDING execution and the first PENDING attempt of every step.
     */
    public ExecutionContext createExecution(ExecutionPlan plan, JsonNode inputData) {
        WorkflowExecution execution = WorkflowExecution.create(plan.workflow(), inputData, clock.instant());
        List<StepExecution> attempts = new ArrayList<>();
        for (String stepId : plan.stepIds()) {
            attempts.add(StepExecution.create(execution.id(), stepId, plan.step(stepId).name(), 0));
        }

        retrier.run("save execution", () -> executionRepository.save(execution));
        retrier.run("save step executions", () -> stepRepository.saveAll(attempts));

        ExecutionContext ctx = new ExecutionContext(execution, plan);
        attempts.forEach(ctx::record);
        log.info("Created execution {} of workflow {} v{}", execution.id(), plan.workflow().id(),
            plan.workflow().version());
        publishExecution(execution, null);
        return ctx;
    }

    public WorkflowExecution getExecution(UUID executionId) {
        return retrier.call("find execution",
                () -> executionRepository.findById(executionId))
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    public List<StepExecution> getHistory(UUID executionId) {
        return retrier.call("find step executions", () -> stepRepository.findByExecution(executionId));
    }

    public void markStarted(ExecutionContext ctx) {
        ctx.lock();
        try {
            WorkflowExecution current = ctx.execution();
            if (current.status() == ExecutionStatus.RUNNING) {
                return;
            }
            transitionExecution(ctx, current.withRunning(clock.instant()));
        } finally {
            ctx.unlock();
        }
    }

    public void complete(ExecutionContext ctx, JsonNode outputData) {
        ctx.lock();
        try {
            transitionExecution(ctx, ctx.execution().withSucceeded(outputData, clock.instant()));
        } finally {
            ctx.unlock();
        }
    }

    public void fail(ExecutionContext ctx, String errorCode, String message) {
        ctx.lock();
        try {
            transitionExecution(ctx, ctx.execution().withFailed(errorCode, message, clock.instant()));
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Cancel the execution and skip every step attempt that has not reached a terminal state.
     */
    public void cancel(ExecutionContext ctx, String reason) {
        ctx.lock();
        try {
            transitionExecution(ctx, ctx.execution().withCancelled(reason, clock.instant()));
            for (StepExecution attempt : new ArrayList<>(ctx.allLatest())) {
                if (!attempt.status().isTerminal()) {
                    skip(ctx, attempt, ErrorCodes.CANCELLED, reason, false);
                }
            }
        } finally {
            ctx.unlock();
        }
    }

    public void recordEvent(ExecutionContext ctx, String eventName, JsonNode payload) {
        ctx.lock();
        try {
            WorkflowExecution updated = ctx.execution().withEvent(eventName, payload);
            retrier.run("record event", () -> executionRepository.update(updated));
            ctx.update(updated);
            log.info("Execution {} received event '{}'", ctx.executionId(), eventName);
        } finally {
            ctx.unlock();
        }
    }

    // ========== Step attempts ==========

    /**
     * Dispatch the current attempt of a step. A PENDING attempt is dispatched in place, a
     * RETRYING one is settled to its outcome and superseded by a new attempt record.
     *
     * @return the dispatched attempt
     */
    public StepExecution markDispatched(ExecutionContext ctx, StepKey key, Duration timeout) {
        ctx.lock();
        try {
            StepExecution current = require(ctx, key);
            Instant now = clock.instant();
            Instant due = now.plus(timeout);
            if (current.status() == StepStatus.PENDING) {
                StepExecution dispatched = current.withDispatched(now, due);
                retrier.run("update step execution", () -> stepRepository.update(dispatched));
                return apply(ctx, dispatched, current.status());
            }
            if (current.status() == StepStatus.RETRYING) {
                StepExecution settled = current.withSettled();
                StepExecution next = current.nextAttempt(now, due);
                retrier.run("save step execution", () -> stepRepository.save(next));
                retrier.run("update step execution", () -> stepRepository.update(settled));
                return apply(ctx, next, current.status());
            }
            throw new InvalidStateTransitionException("StepExecution", current.status(), StepStatus.DISPATCHED);
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Record that an executor picked up an attempt.
     *
     * @return false if the attempt is stale
     */
    public boolean markRunning(ExecutionContext ctx, StepKey key, int attempt) {
        ctx.lock();
        try {
            StepExecution current = ctx.latest(key);
            if (!isCurrent(current, attempt) || current.status() != StepStatus.DISPATCHED) {
                return false;
            }
            StepExecution running = current.withRunning(clock.instant());
            retrier.run("update step execution", () -> stepRepository.update(running));
            apply(ctx, running, current.status());
            return true;
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Record the result of an attempt and append it to the execution's step results.
     *
     * @return false if the attempt is stale
     */
    public boolean recordSuccess(ExecutionContext ctx, StepKey key, int attempt, JsonNode result) {
        ctx.lock();
        try {
            StepExecution current = ctx.latest(key);
            if (!isCurrent(current, attempt) || !current.status().isAwaitingResult()) {
                log.warn("Discarding stale result for step {} attempt {}", key, attempt);
                return false;
            }
            StepExecution succeeded = current.withSucceeded(result, clock.instant());
            retrier.run("update step execution", () -> stepRepository.update(succeeded));
            apply(ctx, succeeded, current.status());
            appendResult(ctx, succeeded);
            return true;
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Record a failed attempt. With attempts left and a retryable error the step moves straight
     * to RETRYING; otherwise it is permanently FAILED and its result is appended.
     */
    public FailureOutcome recordFailure(ExecutionContext ctx, StepKey key, int attempt, String errorCode,
                                        String message, boolean retryable, RetryPolicy policy) {
        ctx.lock();
        try {
            StepExecution current = ctx.latest(key);
            if (!isCurrent(current, attempt) || !current.status().isAwaitingResult()) {
                log.warn("Discarding stale failure for step {} attempt {}", key, attempt);
                return FailureOutcome.STALE;
            }
            StepExecution failed = current.withFailed(errorCode, message, clock.instant());
            if (retryable && policy.shouldRetry(errorCode) && policy.hasMoreAttempts(attempt)) {
                StepExecution retrying = failed.withRetrying();
                retrier.run("update step execution", () -> stepRepository.update(retrying));
                publishStep(failed, current.status());
                apply(ctx, retrying, failed.status());
                return FailureOutcome.RETRY;
            }
            retrier.run("update step execution", () -> stepRepository.update(failed));
            apply(ctx, failed, current.status());
            appendResult(ctx, failed);
            return FailureOutcome.EXHAUSTED;
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Record that an attempt missed its deadline. TIMED_OUT is stored first, then the attempt
     * moves to RETRYING, or to FAILED when no retry remains.
     */
    public FailureOutcome recordTimeout(ExecutionContext ctx, StepKey key, int attempt, RetryPolicy policy) {
        ctx.lock();
        try {
            StepExecution current = ctx.latest(key);
            if (!isCurrent(current, attempt) || !current.status().isAwaitingResult()) {
                return FailureOutcome.STALE;
            }
            StepExecution timedOut = current.withTimedOut(clock.instant());
            retrier.run("update step execution", () -> stepRepository.update(timedOut));
            publishStep(timedOut, current.status());
            return resolveTimeout(ctx, timedOut, policy);
        } finally {
            ctx.unlock();
        }
    }

    public void markSkipped(ExecutionContext ctx, StepKey key, String errorCode, String reason) {
        ctx.lock();
        try {
            skip(ctx, require(ctx, key), errorCode, reason, true);
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Create PENDING attempts of the loop body for the next iteration.
     */
    public void startIteration(ExecutionContext ctx, int iteration) {
        ctx.lock();
        try {
            List<StepExecution> attempts = new ArrayList<>();
            for (String stepId : ctx.plan().stepIds()) {
                if (ctx.plan().isLoopStep(stepId)) {
                    attempts.add(StepExecution.create(ctx.executionId(), stepId,
                        ctx.plan().step(stepId).name(), iteration));
                }
            }
            retrier.run("save step executions", () -> stepRepository.saveAll(attempts));
            attempts.forEach(ctx::record);
            ctx.setIteration(iteration);
            log.info("Execution {} starting loop iteration {}", ctx.executionId(), iteration);
        } finally {
            ctx.unlock();
        }
    }

    // ========== Recovery ==========

    /**
     * Load every non-terminal execution with its attempt history.
     */
    public List<RecoveredExecution> loadResumable() {
        List<RecoveredExecution> recovered = new ArrayList<>();
        for (WorkflowExecution execution : retrier.call("find non-terminal executions",
                executionRepository::findNonTerminal)) {
            recovered.add(new RecoveredExecution(execution, getHistory(execution.id())));
        }
        return recovered;
    }

    /**
     * Load one execution with its attempt history.
     */
    public RecoveredExecution loadRecovered(UUID executionId) {
        return new RecoveredExecution(getExecution(executionId), getHistory(executionId));
    }

    /**
     * Fail an execution whose context could not be rebuilt, reading its latest version from the
     * store since a partial restore may already have written to it.
     */
    public void failUnrestorable(UUID executionId, String errorCode, String message) {
        WorkflowExecution current = getExecution(executionId);
        if (current.status().isTerminal()) {
            return;
        }
        WorkflowExecution failed = current.withFailed(errorCode, message, clock.instant());
        retrier.run("update execution", () -> executionRepository.update(failed));
        log.warn("Execution {} {} -> {}: {}", executionId, current.status(), failed.status(), message);
        publishExecution(failed, current.status());
    }

    /**
     * Rebuild a context from persisted history. Step results missing for attempts that were
     * already terminal, because the process stopped between the two writes, are appended.
     */
    public ExecutionContext restore(RecoveredExecution recovered, ExecutionPlan plan) {
        ExecutionContext ctx = new ExecutionContext(recovered.execution(), plan);
        ctx.lock();
        try {
            int iteration = 0;
            for (StepExecution attempt : recovered.history()) {
                StepExecution known = ctx.latest(attempt.key());
                if (known == null || attempt.attempt() >= known.attempt()) {
                    ctx.record(attempt);
                }
                if (plan.isLoopStep(attempt.stepId())) {
                    iteration = Math.max(iteration, attempt.iteration());
                }
            }
            ctx.setIteration(iteration);
            for (String stepId : plan.stepIds()) {
                if (ctx.current(stepId) == null) {
                    StepExecution missing = StepExecution.create(ctx.executionId(), stepId,
                        plan.step(stepId).name(), plan.isLoopStep(stepId) ? iteration : 0);
                    retrier.run("save step execution", () -> stepRepository.save(missing));
                    ctx.record(missing);
                }
            }
            for (StepExecution attempt : new ArrayList<>(ctx.allLatest())) {
                if (attempt.status().isTerminal()
                    && !ctx.execution().stepResults().containsKey(attempt.key().resultKey())) {
                    appendResult(ctx, attempt);
                }
            }
            return ctx;
        } finally {
            ctx.unlock();
        }
    }

    /**
     * Treat every attempt that was awaiting a result when the process stopped as failed with
     * {@code ORCHESTRATOR_RESTART}, subject to the step's retry policy. A stored timeout that was
     * not yet resolved goes through the retry policy as well.
     *
     * @return number of attempts affected
     */
    public int failInFlight(ExecutionContext ctx, Function<String, RetryPolicy> policies) {
        ctx.lock();
        try {
            int affected = 0;
            for (StepExecution attempt : new ArrayList<>(ctx.allLatest())) {
                if (attempt.status().isAwaitingResult()) {
                    FailureOutcome outcome = recordFailure(ctx, attempt.key(), attempt.attempt(),
                        ErrorCodes.ORCHESTRATOR_RESTART,
                        "Attempt interrupted by orchestrator restart", true, policies.apply(attempt.stepId()));
                    log.info("Step {} attempt {} interrupted by restart: {}", attempt.key(), attempt.attempt(), outcome);
                    affected++;
                } else if (attempt.status() == StepStatus.TIMED_OUT) {
                    FailureOutcome outcome = resolveTimeout(ctx, attempt, policies.apply(attempt.stepId()));
                    log.info("Step {} attempt {} timed out before restart: {}", attempt.key(), attempt.attempt(), outcome);
                    affected++;
                }
            }
            return affected;
        } finally {
            ctx.unlock();
        }
    }

    // ========== Internal Methods ==========

    private FailureOutcome resolveTimeout(ExecutionContext ctx, StepExecution timedOut, RetryPolicy policy) {
        StepExecution next = policy.shouldRetry(timedOut.errorCode()) && policy.hasMoreAttempts(timedOut.attempt())
            ? timedOut.withRetrying()
            : timedOut.withExhausted();
        retrier.run("update step execution", () -> stepRepository.update(next));
        apply(ctx, next, timedOut.status());
        if (next.status() == StepStatus.RETRYING) {
            return FailureOutcome.RETRY;
        }
        appendResult(ctx, next);
        return FailureOutcome.EXHAUSTED;
    }

    private void transitionExecution(ExecutionContext ctx, WorkflowExecution updated) {
        WorkflowExecution current = ctx.execution();
        if (!current.status().canTransitionTo(updated.status())) {
            throw new InvalidStateTransitionException("WorkflowExecution", current.status(), updated.status());
        }
        retrier.run("update execution", () -> executionRepository.update(updated));
        ctx.update(updated);
        log.info("Execution {} {} -> {}", ctx.executionId(), current.status(), updated.status());
        publishExecution(updated, current.status());
    }

    private void skip(ExecutionContext ctx, StepExecution current, String errorCode, String reason,
                      boolean appendResult) {
        if (!current.status().canTransitionTo(StepStatus.SKIPPED)) {
            throw new InvalidStateTransitionException("StepExecution", current.status(), StepStatus.SKIPPED);
        }
        StepExecution skipped = current.withSkipped(errorCode, reason, clock.instant());
        retrier.run("update step execution", () -> stepRepository.update(skipped));
        apply(ctx, skipped, current.status());
        if (appendResult) {
            appendResult(ctx, skipped);
        }
    }

    private StepExecution apply(ExecutionContext ctx, StepExecution updated, StepStatus from) {
        if (!from.canTransitionTo(updated.status())) {
            throw new InvalidStateTransitionException("StepExecution", from, updated.status());
        }
        ctx.record(updated);
        log.debug("Step {} attempt {} {} -> {}", updated.key(), updated.attempt(), from, updated.status());
        publishStep(updated, from);
        return updated;
    }

    private void appendResult(ExecutionContext ctx, StepExecution terminal) {
        WorkflowExecution updated = ctx.execution()
            .withStepResult(terminal.key().resultKey(), StepResult.of(terminal));
        retrier.run("update execution", () -> executionRepository.update(updated));
        ctx.update(updated);
    }

    private StepExecution require(ExecutionContext ctx, StepKey key) {
        StepExecution current = ctx.latest(key);
        if (current == null) {
            throw new IllegalStateException("No attempt recorded for step " + key);
        }
        return current;
    }

    private static boolean isCurrent(StepExecution current, int attempt) {
        return current != null && current.attempt() == attempt;
    }

    private void publishExecution(WorkflowExecution execution, ExecutionStatus from) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionTransition(execution, from);
            } catch (RuntimeException e) {
                log.warn("Execution listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void publishStep(StepExecution step, StepStatus from) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onStepTransition(step, from);
            } catch (RuntimeException e) {
                log.warn("Step listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
