package com.agentflow.engine.execution;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.condition.StepCondition;
import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.StoreUnavailableException;
import com.agentflow.core.model.ErrorCodes;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.StepConfig;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepKey;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.service.ExecutionService;
import com.agentflow.engine.state.FailureOutcome;
import com.agentflow.engine.state.RecoveredExecution;
import com.agentflow.engine.state.StateManager;
import com.agentflow.scheduler.TimerScheduler;
import com.agentflow.scheduler.TimerScheduler.TimerType;
import com.agentflow.worker.StepDispatch;
import com.agentflow.worker.StepExecutionException;
import com.agentflow.worker.StepExecutor;
import com.agentflow.worker.StepExecutorRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives executions: decides which steps are ready, dispatches attempts to executors on a worker
 * pool, enforces deadlines and retries, and finishes executions.
 *
 * Each execution is advanced under its own lock, so executor callbacks, timers, cancellation
 * and events for one execution are serialized while different executions progress in parallel.
 * Every state change goes through the {@link StateManager} before the engine acts on it.
 *
 * Until {@link #open()} is called (normally by recovery once in-flight work has been
 * reconciled) accepted executions are persisted but not started.
 */
public class ExecutionEngine implements ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final StateManager stateManager;
    private final StepExecutorRegistry executors;
    private final TimerScheduler timers;
    private final ConditionEvaluator conditions;
    private final ExecutionPlanCache plans;
    private final EngineSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService workerPool;

    private final Map<UUID, ExecutionContext> active = new ConcurrentHashMap<>();
    private volatile boolean open = false;
    private volatile boolean shuttingDown = false;

    public ExecutionEngine(
        StateManager stateManager,
        StepExecutorRegistry executors,
        TimerScheduler timers,
        ConditionEvaluator conditions,
        ExecutionPlanCache plans,
        EngineSettings settings,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.stateManager = stateManager;
        this.executors = executors;
        this.timers = timers;
        this.conditions = conditions;
        this.plans = plans;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.workerPool = Executors.newFixedThreadPool(settings.workerThreads(), new WorkerThreadFactory());
    }

    // ========== ExecutionService ==========

    @Override
    public UUID execute(Workflow workflow, JsonNode inputData) {
        if (shuttingDown) {
            throw new ConflictException("Engine is shutting down, not accepting executions");
        }
        if (!workflow.status().allowsExecution()) {
            throw new ConflictException("Workflow " + workflow.id() + " is " + workflow.status().value()
                + " and cannot be executed");
        }
        ExecutionPlan plan = plans.planFor(workflow);
        ExecutionContext ctx = stateManager.createExecution(plan, inputData);
        active.put(ctx.executionId(), ctx);
        if (open) {
            guarded(ctx, () -> start(ctx));
        } else {
            log.info("Execution {} accepted, deferred until recovery completes", ctx.executionId());
        }
        return ctx.executionId();
    }

    @Override
    public WorkflowExecution getStatus(UUID executionId) {
        return stateManager.getExecution(executionId);
    }

    @Override
    public WorkflowExecution cancel(UUID executionId, String reason) {
        ExecutionContext ctx = requireActive(executionId, ExecutionStatus.CANCELLED);
        String message = reason != null && !reason.isBlank() ? reason : "Cancelled by request";
        ctx.lock();
        try (LoggingContext lc = LoggingContext.forExecution(executionId, ctx.plan().workflow().id())) {
            if (ctx.isClosed()) {
                throw new InvalidStateTransitionException("WorkflowExecution", ctx.execution().status(),
                    ExecutionStatus.CANCELLED);
            }
            stateManager.cancel(ctx, message);
            ctx.cancellation().cancel();
            release(ctx);
            log.info("Execution {} cancelled: {}", executionId, message);
            return ctx.execution();
        } finally {
            ctx.unlock();
        }
    }

    @Override
    public void signal(UUID executionId, String eventName, JsonNode payload) {
        ExecutionContext ctx = requireActive(executionId, ExecutionStatus.RUNNING);
        ctx.lock();
        try (LoggingContext lc = LoggingContext.forExecution(executionId, ctx.plan().workflow().id())) {
            if (ctx.isClosed()) {
                throw new InvalidStateTransitionException("WorkflowExecution", ctx.execution().status(),
                    ExecutionStatus.RUNNING);
            }
            stateManager.recordEvent(ctx, eventName, payload != null ? payload : NullNode.getInstance());
            guarded(ctx, () -> advance(ctx));
        } finally {
            ctx.unlock();
        }
    }

    // ========== Lifecycle ==========

    /**
     * Adopt an execution found in the store after a restart. Attempts that were awaiting a result
     * are failed with {@code ORCHESTRATOR_RESTART} and go through their retry policy. An execution
     * whose context cannot be rebuilt is failed in the store instead.
     *
     * @throws StoreUnavailableException if neither the restore nor the failure could be written
     */
    public void resume(RecoveredExecution recovered) {
        UUID executionId = recovered.execution().id();
        ExecutionContext ctx;
        try {
            ExecutionPlan plan = plans.planFor(recovered.execution().definition());
            ctx = stateManager.restore(recovered, plan);
        } catch (RuntimeException e) {
            log.error("Could not restore execution {}", executionId, e);
            String errorCode = e instanceof StoreUnavailableException ? ErrorCodes.STORE_ERROR : ErrorCodes.INTERNAL_ERROR;
            stateManager.failUnrestorable(executionId, errorCode, "Recovery failed: " + e.getMessage());
            return;
        }
        active.put(ctx.executionId(), ctx);
        guarded(ctx, () -> {
            int interrupted = stateManager.failInFlight(ctx, stepId -> policyFor(ctx, stepId));
            log.info("Resumed execution {} ({} in-flight attempts reconciled)", ctx.executionId(), interrupted);
            if (open) {
                start(ctx);
            }
        });
    }

    /**
     * Start dispatching. Executions accepted or resumed before this call are started now.
     */
    public void open() {
        open = true;
        log.info("Execution engine open, starting {} executions", active.size());
        for (ExecutionContext ctx : active.values()) {
            guarded(ctx, () -> start(ctx));
        }
    }

    public boolean isOpen() {
        return open;
    }

    public int activeCount() {
        return active.size();
    }

    /**
     * Enforce deadlines of attempts whose timers were lost. Safe to call at any time.
     *
     * @return number of overdue attempts handled
     */
    public int sweepOverdue() {
        Instant now = clock.instant();
        AtomicInteger handled = new AtomicInteger();
        for (ExecutionContext ctx : active.values()) {
            guarded(ctx, () -> {
                for (String stepId : ctx.plan().stepIds()) {
                    StepExecution attempt = ctx.current(stepId);
                    if (attempt != null && attempt.isOverdue(now)) {
                        handled.incrementAndGet();
                        handleDeadline(ctx, attempt.key(), attempt.attempt());
                    }
                }
            });
        }
        if (handled.get() > 0) {
            log.info("Sweep handled {} overdue attempts", handled.get());
        }
        return handled.get();
    }

    /**
     * Stop dispatching and wait for in-flight attempts, up to the configured timeout.
     */
    public void shutdown() {
        shuttingDown = true;
        open = false;
        log.info("Execution engine shutting down, waiting for in-flight attempts");
        long deadline = System.nanoTime() + settings.shutdownTimeout().toNanos();
        while (System.nanoTime() < deadline && runningWorkers() > 0) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int remaining = runningWorkers();
        if (remaining > 0) {
            log.warn("{} attempts still running after shutdown timeout, they will be recovered on restart",
                remaining);
        }
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Execution engine stopped");
    }

    // ========== Internal Methods ==========

    private void start(ExecutionContext ctx) {
        if (ctx.isClosed()) {
            return;
        }
        if (ctx.execution().status() == ExecutionStatus.PENDING) {
            stateManager.markStarted(ctx);
        }
        advance(ctx);
    }

    /**
     * Move an execution forward as far as possible: skip steps that can no longer run, advance
     * the loop, dispatch ready steps within the concurrency limit and finish when every step is
     * terminal. Caller holds the execution lock.
     */
    private void advance(ExecutionContext ctx) {
        if (!open || ctx.isClosed()) {
            return;
        }
        boolean again;
        do {
            List<StepKey> ready = resolvePending(ctx);
            again = dispatchReady(ctx, ready);
            if (ctx.isClosed()) {
                return;
            }
        } while (again);

        if (isFinished(ctx)) {
            finish(ctx);
        }
    }

    /**
     * Skip steps whose dependencies failed or whose condition is false, start further loop
     * iterations, and collect PENDING steps that can be dispatched now in definition order.
     */
    private List<StepKey> resolvePending(ExecutionContext ctx) {
        ExecutionPlan plan = ctx.plan();
        List<StepKey> ready = new ArrayList<>();
        boolean changed;
        do {
            changed = false;
            ready.clear();
            for (String stepId : plan.stepIds()) {
                StepExecution attempt = ctx.current(stepId);
                if (attempt == null || attempt.status() != StepStatus.PENDING) {
                    continue;
                }
                Readiness readiness = readiness(ctx, stepId);
                switch (readiness.state()) {
                    case SKIP -> {
                        stateManager.markSkipped(ctx, attempt.key(), readiness.errorCode(), readiness.reason());
                        changed = true;
                    }
                    case READY -> ready.add(attempt.key());
                    case WAIT -> {
                    }
                }
            }
            if (plan.isLoop() && !ctx.isLoopComplete() && iterationFinished(ctx)) {
                if (continueLoop(ctx)) {
                    stateManager.startIteration(ctx, ctx.iteration() + 1);
                } else {
                    ctx.markLoopComplete();
                    log.info("Execution {} loop finished after {} iterations", ctx.executionId(), ctx.iteration() + 1);
                }
                changed = true;
            }
        } while (changed);
        return ready;
    }

    private Readiness readiness(ExecutionContext ctx, String stepId) {
        ExecutionPlan plan = ctx.plan();
        if (plan.runsAfterLoop(stepId) && !ctx.isLoopComplete()) {
            return Readiness.WAIT;
        }
        boolean waiting = false;
        for (String dependency : plan.graph().dependenciesOf(stepId)) {
            StepExecution upstream = ctx.current(dependency);
            StepStatus status = upstream != null ? upstream.status() : StepStatus.PENDING;
            if (status == StepStatus.SUCCEEDED) {
                continue;
            }
            if (status == StepStatus.FAILED && plan.isBestEffort(dependency)) {
                continue;
            }
            if (status == StepStatus.FAILED || status == StepStatus.SKIPPED) {
                if (plan.continueOnFailure()) {
                    continue;
                }
                return Readiness.skip(ErrorCodes.DEPENDENCY_FAILED,
                    "Dependency '" + plan.step(dependency).name() + "' " + status.value());
            }
            waiting = true;
        }
        if (waiting) {
            return Readiness.WAIT;
        }

        StepConfig stepConfig = plan.stepConfig(stepId);
        if (stepConfig.awaitEvent() != null
            && !ctx.execution().receivedEvents().containsKey(stepConfig.awaitEvent())) {
            return Readiness.WAIT;
        }
        Optional<StepCondition> condition = plan.condition(stepId);
        if (condition.isPresent() && !conditions.evaluate(condition.get(), conditionScope(ctx))) {
            return Readiness.skip(ErrorCodes.CONDITION_NOT_MET,
                "Condition not met: " + condition.get().source());
        }
        return Readiness.READY;
    }

    private boolean iterationFinished(ExecutionContext ctx) {
        for (String stepId : ctx.plan().loopSteps()) {
            StepExecution attempt = ctx.current(stepId);
            if (attempt == null || !attempt.status().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private boolean continueLoop(ExecutionContext ctx) {
        ExecutionPlan plan = ctx.plan();
        for (String stepId : plan.loopSteps()) {
            StepExecution attempt = ctx.current(stepId);
            if (attempt.status() == StepStatus.FAILED && !plan.isBestEffort(stepId)) {
                return false;
            }
        }
        if (ctx.iteration() + 1 >= plan.maxIterations()) {
            return false;
        }
        return plan.loopWhile()
            .map(condition -> conditions.evaluate(condition, conditionScope(ctx)))
            .orElse(true);
    }

    /**
     * Dispatch ready steps within the concurrency limit, then retries whose backoff timer was lost.
     *
     * @return true if a dispatch settled synchronously and the execution needs another pass
     */
    private boolean dispatchReady(ExecutionContext ctx, List<StepKey> ready) {
        boolean settled = false;
        int slots = ctx.plan().maxInFlight(settings.maxConcurrency()) - ctx.inFlightCount();
        for (StepKey key : ready) {
            if (slots <= 0) {
                break;
            }
            settled |= dispatch(ctx, key);
            slots--;
        }
        for (String stepId : ctx.plan().stepIds()) {
            StepExecution attempt = ctx.current(stepId);
            if (attempt != null && attempt.status() == StepStatus.RETRYING && !ctx.hasRetryTimer(attempt.key())) {
                settled |= dispatch(ctx, attempt.key());
            }
        }
        return settled;
    }

    /**
     * Dispatch the current attempt of a step to its executor.
     *
     * @return true if the attempt failed synchronously
     */
    private boolean dispatch(ExecutionContext ctx, StepKey key) {
        ExecutionPlan plan = ctx.plan();
        WorkflowStep step = plan.step(key.stepId());
        Duration timeout = Duration.ofSeconds(step.timeoutSeconds());
        StepExecution attempt = stateManager.markDispatched(ctx, key, timeout);

        Optional<StepExecutor> executor = executors.resolve(step.agentRef(), step.stepType());
        if (executor.isEmpty()) {
            String target = step.agentRef() != null ? step.agentRef() : step.stepType();
            log.warn("No executor registered for '{}' (step {})", target, step.name());
            stateManager.recordFailure(ctx, key, attempt.attempt(), ErrorCodes.NO_EXECUTOR,
                "No executor registered for '" + target + "'", false, policyFor(ctx, key.stepId()));
            return true;
        }

        StepDispatch dispatch = buildDispatch(ctx, step, attempt);
        UUID deadlineTimer = scheduleDeadline(ctx, key, attempt.attempt(), timeout);
        Future<?> worker = workerPool.submit(() -> runAttempt(ctx, key, attempt.attempt(), executor.get(), dispatch));
        ctx.trackAttempt(key, worker, deadlineTimer);
        log.info("Dispatched step {} attempt {} of execution {}", key, attempt.attempt(), ctx.executionId());
        return false;
    }

    private StepDispatch buildDispatch(ExecutionContext ctx, WorkflowStep step, StepExecution attempt) {
        ExecutionPlan plan = ctx.plan();
        Map<String, JsonNode> upstream = new LinkedHashMap<>();
        for (String dependency : plan.graph().dependenciesOf(step.id())) {
            StepExecution result = ctx.current(dependency);
            JsonNode value = result != null ? result.result() : null;
            upstream.put(plan.step(dependency).name(), value != null ? value : NullNode.getInstance());
        }
        StepConfig stepConfig = plan.stepConfig(step.id());
        JsonNode event = stepConfig.awaitEvent() != null
            ? ctx.execution().receivedEvents().get(stepConfig.awaitEvent())
            : null;
        return new StepDispatch(
            step.id(),
            step.name(),
            step.stepType(),
            step.agentRef(),
            ctx.executionId(),
            plan.workflow().id(),
            attempt.attempt(),
            attempt.iteration(),
            step.timeoutSeconds(),
            stepConfig.parameters(),
            upstream,
            ctx.execution().inputData(),
            event,
            ctx.cancellation()
        );
    }

    /**
     * Runs on a worker thread, without the execution lock while the executor is busy.
     */
    private void runAttempt(ExecutionContext ctx, StepKey key, int attempt, StepExecutor executor,
                            StepDispatch dispatch) {
        try (LoggingContext lc = LoggingContext.forStep(ctx.executionId(), dispatch.workflowId(),
                dispatch.stepName(), attempt)) {
            boolean started = guarded(ctx, false, () -> !ctx.isClosed() && stateManager.markRunning(ctx, key, attempt));
            if (!started) {
                log.debug("Attempt {} of step {} no longer current, not running it", attempt, key);
                return;
            }
            JsonNode result;
            try {
                result = executor.execute(dispatch);
            } catch (StepExecutionException e) {
                log.warn("Step {} attempt {} failed: [{}] {}", key, attempt, e.getErrorCode(), e.getMessage());
                onAttemptFailed(ctx, key, attempt, e.getErrorCode(), e.getMessage(), e.isRetryable());
                return;
            } catch (RuntimeException e) {
                log.warn("Step {} attempt {} threw {}", key, attempt, e.getClass().getSimpleName(), e);
                onAttemptFailed(ctx, key, attempt, ErrorCodes.STEP_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), true);
                return;
            }
            onAttemptSucceeded(ctx, key, attempt, result != null ? result : NullNode.getInstance());
        }
    }

    private void onAttemptSucceeded(ExecutionContext ctx, StepKey key, int attempt, JsonNode result) {
        guarded(ctx, () -> {
            if (ctx.isClosed() || !stateManager.recordSuccess(ctx, key, attempt, result)) {
                return;
            }
            settle(ctx, key, false);
            log.info("Step {} attempt {} succeeded", key, attempt);
            advance(ctx);
        });
    }

    private void onAttemptFailed(ExecutionContext ctx, StepKey key, int attempt, String errorCode,
                                 String message, boolean retryable) {
        guarded(ctx, () -> {
            if (ctx.isClosed()) {
                return;
            }
            FailureOutcome outcome = stateManager.recordFailure(ctx, key, attempt, errorCode, message,
                retryable, policyFor(ctx, key.stepId()));
            if (outcome == FailureOutcome.STALE) {
                return;
            }
            settle(ctx, key, false);
            if (outcome == FailureOutcome.RETRY) {
                scheduleRetry(ctx, key, attempt);
            }
            advance(ctx);
        });
    }

    private UUID scheduleDeadline(ExecutionContext ctx, StepKey key, int attempt, Duration delay) {
        return timers.schedule(ctx.executionId(), key.resultKey(), TimerType.ATTEMPT_DEADLINE, delay,
            timer -> guarded(ctx, () -> handleDeadline(ctx, key, attempt))).timerId();
    }

    /**
     * Deadline of an attempt reached. Never acts before the recorded deadline; an early firing
     * is re-armed for the remaining time.
     */
    private void handleDeadline(ExecutionContext ctx, StepKey key, int attempt) {
        if (ctx.isClosed()) {
            return;
        }
        StepExecution current = ctx.latest(key);
        if (current == null || current.attempt() != attempt || !current.status().isAwaitingResult()) {
            return;
        }
        Instant now = clock.instant();
        if (now.isBefore(current.deadline())) {
            ctx.replaceDeadlineTimer(key, scheduleDeadline(ctx, key, attempt, Duration.between(now, current.deadline())));
            return;
        }
        FailureOutcome outcome = stateManager.recordTimeout(ctx, key, attempt, policyFor(ctx, key.stepId()));
        if (outcome == FailureOutcome.STALE) {
            return;
        }
        log.warn("Step {} attempt {} timed out after {}s", key, attempt, ctx.plan().step(key.stepId()).timeoutSeconds());
        settle(ctx, key, true);
        if (outcome == FailureOutcome.RETRY) {
            scheduleRetry(ctx, key, attempt);
        }
        advance(ctx);
    }

    private void scheduleRetry(ExecutionContext ctx, StepKey key, int failedAttempt) {
        Duration backoff = policyFor(ctx, key.stepId()).computeBackoff(failedAttempt);
        UUID timerId = timers.schedule(ctx.executionId(), key.resultKey(), TimerType.RETRY_BACKOFF, backoff,
            timer -> guarded(ctx, () -> {
                ctx.clearRetryTimer(key);
                advance(ctx);
            })).timerId();
        ctx.setRetryTimer(key, timerId);
        log.info("Step {} will retry in {}ms (attempt {} failed)", key, backoff.toMillis(), failedAttempt);
    }

    /**
     * Forget the worker and deadline timer of a settled attempt. A timed-out worker is
     * interrupted, its eventual result is discarded as stale.
     */
    private void settle(ExecutionContext ctx, StepKey key, boolean interruptWorker) {
        ExecutionContext.SettledAttempt settled = ctx.settle(key);
        if (settled.deadlineTimer() != null) {
            timers.cancelTimer(settled.deadlineTimer());
        }
        if (interruptWorker && settled.worker() != null) {
            settled.worker().cancel(true);
        }
    }

    private boolean isFinished(ExecutionContext ctx) {
        if (!ctx.isLoopComplete()) {
            return false;
        }
        for (String stepId : ctx.plan().stepIds()) {
            StepExecution attempt = ctx.current(stepId);
            if (attempt == null || !attempt.status().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private void finish(ExecutionContext ctx) {
        ExecutionPlan plan = ctx.plan();
        for (StepExecution attempt : ctx.allLatest()) {
            if (attempt.status() == StepStatus.FAILED && !plan.isBestEffort(attempt.stepId())) {
                stateManager.fail(ctx, attempt.errorCode() != null ? attempt.errorCode() : ErrorCodes.STEP_FAILED,
                    "Step '" + attempt.stepName() + "' failed: " + attempt.error());
                release(ctx);
                return;
            }
        }
        stateManager.complete(ctx, buildOutput(ctx));
        release(ctx);
    }

    private JsonNode buildOutput(ExecutionContext ctx) {
        ExecutionPlan plan = ctx.plan();
        ObjectNode output = objectMapper.createObjectNode();
        List<String> stepIds = plan.outputSteps().isEmpty() ? plan.stepIds() : plan.outputSteps();
        for (String stepId : stepIds) {
            Optional<StepExecution> attempt = ctx.mostRecent(stepId);
            boolean succeeded = attempt.isPresent() && attempt.get().status() == StepStatus.SUCCEEDED;
            if (succeeded) {
                JsonNode result = attempt.get().result();
                output.set(plan.step(stepId).name(), result != null ? result : NullNode.getInstance());
            } else if (!plan.outputSteps().isEmpty()) {
                output.set(plan.step(stepId).name(), NullNode.getInstance());
            }
        }
        return output;
    }

    /**
     * Variables visible to predicates: one entry per step name with its latest
     * {@code result}, {@code status} and {@code error}, plus {@code input} and {@code iteration}.
     */
    private Map<String, Object> conditionScope(ExecutionContext ctx) {
        ExecutionPlan plan = ctx.plan();
        Map<String, Object> scope = new HashMap<>();
        for (String stepId : plan.stepIds()) {
            Optional<StepExecution> attempt = ctx.mostRecent(stepId);
            Map<String, Object> entry = new HashMap<>();
            entry.put("status", attempt.map(a -> a.status().value()).orElse(StepStatus.PENDING.value()));
            entry.put("result", attempt.map(StepExecution::result).map(this::toPlain).orElse(null));
            entry.put("error", attempt.map(StepExecution::error).orElse(null));
            scope.put(plan.step(stepId).name(), entry);
        }
        scope.put("input", toPlain(ctx.execution().inputData()));
        scope.put("iteration", ctx.iteration());
        return scope;
    }

    private Object toPlain(JsonNode node) {
        return node == null || node.isNull() ? null : objectMapper.convertValue(node, Object.class);
    }

    private RetryPolicy policyFor(ExecutionContext ctx, String stepId) {
        return ctx.plan().retryPolicy(stepId, settings.retryPolicy());
    }

    private ExecutionContext requireActive(UUID executionId, ExecutionStatus target) {
        ExecutionContext ctx = active.get(executionId);
        if (ctx != null) {
            return ctx;
        }
        WorkflowExecution execution = stateManager.getExecution(executionId);
        if (execution.status().isTerminal()) {
            throw new InvalidStateTransitionException("WorkflowExecution", execution.status(), target);
        }
        throw new ConflictException("Execution " + executionId + " is not active on this orchestrator");
    }

    private void release(ExecutionContext ctx) {
        ctx.close();
        ExecutionContext.Released released = ctx.release();
        released.timers().forEach(timers::cancelTimer);
        for (Future<?> worker : released.workers()) {
            if (!worker.isDone()) {
                worker.cancel(false);
            }
        }
        active.remove(ctx.executionId());
    }

    private int runningWorkers() {
        int count = 0;
        for (ExecutionContext ctx : active.values()) {
            ctx.lock();
            try {
                count += ctx.runningWorkers();
            } finally {
                ctx.unlock();
            }
        }
        return count;
    }

    private void guarded(ExecutionContext ctx, Runnable body) {
        guarded(ctx, null, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Run under the execution lock. A store outage or unexpected error fails the execution
     * instead of leaving it stuck.
     */
    private <T> T guarded(ExecutionContext ctx, T fallback, Supplier<T> body) {
        ctx.lock();
        try {
            return body.get();
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while advancing execution {}", ctx.executionId(), e);
            abort(ctx, ErrorCodes.STORE_ERROR, "State store unavailable: " + e.getMessage());
            return fallback;
        } catch (RuntimeException e) {
            log.error("Unexpected error while advancing execution {}", ctx.executionId(), e);
            abort(ctx, ErrorCodes.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
            return fallback;
        } finally {
            ctx.unlock();
        }
    }

    private void abort(ExecutionContext ctx, String errorCode, String message) {
        if (ctx.isClosed()) {
            return;
        }
        try {
            if (!ctx.execution().status().isTerminal()) {
                stateManager.fail(ctx, errorCode, message);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of execution {}, it will be recovered on restart",
                ctx.executionId(), e);
        }
        ctx.cancellation().cancel();
        release(ctx);
    }

    private record Readiness(State state, String errorCode, String reason) {

        static final Readiness READY = new Readiness(State.READY, null, null);
        static final Readiness WAIT = new Readiness(State.WAIT, null, null);

        static Readiness skip(String errorCode, String reason) {
            return new Readiness(State.SKIP, errorCode, reason);
        }

        enum State { READY, WAIT, SKIP }
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agentflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
