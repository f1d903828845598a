package com.agentflow.engine.metrics;

import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.engine.state.ExecutionListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * Micrometer metrics for the engine, fed by persisted state transitions.
 *
 * Metrics exposed:
 * - executions started, succeeded, failed and cancelled, per workflow
 * - step attempts dispatched, retried and timed out, and final step failures, per step
 * - execution duration by outcome
 * - live executions
 *
 * Transitions seen before the registry is bound are not counted.
 */
public class WorkflowMetrics implements MeterBinder, ExecutionListener {

    public static final String EXECUTIONS_STARTED = "agentflow.executions.started";
    public static final String EXECUTIONS_SUCCEEDED = "agentflow.executions.succeeded";
    public static final String EXECUTIONS_FAILED = "agentflow.executions.failed";
    public static final String EXECUTIONS_CANCELLED = "agentflow.executions.cancelled";
    public static final String EXECUTIONS_ACTIVE = "agentflow.executions.active";
    public static final String EXECUTION_DURATION = "agentflow.execution.duration";

    public static final String STEPS_DISPATCHED = "agentflow.steps.dispatched";
    public static final String STEP_RETRIES = "agentflow.steps.retries";
    public static final String STEP_TIMEOUTS = "agentflow.steps.timeouts";
    public static final String STEP_FAILURES = "agentflow.steps.failures";

    private final IntSupplier activeExecutions;
    private volatile MeterRegistry registry;

    public WorkflowMetrics(IntSupplier activeExecutions) {
        this.activeExecutions = activeExecutions;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(EXECUTIONS_ACTIVE, activeExecutions, IntSupplier::getAsInt)
            .description("Executions currently owned by this engine")
            .register(registry);
    }

    // ========== Execution Metrics ==========

    @Override
    public void onExecutionTransition(WorkflowExecution execution, ExecutionStatus from) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        switch (execution.status()) {
            case RUNNING -> executionCounter(current, EXECUTIONS_STARTED, "Executions started", execution);
            case SUCCEEDED -> finished(current, EXECUTIONS_SUCCEEDED, "Executions succeeded", execution);
            case FAILED -> finished(current, EXECUTIONS_FAILED, "Executions failed", execution);
            case CANCELLED -> finished(current, EXECUTIONS_CANCELLED, "Executions cancelled", execution);
            case PENDING -> {
            }
        }
    }

    // ========== Step Metrics ==========

    @Override
    public void onStepTransition(StepExecution step, StepStatus from) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        switch (step.status()) {
            case DISPATCHED -> stepCounter(current, STEPS_DISPATCHED, "Step attempts dispatched", step);
            case RETRYING -> stepCounter(current, STEP_RETRIES, "Step attempts retried", step);
            case TIMED_OUT -> stepCounter(current, STEP_TIMEOUTS, "Step attempts timed out", step);
            case FAILED -> stepCounter(current, STEP_FAILURES, "Steps failed after their last attempt", step);
            default -> {
            }
        }
    }

    // ========== Internal Methods ==========

    private static void finished(MeterRegistry registry, String name, String description, WorkflowExecution execution) {
        executionCounter(registry, name, description, execution);
        if (execution.durationSeconds() != null) {
            Timer.builder(EXECUTION_DURATION)
                .tag("workflow", execution.workflowId())
                .tag("outcome", execution.status().value())
                .description("Execution duration")
                .register(registry)
                .record(Duration.ofMillis(Math.round(execution.durationSeconds() * 1000)));
        }
    }

    private static void executionCounter(MeterRegistry registry, String name, String description,
                                         WorkflowExecution execution) {
        Counter.builder(name)
            .tag("workflow", execution.workflowId())
            .description(description)
            .register(registry)
            .increment();
    }

    private static void stepCounter(MeterRegistry registry, String name, String description, StepExecution step) {
        Counter.builder(name)
            .tag("step", step.stepName())
            .description(description)
            .register(registry)
            .increment();
    }
}
