package com.agentflow.engine.execution;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.condition.StepCondition;
import com.agentflow.core.graph.DependencyGraph;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.StepConfig;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowConfig;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, pre-computed view of a validated workflow: dependency graph, typed configs and
 * compiled predicates. Built once per workflow id and version, shared by every execution of it.
 */
public final class ExecutionPlan {

    private final Workflow workflow;
    private final DependencyGraph graph;
    private final WorkflowConfig config;
    private final Map<String, WorkflowStep> steps;
    private final Map<String, StepConfig> stepConfigs;
    private final Map<String, StepCondition> conditions;
    private final Set<String> loopSteps;
    private final Set<String> afterLoopSteps;
    private final StepCondition loopWhile;
    private final List<String> outputSteps;

    private ExecutionPlan(Workflow workflow, ConditionEvaluator evaluator) {
        this.workflow = workflow;
        this.graph = DependencyGraph.of(workflow.steps());
        if (!graph.isAcyclic()) {
            throw new IllegalArgumentException("Workflow " + workflow.id() + " has a dependency cycle");
        }
        this.config = WorkflowConfig.parse(workflow.config());

        Map<String, WorkflowStep> byId = new HashMap<>();
        Map<String, StepConfig> typed = new HashMap<>();
        Map<String, StepCondition> compiled = new HashMap<>();
        for (int i = 0; i < workflow.steps().size(); i++) {
            WorkflowStep step = workflow.steps().get(i);
            byId.put(step.id(), step);
            StepConfig stepConfig = StepConfig.parse(step.config(), "steps[" + i + "].config");
            typed.put(step.id(), stepConfig);
            if (stepConfig.condition() != null && workflow.workflowType() == WorkflowType.CONDITIONAL) {
                compiled.put(step.id(), evaluator.compile(stepConfig.condition()));
            }
        }
        this.steps = Collections.unmodifiableMap(byId);
        this.stepConfigs = Collections.unmodifiableMap(typed);
        this.conditions = Collections.unmodifiableMap(compiled);

        Set<String> loop = new LinkedHashSet<>();
        StepCondition whileCondition = null;
        if (workflow.workflowType() == WorkflowType.LOOP && config.loop() != null) {
            if (config.loop().steps().isEmpty()) {
                loop.addAll(graph.stepIds());
            } else {
                for (String reference : config.loop().steps()) {
                    workflow.step(reference).ifPresent(step -> loop.add(step.id()));
                }
            }
            if (config.loop().whileCondition() != null) {
                whileCondition = evaluator.compile(config.loop().whileCondition());
            }
        }
        this.loopSteps = Collections.unmodifiableSet(loop);
        this.loopWhile = whileCondition;

        Set<String> afterLoop = new LinkedHashSet<>();
        for (String stepId : graph.stepIds()) {
            if (!loop.contains(stepId) && graph.upstreamOf(stepId).stream().anyMatch(loop::contains)) {
                afterLoop.add(stepId);
            }
        }
        this.afterLoopSteps = Collections.unmodifiableSet(afterLoop);

        List<String> outputs = new ArrayList<>();
        for (String reference : config.outputSteps()) {
            workflow.step(reference).ifPresent(step -> outputs.add(step.id()));
        }
        this.outputSteps = Collections.unmodifiableList(outputs);
    }

    /**
     * Build a plan for a workflow that already passed validation.
     *
     * @throws IllegalArgumentException if the workflow is structurally invalid
     */
    public static ExecutionPlan build(Workflow workflow, ConditionEvaluator evaluator) {
        return new ExecutionPlan(workflow, evaluator);
    }

    public Workflow workflow() {
        return workflow;
    }

    public WorkflowType type() {
        return workflow.workflowType();
    }

    public DependencyGraph graph() {
        return graph;
    }

    public WorkflowConfig config() {
        return config;
    }

    /**
     * Step ids in definition order.
     */
    public List<String> stepIds() {
        return graph.stepIds();
    }

    public WorkflowStep step(String stepId) {
        WorkflowStep step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return step;
    }

    public StepConfig stepConfig(String stepId) {
        return stepConfigs.get(stepId);
    }

    public Optional<StepCondition> condition(String stepId) {
        return Optional.ofNullable(conditions.get(stepId));
    }

    public boolean isBestEffort(String stepId) {
        return stepConfigs.get(stepId).bestEffort();
    }

    public boolean continueOnFailure() {
        return config.continueOnFailure();
    }

    public boolean isLoop() {
        return !loopSteps.isEmpty();
    }

    public boolean isLoopStep(String stepId) {
        return loopSteps.contains(stepId);
    }

    public Set<String> loopSteps() {
        return loopSteps;
    }

    /**
     * Check if a step sits downstream of the loop body and therefore waits for its last iteration.
     */
    public boolean runsAfterLoop(String stepId) {
        return afterLoopSteps.contains(stepId);
    }

    public int maxIterations() {
        return config.loop() != null ? config.loop().maxIterations() : 1;
    }

    public Optional<StepCondition> loopWhile() {
        return Optional.ofNullable(loopWhile);
    }

    /**
     * Steps whose results form the output, empty when every succeeded step contributes.
     */
    public List<String> outputSteps() {
        return outputSteps;
    }

    /**
     * Number of attempts allowed in flight at once.
     */
    public int maxInFlight(int defaultConcurrency) {
        if (workflow.workflowType().isSerial()) {
            return 1;
        }
        return config.maxConcurrency() != null ? config.maxConcurrency() : defaultConcurrency;
    }

    public RetryPolicy retryPolicy(String stepId, RetryPolicy defaults) {
        return config.retryPolicy(defaults, step(stepId).maxAttempts());
    }
}
