package com.agentflow.core.validation;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.condition.InvalidConditionException;
import com.agentflow.core.condition.StepCondition;
import com.agentflow.core.graph.DependencyGraph;
import com.agentflow.core.model.StepConfig;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowConfig;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on workflow definitions and execution requests.
 *
 * Side-effect free: it never persists or mutates anything, and reports every violation it finds.
 * Checks run in this order: text bounds, step count, step name uniqueness, dependency references,
 * acyclicity, per-step timeout and retry bounds, payload sizes, then typed configuration.
 */
public class WorkflowValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final ValidationLimits limits;
    private final StepConfigSchemaRegistry schemas;
    private final ConditionEvaluator conditions;

    public WorkflowValidator(ValidationLimits limits, StepConfigSchemaRegistry schemas,
                             ConditionEvaluator conditions) {
        this.limits = limits;
        this.schemas = schemas;
        this.conditions = conditions;
    }

    public WorkflowValidator() {
        this(ValidationLimits.defaults(), StepConfigSchemaRegistry.withDefaults(), new ConditionEvaluator());
    }

    public ValidationLimits limits() {
        return limits;
    }

    /**
     * Validate a complete workflow definition.
     */
    public ValidationResult validate(Workflow workflow) {
        ValidationResult result = ValidationResult.valid();
        List<WorkflowStep> steps = workflow.steps();

        checkText(workflow, result);
        checkStepCount(steps, result);
        checkStepNames(steps, result);

        DependencyGraph graph = DependencyGraph.of(steps);
        checkDependencies(steps, graph, result);
        checkCycles(steps, graph, result);
        checkStepBounds(steps, result);
        checkPayloads(workflow, result);
        checkTypedConfig(workflow, graph, result);

        return result;
    }

    /**
     * Validate the input payload of an execution request.
     */
    public ValidationResult validateInput(JsonNode inputData) {
        ValidationResult result = ValidationResult.valid();
        if (inputData != null && !inputData.isNull() && !inputData.isObject()) {
            result.add(ViolationCode.INVALID_FORMAT, "input_data", "Input data must be a JSON object");
        }
        checkSize(inputData, limits.maxInputBytes(), "input_data", "Input data", result);
        return result;
    }

    /**
     * Validate pagination parameters of a list request.
     */
    public ValidationResult validatePage(int limit, int offset) {
        ValidationResult result = ValidationResult.valid();
        if (limit < 1 || limit > limits.maxPageSize()) {
            result.add(ViolationCode.OUT_OF_RANGE, "limit",
                "Limit must be between 1 and " + limits.maxPageSize());
        }
        if (offset < 0) {
            result.add(ViolationCode.OUT_OF_RANGE, "offset", "Offset must be non-negative");
        }
        return result;
    }

    // ========== Internal Methods ==========

    private void checkText(Workflow workflow, ValidationResult result) {
        String id = workflow.id();
        if (id != null && (id.length() > limits.maxIdLength() || !ID_PATTERN.matcher(id).matches())) {
            result.add(ViolationCode.INVALID_FORMAT, "id",
                "Workflow id must contain only letters, digits, '-' or '_' (max "
                    + limits.maxIdLength() + " characters)");
        }
        if (isBlank(workflow.name())) {
            result.add(ViolationCode.REQUIRED, "name", "Workflow name is required");
        } else if (workflow.name().length() > limits.maxNameLength()) {
            result.add(ViolationCode.TOO_LONG, "name",
                "Workflow name too long (max " + limits.maxNameLength() + " characters)");
        }
        if (workflow.description() != null && workflow.description().length() > limits.maxDescriptionLength()) {
            result.add(ViolationCode.TOO_LONG, "description",
                "Description too long (max " + limits.maxDescriptionLength() + " characters)");
        }
        if (workflow.workflowType() == null) {
            result.add(ViolationCode.REQUIRED, "workflow_type", "Workflow type is required");
        }
        if (workflow.tags().size() > limits.maxTags()) {
            result.add(ViolationCode.TOO_MANY, "tags", "Too many tags (max " + limits.maxTags() + ")");
        }
        int index = 0;
        for (String tag : workflow.tags()) {
            if (isBlank(tag)) {
                result.add(ViolationCode.REQUIRED, "tags[" + index + "]", "Tags must not be empty");
            } else if (tag.length() > limits.maxTagLength()) {
                result.add(ViolationCode.TOO_LONG, "tags[" + index + "]",
                    "Tag '" + tag + "' too long (max " + limits.maxTagLength() + " characters)");
            }
            index++;
        }
    }

    private void checkStepCount(List<WorkflowStep> steps, ValidationResult result) {
        if (steps.isEmpty()) {
            result.add(ViolationCode.REQUIRED, "steps", "Workflow must have at least one step");
        } else if (steps.size() > limits.maxSteps()) {
            result.add(ViolationCode.TOO_MANY, "steps", "Too many steps (max " + limits.maxSteps() + ")");
        }
    }

    private void checkStepNames(List<WorkflowStep> steps, ValidationResult result) {
        Set<String> names = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String path = "steps[" + i + "]";
            if (isBlank(step.name())) {
                result.add(ViolationCode.REQUIRED, path + ".name", "Step name is required");
            } else {
                if (step.name().length() > limits.maxNameLength()) {
                    result.add(ViolationCode.TOO_LONG, path + ".name",
                        "Step name too long (max " + limits.maxNameLength() + " characters)");
                }
                if (!names.add(step.name())) {
                    result.add(ViolationCode.DUPLICATE_NAME, path + ".name",
                        "Duplicate step name '" + step.name() + "'");
                }
            }
            if (step.id() != null && !ids.add(step.id())) {
                result.add(ViolationCode.DUPLICATE_NAME, path + ".id", "Duplicate step id '" + step.id() + "'");
            }
            if (isBlank(step.stepType())) {
                result.add(ViolationCode.REQUIRED, path + ".step_type", "Step type is required");
            } else if (step.stepType().length() > limits.maxStepTypeLength()) {
                result.add(ViolationCode.TOO_LONG, path + ".step_type",
                    "Step type too long (max " + limits.maxStepTypeLength() + " characters)");
            }
        }
    }

    private void checkDependencies(List<WorkflowStep> steps, DependencyGraph graph, ValidationResult result) {
        Map<String, Integer> positions = positions(steps);
        for (DependencyGraph.UnresolvedDependency missing : graph.unresolved()) {
            result.add(ViolationCode.UNKNOWN_DEPENDENCY,
                "steps[" + positions.get(missing.stepId()) + "].dependencies",
                "Step '" + missing.stepName() + "' depends on unknown step '" + missing.reference() + "'");
        }
        for (String stepId : graph.selfDependent()) {
            int position = positions.get(stepId);
            result.add(ViolationCode.SELF_DEPENDENCY, "steps[" + position + "].dependencies",
                "Step '" + steps.get(position).name() + "' cannot depend on itself");
        }
    }

    private void checkCycles(List<WorkflowStep> steps, DependencyGraph graph, ValidationResult result) {
        if (graph.isAcyclic()) {
            return;
        }
        Map<String, String> names = new HashMap<>();
        for (WorkflowStep step : steps) {
            names.putIfAbsent(step.id(), step.name());
        }
        List<String> involved = new ArrayList<>();
        for (String id : graph.cyclicSteps()) {
            involved.add(names.get(id));
        }
        result.add(ViolationCode.CYCLE, "steps",
            "Circular dependency detected among steps: " + String.join(", ", involved));
    }

    private void checkStepBounds(List<WorkflowStep> steps, ValidationResult result) {
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String path = "steps[" + i + "]";
            if (step.timeoutSeconds() < limits.minTimeoutSeconds()
                    || step.timeoutSeconds() > limits.maxTimeoutSeconds()) {
                result.add(ViolationCode.OUT_OF_RANGE, path + ".timeout_seconds",
                    "Timeout must be between " + limits.minTimeoutSeconds() + " and "
                        + limits.maxTimeoutSeconds() + " seconds");
            }
            if (step.retryCount() < 0 || step.retryCount() > limits.maxRetryCount()) {
                result.add(ViolationCode.OUT_OF_RANGE, path + ".retry_count",
                    "Retry count must be between 0 and " + limits.maxRetryCount());
            }
        }
    }

    private void checkPayloads(Workflow workflow, ValidationResult result) {
        checkSize(workflow.config(), limits.maxConfigBytes(), "config", "Config", result);
        checkSize(workflow.metadata(), limits.maxMetadataBytes(), "metadata", "Metadata", result);
        List<WorkflowStep> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            checkSize(steps.get(i).config(), limits.maxConfigBytes(), "steps[" + i + "].config",
                "Step config", result);
        }
    }

    private void checkTypedConfig(Workflow workflow, DependencyGraph graph, ValidationResult result) {
        WorkflowConfig config;
        try {
            config = WorkflowConfig.parse(workflow.config());
        } catch (IllegalArgumentException e) {
            result.add(ViolationCode.INVALID_CONFIG, "config", e.getMessage());
            config = null;
        }

        WorkflowType type = workflow.workflowType();
        List<WorkflowStep> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            checkStepConfig(workflow, graph, steps.get(i), "steps[" + i + "]", type, result);
        }

        if (config == null) {
            return;
        }
        for (String output : config.outputSteps()) {
            if (workflow.step(output).isEmpty()) {
                result.add(ViolationCode.INVALID_CONFIG, "config.output_steps",
                    "Output step '" + output + "' does not exist");
            }
        }
        if (type == WorkflowType.LOOP && config.loop() == null) {
            result.add(ViolationCode.REQUIRED, "config.loop", "Loop workflows require a loop configuration");
        }
        if (type != null && type != WorkflowType.LOOP && config.loop() != null) {
            result.add(ViolationCode.INVALID_CONFIG, "config.loop",
                "Loop configuration is only supported by loop workflows");
        }
        if (type == WorkflowType.LOOP && config.loop() != null) {
            checkLoop(workflow, config.loop(), graph, result);
        }
    }

    private void checkStepConfig(Workflow workflow, DependencyGraph graph, WorkflowStep step, String path,
                                 WorkflowType type, ValidationResult result) {
        StepConfig stepConfig;
        try {
            stepConfig = StepConfig.parse(step.config(), path + ".config");
        } catch (IllegalArgumentException e) {
            result.add(ViolationCode.INVALID_CONFIG, path + ".config", e.getMessage());
            return;
        }

        schemas.find(step.stepType()).ifPresent(schema -> {
            if (schema.requiresAgentRef() && isBlank(step.agentRef())) {
                result.add(ViolationCode.REQUIRED, path + ".agent_ref",
                    "Steps of type '" + schema.stepType() + "' must reference an agent");
            }
            for (String parameter : schema.requiredParameters()) {
                if (!stepConfig.parameters().has(parameter)) {
                    result.add(ViolationCode.INVALID_CONFIG, path + ".config.parameters." + parameter,
                        "Parameter '" + parameter + "' is required for steps of type '" + schema.stepType() + "'");
                }
            }
        });

        if (stepConfig.condition() != null) {
            if (type != WorkflowType.CONDITIONAL) {
                result.add(ViolationCode.INVALID_CONFIG, path + ".config.condition",
                    "Conditions are only supported by conditional workflows");
            } else {
                StepCondition condition = checkPredicate(stepConfig.condition(), path + ".config.condition", result);
                if (condition != null) {
                    checkPredicateScope(workflow, graph, step, condition, path + ".config.condition", result);
                }
            }
        }
        if (stepConfig.awaitEvent() != null && type != WorkflowType.EVENT_DRIVEN) {
            result.add(ViolationCode.INVALID_CONFIG, path + ".config.await_event",
                "Events are only supported by event_driven workflows");
        }
    }

    private void checkLoop(Workflow workflow, WorkflowConfig.LoopConfig loop, DependencyGraph graph,
                           ValidationResult result) {
        Set<String> loopIds = new LinkedHashSet<>();
        for (String reference : loop.steps()) {
            workflow.step(reference).ifPresentOrElse(
                step -> loopIds.add(step.id()),
                () -> result.add(ViolationCode.INVALID_CONFIG, "config.loop.steps",
                    "Loop step '" + reference + "' does not exist"));
        }
        if (loop.whileCondition() != null) {
            checkPredicate(loop.whileCondition(), "config.loop.while", result);
        }
        if (loopIds.isEmpty() || !graph.isAcyclic()) {
            return;
        }
        // a step outside the loop cannot sit between two loop steps
        for (WorkflowStep step : workflow.steps()) {
            if (loopIds.contains(step.id())) {
                continue;
            }
            boolean feedsLoop = graph.downstreamOf(step.id()).stream().anyMatch(loopIds::contains);
            boolean followsLoop = graph.upstreamOf(step.id()).stream().anyMatch(loopIds::contains);
            if (feedsLoop && followsLoop) {
                result.add(ViolationCode.INVALID_CONFIG, "config.loop.steps",
                    "Step '" + step.name() + "' both depends on and feeds the loop body");
            }
        }
    }

    private StepCondition checkPredicate(String source, String path, ValidationResult result) {
        try {
            return conditions.compile(source);
        } catch (InvalidConditionException e) {
            result.add(ViolationCode.INVALID_PREDICATE, path, e.getMessage());
            return null;
        }
    }

    /**
     * A step's predicate may only read the outcome of steps it depends on, directly or transitively.
     */
    private void checkPredicateScope(Workflow workflow, DependencyGraph graph, WorkflowStep step,
                                     StepCondition condition, String path, ValidationResult result) {
        Set<String> upstream = graph.upstreamOf(step.id());
        for (String name : condition.referencedNames()) {
            workflow.steps().stream()
                .filter(candidate -> name.equals(candidate.name()))
                .filter(candidate -> !upstream.contains(candidate.id()))
                .findFirst()
                .ifPresent(candidate -> result.add(ViolationCode.INVALID_PREDICATE, path,
                    "Condition of step '" + step.name() + "' reads step '" + name
                        + "', which it does not depend on"));
        }
    }

    private void checkSize(JsonNode node, long maxBytes, String field, String label, ValidationResult result) {
        if (node == null || node.isNull()) {
            return;
        }
        long size = node.toString().getBytes(StandardCharsets.UTF_8).length;
        if (size > maxBytes) {
            result.add(ViolationCode.PAYLOAD_TOO_LARGE, field,
                label + " too large (" + size + " bytes, max " + maxBytes + ")");
        }
    }

    private static Map<String, Integer> positions(List<WorkflowStep> steps) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            positions.putIfAbsent(steps.get(i).id(), i);
        }
        return positions;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
