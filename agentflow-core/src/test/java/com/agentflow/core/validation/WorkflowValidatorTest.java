package com.agentflow.core.validation;

import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WorkflowValidator validator = new WorkflowValidator();

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("A linear definition is accepted")
        void acceptsLinearWorkflow() {
            Workflow workflow = workflow(WorkflowType.SEQUENTIAL,
                step("A"), step("B", "A"), step("C", "B"));

            assertThat(validator.validate(workflow).isValid()).isTrue();
        }

        @Test
        @DisplayName("Missing name, type and steps are all reported at once")
        void reportsEveryViolation() {
            Workflow workflow = Workflow.builder().name(" ").build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.violations())
                .extracting(ValidationResult.Violation::field)
                .contains("name", "workflow_type", "steps");
        }

        @Test
        @DisplayName("Duplicate step names are rejected")
        void rejectsDuplicateNames() {
            Workflow workflow = workflow(WorkflowType.PARALLEL, step("A"), step("A"));

            ValidationResult result = validator.validate(workflow);

            assertThat(result.hasViolation(ViolationCode.DUPLICATE_NAME)).isTrue();
            assertThat(result.violations()).anyMatch(v -> v.field().equals("steps[1].name"));
        }

        @Test
        @DisplayName("Unknown and self dependencies are rejected")
        void rejectsBadDependencies() {
            Workflow workflow = workflow(WorkflowType.PARALLEL, step("A", "A"), step("B", "missing"));

            ValidationResult result = validator.validate(workflow);

            assertThat(result.hasViolation(ViolationCode.SELF_DEPENDENCY)).isTrue();
            assertThat(result.hasViolation(ViolationCode.UNKNOWN_DEPENDENCY)).isTrue();
        }

        @Test
        @DisplayName("A cycle is rejected with the steps involved")
        void rejectsCycle() {
            Workflow workflow = workflow(WorkflowType.PARALLEL,
                step("A", "C"), step("B", "A"), step("C", "B"), step("D"));

            ValidationResult result = validator.validate(workflow);

            assertThat(result.hasViolation(ViolationCode.CYCLE)).isTrue();
            assertThat(result.violations())
                .filteredOn(v -> v.code() == ViolationCode.CYCLE)
                .singleElement()
                .satisfies(v -> assertThat(v.message()).contains("A", "B", "C").doesNotContain("D"));
        }

        @Test
        @DisplayName("Agent steps must name their agent")
        void agentStepsRequireAgentRef() {
            WorkflowStep step = WorkflowStep.builder().name("A").stepType("agent").build();
            Workflow workflow = workflow(WorkflowType.SEQUENTIAL, step);

            ValidationResult result = validator.validate(workflow);

            assertThat(result.violations()).anyMatch(v -> v.field().equals("steps[0].agent_ref"));
        }
    }

    @Nested
    @DisplayName("Bounds")
    class Bounds {

        @Test
        @DisplayName("Timeout and retry count outside their ranges are rejected")
        void rejectsOutOfRangeStepSettings() {
            WorkflowStep step = WorkflowStep.builder().name("A").stepType("task")
                .timeoutSeconds(0).retryCount(11).build();

            ValidationResult result = validator.validate(workflow(WorkflowType.SEQUENTIAL, step));

            assertThat(result.violations())
                .filteredOn(v -> v.code() == ViolationCode.OUT_OF_RANGE)
                .extracting(ValidationResult.Violation::field)
                .containsExactly("steps[0].timeout_seconds", "steps[0].retry_count");
        }

        @Test
        @DisplayName("More than 100 steps are rejected")
        void rejectsTooManySteps() {
            List<WorkflowStep> steps = new ArrayList<>();
            for (int i = 0; i < 101; i++) {
                steps.add(step("s" + i));
            }

            ValidationResult result = validator.validate(workflow(WorkflowType.PARALLEL, steps.toArray(WorkflowStep[]::new)));

            assertThat(result.hasViolation(ViolationCode.TOO_MANY)).isTrue();
        }

        @Test
        @DisplayName("Long names, descriptions and tags are rejected")
        void rejectsLongText() {
            Set<String> tags = new LinkedHashSet<>();
            tags.add("x".repeat(51));
            Workflow workflow = Workflow.builder()
                .name("n".repeat(256))
                .description("d".repeat(1001))
                .workflowType(WorkflowType.SEQUENTIAL)
                .tags(tags)
                .step(step("A"))
                .build();

            ValidationResult result = validator.validate(workflow);

            assertThat(result.violations())
                .filteredOn(v -> v.code() == ViolationCode.TOO_LONG)
                .extracting(ValidationResult.Violation::field)
                .containsExactly("name", "description", "tags[0]");
        }

        @Test
        @DisplayName("Oversized step config is rejected")
        void rejectsLargeConfig() {
            ObjectNode config = MAPPER.createObjectNode();
            config.putObject("parameters").put("blob", "x".repeat(1024 * 1024));
            WorkflowStep step = WorkflowStep.builder().name("A").stepType("task").config(config).build();

            ValidationResult result = validator.validate(workflow(WorkflowType.SEQUENTIAL, step));

            assertThat(result.violations())
                .anyMatch(v -> v.code() == ViolationCode.PAYLOAD_TOO_LARGE && v.field().equals("steps[0].config"));
        }

        @Test
        @DisplayName("Input data must be an object")
        void rejectsNonObjectInput() {
            assertThat(validator.validateInput(MAPPER.createArrayNode()).isValid()).isFalse();
            assertThat(validator.validateInput(MAPPER.createObjectNode()).isValid()).isTrue();
            assertThat(validator.validateInput(null).isValid()).isTrue();
        }

        @Test
        @DisplayName("Pagination limits are enforced")
        void validatesPage() {
            assertThat(validator.validatePage(100, 0).isValid()).isTrue();
            assertThat(validator.validatePage(0, 0).isValid()).isFalse();
            assertThat(validator.validatePage(1001, 0).isValid()).isFalse();
            assertThat(validator.validatePage(10, -1).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Typed configuration")
    class TypedConfig {

        @Test
        @DisplayName("Conditions are only accepted on conditional workflows")
        void conditionRequiresConditionalType() throws Exception {
            WorkflowStep step = WorkflowStep.builder().name("B").stepType("task")
                .config(MAPPER.readTree("{\"condition\": \"A.result.flag == true\"}"))
                .dependsOn("A").build();

            ValidationResult parallel = validator.validate(workflow(WorkflowType.PARALLEL, step("A"), step));
            ValidationResult conditional = validator.validate(workflow(WorkflowType.CONDITIONAL, step("A"), step));

            assertThat(parallel.hasViolation(ViolationCode.INVALID_CONFIG)).isTrue();
            assertThat(conditional.isValid()).isTrue();
        }

        @Test
        @DisplayName("Predicates may only read steps the conditioned step depends on")
        void predicateReadsUpstreamOnly() throws Exception {
            WorkflowStep transitive = WorkflowStep.builder().name("C").stepType("task")
                .config(MAPPER.readTree("{\"condition\": \"A.result.flag == true and B.status == 'succeeded'\"}"))
                .dependsOn("B").build();
            WorkflowStep sibling = WorkflowStep.builder().name("D").stepType("task")
                .config(MAPPER.readTree("{\"condition\": \"B.result.flag == true\"}"))
                .dependsOn("A").build();
            WorkflowStep itself = WorkflowStep.builder().name("E").stepType("task")
                .config(MAPPER.readTree("{\"condition\": \"E.status == 'pending' and input.go == true\"}"))
                .dependsOn("A").build();

            ValidationResult valid = validator.validate(
                workflow(WorkflowType.CONDITIONAL, step("A"), step("B", "A"), transitive));
            ValidationResult invalid = validator.validate(
                workflow(WorkflowType.CONDITIONAL, step("A"), step("B", "A"), sibling, itself));

            assertThat(valid.isValid()).isTrue();
            assertThat(invalid.violations())
                .filteredOn(violation -> violation.code() == ViolationCode.INVALID_PREDICATE)
                .extracting(ValidationResult.Violation::field)
                .containsExactly("steps[2].config.condition", "steps[3].config.condition");
        }

        @Test
        @DisplayName("Unparseable predicates are rejected")
        void rejectsInvalidPredicate() throws Exception {
            WorkflowStep step = WorkflowStep.builder().name("B").stepType("task")
                .config(MAPPER.readTree("{\"condition\": \"A.result.flag ==\"}"))
                .build();

            ValidationResult result = validator.validate(workflow(WorkflowType.CONDITIONAL, step));

            assertThat(result.hasViolation(ViolationCode.INVALID_PREDICATE)).isTrue();
        }

        @Test
        @DisplayName("Loop workflows require max_iterations within bounds")
        void loopRequiresBoundedIterations() throws Exception {
            Workflow missing = Workflow.builder().name("loop").workflowType(WorkflowType.LOOP)
                .step(step("poll")).build();
            Workflow tooMany = Workflow.builder().name("loop").workflowType(WorkflowType.LOOP)
                .config(MAPPER.readTree("{\"loop\": {\"max_iterations\": 5000}}"))
                .step(step("poll")).build();
            Workflow valid = Workflow.builder().name("loop").workflowType(WorkflowType.LOOP)
                .config(MAPPER.readTree("{\"loop\": {\"steps\": [\"poll\"], \"max_iterations\": 3}}"))
                .step(step("poll")).step(step("report", "poll")).build();

            assertThat(validator.validate(missing).hasViolation(ViolationCode.REQUIRED)).isTrue();
            assertThat(validator.validate(tooMany).hasViolation(ViolationCode.INVALID_CONFIG)).isTrue();
            assertThat(validator.validate(valid).isValid()).isTrue();
        }

        @Test
        @DisplayName("Output steps must exist")
        void outputStepsMustExist() throws Exception {
            Workflow workflow = Workflow.builder().name("wf").workflowType(WorkflowType.SEQUENTIAL)
                .config(MAPPER.readTree("{\"output_steps\": [\"nope\"]}"))
                .step(step("A")).build();

            assertThat(validator.validate(workflow).violations())
                .anyMatch(v -> v.field().equals("config.output_steps"));
        }
    }

    // ========== Helpers ==========

    private static Workflow workflow(WorkflowType type, WorkflowStep... steps) {
        return Workflow.builder()
            .name("test-workflow")
            .workflowType(type)
            .steps(List.of(steps))
            .build();
    }

    private static WorkflowStep step(String name, String... dependencies) {
        return WorkflowStep.builder()
            .name(name)
            .stepType("task")
            .dependsOn(dependencies)
            .build();
    }
}
