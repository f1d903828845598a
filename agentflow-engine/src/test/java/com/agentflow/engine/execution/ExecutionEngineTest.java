package com.agentflow.engine.execution;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.model.ErrorCodes;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.engine.test.EngineFixture;
import com.agentflow.worker.StepDispatch;
import com.agentflow.worker.StepExecutionException;
import com.agentflow.worker.StepExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Drives real executions through the engine with in-process executors.
 */
class ExecutionEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EngineFixture fixture;
    private final List<String> invocations = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    @BeforeEach
    void setUp() {
        RetryPolicy fastRetry = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(10))
            .maxBackoff(Duration.ofMillis(50))
            .jitterFactor(0.0)
            .build();
        fixture = new EngineFixture(EngineSettings.defaults().withRetryPolicy(fastRetry));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Nested
    @DisplayName("Dependency ordering")
    class Ordering {

        @Test
        @DisplayName("Linear chain runs in order and passes upstream results along")
        void linearChain() {
            Map<String, JsonNode> seenByC = new ConcurrentHashMap<>();
            fixture.register("task", dispatch -> {
                invocations.add(dispatch.stepName());
                if (dispatch.stepName().equals("C")) {
                    seenByC.putAll(dispatch.upstreamResults());
                }
                return object("from", dispatch.stepName());
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, null, step("A"), step("B", "A"), step("C", "B")),
                object("topic", "x"));
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(invocations).containsExactly("A", "B", "C");
            assertThat(seenByC).containsOnlyKeys("B");
            assertThat(execution.outputData().get("C").get("from").asText()).isEqualTo("C");
            assertThat(execution.stepResults()).containsOnlyKeys("A", "B", "C");
            assertThat(execution.completedAt()).isNotNull();
            assertThat(execution.durationSeconds()).isNotNull();
        }

        @Test
        @DisplayName("Sequential workflows keep at most one step in flight, in definition order")
        void sequentialOneInFlight() {
            fixture.register("task", tracking(30));
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, null, step("A"), step("B"), step("C")), null);

            assertThat(fixture.awaitTerminal(executionId).status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(maxInFlight.get()).isEqualTo(1);
            assertThat(invocations).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("Output is restricted to output_steps when configured")
        void outputSteps() {
            fixture.register("task", dispatch -> object("from", dispatch.stepName()));
            fixture.engine().open();

            ObjectNode config = MAPPER.createObjectNode();
            config.putArray("output_steps").add("B");
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, config, step("A"), step("B", "A")), null);

            WorkflowExecution execution = fixture.awaitTerminal(executionId);
            assertThat(execution.outputData().has("A")).isFalse();
            assertThat(execution.outputData().get("B").get("from").asText()).isEqualTo("B");
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Parallel steps without dependencies run at the same time")
        void parallelStepsOverlap() {
            CountDownLatch allStarted = new CountDownLatch(3);
            fixture.register("task", dispatch -> {
                allStarted.countDown();
                try {
                    if (!allStarted.await(5, TimeUnit.SECONDS)) {
                        throw StepExecutionException.permanent("NOT_PARALLEL", "peers never started");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw StepExecutionException.permanent("INTERRUPTED", "interrupted");
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.PARALLEL, null, step("A"), step("B"), step("C")), null);

            assertThat(fixture.awaitTerminal(executionId).status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("max_concurrency bounds the attempts in flight")
        void concurrencyLimit() {
            fixture.register("task", tracking(50));
            fixture.engine().open();

            ObjectNode config = MAPPER.createObjectNode().put("max_concurrency", 2);
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.PARALLEL, config, step("A"), step("B"), step("C"), step("D")), null);

            assertThat(fixture.awaitTerminal(executionId).status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
            assertThat(invocations).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Failures, retries and timeouts")
    class Failures {

        @Test
        @DisplayName("A step with retry_count 2 is attempted three times before the execution fails")
        void retriesThenFails() {
            AtomicInteger calls = new AtomicInteger();
            fixture.register("task", dispatch -> {
                calls.incrementAndGet();
                throw StepExecutionException.retryable("FLAKY", "attempt " + dispatch.attempt());
            });
            fixture.engine().open();

            WorkflowStep flaky = WorkflowStep.builder().id("A").name("A").stepType("task").retryCount(2).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, flaky), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.errorCode()).isEqualTo("FLAKY");
            assertThat(calls.get()).isEqualTo(3);
            List<StepExecution> attempts = fixture.history(executionId);
            assertThat(attempts).extracting(StepExecution::attempt).containsExactly(1, 2, 3);
            assertThat(attempts.get(2).status()).isEqualTo(StepStatus.FAILED);
            assertThat(execution.stepResults().get("A").attempt()).isEqualTo(3);
        }

        @Test
        @DisplayName("A retried step that eventually succeeds completes the execution")
        void retryThenSucceed() {
            fixture.register("task", dispatch -> {
                if (dispatch.attempt() < 2) {
                    throw StepExecutionException.retryable("FLAKY", "first attempt fails");
                }
                return object("attempt", String.valueOf(dispatch.attempt()));
            });
            fixture.engine().open();

            WorkflowStep flaky = WorkflowStep.builder().id("A").name("A").stepType("task").retryCount(1).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, flaky), null);

            WorkflowExecution execution = fixture.awaitTerminal(executionId);
            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults().get("A").attempt()).isEqualTo(2);
        }

        @Test
        @DisplayName("Permanent failures are not retried")
        void permanentFailureNotRetried() {
            AtomicInteger calls = new AtomicInteger();
            fixture.register("task", dispatch -> {
                calls.incrementAndGet();
                throw StepExecutionException.permanent("BAD_INPUT", "rejected");
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, step("A")), null);

            assertThat(fixture.awaitTerminal(executionId).errorCode()).isEqualTo("BAD_INPUT");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("A step that outlives its timeout is failed, never before the deadline")
        void timeoutNotBeforeDeadline() {
            fixture.register("task", dispatch -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return object("late", "true");
            });
            fixture.engine().open();

            WorkflowStep slow = WorkflowStep.builder()
                .id("A").name("A").stepType("task").timeoutSeconds(1).retryCount(0).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, slow), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.errorCode()).isEqualTo(ErrorCodes.STEP_TIMEOUT);
            StepExecution attempt = fixture.history(executionId).get(0);
            assertThat(attempt.status()).isEqualTo(StepStatus.FAILED);
            assertThat(Duration.between(attempt.dispatchedAt(), attempt.completedAt()))
                .isGreaterThanOrEqualTo(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("A timed out attempt is retried, stays TIMED_OUT in history and its late result is discarded")
        void timeoutThenRetry() {
            CountDownLatch lateResult = new CountDownLatch(1);
            fixture.register("task", dispatch -> {
                if (dispatch.attempt() == 1) {
                    sleepThroughInterrupts(2_500);
                    lateResult.countDown();
                    return object("attempt", "1");
                }
                return object("attempt", String.valueOf(dispatch.attempt()));
            });
            fixture.engine().open();

            WorkflowStep slow = WorkflowStep.builder()
                .id("A").name("A").stepType("task").timeoutSeconds(1).retryCount(1).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, slow), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults().get("A").attempt()).isEqualTo(2);

            assertThat(awaitLatch(lateResult)).isTrue();
            EngineFixture.pause(200);
            assertThat(fixture.engine().getStatus(executionId).stepResults().get("A").result().get("attempt").asText())
                .isEqualTo("2");
            assertThat(fixture.history(executionId))
                .extracting(StepExecution::attempt, StepExecution::status, StepExecution::errorCode)
                .containsExactly(
                    tuple(1, StepStatus.TIMED_OUT, ErrorCodes.STEP_TIMEOUT),
                    tuple(2, StepStatus.SUCCEEDED, null));
        }

        @Test
        @DisplayName("Dependents of a failed step are skipped with DEPENDENCY_FAILED")
        void skipPropagation() {
            fixture.register("task", dispatch -> {
                if (dispatch.stepName().equals("A")) {
                    throw StepExecutionException.permanent("BROKEN", "A is broken");
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.PARALLEL, null, step("A"), step("B", "A"), step("C", "B"), step("D")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.stepResults().get("B").status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(execution.stepResults().get("B").errorCode()).isEqualTo(ErrorCodes.DEPENDENCY_FAILED);
            assertThat(execution.stepResults().get("C").errorCode()).isEqualTo(ErrorCodes.DEPENDENCY_FAILED);
            assertThat(execution.stepResults().get("D").status()).isEqualTo(StepStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("continue_on_failure lets dependents of a failed step run")
        void continueOnFailure() {
            fixture.register("task", dispatch -> {
                if (dispatch.stepName().equals("A")) {
                    throw StepExecutionException.permanent("BROKEN", "A is broken");
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            ObjectNode config = MAPPER.createObjectNode().put("continue_on_failure", true);
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, config, step("A"), step("B", "A")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.stepResults().get("B").status()).isEqualTo(StepStatus.SUCCEEDED);
            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        @DisplayName("A failed best-effort step does not fail the execution")
        void bestEffort() {
            fixture.register("task", dispatch -> {
                if (dispatch.stepName().equals("A")) {
                    throw StepExecutionException.permanent("OPTIONAL", "nice to have");
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            WorkflowStep optional = WorkflowStep.builder().id("A").name("A").stepType("task").retryCount(0)
                .config(MAPPER.createObjectNode().put("best_effort", true)).build();
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, null, optional, step("B", "A")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults().get("A").status()).isEqualTo(StepStatus.FAILED);
            assertThat(execution.outputData().has("B")).isTrue();
        }

        @Test
        @DisplayName("A step without a registered executor fails with NO_EXECUTOR")
        void noExecutor() {
            fixture.engine().open();

            WorkflowStep orphan = WorkflowStep.builder().id("A").name("A").stepType("unknown").build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, orphan), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.errorCode()).isEqualTo(ErrorCodes.NO_EXECUTOR);
            assertThat(fixture.history(executionId)).hasSize(1);
        }

        @Test
        @DisplayName("An unexpected executor exception counts as a retryable step failure")
        void unexpectedException() {
            AtomicInteger calls = new AtomicInteger();
            fixture.register("task", dispatch -> {
                calls.incrementAndGet();
                throw new IllegalStateException("bug in executor");
            });
            fixture.engine().open();

            WorkflowStep step = WorkflowStep.builder().id("A").name("A").stepType("task").retryCount(1).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, step), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.errorCode()).isEqualTo(ErrorCodes.STEP_FAILED);
            assertThat(calls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("A store outage while recording progress fails the execution with STORE_ERROR")
        void storeOutage() {
            fixture.register("task", dispatch -> {
                fixture.executionRepository().failNextUpdates(1);
                return object("ok", "true");
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, null, step("A"), step("B", "A")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.errorCode()).isEqualTo(ErrorCodes.STORE_ERROR);
            assertThat(fixture.executionRepository().getFailureCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Topologies")
    class Topologies {

        @Test
        @DisplayName("A false condition skips the step and the execution still succeeds")
        void conditionalSkip() {
            fixture.register("task", dispatch -> {
                invocations.add(dispatch.stepName());
                ObjectNode result = MAPPER.createObjectNode();
                result.put("flag", false);
                return result;
            });
            fixture.engine().open();

            WorkflowStep guarded = WorkflowStep.builder().id("B").name("B").stepType("task").dependsOn("A")
                .config(MAPPER.createObjectNode().put("condition", "A.result.flag == true")).build();
            WorkflowStep always = WorkflowStep.builder().id("C").name("C").stepType("task").dependsOn("A")
                .config(MAPPER.createObjectNode().put("condition", "A.status == 'succeeded'")).build();
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.CONDITIONAL, null, step("A"), guarded, always), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults().get("B").status()).isEqualTo(StepStatus.SKIPPED);
            assertThat(execution.stepResults().get("B").errorCode()).isEqualTo(ErrorCodes.CONDITION_NOT_MET);
            assertThat(invocations).containsExactlyInAnyOrder("A", "C");
        }

        @Test
        @DisplayName("An event-driven step waits for its event and receives the payload")
        void eventWait() {
            AtomicReference<JsonNode> received = new AtomicReference<>();
            fixture.register("task", dispatch -> {
                if (dispatch.event() != null) {
                    received.set(dispatch.event());
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            WorkflowStep approval = WorkflowStep.builder().id("B").name("B").stepType("task").dependsOn("A")
                .config(MAPPER.createObjectNode().put("await_event", "approved")).build();
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.EVENT_DRIVEN, null, step("A"), approval), null);

            awaitStep(executionId, "A", StepStatus.SUCCEEDED);
            EngineFixture.pause(100);
            assertThat(fixture.engine().getStatus(executionId).status()).isEqualTo(ExecutionStatus.RUNNING);
            assertThat(latest(executionId, "B").status()).isEqualTo(StepStatus.PENDING);

            fixture.engine().signal(executionId, "approved", object("by", "alice"));
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.receivedEvents()).containsKey("approved");
            assertThat(received.get().get("by").asText()).isEqualTo("alice");
        }

        @Test
        @DisplayName("A loop runs until max_iterations and records one result per iteration")
        void loopMaxIterations() {
            fixture.register("task", dispatch -> object("iteration", String.valueOf(dispatch.iteration())));
            fixture.engine().open();

            ObjectNode config = MAPPER.createObjectNode();
            config.putObject("loop").put("max_iterations", 3);
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.LOOP, config, step("poll")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults()).containsOnlyKeys("poll", "poll#1", "poll#2");
            assertThat(execution.outputData().get("poll").get("iteration").asText()).isEqualTo("2");
        }

        @Test
        @DisplayName("A loop stops as soon as its while predicate turns false")
        void loopWhile() {
            fixture.register("task", dispatch -> {
                if (dispatch.stepName().equals("report")) {
                    return object("reported", "true");
                }
                ObjectNode result = MAPPER.createObjectNode();
                result.put("done", dispatch.iteration() >= 1);
                return result;
            });
            fixture.engine().open();

            ObjectNode config = MAPPER.createObjectNode();
            ObjectNode loop = config.putObject("loop");
            loop.putArray("steps").add("poll");
            loop.put("max_iterations", 10);
            loop.put("while", "poll.result.done == false");
            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.LOOP, config, step("poll"), step("report", "poll")), null);
            WorkflowExecution execution = fixture.awaitTerminal(executionId);

            assertThat(execution.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(execution.stepResults()).containsOnlyKeys("poll", "poll#1", "report");
            assertThat(List.copyOf(execution.stepResults().keySet())).endsWith("report");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Cancelling skips unfinished steps and discards the late result")
        void cancel() throws InterruptedException {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            fixture.register("task", dispatch -> {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return object("late", "true");
            });
            fixture.engine().open();

            UUID executionId = fixture.engine().execute(
                workflow(WorkflowType.SEQUENTIAL, null, step("A"), step("B", "A")), null);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            WorkflowExecution cancelled = fixture.engine().cancel(executionId, "user abort");
            release.countDown();
            EngineFixture.pause(100);

            assertThat(cancelled.status()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(cancelled.error()).isEqualTo("user abort");
            assertThat(fixture.history(executionId))
                .allSatisfy(attempt -> {
                    assertThat(attempt.status()).isEqualTo(StepStatus.SKIPPED);
                    assertThat(attempt.errorCode()).isEqualTo(ErrorCodes.CANCELLED);
                });
            assertThat(fixture.engine().getStatus(executionId).status()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThatThrownBy(() -> fixture.engine().cancel(executionId, "again"))
                .isInstanceOf(InvalidStateTransitionException.class);
        }

        @Test
        @DisplayName("Executions accepted before the engine opens start once it opens")
        void deferredUntilOpen() {
            fixture.register("task", dispatch -> object("ok", "true"));

            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, step("A")), null);
            EngineFixture.pause(100);
            assertThat(fixture.engine().getStatus(executionId).status()).isEqualTo(ExecutionStatus.PENDING);

            fixture.engine().open();
            assertThat(fixture.awaitTerminal(executionId).status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("Archived workflows cannot be executed")
        void archivedRejected() {
            fixture.engine().open();
            Workflow archived = Workflow.builder()
                .name("archived")
                .workflowType(WorkflowType.SEQUENTIAL)
                .status(WorkflowStatus.ARCHIVED)
                .step(step("A"))
                .build();

            assertThatThrownBy(() -> fixture.engine().execute(archived, null))
                .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("Each dispatch carries a stable idempotency key per attempt target")
        void idempotencyKey() {
            List<String> keys = Collections.synchronizedList(new ArrayList<>());
            fixture.register("task", dispatch -> {
                keys.add(dispatch.idempotencyKey());
                if (dispatch.attempt() == 1) {
                    throw StepExecutionException.retryable("FLAKY", "again");
                }
                return object("ok", "true");
            });
            fixture.engine().open();

            WorkflowStep step = WorkflowStep.builder().id("A").name("A").stepType("task").retryCount(1).build();
            UUID executionId = fixture.engine().execute(workflow(WorkflowType.SEQUENTIAL, null, step), null);
            fixture.awaitTerminal(executionId);

            assertThat(keys).hasSize(2);
            assertThat(keys.get(0)).isEqualTo(keys.get(1)).startsWith(executionId.toString());
        }
    }

    // ========== Helpers ==========

    private StepExecutor tracking(long busyMillis) {
        return (StepDispatch dispatch) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            invocations.add(dispatch.stepName());
            try {
                Thread.sleep(busyMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return object("ok", "true");
        };
    }

    private void awaitStep(UUID executionId, String stepId, StepStatus status) {
        long deadline = System.nanoTime() + EngineFixture.AWAIT_TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            StepExecution attempt = latest(executionId, stepId);
            if (attempt != null && attempt.status() == status) {
                return;
            }
            EngineFixture.pause(20);
        }
        throw new AssertionError("Step " + stepId + " never reached " + status);
    }

    private StepExecution latest(UUID executionId, String stepId) {
        StepExecution latest = null;
        for (StepExecution attempt : fixture.history(executionId)) {
            if (attempt.stepId().equals(stepId)) {
                latest = attempt;
            }
        }
        return latest;
    }

    private static Workflow workflow(WorkflowType type, JsonNode config, WorkflowStep... steps) {
        return Workflow.builder()
            .name("wf-" + type.value())
            .workflowType(type)
            .status(WorkflowStatus.ACTIVE)
            .config(config)
            .steps(List.of(steps))
            .build();
    }

    private static WorkflowStep step(String name, String... dependsOn) {
        return WorkflowStep.builder()
            .id(name)
            .name(name)
            .stepType("task")
            .dependsOn(dependsOn)
            .retryCount(0)
            .build();
    }

    private static void sleepThroughInterrupts(long millis) {
        long until = System.currentTimeMillis() + millis;
        boolean interrupted = false;
        while (System.currentTimeMillis() < until) {
            try {
                Thread.sleep(Math.max(1, until - System.currentTimeMillis()));
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ObjectNode object(String field, String value) {
        return MAPPER.createObjectNode().put(field, value);
    }
}
