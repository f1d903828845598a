package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Template for one unit of work inside a workflow.
 *
 * Invariants (enforced by the validator):
 * - name is unique within the workflow
 * - dependencies reference other steps of the same workflow, by name or id
 * - timeoutSeconds > 0, retryCount >= 0
 */
public record WorkflowStep(
    String id,
    String workflowId,
    String name,
    String stepType,
    String agentRef,
    JsonNode config,
    List<String> dependencies,
    int timeoutSeconds,
    int retryCount
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_RETRY_COUNT = 3;

    public WorkflowStep {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Attempts allowed for this step: the first run plus every retry.
     */
    public int maxAttempts() {
        return retryCount + 1;
    }

    public WorkflowStep withWorkflowId(String newWorkflowId) {
        return new WorkflowStep(id, newWorkflowId, name, stepType, agentRef, config,
            dependencies, timeoutSeconds, retryCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String workflowId;
        private String name;
        private String stepType = "agent";
        private String agentRef;
        private JsonNode config;
        private final List<String> dependencies = new ArrayList<>();
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int retryCount = DEFAULT_RETRY_COUNT;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder stepType(String stepType) {
            this.stepType = stepType;
            return this;
        }

        public Builder agentRef(String agentRef) {
            this.agentRef = agentRef;
            return this;
        }

        public Builder config(JsonNode config) {
            this.config = config;
            return this;
        }

        public Builder dependsOn(String... stepNames) {
            this.dependencies.addAll(List.of(stepNames));
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies.clear();
            if (dependencies != null) {
                this.dependencies.addAll(dependencies);
            }
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(
                id != null ? id : UUID.randomUUID().toString(),
                workflowId, name, stepType, agentRef, config,
                dependencies, timeoutSeconds, retryCount
            );
        }
    }
}
