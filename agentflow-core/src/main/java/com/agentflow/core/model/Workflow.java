package com.agentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A reusable workflow definition: steps, their dependencies and the topology used to run them.
 *
 * Primary Key: id
 * Optimistic version: version (incremented on every update)
 *
 * Invariants:
 * - at least one step, step names unique
 * - the dependency relation is a DAG
 * - an execution keeps the snapshot it started with, so updates never change a running plan
 */
public record Workflow(
    String id,
    String name,
    String description,
    WorkflowType workflowType,
    WorkflowStatus status,
    JsonNode config,
    JsonNode metadata,
    Set<String> tags,
    List<WorkflowStep> steps,
    int version,
    Instant createdAt,
    Instant updatedAt
) {
    public Workflow {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Find a step by name, falling back to id.
     */
    public Optional<WorkflowStep> step(String nameOrId) {
        for (WorkflowStep step : steps) {
            if (step.name() != null && step.name().equals(nameOrId)) {
                return Optional.of(step);
            }
        }
        for (WorkflowStep step : steps) {
            if (step.id() != null && step.id().equals(nameOrId)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    /**
     * Create the next version of this workflow from an updated definition.
     * Identity and creation time are preserved.
     */
    public Workflow nextVersion(Workflow updated, Instant now) {
        List<WorkflowStep> ownedSteps = new ArrayList<>();
        for (WorkflowStep step : updated.steps()) {
            ownedSteps.add(step.withWorkflowId(id));
        }
        return new Workflow(
            id, updated.name(), updated.description(), updated.workflowType(),
            updated.status() != null ? updated.status() : status,
            updated.config(), updated.metadata(), updated.tags(), ownedSteps,
            version + 1, createdAt, now
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private WorkflowType workflowType;
        private WorkflowStatus status = WorkflowStatus.DRAFT;
        private JsonNode config;
        private JsonNode metadata;
        private Set<String> tags = Set.of();
        private final List<WorkflowStep> steps = new ArrayList<>();
        private int version = 1;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder workflowType(WorkflowType workflowType) {
            this.workflowType = workflowType;
            return this;
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder config(JsonNode config) {
            this.config = config;
            return this;
        }

        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps.clear();
            if (steps != null) {
                this.steps.addAll(steps);
            }
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Workflow build() {
            String workflowId = id != null ? id : UUID.randomUUID().toString();
            Instant created = createdAt != null ? createdAt : Instant.now();
            List<WorkflowStep> ownedSteps = new ArrayList<>();
            for (WorkflowStep step : steps) {
                ownedSteps.add(step.workflowId() == null ? step.withWorkflowId(workflowId) : step);
            }
            return new Workflow(
                workflowId, name, description, workflowType, status,
                config, metadata, tags, ownedSteps, version,
                created, updatedAt != null ? updatedAt : created
            );
        }
    }
}
