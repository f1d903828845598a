package com.agentflow.core.model;

/**
 * Identifies a step within one loop iteration. Steps outside a loop always use iteration 0.
 */
public record StepKey(String stepId, int iteration) {

    /**
     * Key under which the step's result is recorded in an execution's step results.
     */
    public String resultKey() {
        return iteration == 0 ? stepId : stepId + "#" + iteration;
    }

    @Override
    public String toString() {
        return resultKey();
    }
}
