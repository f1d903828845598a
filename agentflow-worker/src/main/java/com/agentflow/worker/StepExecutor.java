package com.agentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Contract for the external collaborators that perform step work.
 * An executor reports exactly one outcome per dispatch: a result, or a {@link StepExecutionException}.
 * An executor that does not return within the step's timeout is treated as timed out.
 */
@FunctionalInterface
public interface StepExecutor {

    /**
     * Execute one attempt of a step.
     *
     * @param dispatch Step identity, parameters and upstream results
     * @return The step result
     * @throws StepExecutionException if the step fails
     */
    JsonNode execute(StepDispatch dispatch) throws StepExecutionException;
}
