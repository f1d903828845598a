package com.agentflow.engine.state;

import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.model.WorkflowExecution;

/**
 * Observer of persisted transitions. Called after the new state is durable, on the thread that
 * made the transition and while the execution lock is held, so implementations must not block.
 */
public interface ExecutionListener {

    /**
     * @param execution the execution in its new state
     * @param from      the previous status, null for a newly created execution
     */
    default void onExecutionTransition(WorkflowExecution execution, ExecutionStatus from) {
    }

    /**
     * @param step the attempt in its new state
     * @param from the previous status, null for a newly created attempt
     */
    default void onStepTransition(StepExecution step, StepStatus from) {
    }
}
