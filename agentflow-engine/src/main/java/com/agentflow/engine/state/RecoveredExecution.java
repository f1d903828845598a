package com.agentflow.engine.state;

import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.WorkflowExecution;

import java.util.List;

/**
 * A non-terminal execution loaded from the store together with its attempt history.
 */
public record RecoveredExecution(WorkflowExecution execution, List<StepExecution> history) {

    public RecoveredExecution {
        history = List.copyOf(history);
    }
}
