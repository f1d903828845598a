package com.agentflow.engine.execution;

import com.agentflow.core.condition.ConditionEvaluator;
import com.agentflow.core.model.Workflow;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plans keyed by workflow id and version. Caching a new version evicts older ones of the same workflow.
 */
public class ExecutionPlanCache {

    private final ConditionEvaluator evaluator;
    private final Map<String, ExecutionPlan> plans = new ConcurrentHashMap<>();

    public ExecutionPlanCache(ConditionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ExecutionPlan planFor(Workflow workflow) {
        String key = key(workflow.id(), workflow.version());
        ExecutionPlan plan = plans.computeIfAbsent(key, k -> ExecutionPlan.build(workflow, evaluator));
        plans.keySet().removeIf(existing -> existing.startsWith(workflow.id() + "@")
            && !existing.equals(key) && version(existing) < workflow.version());
        return plan;
    }

    public void evict(String workflowId) {
        plans.keySet().removeIf(existing -> existing.startsWith(workflowId + "@"));
    }

    public int size() {
        return plans.size();
    }

    private static String key(String workflowId, int version) {
        return workflowId + "@" + version;
    }

    private static int version(String key) {
        return Integer.parseInt(key.substring(key.lastIndexOf('@') + 1));
    }
}
