package com.agentflow.api.rest;

import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.SystemStatistics;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.engine.service.WorkflowService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated execution counters, per workflow and system wide.
 */
@RestController
public class StatisticsController {

    private final WorkflowService workflowService;

    public StatisticsController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping("/workflows/{workflowId}/stats")
    public ResponseEntity<WorkflowStatsResponse> getWorkflowStatistics(@PathVariable String workflowId) {
        return ResponseEntity.ok(WorkflowStatsResponse.from(workflowService.getWorkflowStatistics(workflowId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<SystemStatsResponse> getSystemStatistics() {
        return ResponseEntity.ok(SystemStatsResponse.from(workflowService.getSystemStatistics()));
    }

    // ========== DTOs ==========

    public record WorkflowStatsResponse(
        String workflowId,
        long executionCount,
        long successCount,
        long failureCount,
        long cancelledCount,
        long runningCount,
        double averageDurationSeconds,
        double successRate
    ) {
        public static WorkflowStatsResponse from(ExecutionStatistics stats) {
            return new WorkflowStatsResponse(
                stats.workflowId(),
                stats.executionCount(),
                stats.successCount(),
                stats.failureCount(),
                stats.cancelledCount(),
                stats.runningCount(),
                stats.averageDurationSeconds(),
                stats.successRate()
            );
        }
    }

    public record SystemStatsResponse(
        long totalWorkflows,
        long executionCount,
        long successCount,
        long failureCount,
        long cancelledCount,
        long runningCount,
        double averageDurationSeconds,
        double successRate,
        Map<String, Long> workflowsByType,
        Map<String, Long> workflowsByStatus
    ) {
        public static SystemStatsResponse from(SystemStatistics stats) {
            ExecutionStatistics executions = stats.executions();
            Map<String, Long> byType = new LinkedHashMap<>();
            for (WorkflowType type : WorkflowType.values()) {
                byType.put(type.value(), stats.workflowsByType().getOrDefault(type, 0L));
            }
            Map<String, Long> byStatus = new LinkedHashMap<>();
            for (WorkflowStatus status : WorkflowStatus.values()) {
                byStatus.put(status.value(), stats.workflowsByStatus().getOrDefault(status, 0L));
            }
            return new SystemStatsResponse(
                stats.totalWorkflows(),
                executions.executionCount(),
                executions.successCount(),
                executions.failureCount(),
                executions.cancelledCount(),
                executions.runningCount(),
                executions.averageDurationSeconds(),
                executions.successRate(),
                byType,
                byStatus
            );
        }
    }
}
