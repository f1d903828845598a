package com.agentflow.engine.metrics;

import com.agentflow.engine.execution.ExecutionEngine;
import com.agentflow.engine.state.StateManager;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring: common tags for every meter and the engine's transition metrics.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config().commonTags("application", "agentflow");
    }

    @Bean
    public WorkflowMetrics workflowMetrics(ExecutionEngine engine, StateManager stateManager) {
        WorkflowMetrics metrics = new WorkflowMetrics(engine::activeCount);
        stateManager.addListener(metrics);
        return metrics;
    }
}
