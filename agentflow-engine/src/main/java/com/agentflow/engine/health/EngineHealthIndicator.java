package com.agentflow.engine.health;

import com.agentflow.engine.execution.ExecutionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports engine health based on:
 * - state store reachability
 * - whether crash recovery has finished and the engine is dispatching
 * - number of live executions
 */
public class EngineHealthIndicator implements HealthIndicator {

    private final StoreProbe storeProbe;
    private final ExecutionEngine engine;

    public EngineHealthIndicator(StoreProbe storeProbe, ExecutionEngine engine) {
        this.storeProbe = storeProbe;
        this.engine = engine;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean storeUp = storeProbe.isAvailable();
        details.put("store", storeProbe.name());
        details.put("storeStatus", storeUp ? "connected" : "disconnected");
        details.put("recoveryComplete", engine.isOpen());
        details.put("activeExecutions", engine.activeCount());
        if (!storeUp) {
            return Health.down().withDetails(details).build();
        }
        if (!engine.isOpen()) {
            return Health.outOfService().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    /**
     * Ready to accept work: store reachable and recovery finished.
     */
    public boolean isReady() {
        return engine.isOpen() && storeProbe.isAvailable();
    }
}
