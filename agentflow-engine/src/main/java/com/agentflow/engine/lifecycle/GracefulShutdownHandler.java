package com.agentflow.engine.lifecycle;

import com.agentflow.engine.execution.ExecutionEngine;
import com.agentflow.scheduler.TimerScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of the engine.
 *
 * On shutdown:
 * 1. Stops dispatching new attempts and accepting executions
 * 2. Waits for in-flight attempts to report (bounded by the engine's shutdown timeout)
 * 3. Stops the timer scheduler
 *
 * Executions still running afterwards stay non-terminal in the store and are picked up by
 * recovery on the next start.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final ExecutionEngine engine;
    private final TimerScheduler timers;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(ExecutionEngine engine, TimerScheduler timers) {
        this.engine = engine;
        this.timers = timers;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown, {} active executions", engine.activeCount());
        engine.shutdown();
        timers.stop();
        log.info("Graceful shutdown complete");
    }
}
