package com.agentflow.recovery;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.engine.execution.ExecutionEngine;
import com.agentflow.engine.state.RecoveredExecution;
import com.agentflow.engine.state.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery engine responsible for resuming work after a restart.
 *
 * Responsibilities:
 * - Load every non-terminal execution with its attempt history before dispatch begins
 * - Hand each back to the execution engine, which fails interrupted attempts and retries them
 * - Open the engine for dispatch once every execution has been enumerated
 * - Periodically sweep for attempts whose deadline passed without their timer firing
 * - Retry, on every sweep, executions that could be neither resumed nor failed during the pass
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final StateManager stateManager;
    private final ExecutionEngine engine;
    private final Duration sweepInterval;

    private final ScheduledExecutorService scheduler;
    private final Set<UUID> unresolved = ConcurrentHashMap.newKeySet();
    private volatile boolean running = false;
    private volatile RecoveryReport lastReport;

    public RecoveryEngine(StateManager stateManager, ExecutionEngine engine, Duration sweepInterval) {
        this.stateManager = stateManager;
        this.engine = engine;
        this.sweepInterval = sweepInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run the recovery pass, open the engine and start the periodic sweep.
     *
     * @return what the pass resumed
     */
    public RecoveryReport start() {
        if (running) {
            log.warn("Recovery engine already running");
            return lastReport;
        }
        running = true;
        log.info("Starting recovery pass");

        RecoveryReport report;
        try {
            report = recover();
        } catch (RuntimeException e) {
            running = false;
            throw e;
        }
        engine.open();

        long intervalMillis = sweepInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Recovery engine started: {} executions resumed, {} failed to resume, sweep every {}s",
            report.resumedCount(), report.failed().size(), sweepInterval.toSeconds());
        return report;
    }

    /**
     * Stop the periodic sweep.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public RecoveryReport lastReport() {
        return lastReport;
    }

    /**
     * Executions still waiting to be resumed or failed.
     */
    public Set<UUID> unresolved() {
        return Set.copyOf(unresolved);
    }

    // ========== Internal Methods ==========

    private RecoveryReport recover() {
        Instant started = Instant.now();
        List<RecoveredExecution> resumable = stateManager.loadResumable();
        log.info("Found {} non-terminal executions", resumable.size());

        List<UUID> resumed = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();
        for (RecoveredExecution recovered : resumable) {
            UUID executionId = recovered.execution().id();
            try {
                engine.resume(recovered);
                resumed.add(executionId);
            } catch (RuntimeException e) {
                log.error("Failed to resume execution {}, retrying on the next sweep", executionId, e);
                failed.add(executionId);
                unresolved.add(executionId);
            }
        }
        RecoveryReport report = new RecoveryReport(resumed, failed, Duration.between(started, Instant.now()));
        lastReport = report;
        return report;
    }

    private void sweep() {
        if (!running) {
            return;
        }
        retryUnresolved();
        try {
            engine.sweepOverdue();
        } catch (RuntimeException e) {
            log.error("Overdue attempt sweep failed", e);
        }
    }

    void retryUnresolved() {
        for (UUID executionId : List.copyOf(unresolved)) {
            try {
                RecoveredExecution recovered = stateManager.loadRecovered(executionId);
                if (!recovered.execution().status().isTerminal()) {
                    engine.resume(recovered);
                }
                unresolved.remove(executionId);
                log.info("Execution {} resolved after a failed resume", executionId);
            } catch (NotFoundException e) {
                unresolved.remove(executionId);
                log.info("Execution {} was deleted before it could be resumed", executionId);
            } catch (RuntimeException e) {
                log.warn("Execution {} still cannot be resumed: {}", executionId, e.getMessage());
            }
        }
    }
}
