package com.agentflow.recovery;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of the startup recovery pass.
 *
 * @param resumed  executions handed back to the engine
 * @param failed   executions that could not be resumed, by id
 * @param duration time the pass took
 */
public record RecoveryReport(List<UUID> resumed, List<UUID> failed, Duration duration) {

    public RecoveryReport {
        resumed = List.copyOf(resumed);
        failed = List.copyOf(failed);
    }

    public int resumedCount() {
        return resumed.size();
    }
}
