package com.agentflow.engine.state;

/**
 * What happened to a failed or timed-out attempt.
 */
public enum FailureOutcome {
    /** The signal referred to an attempt that is no longer current; nothing changed. */
    STALE,
    /** The step moved to RETRYING and another attempt will follow. */
    RETRY,
    /** The step is permanently FAILED. */
    EXHAUSTED
}
