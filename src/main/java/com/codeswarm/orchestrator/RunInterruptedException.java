package com.codeswarm.orchestrator;

import com.codeswarm.core.state.LoopPhase;

/**
 * The thread driving a run was interrupted while waiting on an adapter call.
 * Treated as cancellation, never as an adapter failure.
 */
public class RunInterruptedException extends RuntimeException {

    private final LoopPhase phase;

    public RunInterruptedException(LoopPhase phase, Throwable cause) {
        super(phase + " interrupted", cause);
        this.phase = phase;
    }

    public LoopPhase getPhase() { return phase; }
}
