package com.codeswarm.orchestrator;

import com.codeswarm.core.state.LoopPhase;

/**
 * An adapter call that threw or exceeded the phase timeout.
 * Caught at the phase boundary and mapped to a loop outcome.
 */
public class AdapterInvocationException extends RuntimeException {

    private final LoopPhase phase;
    private final boolean   timedOut;

    public AdapterInvocationException(LoopPhase phase, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.phase    = phase;
        this.timedOut = timedOut;
    }

    public LoopPhase getPhase()  { return phase; }
    public boolean   isTimedOut() { return timedOut; }
}
