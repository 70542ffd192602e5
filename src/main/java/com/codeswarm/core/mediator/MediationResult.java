package com.codeswarm.core.mediator;

import com.codeswarm.core.state.TerminalState;

import java.util.Objects;

/**
 * MediationResult - immutable value returned by ConvergenceDetector.
 *
 * Always construct via the static factories:
 *   MediationResult.proceed(reasoning)
 *   MediationResult.terminate(terminalState, reasoning)
 */
public final class MediationResult {

    private final MediationDecision decision;
    private final TerminalState     terminalState;   // null when CONTINUE
    private final String            reasoning;

    private MediationResult(MediationDecision decision, TerminalState terminalState, String reasoning) {
        this.decision      = decision;
        this.terminalState = terminalState;
        this.reasoning     = reasoning != null ? reasoning : "";
    }

    // =========================================================================
    // Static factory methods
    // =========================================================================

    public static MediationResult proceed(String reasoning) {
        return new MediationResult(MediationDecision.CONTINUE, null, reasoning);
    }

    public static MediationResult terminate(TerminalState terminalState, String reasoning) {
        return new MediationResult(MediationDecision.TERMINATE,
                Objects.requireNonNull(terminalState, "terminalState"), reasoning);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public MediationDecision getDecision()      { return decision; }
    public TerminalState     getTerminalState() { return terminalState; }
    public String            getReasoning()     { return reasoning; }

    public boolean isTerminal() { return decision == MediationDecision.TERMINATE; }

    @Override
    public String toString() {
        String preview = reasoning.length() > 80 ? reasoning.substring(0, 80) + "..." : reasoning;
        return String.format("MediationResult{decision=%s, terminal=%s, reasoning='%s'}",
                decision, terminalState, preview);
    }
}
