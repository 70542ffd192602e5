package com.codeswarm.core.state;

import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.plan.Plan;

import java.util.Objects;

/**
 * PhaseResult - one event fed to {@link LoopStateReducer}.
 *
 * Exactly one payload is set, matching the kind.
 */
public final class PhaseResult {

    public enum Kind { ITERATION_STARTED, AUDITED, FIXED, JUDGED, TERMINATED }

    private final Kind          kind;
    private final Plan          plan;
    private final FixReport     fixReport;
    private final Verdict       verdict;
    private final TerminalState terminalState;
    private final String        message;

    private PhaseResult(Kind kind, Plan plan, FixReport fixReport, Verdict verdict,
                        TerminalState terminalState, String message) {
        this.kind          = kind;
        this.plan          = plan;
        this.fixReport     = fixReport;
        this.verdict       = verdict;
        this.terminalState = terminalState;
        this.message       = message;
    }

    public static PhaseResult iterationStarted() {
        return new PhaseResult(Kind.ITERATION_STARTED, null, null, null, null, null);
    }

    public static PhaseResult audited(Plan plan) {
        return new PhaseResult(Kind.AUDITED, Objects.requireNonNull(plan, "plan"), null, null, null, null);
    }

    public static PhaseResult fixed(FixReport fixReport) {
        return new PhaseResult(Kind.FIXED, null, Objects.requireNonNull(fixReport, "fixReport"), null, null, null);
    }

    public static PhaseResult judged(Verdict verdict) {
        return new PhaseResult(Kind.JUDGED, null, null, Objects.requireNonNull(verdict, "verdict"), null, null);
    }

    public static PhaseResult terminated(TerminalState terminalState, String message) {
        Objects.requireNonNull(terminalState, "terminalState");
        String text = message == null || message.isBlank() ? terminalState.defaultMessage() : message;
        return new PhaseResult(Kind.TERMINATED, null, null, null, terminalState, text);
    }

    public Kind          getKind()          { return kind; }
    public Plan          getPlan()          { return plan; }
    public FixReport     getFixReport()     { return fixReport; }
    public Verdict       getVerdict()       { return verdict; }
    public TerminalState getTerminalState() { return terminalState; }
    public String        getMessage()       { return message; }

    @Override
    public String toString() {
        return "PhaseResult{" + kind + "}";
    }
}
