package com.codeswarm.orchestrator;

import com.codeswarm.core.judge.VerdictStatus;
import com.codeswarm.core.state.LoopState;
import com.codeswarm.core.state.TerminalState;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;

/**
 * Final outcome of a run, built once from the terminal LoopState.
 * Serialized as-is by the controller and by RunReportWriter.
 */
public class RunResult {

    private final String        runId;
    private final TerminalState terminalState;
    private final String        message;
    private final int           iterations;
    private final int           maxIterations;
    private final int           issuesFound;
    private final int           filesModified;
    private final Duration      duration;
    private final VerdictStatus lastVerdictStatus;   // null when JUDGE never ran

    public RunResult(
            String        runId,
            TerminalState terminalState,
            String        message,
            int           iterations,
            int           maxIterations,
            int           issuesFound,
            int           filesModified,
            Duration      duration,
            VerdictStatus lastVerdictStatus
    ) {
        this.runId             = runId;
        this.terminalState     = terminalState;
        this.message           = message;
        this.iterations        = iterations;
        this.maxIterations     = maxIterations;
        this.issuesFound       = issuesFound;
        this.filesModified     = filesModified;
        this.duration          = duration;
        this.lastVerdictStatus = lastVerdictStatus;
    }

    static RunResult fromTerminal(String runId, LoopState state, Duration duration) {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Run has not terminated: " + state);
        }
        return new RunResult(
                runId,
                state.getTerminalState(),
                state.getTerminalMessage(),
                state.getIteration(),
                state.getMaxIterations(),
                state.getStatistics().getIssuesFound(),
                state.getStatistics().getFilesModified(),
                duration,
                state.getVerdict() != null ? state.getVerdict().getStatus() : null
        );
    }

    public String        getRunId()             { return runId; }
    public TerminalState getTerminalState()     { return terminalState; }
    public String        getMessage()           { return message; }
    public int           getIterations()        { return iterations; }
    public int           getMaxIterations()     { return maxIterations; }
    public int           getIssuesFound()       { return issuesFound; }
    public int           getFilesModified()     { return filesModified; }
    public VerdictStatus getLastVerdictStatus() { return lastVerdictStatus; }

    @JsonIgnore
    public Duration getDuration() { return duration; }

    public long getDurationMs() { return duration.toMillis(); }

    /** 0 for SUCCESS, PARTIAL and STOPPED; 130 for CANCELLED; 1 otherwise. */
    public int getExitCode() {
        return terminalState.exitCode();
    }

    /** True when the outcome needs a human to interpret it. */
    public boolean isUncertain() {
        return terminalState.uncertain();
    }

    @Override
    public String toString() {
        return String.format("RunResult{runId=%s, state=%s, iterations=%d/%d, issuesFound=%d, filesModified=%d, %dms}",
                runId, terminalState, iterations, maxIterations, issuesFound, filesModified, duration.toMillis());
    }
}
