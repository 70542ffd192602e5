package com.codeswarm.core.state;

import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.plan.Plan;

import java.util.Objects;

/**
 * LoopState - immutable snapshot of the control loop's working memory.
 *
 * Owned by the orchestrator and never shared across threads. A new snapshot
 * is produced for every phase transition by {@link LoopStateReducer}; adapters
 * only ever see the values they are handed (resource set, Plan).
 *
 * plan, fixReport and verdict always describe the current iteration; they are
 * reset when a new iteration starts. verdict is null until JUDGE has run.
 */
public final class LoopState {

    private final int           iteration;
    private final int           maxIterations;
    private final LoopPhase     phase;
    private final Plan          plan;
    private final FixReport     fixReport;
    private final Verdict       verdict;
    private final RunStatistics statistics;
    private final TerminalState terminalState;   // null until TERMINAL
    private final String        terminalMessage;

    LoopState(
            int           iteration,
            int           maxIterations,
            LoopPhase     phase,
            Plan          plan,
            FixReport     fixReport,
            Verdict       verdict,
            RunStatistics statistics,
            TerminalState terminalState,
            String        terminalMessage
    ) {
        this.iteration       = iteration;
        this.maxIterations   = maxIterations;
        this.phase           = phase;
        this.plan            = plan;
        this.fixReport       = fixReport;
        this.verdict         = verdict;
        this.statistics      = statistics;
        this.terminalState   = terminalState;
        this.terminalMessage = terminalMessage;
    }

    public static LoopState initial(int maxIterations, RunStatistics statistics) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        return new LoopState(0, maxIterations, LoopPhase.AUDIT, Plan.empty(), FixReport.empty(), null,
                Objects.requireNonNull(statistics, "statistics"), null, null);
    }

    public int           getIteration()       { return iteration; }
    public int           getMaxIterations()   { return maxIterations; }
    public LoopPhase     getPhase()           { return phase; }
    public Plan          getPlan()            { return plan; }
    public FixReport     getFixReport()       { return fixReport; }
    public Verdict       getVerdict()         { return verdict; }
    public RunStatistics getStatistics()      { return statistics; }
    public TerminalState getTerminalState()   { return terminalState; }
    public String        getTerminalMessage() { return terminalMessage; }

    public boolean isTerminal() {
        return phase == LoopPhase.TERMINAL;
    }

    public boolean budgetExhausted() {
        return iteration >= maxIterations;
    }

    @Override
    public String toString() {
        return String.format("LoopState{iter=%d/%d, phase=%s, issues=%d, modified=%d%s}",
                iteration, maxIterations, phase,
                statistics.getIssuesFound(), statistics.getFilesModified(),
                terminalState != null ? ", terminal=" + terminalState : "");
    }
}
