package com.codeswarm.core.state;

import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.plan.Plan;

/**
 * The only way a LoopState evolves: (LoopState, PhaseResult) → LoopState.
 *
 * Enforces the phase order. Feeding a result out of order, starting an
 * iteration past the budget, or touching a terminal state is a programming
 * error and raises IllegalStateException.
 */
public final class LoopStateReducer {

    private LoopStateReducer() {
    }

    public static LoopState reduce(LoopState state, PhaseResult result) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run already terminated: " + state);
        }

        switch (result.getKind()) {

            case ITERATION_STARTED: {
                requirePhase(state, LoopPhase.AUDIT, result);
                if (state.budgetExhausted()) {
                    throw new IllegalStateException("Iteration budget " + state.getMaxIterations() + " already used");
                }
                return new LoopState(
                        state.getIteration() + 1, state.getMaxIterations(), LoopPhase.AUDIT,
                        Plan.empty(), FixReport.empty(), null,
                        state.getStatistics(), null, null);
            }

            case AUDITED: {
                requirePhase(state, LoopPhase.AUDIT, result);
                requireStarted(state, result);
                Plan plan = result.getPlan();
                return new LoopState(
                        state.getIteration(), state.getMaxIterations(), LoopPhase.FIX,
                        plan, FixReport.empty(), null,
                        state.getStatistics().plusIssuesFound(plan.issueCount()), null, null);
            }

            case FIXED: {
                requirePhase(state, LoopPhase.FIX, result);
                FixReport report = result.getFixReport();
                return new LoopState(
                        state.getIteration(), state.getMaxIterations(), LoopPhase.JUDGE,
                        state.getPlan(), report, null,
                        state.getStatistics().plusFilesModified(report.filesModified()), null, null);
            }

            case JUDGED: {
                requirePhase(state, LoopPhase.JUDGE, result);
                return new LoopState(
                        state.getIteration(), state.getMaxIterations(), LoopPhase.AUDIT,
                        state.getPlan(), state.getFixReport(), result.getVerdict(),
                        state.getStatistics(), null, null);
            }

            case TERMINATED:
                return new LoopState(
                        state.getIteration(), state.getMaxIterations(), LoopPhase.TERMINAL,
                        state.getPlan(), state.getFixReport(), state.getVerdict(),
                        state.getStatistics(), result.getTerminalState(), result.getMessage());

            default:
                throw new IllegalStateException("Unhandled phase result: " + result.getKind());
        }
    }

    private static void requirePhase(LoopState state, LoopPhase expected, PhaseResult result) {
        if (state.getPhase() != expected) {
            throw new IllegalStateException(
                    result.getKind() + " is not valid in phase " + state.getPhase() + " (expected " + expected + ")");
        }
    }

    private static void requireStarted(LoopState state, PhaseResult result) {
        if (state.getIteration() == 0) {
            throw new IllegalStateException(result.getKind() + " before the first iteration started");
        }
    }
}
