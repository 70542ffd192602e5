package com.codeswarm.core.mediator;

import com.codeswarm.core.judge.JudgeAction;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.state.LoopState;
import com.codeswarm.core.state.TerminalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ConvergenceDetector - decides the next transition from a LoopState.
 *
 * ARCHITECTURAL BOUNDARY:
 * The detector DECIDES. The orchestrator EXECUTES transitions.
 * No state is kept between calls; the same LoopState always yields the same
 * decision.
 *
 * Rules, in precedence order:
 *   1. afterAudit: empty Plan                      → SUCCESS
 *   2. afterJudge: action REQUIRE_HUMAN            → NEEDS_HUMAN (even when all tests passed)
 *   3.             action STOP                     → SUCCESS if all passed, else STOPPED
 *   4.             iteration reached the budget    → MAX_ITERATIONS
 *   5.             non-empty Plan, nothing changed → PARTIAL (stall)
 *   6.             otherwise                       → CONTINUE
 */
@Component
public class ConvergenceDetector {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceDetector.class);

    public MediationResult afterAudit(LoopState state) {
        if (state.getPlan().isEmpty()) {
            log.info("[Detector] Empty plan in iteration {} → SUCCESS", state.getIteration());
            return MediationResult.terminate(TerminalState.SUCCESS,
                    "No issues detected in iteration " + state.getIteration());
        }
        return MediationResult.proceed(
                state.getPlan().issueCount() + " issue(s) in " + state.getPlan().resourceCount() + " resource(s)");
    }

    public MediationResult afterJudge(LoopState state) {
        Verdict verdict = state.getVerdict();
        if (verdict == null) {
            throw new IllegalStateException("afterJudge called without a verdict: " + state);
        }

        // ================================================================
        // JUDGE DIRECTIVES
        // ================================================================

        if (verdict.getAction() == JudgeAction.REQUIRE_HUMAN) {
            if (verdict.isAllPassed()) {
                log.warn("[Detector] Judge requires a human although all tests passed; escalating");
            }
            log.info("[Detector] REQUIRE_HUMAN → NEEDS_HUMAN");
            return MediationResult.terminate(TerminalState.NEEDS_HUMAN,
                    "Judge requires human review: " + verdict.getReason());
        }

        if (verdict.getAction() == JudgeAction.STOP) {
            if (verdict.isAllPassed()) {
                log.info("[Detector] STOP with all {} test(s) passing → SUCCESS", verdict.getTotal());
                return MediationResult.terminate(TerminalState.SUCCESS,
                        "All tests passed (" + verdict.getPassed() + "/" + verdict.getTotal() + ")");
            }
            log.info("[Detector] STOP with {} failing test(s) → STOPPED", verdict.getFailed());
            return MediationResult.terminate(TerminalState.STOPPED,
                    "Judge stopped with " + verdict.getFailed() + " failing test(s): " + verdict.getReason());
        }

        // ================================================================
        // LOOP GUARDS
        // ================================================================

        if (state.budgetExhausted()) {
            log.warn("[Detector] Iteration {}/{} reached → MAX_ITERATIONS",
                    state.getIteration(), state.getMaxIterations());
            return MediationResult.terminate(TerminalState.MAX_ITERATIONS,
                    "Reached " + state.getMaxIterations() + " iteration(s) without convergence");
        }

        if (!state.getPlan().isEmpty() && state.getFixReport().filesModified() == 0) {
            log.warn("[Detector] {} issue(s) planned but no resource modified → PARTIAL",
                    state.getPlan().issueCount());
            return MediationResult.terminate(TerminalState.PARTIAL,
                    "Stalled: " + state.getPlan().issueCount() + " issue(s) detected but no file was modified");
        }

        log.info("[Detector] {} file(s) modified, tests still failing → CONTINUE",
                state.getFixReport().filesModified());
        return MediationResult.proceed("Progress made; re-auditing");
    }
}
