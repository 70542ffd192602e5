package com.codeswarm.core.mediator;

import com.codeswarm.core.judge.JudgeAction;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.judge.VerdictStatus;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.core.state.LoopState;
import com.codeswarm.core.state.LoopStateReducer;
import com.codeswarm.core.state.PhaseResult;
import com.codeswarm.core.state.TerminalState;

import org.junit.jupiter.api.Test;

import static com.codeswarm.core.state.LoopStateTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class ConvergenceDetectorTest {

    private final ConvergenceDetector detector = new ConvergenceDetector();

    @Test
    void testEmptyPlanAfterAuditIsSuccess() {
        MediationResult result = detector.afterAudit(audited(fresh(5), Plan.empty()));

        assertTrue(result.isTerminal());
        assertEquals(TerminalState.SUCCESS, result.getTerminalState());
    }

    @Test
    void testNonEmptyPlanAfterAuditContinues() {
        MediationResult result = detector.afterAudit(audited(fresh(5), planWithIssues("a.py", 1)));

        assertEquals(MediationDecision.CONTINUE, result.getDecision());
        assertNull(result.getTerminalState());
    }

    @Test
    void testRequireHumanOverridesAllPassed() {
        Verdict verdict = new Verdict(true, 4, 0, VerdictStatus.PASS, JudgeAction.REQUIRE_HUMAN, "odd");
        LoopState state = judged(fresh(5), planWithIssues("a.py", 1), modified("a.py"), verdict);

        assertEquals(TerminalState.NEEDS_HUMAN, detector.afterJudge(state).getTerminalState());
    }

    @Test
    void testStopWithAllPassedIsSuccess() {
        LoopState state = judged(fresh(5), planWithIssues("a.py", 1), modified("a.py"), Verdict.pass(3, "ok"));

        assertEquals(TerminalState.SUCCESS, detector.afterJudge(state).getTerminalState());
    }

    @Test
    void testStopWithFailuresIsStopped() {
        Verdict verdict = new Verdict(false, 1, 2, VerdictStatus.FAIL_UNCERTAIN, JudgeAction.STOP, "pointless");
        LoopState state = judged(fresh(5), planWithIssues("a.py", 1), modified("a.py"), verdict);

        assertEquals(TerminalState.STOPPED, detector.afterJudge(state).getTerminalState());
    }

    @Test
    void testBudgetReachedIsMaxIterations() {
        LoopState state = fresh(2);
        state = judged(state, planWithIssues("a.py", 1), modified("a.py"), Verdict.fixable(0, 1, "x"));
        assertFalse(detector.afterJudge(state).isTerminal());

        state = judged(state, planWithIssues("a.py", 1), modified("a.py"), Verdict.fixable(0, 1, "x"));
        MediationResult result = detector.afterJudge(state);

        assertEquals(TerminalState.MAX_ITERATIONS, result.getTerminalState());
        assertEquals(2, state.getIteration());
    }

    @Test
    void testNothingModifiedIsStall() {
        LoopState state = judged(fresh(5), planWithIssues("a.py", 2), unchanged("a.py"), Verdict.fixable(0, 1, "x"));

        assertEquals(TerminalState.PARTIAL, detector.afterJudge(state).getTerminalState());
    }

    @Test
    void testBudgetTakesPrecedenceOverStall() {
        LoopState state = judged(fresh(1), planWithIssues("a.py", 2), unchanged("a.py"), Verdict.fixable(0, 1, "x"));

        assertEquals(TerminalState.MAX_ITERATIONS, detector.afterJudge(state).getTerminalState());
    }

    @Test
    void testProgressContinues() {
        LoopState state = judged(fresh(5), planWithIssues("a.py", 2), modified("a.py"), Verdict.fixable(1, 1, "x"));

        MediationResult first  = detector.afterJudge(state);
        MediationResult second = detector.afterJudge(state);

        assertFalse(first.isTerminal());
        assertEquals(first.getDecision(), second.getDecision());
        assertEquals(first.getReasoning(), second.getReasoning());
    }

    @Test
    void testAfterJudgeWithoutVerdictIsRejected() {
        LoopState fixed = LoopStateReducer.reduce(audited(fresh(5), planWithIssues("a.py", 1)),
                PhaseResult.fixed(modified("a.py")));

        assertThrows(IllegalStateException.class, () -> detector.afterJudge(fixed));
    }
}
