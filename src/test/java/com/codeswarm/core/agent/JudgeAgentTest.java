package com.codeswarm.core.agent;

import com.codeswarm.core.executor.PytestOutputAnalyzer;
import com.codeswarm.core.executor.PythonExecutionResult;
import com.codeswarm.core.judge.JudgeAction;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.judge.VerdictStatus;
import com.codeswarm.llm.LLMClient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JudgeAgentTest {

    private static final String ASSERTION_FAILURE = """
            F.                                                                [100%]
            ================================ FAILURES =================================
            ______________________________ test_double ________________________________
                def test_double():
            >       assert double(2) == 4
            E       assert 2 == 4
            FAILED test_calc.py::test_double - assert 2 == 4
            1 failed, 1 passed in 0.03s
            """;

    @TempDir
    Path target;

    private StubPythonExecutor python;
    private AtomicInteger      modelCalls;

    @BeforeEach
    void setUp() {
        python     = new StubPythonExecutor();
        modelCalls = new AtomicInteger();
    }

    private JudgeAgent judge(boolean skipTests, boolean modelClassification, String modelResponse) {
        LLMClient llm = (role, prompt, temperature, model) -> {
            modelCalls.incrementAndGet();
            return modelResponse;
        };
        return new JudgeAgent(llm, python, new PytestOutputAnalyzer(), skipTests, modelClassification);
    }

    private Verdict judge(JudgeAgent agent) {
        return agent.judge(new ResourceSet(target, null));
    }

    @Test
    void testSkipTestsPassesWithoutRunning() {
        Verdict verdict = judge(judge(true, true, ""));

        assertTrue(verdict.isAllPassed());
        assertEquals(JudgeAction.STOP, verdict.getAction());
        assertEquals(0, python.pytestRuns);
    }

    @Test
    void testAllPassed() {
        python.pytestResult = PythonExecutionResult.completed(0, "...\n3 passed in 0.05s\n", 50);

        Verdict verdict = judge(judge(false, true, ""));

        assertEquals(VerdictStatus.PASS, verdict.getStatus());
        assertEquals(3, verdict.getPassed());
        assertEquals(0, modelCalls.get());
    }

    @Test
    void testNoTestsCollectedPasses() {
        python.pytestResult = PythonExecutionResult.completed(5, "no tests ran in 0.01s\n", 10);

        Verdict verdict = judge(judge(false, true, ""));

        assertTrue(verdict.isAllPassed());
        assertEquals(0, verdict.getTotal());
    }

    @Test
    void testTimeoutIsError() {
        python.pytestResult = PythonExecutionResult.timedOut("partial", 120, 120_000);

        Verdict verdict = judge(judge(false, true, ""));

        assertEquals(VerdictStatus.ERROR, verdict.getStatus());
        assertEquals(JudgeAction.REQUIRE_HUMAN, verdict.getAction());
    }

    @Test
    void testUsageErrorIsError() {
        python.pytestResult = PythonExecutionResult.completed(4, "ERROR: file or directory not found\n", 10);

        assertEquals(VerdictStatus.ERROR, judge(judge(false, true, "")).getStatus());
    }

    @Test
    void testHeuristicClassificationOfAssertion() {
        python.pytestResult = PythonExecutionResult.completed(1, ASSERTION_FAILURE, 30);

        Verdict verdict = judge(judge(false, false, ""));

        assertEquals(VerdictStatus.FAIL_FIXABLE, verdict.getStatus());
        assertEquals(JudgeAction.RETURN_TO_AUDIT, verdict.getAction());
        assertEquals(1, verdict.getPassed());
        assertEquals(1, verdict.getFailed());
        assertTrue(verdict.getReason().startsWith("ASSERTION_ERROR"));
        assertEquals(0, modelCalls.get());
    }

    @Test
    void testHeuristicClassificationOfCollectionError() {
        python.pytestResult = PythonExecutionResult.completed(2,
                "ERROR collecting test_db.py\nfixture 'db' not found\n1 error in 0.02s\n", 20);

        Verdict verdict = judge(judge(false, false, ""));

        assertEquals(VerdictStatus.FAIL_UNCERTAIN, verdict.getStatus());
        assertEquals(JudgeAction.REQUIRE_HUMAN, verdict.getAction());
    }

    @Test
    void testModelClassificationCannotClaimPass() {
        python.pytestResult = PythonExecutionResult.completed(1, ASSERTION_FAILURE, 30);

        Verdict verdict = judge(judge(false, true,
                "```json\n{\"status\": \"PASS\", \"action\": \"RETURN_TO_AUDIT\", \"root_cause\": \"off by one\"}\n```"));

        assertFalse(verdict.isAllPassed());
        assertEquals(VerdictStatus.FAIL_FIXABLE, verdict.getStatus());
        assertEquals("off by one", verdict.getReason());
        assertEquals(1, verdict.getFailed());
    }

    @Test
    void testModelStopKeepsFailureCounts() {
        python.pytestResult = PythonExecutionResult.completed(1, ASSERTION_FAILURE, 30);

        Verdict verdict = judge(judge(false, true,
                "{\"status\": \"FAIL_UNCERTAIN\", \"action\": \"STOP\", \"root_cause\": \"tests contradict spec\"}"));

        assertEquals(JudgeAction.STOP, verdict.getAction());
        assertFalse(verdict.isAllPassed());
        assertEquals(1, verdict.getFailed());
    }

    @Test
    void testUnusableModelOutputFallsBackToHeuristic() {
        python.pytestResult = PythonExecutionResult.completed(1, ASSERTION_FAILURE, 30);

        Verdict verdict = judge(judge(false, true, "I think the code is probably wrong."));

        assertEquals(1, modelCalls.get());
        assertEquals(VerdictStatus.FAIL_FIXABLE, verdict.getStatus());
        assertTrue(verdict.getReason().startsWith("ASSERTION_ERROR"));
    }
}
