package com.codeswarm.core.judge;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    @Test
    void testTotalIsPassedPlusFailed() {
        Verdict verdict = Verdict.fixable(3, 2, "AssertionError");

        assertEquals(5, verdict.getTotal());
        assertFalse(verdict.isAllPassed());
        assertEquals(JudgeAction.RETURN_TO_AUDIT, verdict.getAction());
    }

    @Test
    void testAllPassedWithFailuresIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Verdict(true, 1, 1, VerdictStatus.PASS, JudgeAction.STOP, ""));
        assertThrows(IllegalArgumentException.class,
                () -> new Verdict(false, -1, 0, VerdictStatus.ERROR, JudgeAction.STOP, ""));
        assertThrows(IllegalArgumentException.class,
                () -> new Verdict(false, 0, 0, VerdictStatus.ERROR, null, ""));
    }

    @Test
    void testAdapterFailureEscalatesToHuman() {
        Verdict verdict = Verdict.adapterFailure("timeout");

        assertFalse(verdict.isAllPassed());
        assertEquals(JudgeAction.REQUIRE_HUMAN, verdict.getAction());
        assertTrue(verdict.getReason().contains("timeout"));
    }

    @Test
    void testDisplayReasonIsTruncatedButReasonIsNot() {
        String reason = "r".repeat(400);
        Verdict verdict = Verdict.uncertain(0, 1, reason);

        assertEquals(400, verdict.getReason().length());
        assertEquals(153, verdict.displayReason().length());
        assertTrue(verdict.displayReason().endsWith("..."));
    }

    @Test
    void testActionLabels() {
        assertEquals(JudgeAction.REQUIRE_HUMAN, JudgeAction.fromLabel("require_human"));
        assertEquals(JudgeAction.STOP, JudgeAction.fromLabel(" STOP "));
        assertNull(JudgeAction.fromLabel("RETRY_FOREVER"));
    }
}
