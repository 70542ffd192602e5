package com.codeswarm.core.judge;

/**
 * Verdict - immutable judge output for one iteration.
 *
 * INVARIANTS:
 *   - total, passed, failed are non-negative and total == passed + failed
 *   - allPassed implies failed == 0
 *
 * The reason is kept in full for decision-making; {@link #displayReason()}
 * is the truncated form meant for log lines.
 */
public class Verdict {

    private static final int DISPLAY_REASON_LIMIT = 150;

    private final boolean       allPassed;
    private final int           total;
    private final int           passed;
    private final int           failed;
    private final VerdictStatus status;
    private final JudgeAction   action;
    private final String        reason;

    public Verdict(
            boolean       allPassed,
            int           passed,
            int           failed,
            VerdictStatus status,
            JudgeAction   action,
            String        reason
    ) {
        if (passed < 0 || failed < 0) {
            throw new IllegalArgumentException(
                    "Test counts must be non-negative: passed=" + passed + ", failed=" + failed);
        }
        if (allPassed && failed > 0) {
            throw new IllegalArgumentException("allPassed=true with " + failed + " failed test(s)");
        }
        if (status == null || action == null) {
            throw new IllegalArgumentException("Verdict status and action are required");
        }
        this.allPassed = allPassed;
        this.passed    = passed;
        this.failed    = failed;
        this.total     = passed + failed;
        this.status    = status;
        this.action    = action;
        this.reason    = reason != null ? reason : "";
    }

    // =========================================================================
    // Static factories
    // =========================================================================

    public static Verdict pass(int passed, String reason) {
        return new Verdict(true, passed, 0, VerdictStatus.PASS, JudgeAction.STOP, reason);
    }

    public static Verdict fixable(int passed, int failed, String reason) {
        return new Verdict(false, passed, failed, VerdictStatus.FAIL_FIXABLE, JudgeAction.RETURN_TO_AUDIT, reason);
    }

    public static Verdict uncertain(int passed, int failed, String reason) {
        return new Verdict(false, passed, failed, VerdictStatus.FAIL_UNCERTAIN, JudgeAction.REQUIRE_HUMAN, reason);
    }

    /** Validation procedure itself broke (crash, timeout, bad invocation). */
    public static Verdict error(String reason) {
        return new Verdict(false, 0, 0, VerdictStatus.ERROR, JudgeAction.REQUIRE_HUMAN, reason);
    }

    /**
     * Judge adapter raised or timed out. Never a pass: the run escalates
     * to a human instead of treating a missing verdict as success.
     */
    public static Verdict adapterFailure(String reason) {
        return new Verdict(false, 0, 0, VerdictStatus.FAIL_UNCERTAIN, JudgeAction.REQUIRE_HUMAN,
                "Judge adapter failure: " + (reason != null ? reason : "unknown error"));
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public boolean       isAllPassed() { return allPassed; }
    public int           getTotal()    { return total; }
    public int           getPassed()   { return passed; }
    public int           getFailed()   { return failed; }
    public VerdictStatus getStatus()   { return status; }
    public JudgeAction   getAction()   { return action; }
    public String        getReason()   { return reason; }

    public String displayReason() {
        return reason.length() > DISPLAY_REASON_LIMIT
                ? reason.substring(0, DISPLAY_REASON_LIMIT) + "..."
                : reason;
    }

    @Override
    public String toString() {
        return String.format("Verdict{status=%s, action=%s, %d/%d passed, reason='%s'}",
                status, action, passed, total, displayReason());
    }
}
