package com.codeswarm.core.state;

/**
 * How a run ended.
 *
 * NEEDS_HUMAN is the only uncertain outcome: the loop could not tell whether
 * the code or the tests are wrong, so retrying with other parameters is not
 * expected to help. The others are deterministic results of the loop's rules.
 */
public enum TerminalState {

    SUCCESS(0, "Refactoring completed successfully"),
    PARTIAL(0, "Issues were detected but no file could be modified"),
    STOPPED(0, "Judge stopped the run with failing tests"),
    NEEDS_HUMAN(1, "Manual intervention required"),
    MAX_ITERATIONS(1, "Iteration budget exhausted"),
    ERROR(1, "A worker failed fatally"),
    CANCELLED(130, "Run cancelled");

    private final int    exitCode;
    private final String defaultMessage;

    TerminalState(int exitCode, String defaultMessage) {
        this.exitCode       = exitCode;
        this.defaultMessage = defaultMessage;
    }

    /** Process exit code a command-line caller should use for this outcome. */
    public int exitCode() {
        return exitCode;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean uncertain() {
        return this == NEEDS_HUMAN;
    }
}
