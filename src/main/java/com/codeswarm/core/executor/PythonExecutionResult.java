package com.codeswarm.core.executor;

/**
 * PythonExecutionResult - outcome of one Python subprocess.
 *
 * Fields:
 *   - exitCode: process exit code; TIMEOUT_EXIT (-1) and LAUNCH_FAILURE_EXIT (-2)
 *     are reserved for runs that never produced a real exit code
 *   - output: merged stdout/stderr in the order the process wrote it
 *   - errorMessage: why the run was cut short, null for normal completion
 *   - elapsedTimeMs: wall-clock time the execution took
 */
public class PythonExecutionResult {

    public static final int TIMEOUT_EXIT        = -1;
    public static final int LAUNCH_FAILURE_EXIT = -2;

    private final int    exitCode;
    private final String output;
    private final String errorMessage;
    private final long   elapsedTimeMs;

    public PythonExecutionResult(int exitCode, String output, String errorMessage, long elapsedTimeMs) {
        this.exitCode      = exitCode;
        this.output        = output != null ? output : "";
        this.errorMessage  = errorMessage;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static PythonExecutionResult completed(int exitCode, String output, long elapsedTimeMs) {
        return new PythonExecutionResult(exitCode, output, null, elapsedTimeMs);
    }

    public static PythonExecutionResult timedOut(String partialOutput, int timeoutSeconds, long elapsedTimeMs) {
        return new PythonExecutionResult(
                TIMEOUT_EXIT, partialOutput, "TIMEOUT after " + timeoutSeconds + " seconds", elapsedTimeMs);
    }

    /**
     * Create an error result.
     * Used when the process could not be started at all.
     */
    public static PythonExecutionResult error(String errorMessage) {
        return new PythonExecutionResult(LAUNCH_FAILURE_EXIT, "", errorMessage, 0);
    }

    public int    getExitCode()      { return exitCode; }
    public String getOutput()        { return output; }
    public String getErrorMessage()  { return errorMessage; }
    public long   getElapsedTimeMs() { return elapsedTimeMs; }

    public boolean isSuccess()       { return exitCode == 0; }
    public boolean isTimedOut()      { return exitCode == TIMEOUT_EXIT; }
    public boolean isLaunchFailure() { return exitCode == LAUNCH_FAILURE_EXIT; }

    /** True when the process ran to completion and reported its own exit code. */
    public boolean hasRealExitCode() {
        return !isTimedOut() && !isLaunchFailure();
    }

    @Override
    public String toString() {
        return String.format(
            "PythonExecutionResult{exitCode=%d, outputLen=%d, elapsedMs=%d%s}",
            exitCode,
            output.length(),
            elapsedTimeMs,
            errorMessage != null ? ", error=" + errorMessage : ""
        );
    }
}
