package com.codeswarm.core.executor;

/**
 * TestResults - counts and failure classification of one pytest run.
 *
 * Collection errors are folded into the failed count: a test module that
 * could not be imported is a failing test as far as the judge is concerned.
 */
public class TestResults {

    private final int             passed;
    private final int             failed;
    private final TestFailureType failureType;
    private final String          errorSnippet;     // key error line, may be null
    private final String          failingArtifact;  // file the failure points at, may be null
    private final boolean         noTestsCollected;

    public TestResults(
            int             passed,
            int             failed,
            TestFailureType failureType,
            String          errorSnippet,
            String          failingArtifact,
            boolean         noTestsCollected
    ) {
        if (passed < 0 || failed < 0) {
            throw new IllegalArgumentException("Test counts must be non-negative: " + passed + "/" + failed);
        }
        this.passed           = passed;
        this.failed           = failed;
        this.failureType      = failureType != null ? failureType : TestFailureType.UNKNOWN;
        this.errorSnippet     = errorSnippet;
        this.failingArtifact  = failingArtifact;
        this.noTestsCollected = noTestsCollected;
    }

    /**
     * Factory: All tests passed
     */
    public static TestResults allPassed(int count) {
        return new TestResults(count, 0, TestFailureType.NONE, null, null, false);
    }

    /**
     * Factory: pytest exited with "no tests collected"
     */
    public static TestResults noTests() {
        return new TestResults(0, 0, TestFailureType.NONE, null, null, true);
    }

    public int             getPassed()          { return passed; }
    public int             getFailed()          { return failed; }
    public int             getTotal()           { return passed + failed; }
    public TestFailureType getFailureType()     { return failureType; }
    public String          getErrorSnippet()    { return errorSnippet; }
    public String          getFailingArtifact() { return failingArtifact; }
    public boolean         isNoTestsCollected() { return noTestsCollected; }

    public boolean anyFailed() {
        return failed > 0;
    }

    /**
     * Get human-readable summary
     */
    public String getSummary() {
        if (noTestsCollected) {
            return "No tests collected";
        }
        String summary = passed + " passed, " + failed + " failed";
        if (failed > 0 && failureType != TestFailureType.UNKNOWN && failureType != TestFailureType.NONE) {
            summary += " (" + failureType + ")";
        }
        return summary;
    }

    /**
     * Get detailed failure summary for the model prompt
     */
    public String getDetailedFailureSummary() {
        if (!anyFailed()) {
            return "All tests passed";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Failure Type: ").append(failureType).append("\n");
        sb.append("Failed Tests: ").append(failed).append("\n");
        if (failingArtifact != null) {
            sb.append("Failing File: ").append(failingArtifact).append("\n");
        }
        if (errorSnippet != null && !errorSnippet.isEmpty()) {
            sb.append("\nKey Error:\n").append(errorSnippet).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
