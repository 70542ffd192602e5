package com.codeswarm.core.state;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cumulative counters of one run. Immutable; every "plus" returns a new
 * instance and rejects negative deltas, so the counters can only grow.
 */
public final class RunStatistics {

    private final int     issuesFound;
    private final int     filesModified;
    private final Instant startTime;

    private RunStatistics(int issuesFound, int filesModified, Instant startTime) {
        this.issuesFound   = issuesFound;
        this.filesModified = filesModified;
        this.startTime     = Objects.requireNonNull(startTime, "startTime");
    }

    public static RunStatistics startingAt(Instant startTime) {
        return new RunStatistics(0, 0, startTime);
    }

    public RunStatistics plusIssuesFound(int delta) {
        requireNonNegative(delta, "issuesFound");
        return delta == 0 ? this : new RunStatistics(issuesFound + delta, filesModified, startTime);
    }

    public RunStatistics plusFilesModified(int delta) {
        requireNonNegative(delta, "filesModified");
        return delta == 0 ? this : new RunStatistics(issuesFound, filesModified + delta, startTime);
    }

    public Duration durationUntil(Instant end) {
        Duration d = Duration.between(startTime, end);
        return d.isNegative() ? Duration.ZERO : d;
    }

    public int     getIssuesFound()   { return issuesFound; }
    public int     getFilesModified() { return filesModified; }
    public Instant getStartTime()     { return startTime; }

    private static void requireNonNegative(int delta, String counter) {
        if (delta < 0) {
            throw new IllegalArgumentException(counter + " cannot decrease (delta=" + delta + ")");
        }
    }

    @Override
    public String toString() {
        return "RunStatistics{issuesFound=" + issuesFound + ", filesModified=" + filesModified
                + ", startTime=" + startTime + "}";
    }
}
