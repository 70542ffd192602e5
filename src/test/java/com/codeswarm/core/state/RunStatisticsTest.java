package com.codeswarm.core.state;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunStatisticsTest {

    private final Instant start = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void testCountersOnlyGrow() {
        RunStatistics stats = RunStatistics.startingAt(start)
                .plusIssuesFound(3)
                .plusFilesModified(1)
                .plusIssuesFound(2);

        assertEquals(5, stats.getIssuesFound());
        assertEquals(1, stats.getFilesModified());
        assertThrows(IllegalArgumentException.class, () -> stats.plusIssuesFound(-1));
        assertThrows(IllegalArgumentException.class, () -> stats.plusFilesModified(-2));
    }

    @Test
    void testZeroDeltaReturnsSameInstance() {
        RunStatistics stats = RunStatistics.startingAt(start);

        assertSame(stats, stats.plusIssuesFound(0));
        assertSame(stats, stats.plusFilesModified(0));
    }

    @Test
    void testDuration() {
        RunStatistics stats = RunStatistics.startingAt(start);

        assertEquals(Duration.ofSeconds(90), stats.durationUntil(start.plusSeconds(90)));
        assertEquals(Duration.ZERO, stats.durationUntil(start.minusSeconds(5)));
    }
}
