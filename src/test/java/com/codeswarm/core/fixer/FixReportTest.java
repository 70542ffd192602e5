package com.codeswarm.core.fixer;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FixReportTest {

    @Test
    void testFilesModifiedCountsBothFixedStatuses() {
        Map<String, FixOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("a.py", FixOutcome.fixed(2));
        outcomes.put("b.py", FixOutcome.fixedViaFallback(1));
        outcomes.put("c.py", FixOutcome.noChange("nothing to do"));
        outcomes.put("d.py", FixOutcome.error("write failed"));

        FixReport report = FixReport.of(outcomes);

        assertEquals(2, report.filesModified());
        assertEquals(1, report.errorCount());
        assertEquals(FixStatus.NO_CHANGE, report.outcomeFor("c.py").getStatus());
    }

    @Test
    void testFailedForMarksEveryResource() {
        FixReport report = FixReport.failedFor(new LinkedHashSet<>(List.of("a.py", "b.py")), "fixer crashed");

        assertEquals(0, report.filesModified());
        assertEquals(2, report.errorCount());
        assertEquals("fixer crashed", report.outcomeFor("b.py").getDetail());
    }

    @Test
    void testModifiedRequiresModifyingStatus() {
        assertThrows(IllegalArgumentException.class, () -> new FixOutcome(true, 1, FixStatus.NO_CHANGE, ""));
        assertThrows(IllegalArgumentException.class, () -> new FixOutcome(true, 1, FixStatus.ERROR, ""));
        assertThrows(IllegalArgumentException.class, () -> new FixOutcome(false, -1, FixStatus.NO_CHANGE, ""));
        assertThrows(IllegalArgumentException.class, () -> new FixOutcome(false, 0, null, ""));
    }

    @Test
    void testEmptyReport() {
        assertTrue(FixReport.of(Map.of()).isEmpty());
        assertEquals(0, FixReport.empty().filesModified());
    }
}
