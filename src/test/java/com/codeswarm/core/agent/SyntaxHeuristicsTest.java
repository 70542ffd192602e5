package com.codeswarm.core.agent;

import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Severity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxHeuristicsTest {

    @Test
    void testMissingColonDetected() {
        String code = "def add(a, b)\n    return a + b\n\nif x > 1\n    pass\nelse\n    pass\n";

        List<Issue> issues = SyntaxHeuristics.detect("m.py", code);

        assertEquals(3, issues.size());
        assertEquals(1, issues.get(0).getLine());
        assertEquals(4, issues.get(1).getLine());
        assertEquals(6, issues.get(2).getLine());
        assertTrue(issues.get(0).getDescription().startsWith(SyntaxHeuristics.MISSING_COLON));
        assertEquals(IssueCategory.SYNTAX, issues.get(0).getCategory());
        assertEquals(Severity.CRITICAL, issues.get(0).getSeverity());
    }

    @Test
    void testUnclosedParameterListDetected() {
        List<Issue> issues = SyntaxHeuristics.detect("m.py", "def add(a, b:\n    return a + b\n");

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getDescription().startsWith(SyntaxHeuristics.MISSING_PAREN));
    }

    @Test
    void testValidCodeHasNoFindings() {
        String code = """
                import os  # if this were a block it would need a colon

                class Point:
                    \"\"\"A point.
                    if mentioned in a docstring
                    \"\"\"

                    def dist(self, other: "Point") -> float:
                        if self.x == {'a': 1}['a']:
                            return 0.0
                        for item in (self.x,
                                     self.y):
                            pass
                        with open(os.devnull) as f, \\
                                open(os.devnull) as g:
                            pass
                        try:
                            pass
                        finally:
                            pass
                """;

        assertTrue(SyntaxHeuristics.detect("p.py", code).isEmpty());
    }

    @Test
    void testRepairAddsColonAndParen() {
        String code = "def add(a, b)\n    return a + b\ndef sub(a, b:\n    return a - b\n";
        List<Issue> issues = SyntaxHeuristics.detect("m.py", code);

        String repaired = SyntaxHeuristics.repair(code, issues);

        assertEquals("def add(a, b):\n    return a + b\ndef sub(a, b):\n    return a - b\n", repaired);
        assertEquals(2, SyntaxHeuristics.countRepairable(issues));
        assertTrue(SyntaxHeuristics.detect("m.py", repaired).isEmpty());
    }

    @Test
    void testRepairIgnoresUnrelatedIssues() {
        String code = "x = 1\n";
        List<Issue> issues = List.of(
                new Issue("m.py", 1, IssueCategory.BUG, Severity.HIGH, "Missing colon at end of statement", null),
                new Issue("m.py", 9, IssueCategory.SYNTAX, Severity.HIGH, "Missing colon at end of statement", null));

        assertSame(code, SyntaxHeuristics.repair(code, issues));
        assertEquals(1, SyntaxHeuristics.countRepairable(issues));
    }
}
