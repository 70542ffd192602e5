package com.codeswarm.core.agent;

import com.codeswarm.core.filesystem.FileSystemManager;
import com.codeswarm.core.fixer.FixOutcome;
import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.fixer.FixStatus;
import com.codeswarm.core.normalizer.IssueNormalizer;
import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.core.plan.Severity;
import com.codeswarm.llm.LLMClient;
import com.codeswarm.llm.LlmClientException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FixerAgentTest {

    private static final String BROKEN = "def f(x)\n    return x\n";

    @TempDir
    Path sandbox;

    private FileSystemManager fileSystem;
    private Path              target;
    private ResourceSet       resources;

    @BeforeEach
    void setUp() throws Exception {
        fileSystem = new FileSystemManager(sandbox.toString());
        target     = Files.createDirectories(sandbox.resolve("proj"));
        resources  = new ResourceSet(target, null);
        Files.writeString(target.resolve("a.py"), BROKEN);
    }

    private FixerAgent fixer(LLMClient llm) {
        return new FixerAgent(llm, new IssueNormalizer(), fileSystem);
    }

    private static Plan missingColonPlan() {
        return Plan.builder()
                .add(new Issue("a.py", 1, IssueCategory.SYNTAX, Severity.CRITICAL,
                        SyntaxHeuristics.MISSING_COLON + " on line 1", "Add ':'"))
                .build();
    }

    private static Plan bugPlan(String resource) {
        return Plan.builder()
                .add(new Issue(resource, 2, IssueCategory.BUG, Severity.HIGH, "Should double x", null))
                .build();
    }

    @Test
    void testModelRewriteIsWritten() throws Exception {
        FixReport report = fixer((role, prompt, temperature, model) ->
                "Here you go:\n```python\ndef f(x):\n    return 2 * x\n```\n")
                .fix(resources, bugPlan("a.py"));

        FixOutcome outcome = report.outcomeFor("a.py");
        assertEquals(FixStatus.FIXED, outcome.getStatus());
        assertEquals(1, outcome.getIssuesAddressed());
        assertEquals("def f(x):\n    return 2 * x\n", Files.readString(target.resolve("a.py")));
    }

    @Test
    void testInterruptStopsBeforeWritingAndBeforeLaterFiles() throws Exception {
        Files.writeString(target.resolve("b.py"), BROKEN);
        Plan plan = Plan.builder()
                .add(new Issue("a.py", 2, IssueCategory.BUG, Severity.HIGH, "Should double x", null))
                .add(new Issue("b.py", 2, IssueCategory.BUG, Severity.HIGH, "Should double x", null))
                .build();
        AtomicInteger modelCalls = new AtomicInteger();

        FixReport report;
        try {
            report = fixer((role, prompt, temperature, model) -> {
                modelCalls.incrementAndGet();
                Thread.currentThread().interrupt();
                return "```python\ndef f(x):\n    return 2 * x\n```\n";
            }).fix(resources, plan);
        } finally {
            Thread.interrupted();
        }

        assertEquals(1, modelCalls.get());
        assertEquals(0, report.filesModified());
        assertEquals(FixStatus.ERROR, report.outcomeFor("a.py").getStatus());
        assertFalse(report.asMap().containsKey("b.py"));
        assertEquals(BROKEN, Files.readString(target.resolve("a.py")));
        assertEquals(BROKEN, Files.readString(target.resolve("b.py")));
    }

    @Test
    void testHeuristicRepairWhenModelFails() throws Exception {
        FixReport report = fixer((role, prompt, temperature, model) -> {
            throw new LlmClientException("model unreachable", 3, null);
        }).fix(resources, missingColonPlan());

        assertEquals(FixStatus.FIXED_VIA_FALLBACK, report.outcomeFor("a.py").getStatus());
        assertEquals(1, report.filesModified());
        assertEquals("def f(x):\n    return x\n", Files.readString(target.resolve("a.py")));
    }

    @Test
    void testUnchangedRewriteIsNoChange() throws Exception {
        FixReport report = fixer((role, prompt, temperature, model) -> "```python\n" + BROKEN + "```")
                .fix(resources, bugPlan("a.py"));

        assertEquals(FixStatus.NO_CHANGE, report.outcomeFor("a.py").getStatus());
        assertEquals(0, report.filesModified());
        assertEquals(BROKEN, Files.readString(target.resolve("a.py")));
    }

    @Test
    void testModelFailureWithoutHeuristicIsError() {
        FixReport report = fixer((role, prompt, temperature, model) -> {
            throw new LlmClientException("model unreachable", 3, null);
        }).fix(resources, bugPlan("a.py"));

        assertEquals(FixStatus.ERROR, report.outcomeFor("a.py").getStatus());
        assertFalse(report.asMap().containsKey("b.py"));
        assertTrue(report.outcomeFor("a.py").getDetail().contains("model unreachable"));
    }

    @Test
    void testMissingFileIsError() {
        FixReport report = fixer((role, prompt, temperature, model) -> "x = 2\n")
                .fix(resources, bugPlan("gone.py"));

        assertEquals(FixStatus.ERROR, report.outcomeFor("gone.py").getStatus());
        assertFalse(Files.exists(target.resolve("gone.py")));
    }

    @Test
    void testPromptCarriesCanonicalIssues() {
        StringBuilder prompt = new StringBuilder();

        fixer((role, p, temperature, model) -> {
            prompt.append(p);
            return "";
        }).fix(resources, bugPlan("a.py"));

        assertTrue(prompt.toString().contains("\"description\":\"Should double x\""));
        assertTrue(prompt.toString().contains(BROKEN.strip()));
    }
}
