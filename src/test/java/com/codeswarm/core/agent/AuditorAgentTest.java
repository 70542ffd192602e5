package com.codeswarm.core.agent;

import com.codeswarm.core.executor.PythonExecutionResult;
import com.codeswarm.core.filesystem.FileSystemManager;
import com.codeswarm.core.normalizer.IssueNormalizer;
import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.llm.LLMClient;
import com.codeswarm.llm.LlmClientException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AuditorAgentTest {

    @TempDir
    Path sandbox;

    private FileSystemManager  fileSystem;
    private StubPythonExecutor python;
    private Path               target;

    @BeforeEach
    void setUp() throws Exception {
        fileSystem = new FileSystemManager(sandbox.toString());
        python     = new StubPythonExecutor();
        target     = Files.createDirectories(sandbox.resolve("proj"));
    }

    private AuditorAgent auditor(LLMClient llm) {
        return new AuditorAgent(llm, new IssueNormalizer(), python, fileSystem);
    }

    @Test
    void testCombinesCompilerHeuristicAndModelFindings() throws Exception {
        Files.writeString(target.resolve("a.py"), "def f(x)\n    return x\n");
        python.compileResult = PythonExecutionResult.completed(1,
                "  File \"a.py\", line 1\n    def f(x)\n            ^\nSyntaxError: expected ':'\n", 1);

        LLMClient llm = (role, prompt, temperature, model) ->
                "{\"issues\": [{\"line\": 2, \"type\": \"BUG\", \"severity\": \"LOW\", \"description\": \"Returns input unchanged\"}]}";

        Plan plan = auditor(llm).audit(new ResourceSet(target, null));

        assertEquals(1, plan.resourceCount());
        List<Issue> issues = plan.issuesFor("a.py");
        assertEquals(3, issues.size());
        assertEquals("SyntaxError: expected ':'", issues.get(0).getDescription());
        assertTrue(issues.get(1).getDescription().startsWith(SyntaxHeuristics.MISSING_COLON));
        assertEquals(IssueCategory.BUG, issues.get(2).getCategory());
    }

    @Test
    void testModelFailureKeepsLocalFindings() throws Exception {
        Files.writeString(target.resolve("a.py"), "if ready\n    go()\n");

        Plan plan = auditor((role, prompt, temperature, model) -> {
            throw new LlmClientException("model unreachable", 4, null);
        }).audit(new ResourceSet(target, null));

        assertEquals(1, plan.issueCount());
        assertEquals(IssueCategory.SYNTAX, plan.issuesFor("a.py").get(0).getCategory());
    }

    @Test
    void testMalformedModelOutputIsReformattedOnce() throws Exception {
        Files.writeString(target.resolve("a.py"), "x = 1\n");
        AtomicInteger calls = new AtomicInteger();

        Plan plan = auditor((role, prompt, temperature, model) -> {
            calls.incrementAndGet();
            return prompt.contains("not valid JSON")
                    ? "{\"issues\": [{\"description\": \"Magic number\", \"type\": \"STYLE\"}]}"
                    : "{issues: [Magic number";
        }).audit(new ResourceSet(target, null));

        assertEquals(2, calls.get());
        assertEquals("Magic number", plan.issuesFor("a.py").get(0).getDescription());
    }

    @Test
    void testModelSelectorIsForwarded() throws Exception {
        Files.writeString(target.resolve("a.py"), "x = 1\n");
        StringBuilder seen = new StringBuilder();

        auditor((role, prompt, temperature, model) -> {
            seen.append(model);
            return "{\"issues\": []}";
        }).audit(new ResourceSet(target, "llama3:70b"));

        assertEquals("llama3:70b", seen.toString());
    }

    @Test
    void testCleanTargetGivesEmptyPlan() throws Exception {
        Files.writeString(target.resolve("ok.py"), "def ok():\n    return 1\n");

        Plan plan = auditor((role, prompt, temperature, model) -> "{\"issues\": []}")
                .audit(new ResourceSet(target, null));

        assertTrue(plan.isEmpty());
    }
}
