package com.codeswarm.core.agent;

import com.codeswarm.core.executor.PythonExecutionResult;
import com.codeswarm.core.executor.PythonExecutor;
import com.codeswarm.core.filesystem.FileSystemManager;
import com.codeswarm.core.filesystem.FileSystemManager.FileSystemException;
import com.codeswarm.core.normalizer.IssueNormalizer;
import com.codeswarm.core.normalizer.NormalizationResult;
import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.core.plan.Severity;
import com.codeswarm.llm.LLMClient;
import com.codeswarm.llm.LlmClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AuditorAgent - builds the Plan for one iteration.
 *
 * Per Python file in the target:
 *   1. py_compile          → SYNTAX/CRITICAL issue with the reported line
 *   2. SyntaxHeuristics    → missing colon / unclosed def parameter list
 *   3. pylint (JSON)       → context for the model, not issues by itself
 *   4. model analysis      → normalised by IssueNormalizer, one reformat retry
 *
 * Fails closed: a file that cannot be read is left out of the Plan, and a
 * failed model call keeps the locally detected issues.
 */
@Component
public class AuditorAgent implements Agent, Auditor {

    private static final Logger log = LoggerFactory.getLogger(AuditorAgent.class);

    private static final int     MAX_PYLINT_CONTEXT = 4000;
    private static final Pattern COMPILE_LINE       = Pattern.compile("line (\\d+)");
    private static final Pattern COMPILE_ERROR      = Pattern.compile("^\\s*(\\w+Error: .+)$", Pattern.MULTILINE);

    private final LLMClient         llmClient;
    private final IssueNormalizer   normalizer;
    private final PythonExecutor    pythonExecutor;
    private final FileSystemManager fileSystem;

    public AuditorAgent(
            LLMClient         llmClient,
            IssueNormalizer   normalizer,
            PythonExecutor    pythonExecutor,
            FileSystemManager fileSystem
    ) {
        this.llmClient      = llmClient;
        this.normalizer     = normalizer;
        this.pythonExecutor = pythonExecutor;
        this.fileSystem     = fileSystem;
    }

    @Override
    public String getAgentId() { return "auditor-agent-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.AUDITOR; }

    // =========================================================================
    // Auditor contract
    // =========================================================================

    @Override
    public Plan audit(ResourceSet resources) {
        Path root = resources.getRoot();

        List<String> files;
        try {
            files = fileSystem.listPythonFiles(root);
        } catch (FileSystemException e) {
            log.error("[Auditor] Cannot list {}: {} → empty plan", root, e.getMessage());
            return Plan.empty();
        }

        log.info("[Auditor] Auditing {} Python file(s) in {}", files.size(), root);

        Plan.Builder plan = Plan.builder();
        for (String file : files) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[Auditor] Interrupted before {} → stopping with a partial plan", file);
                break;
            }
            try {
                List<Issue> issues = auditFile(resources, file);
                log.info("[Auditor] {}: {} issue(s)", file, issues.size());
                plan.add(file, issues);
            } catch (FileSystemException e) {
                log.warn("[Auditor] Skipping {}: {}", file, e.getMessage());
            }
        }

        Plan result = plan.build();
        log.info("[Auditor] Plan: {} issue(s) across {} file(s)", result.issueCount(), result.resourceCount());
        return result;
    }

    // =========================================================================
    // Per-file analysis
    // =========================================================================

    private List<Issue> auditFile(ResourceSet resources, String file) throws FileSystemException {
        Path   root = resources.getRoot();
        String code = fileSystem.readFile(root, file);

        Set<Issue> issues = new LinkedHashSet<>();

        checkCompile(root, file).ifPresentOrElse(
                issues::add,
                () -> log.debug("[Auditor] {} compiles", file));
        issues.addAll(SyntaxHeuristics.detect(file, code));

        String pylintContext = pylintContext(root, file);
        issues.addAll(analyzeWithModel(resources, file, code, pylintContext));

        return new ArrayList<>(issues);
    }

    private Optional<Issue> checkCompile(Path root, String file) {
        PythonExecutionResult result = pythonExecutor.runPyCompile(root, file);
        if (!result.hasRealExitCode() || result.isSuccess()) {
            if (!result.hasRealExitCode()) {
                log.warn("[Auditor] py_compile unavailable for {}: {}", file, result.getErrorMessage());
            }
            return Optional.empty();
        }

        String output = result.getOutput();
        Matcher lineMatcher = COMPILE_LINE.matcher(output);
        int line = 1;
        while (lineMatcher.find()) {
            line = Integer.parseInt(lineMatcher.group(1));
        }

        Matcher errorMatcher = COMPILE_ERROR.matcher(output);
        String message = "SyntaxError";
        while (errorMatcher.find()) {
            message = errorMatcher.group(1).trim();
        }

        return Optional.of(new Issue(file, line, IssueCategory.SYNTAX, Severity.CRITICAL,
                message, "Fix syntax error: " + message));
    }

    private String pylintContext(Path root, String file) {
        PythonExecutionResult result = pythonExecutor.runPylint(root, file);
        if (!result.hasRealExitCode()) {
            return "pylint unavailable: " + result.getErrorMessage();
        }
        String output = result.getOutput().strip();
        if (output.isEmpty() || output.equals("[]")) {
            return "pylint reported no messages";
        }
        return output.length() > MAX_PYLINT_CONTEXT
                ? output.substring(0, MAX_PYLINT_CONTEXT) + "\n... (truncated)"
                : output;
    }

    private List<Issue> analyzeWithModel(ResourceSet resources, String file, String code, String pylintContext) {
        double temperature = llmClient.getTemperatureForRole(AgentType.AUDITOR);
        String model       = resources.getModelSelector();

        try {
            String response = llmClient.generateWithRole(
                    AgentType.AUDITOR, buildAuditPrompt(file, code, pylintContext), temperature, model);

            NormalizationResult result = normalizer.normalizeWithRemediation(
                    response,
                    file,
                    reformatPrompt -> llmClient.generateWithRole(AgentType.AUDITOR, reformatPrompt, temperature, model)
            );

            if (result.isPartial()) {
                log.warn("[Auditor] Model output for {} unusable ({}); keeping local findings", file, result.getNote());
            } else if (result.wasReformatted()) {
                log.info("[Auditor] Model output for {} recovered by reformat", file);
            }
            return result.getIssues();

        } catch (LlmClientException e) {
            log.warn("[Auditor] Model analysis failed for {} after {} attempt(s): {}",
                    file, e.getAttempts(), e.getMessage());
            return List.of();
        }
    }

    // =========================================================================
    // Prompt
    // =========================================================================

    private String buildAuditPrompt(String file, String code, String pylintContext) {
        return """
                FILE: %s

                PYLINT CONTEXT:
                %s

                CODE:
                ```python
                %s
                ```

                Your task:
                - Analyze the provided Python source code.
                - Identify bugs, bad practices, style violations, and design issues.
                - Give a prioritized list of issues. Do NOT generate fixed code.

                Output format (MUST BE VALID JSON, NO EXTRA TEXT):
                {
                  "summary": "short global diagnosis",
                  "issues": [
                    {
                      "line": 0,
                      "type": "SYNTAX | BUG | STYLE | DESIGN | DOC",
                      "severity": "CRITICAL | HIGH | MEDIUM | LOW",
                      "description": "clear explanation of the issue",
                      "fix_instruction": "how to fix it"
                    }
                  ],
                  "global_recommendation": "concise overall recommendation"
                }

                If there are no issues return exactly: {"issues": []}
                """.formatted(file, pylintContext, code);
    }
}
