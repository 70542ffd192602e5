package com.codeswarm.core.agent;

import com.codeswarm.core.executor.PytestOutputAnalyzer;
import com.codeswarm.core.executor.PythonExecutionResult;
import com.codeswarm.core.executor.PythonExecutor;
import com.codeswarm.core.executor.TestResults;
import com.codeswarm.core.judge.JudgeAction;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.judge.VerdictStatus;
import com.codeswarm.core.normalizer.BalancedJsonScanner;
import com.codeswarm.llm.LLMClient;
import com.codeswarm.llm.LlmClientException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * JudgeAgent - validates the target by running its pytest suite.
 *
 * Counts always come from pytest. The model, when enabled, only classifies a
 * failing run (fixable vs. needs a human); its own numbers are ignored.
 *
 *   skip-tests                   → PASS / STOP, nothing executed
 *   pytest timed out / no launch → ERROR / REQUIRE_HUMAN
 *   exit 3 or 4 (pytest broke)   → ERROR / REQUIRE_HUMAN
 *   exit 5 (no tests collected)  → PASS / STOP with total 0
 *   all passed                   → PASS / STOP
 *   failures                     → model classification, else TestFailureType heuristic
 */
@Component
public class JudgeAgent implements Agent, Judge {

    private static final Logger log = LoggerFactory.getLogger(JudgeAgent.class);

    private static final int EXIT_INTERNAL_ERROR = 3;
    private static final int EXIT_USAGE_ERROR    = 4;
    private static final int MAX_OUTPUT_IN_PROMPT = 6000;

    private final LLMClient            llmClient;
    private final PythonExecutor       pythonExecutor;
    private final PytestOutputAnalyzer analyzer;
    private final boolean              skipTests;
    private final boolean              modelClassification;
    private final ObjectMapper         objectMapper = new ObjectMapper();

    public JudgeAgent(
            LLMClient            llmClient,
            PythonExecutor       pythonExecutor,
            PytestOutputAnalyzer analyzer,
            @Value("${codeswarm.judge.skip-tests:false}")         boolean skipTests,
            @Value("${codeswarm.judge.llm-classification:true}")  boolean modelClassification
    ) {
        this.llmClient           = llmClient;
        this.pythonExecutor      = pythonExecutor;
        this.analyzer            = analyzer;
        this.skipTests           = skipTests;
        this.modelClassification = modelClassification;
    }

    @Override
    public String getAgentId() { return "judge-agent-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.JUDGE; }

    // =========================================================================
    // Judge contract
    // =========================================================================

    @Override
    public Verdict judge(ResourceSet resources) {
        if (skipTests) {
            log.info("[Judge] Test execution skipped by configuration");
            return Verdict.pass(0, "Test execution skipped");
        }

        PythonExecutionResult execution = pythonExecutor.runPytest(resources.getRoot());

        if (!execution.hasRealExitCode()) {
            log.error("[Judge] pytest did not complete: {}", execution.getErrorMessage());
            return Verdict.error("pytest did not complete: " + execution.getErrorMessage());
        }

        int exitCode = execution.getExitCode();
        if (exitCode == EXIT_INTERNAL_ERROR || exitCode == EXIT_USAGE_ERROR) {
            log.error("[Judge] pytest failed to run (exit {})", exitCode);
            return Verdict.error("pytest exited with code " + exitCode + ": " + tail(execution.getOutput(), 300));
        }

        TestResults results = analyzer.analyze(execution.getOutput(), exitCode);
        log.info("[Judge] {}", results.getSummary());

        if (results.isNoTestsCollected()) {
            return Verdict.pass(0, "No tests collected");
        }
        if (!results.anyFailed()) {
            return Verdict.pass(results.getPassed(), "All " + results.getPassed() + " test(s) passed");
        }

        if (modelClassification) {
            Optional<Verdict> classified = classifyWithModel(resources, results, execution.getOutput());
            if (classified.isPresent()) {
                log.info("[Judge] Model classification: {}", classified.get());
                return classified.get();
            }
        }

        Verdict heuristic = classifyByFailureType(results);
        log.info("[Judge] Heuristic classification: {}", heuristic);
        return heuristic;
    }

    // =========================================================================
    // Classification
    // =========================================================================

    Verdict classifyByFailureType(TestResults results) {
        String reason = results.getFailureType() + ": "
                + (results.getErrorSnippet() != null ? results.getErrorSnippet() : results.getSummary());
        if (results.getFailureType().isFixable()) {
            return Verdict.fixable(results.getPassed(), results.getFailed(), reason);
        }
        return Verdict.uncertain(results.getPassed(), results.getFailed(), reason);
    }

    private Optional<Verdict> classifyWithModel(ResourceSet resources, TestResults results, String output) {
        String response;
        try {
            response = llmClient.generateWithRole(
                    AgentType.JUDGE,
                    buildJudgePrompt(results, output),
                    llmClient.getTemperatureForRole(AgentType.JUDGE),
                    resources.getModelSelector()
            );
        } catch (LlmClientException e) {
            log.warn("[Judge] Model classification unavailable: {}", e.getMessage());
            return Optional.empty();
        }

        Optional<String> json = BalancedJsonScanner.firstObject(response);
        if (json.isEmpty()) {
            log.warn("[Judge] No JSON object in model classification");
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json.get());
        } catch (Exception e) {
            log.warn("[Judge] Unparsable model classification: {}", e.getMessage());
            return Optional.empty();
        }

        JudgeAction action = JudgeAction.fromLabel(node.path("action").asText(null));
        VerdictStatus status = parseStatus(node.path("status").asText(null));
        if (action == null && status == null) {
            log.warn("[Judge] Model classification has neither status nor action");
            return Optional.empty();
        }

        // A model claiming PASS while pytest reports failures is not trusted
        if (status == null || status == VerdictStatus.PASS || status == VerdictStatus.ERROR) {
            status = action == JudgeAction.RETURN_TO_AUDIT ? VerdictStatus.FAIL_FIXABLE : VerdictStatus.FAIL_UNCERTAIN;
        }
        if (action == null) {
            action = status == VerdictStatus.FAIL_FIXABLE ? JudgeAction.RETURN_TO_AUDIT : JudgeAction.REQUIRE_HUMAN;
        }

        String reason = node.path("root_cause").asText("");
        if (reason.isBlank()) {
            reason = results.getSummary();
        }
        return Optional.of(new Verdict(false, results.getPassed(), results.getFailed(), status, action, reason));
    }

    private static VerdictStatus parseStatus(String label) {
        if (label == null || label.isBlank()) return null;
        try {
            return VerdictStatus.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private String buildJudgePrompt(TestResults results, String output) {
        return """
                PYTEST SUMMARY:
                %s

                PYTEST OUTPUT:
                ```
                %s
                ```

                Decide whether the failures are automatically fixable.
                - FAIL_FIXABLE / RETURN_TO_AUDIT: syntax or logic error in the code under test.
                - FAIL_UNCERTAIN / REQUIRE_HUMAN: unclear whether the code or the tests are wrong.
                - STOP: further automatic attempts are pointless.

                OUTPUT FORMAT (strict JSON):
                {"status": "FAIL_FIXABLE|FAIL_UNCERTAIN", "error_type": "SYNTAX|LOGIC|TEST|UNKNOWN",
                 "root_cause": "max 200 chars", "action": "RETURN_TO_AUDIT|REQUIRE_HUMAN|STOP"}
                """.formatted(results.getDetailedFailureSummary(), tail(output, MAX_OUTPUT_IN_PROMPT));
    }

    private static String tail(String text, int max) {
        if (text == null) return "";
        return text.length() > max ? text.substring(text.length() - max) : text;
    }
}
