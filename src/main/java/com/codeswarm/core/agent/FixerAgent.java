package com.codeswarm.core.agent;

import com.codeswarm.core.filesystem.FileSystemManager;
import com.codeswarm.core.filesystem.FileSystemManager.FileSystemException;
import com.codeswarm.core.fixer.FixOutcome;
import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.normalizer.CodeBlockExtractor;
import com.codeswarm.core.normalizer.IssueNormalizer;
import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.llm.LLMClient;
import com.codeswarm.llm.LlmClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FixerAgent - applies a Plan, one resource at a time.
 *
 * Per planned resource:
 *   1. SyntaxHeuristics.repair for the SYNTAX issues the auditor described
 *   2. model rewrite of the (heuristically repaired) file
 *   3. atomic write of whichever version changed the file
 *
 * Status:
 *   FIXED              - the model's rewrite differs from the original
 *   FIXED_VIA_FALLBACK - only the heuristics changed the file
 *   NO_CHANGE          - nothing to write
 *   ERROR              - read/write failed, or the model failed and no heuristic applied
 *
 * SandboxViolationException is not caught: writing outside the target is fatal.
 */
@Component
public class FixerAgent implements Agent, Fixer {

    private static final Logger log = LoggerFactory.getLogger(FixerAgent.class);

    private final LLMClient         llmClient;
    private final IssueNormalizer   normalizer;
    private final FileSystemManager fileSystem;

    public FixerAgent(LLMClient llmClient, IssueNormalizer normalizer, FileSystemManager fileSystem) {
        this.llmClient  = llmClient;
        this.normalizer = normalizer;
        this.fileSystem = fileSystem;
    }

    @Override
    public String getAgentId() { return "fixer-agent-1"; }

    @Override
    public AgentType getAgentType() { return AgentType.FIXER; }

    // =========================================================================
    // Fixer contract
    // =========================================================================

    @Override
    public FixReport fix(ResourceSet resources, Plan plan) {
        log.info("[Fixer] Applying plan: {} issue(s) in {} file(s)", plan.issueCount(), plan.resourceCount());

        Map<String, FixOutcome> outcomes = new LinkedHashMap<>();
        for (String resource : plan.resources()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[Fixer] Interrupted before {} → returning {} outcome(s)", resource, outcomes.size());
                break;
            }
            FixOutcome outcome = fixResource(resources, resource, plan.issuesFor(resource));
            log.info("[Fixer] {} → {}", resource, outcome);
            outcomes.put(resource, outcome);
        }

        FixReport report = FixReport.of(outcomes);
        log.info("[Fixer] {} file(s) modified, {} error(s)", report.filesModified(), report.errorCount());
        return report;
    }

    // =========================================================================
    // Per-resource repair
    // =========================================================================

    private FixOutcome fixResource(ResourceSet resources, String resource, List<Issue> issues) {
        Path root = resources.getRoot();

        String original;
        try {
            original = fileSystem.readFile(root, resource);
        } catch (FileSystemException e) {
            log.warn("[Fixer] Cannot read {}: {}", resource, e.getMessage());
            return FixOutcome.error("Read failed: " + e.getMessage());
        }

        String heuristic = SyntaxHeuristics.repair(original, issues);
        if (!heuristic.equals(original)) {
            log.info("[Fixer] Heuristic syntax repair applied to {}", resource);
        }

        String rewritten    = null;
        String modelFailure = null;
        try {
            rewritten = requestRewrite(resources, resource, heuristic, issues);
        } catch (LlmClientException e) {
            modelFailure = e.getMessage();
            log.warn("[Fixer] Model rewrite failed for {}: {}", resource, modelFailure);
        }

        String     newCode;
        FixOutcome outcome;
        if (rewritten != null && !rewritten.strip().equals(original.strip())) {
            newCode = rewritten;
            outcome = FixOutcome.fixed(issues.size());
        } else if (!heuristic.equals(original)) {
            newCode = heuristic;
            outcome = FixOutcome.fixedViaFallback(SyntaxHeuristics.countRepairable(issues));
        } else if (modelFailure != null) {
            return FixOutcome.error("Model rewrite failed: " + modelFailure);
        } else {
            return FixOutcome.noChange("No applicable change");
        }

        if (Thread.currentThread().isInterrupted()) {
            log.warn("[Fixer] Interrupted → {} left untouched", resource);
            return FixOutcome.error("Interrupted before write");
        }

        try {
            fileSystem.writeFileAtomic(root, resource, newCode);
        } catch (FileSystemException e) {
            log.error("[Fixer] Write failed for {}: {}", resource, e.getMessage());
            return FixOutcome.error("Write failed: " + e.getMessage());
        }
        return outcome;
    }

    /** Model rewrite of the file, or null when the model returned nothing usable. */
    private String requestRewrite(ResourceSet resources, String resource, String code, List<Issue> issues) {
        String response = llmClient.generateWithRole(
                AgentType.FIXER,
                buildFixPrompt(resource, code, issues),
                llmClient.getTemperatureForRole(AgentType.FIXER),
                resources.getModelSelector()
        );

        String candidate = CodeBlockExtractor.codeOrWhole(response);
        if (candidate.isBlank()) {
            log.warn("[Fixer] Empty rewrite for {}", resource);
            return null;
        }
        return candidate.endsWith("\n") ? candidate : candidate + "\n";
    }

    private String buildFixPrompt(String resource, String code, List<Issue> issues) {
        return """
                FILE: %s

                ISSUES TO FIX (JSON):
                %s

                CODE:
                ```python
                %s
                ```

                Rules:
                - Fix the code strictly according to the issues above.
                - Preserve original functionality. Apply minimal and safe changes.
                - NEVER introduce new features or touch other files.

                Return the COMPLETE corrected file in a single ```python code block and nothing else.
                """.formatted(resource, normalizer.toCanonicalJson(issues), code);
    }
}
