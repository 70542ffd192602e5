package com.codeswarm.orchestrator;

import com.codeswarm.config.LoopSettings;
import com.codeswarm.core.agent.Auditor;
import com.codeswarm.core.agent.Fixer;
import com.codeswarm.core.agent.Judge;
import com.codeswarm.core.agent.ResourceSet;
import com.codeswarm.core.filesystem.FileSystemManager;
import com.codeswarm.core.filesystem.SandboxViolationException;
import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.judge.Verdict;
import com.codeswarm.core.logging.MdcContext;
import com.codeswarm.core.mediator.ConvergenceDetector;
import com.codeswarm.core.mediator.MediationResult;
import com.codeswarm.core.plan.Plan;
import com.codeswarm.core.state.LoopPhase;
import com.codeswarm.core.state.LoopState;
import com.codeswarm.core.state.LoopStateReducer;
import com.codeswarm.core.state.PhaseResult;
import com.codeswarm.core.state.RunStatistics;
import com.codeswarm.core.state.TerminalState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * RefactorOrchestrator - drives AUDIT → FIX → JUDGE until a terminal state.
 *
 * ARCHITECTURE:
 *   Auditor / Fixer / Judge  → produce Plan, FixReport, Verdict (adapters)
 *   LoopStateReducer         → the only way LoopState changes
 *   ConvergenceDetector      → decides CONTINUE or TERMINATE
 *   RefactorOrchestrator     → executes transitions, maps adapter failures
 *
 * Adapter failure mapping:
 *   AUDIT throws / times out  → ERROR
 *   FIX throws / times out    → ERROR outcome for every planned resource, loop goes on to JUDGE
 *   JUDGE throws / times out  → Verdict.adapterFailure → NEEDS_HUMAN
 *   SandboxViolationException → ERROR immediately, whatever the phase
 *   caller thread interrupted → CANCELLED, whatever the phase
 *
 * Cancellation is polled between phases. Interrupting the thread that calls
 * run() cancels as well, including while an adapter call is in flight.
 */
@Component
public class RefactorOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefactorOrchestrator.class);

    private final Auditor             auditor;
    private final Fixer               fixer;
    private final Judge               judge;
    private final ConvergenceDetector detector;
    private final FileSystemManager   fileSystem;
    private final LoopSettings        settings;
    private final Clock               clock;

    public RefactorOrchestrator(
            Auditor             auditor,
            Fixer               fixer,
            Judge               judge,
            ConvergenceDetector detector,
            FileSystemManager   fileSystem,
            LoopSettings        settings,
            Clock               clock
    ) {
        this.auditor    = auditor;
        this.fixer      = fixer;
        this.judge      = judge;
        this.detector   = detector;
        this.fileSystem = fileSystem;
        this.settings   = settings;
        this.clock      = clock;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public RunResult run(RunRequest request, CancellationToken token) {
        int         maxIterations = resolveMaxIterations(request);
        Path        target        = resolveTarget(request);
        if (auditor == null || fixer == null || judge == null) {
            throw new RunConfigurationException("Auditor, Fixer and Judge must all be configured");
        }

        String      runId     = token.getRunId();
        ResourceSet resources = new ResourceSet(target, request.getModel());
        LoopState   state     = LoopState.initial(maxIterations, RunStatistics.startingAt(clock.instant()));

        MdcContext.setRun(runId);
        log.info("========== REFACTOR LOOP START ==========");
        log.info("[Orchestrator] Run {}: target={}, maxIterations={}, model={}",
                runId, target, maxIterations, resources.getModelSelector() != null ? resources.getModelSelector() : "default");

        try (PhaseInvoker invoker = new PhaseInvoker(runId, settings.getPhaseTimeout())) {
            state = runLoop(state, resources, invoker, token);
        } finally {
            MdcContext.clear();
        }

        RunResult result = RunResult.fromTerminal(runId, state, state.getStatistics().durationUntil(clock.instant()));
        log.info("[Orchestrator] Run {} finished: {} - {}", runId, result.getTerminalState(), result.getMessage());
        log.info("========== REFACTOR LOOP END ==========");
        logBenchmark(result);
        return result;
    }

    // =========================================================================
    // CONTROL LOOP
    // =========================================================================

    private LoopState runLoop(LoopState state, ResourceSet resources, PhaseInvoker invoker, CancellationToken token) {
        while (true) {

            if (isCancelled(token)) {
                return cancelled(state);
            }

            state = LoopStateReducer.reduce(state, PhaseResult.iterationStarted());
            log.info("========== ITERATION {}/{} ==========", state.getIteration(), state.getMaxIterations());

            // -----------------------------------------------------------------
            // AUDIT
            // -----------------------------------------------------------------

            MdcContext.setPhase(state.getIteration(), LoopPhase.AUDIT.name());
            long auditStart = clock.millis();
            Plan plan;
            try {
                plan = invoker.invoke(LoopPhase.AUDIT, () -> auditor.audit(resources));
            } catch (RunInterruptedException e) {
                return cancelled(state);
            } catch (SandboxViolationException e) {
                return sandboxViolation(state, e);
            } catch (AdapterInvocationException e) {
                log.error("[Orchestrator] {}", e.getMessage());
                return terminate(state, TerminalState.ERROR, "Audit failed: " + e.getMessage());
            }
            if (plan == null) {
                return terminate(state, TerminalState.ERROR, "Audit returned no plan");
            }

            state = LoopStateReducer.reduce(state, PhaseResult.audited(plan));
            log.info("[Orchestrator] AUDIT done in {} ms: {} issue(s) in {} resource(s)",
                    clock.millis() - auditStart, plan.issueCount(), plan.resourceCount());

            MediationResult afterAudit = detector.afterAudit(state);
            if (afterAudit.isTerminal()) {
                return terminate(state, afterAudit.getTerminalState(), afterAudit.getReasoning());
            }

            if (isCancelled(token)) {
                return cancelled(state);
            }

            // -----------------------------------------------------------------
            // FIX
            // -----------------------------------------------------------------

            MdcContext.setPhase(state.getIteration(), LoopPhase.FIX.name());
            long fixStart = clock.millis();
            Plan planned  = state.getPlan();
            FixReport report;
            try {
                report = invoker.invoke(LoopPhase.FIX, () -> fixer.fix(resources, planned));
            } catch (RunInterruptedException e) {
                return cancelled(state);
            } catch (SandboxViolationException e) {
                return sandboxViolation(state, e);
            } catch (AdapterInvocationException e) {
                log.error("[Orchestrator] {} → marking {} resource(s) as ERROR", e.getMessage(), planned.resourceCount());
                report = FixReport.failedFor(planned.resources(), e.getMessage());
            }
            if (report == null) {
                report = FixReport.failedFor(planned.resources(), "Fixer returned no report");
            }

            state = LoopStateReducer.reduce(state, PhaseResult.fixed(report));
            log.info("[Orchestrator] FIX done in {} ms: {} resource(s) modified, {} error(s)",
                    clock.millis() - fixStart, report.filesModified(), report.errorCount());

            if (isCancelled(token)) {
                return cancelled(state);
            }

            // -----------------------------------------------------------------
            // JUDGE
            // -----------------------------------------------------------------

            MdcContext.setPhase(state.getIteration(), LoopPhase.JUDGE.name());
            long judgeStart = clock.millis();
            Verdict verdict;
            try {
                verdict = invoker.invoke(LoopPhase.JUDGE, () -> judge.judge(resources));
            } catch (RunInterruptedException e) {
                return cancelled(state);
            } catch (SandboxViolationException e) {
                return sandboxViolation(state, e);
            } catch (AdapterInvocationException e) {
                log.error("[Orchestrator] {} → escalating to human", e.getMessage());
                verdict = Verdict.adapterFailure(e.getMessage());
            }
            if (verdict == null) {
                verdict = Verdict.adapterFailure("Judge returned no verdict");
            }

            state = LoopStateReducer.reduce(state, PhaseResult.judged(verdict));
            log.info("[Orchestrator] JUDGE done in {} ms: {} ({} passed, {} failed) → {}",
                    clock.millis() - judgeStart, verdict.getStatus(), verdict.getPassed(), verdict.getFailed(),
                    verdict.getAction());

            MediationResult afterJudge = detector.afterJudge(state);
            if (afterJudge.isTerminal()) {
                return terminate(state, afterJudge.getTerminalState(), afterJudge.getReasoning());
            }
            log.info("[Orchestrator] {}", afterJudge.getReasoning());
        }
    }

    // =========================================================================
    // VALIDATION
    // =========================================================================

    private int resolveMaxIterations(RunRequest request) {
        int max = request.getMaxIterations() != null
                ? request.getMaxIterations()
                : settings.getDefaultMaxIterations();
        if (max <= 0) {
            throw new RunConfigurationException("maxIterations must be positive, got " + max);
        }
        return max;
    }

    private Path resolveTarget(RunRequest request) {
        Path target;
        try {
            target = fileSystem.resolveTarget(request.getTargetDir());
        } catch (SandboxViolationException | IllegalArgumentException e) {
            throw new RunConfigurationException("Invalid target directory: " + e.getMessage(), e);
        }
        if (!Files.isDirectory(target)) {
            throw new RunConfigurationException("Target directory does not exist: " + target);
        }
        return target;
    }

    // =========================================================================
    // TERMINATION
    // =========================================================================

    private LoopState terminate(LoopState state, TerminalState terminal, String message) {
        return LoopStateReducer.reduce(state, PhaseResult.terminated(terminal, message));
    }

    private static boolean isCancelled(CancellationToken token) {
        return token.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private LoopState cancelled(LoopState state) {
        log.warn("[Orchestrator] Cancelled after iteration {} ({})", state.getIteration(), state.getPhase());
        return terminate(state, TerminalState.CANCELLED,
                "Cancelled at iteration " + state.getIteration() + " before " + state.getPhase());
    }

    private LoopState sandboxViolation(LoopState state, SandboxViolationException e) {
        log.error("[Orchestrator] Sandbox violation: {}", e.getMessage());
        return terminate(state, TerminalState.ERROR, "Sandbox violation: " + e.getMessage());
    }

    private void logBenchmark(RunResult result) {
        String json = String.format(
                "{\"run_id\":\"%s\",\"final_state\":\"%s\",\"iterations\":%d,\"max_iterations\":%d," +
                "\"issues_found\":%d,\"files_modified\":%d,\"last_verdict\":\"%s\",\"wall_time_ms\":%d}",
                result.getRunId(), result.getTerminalState(),
                result.getIterations(), result.getMaxIterations(),
                result.getIssuesFound(), result.getFilesModified(),
                result.getLastVerdictStatus() != null ? result.getLastVerdictStatus() : "NONE",
                result.getDurationMs()
        );
        log.info("[Benchmark] {}", json);
    }
}
