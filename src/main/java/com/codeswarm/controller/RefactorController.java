package com.codeswarm.controller;

import com.codeswarm.core.filesystem.SandboxViolationException;
import com.codeswarm.orchestrator.ActiveRunRegistry;
import com.codeswarm.orchestrator.CancellationToken;
import com.codeswarm.orchestrator.RefactorOrchestrator;
import com.codeswarm.orchestrator.RunConfigurationException;
import com.codeswarm.orchestrator.RunReportWriter;
import com.codeswarm.orchestrator.RunRequest;
import com.codeswarm.orchestrator.RunResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/refactor")
public class RefactorController {

    private static final Logger log = LoggerFactory.getLogger(RefactorController.class);

    private final RefactorOrchestrator orchestrator;
    private final ActiveRunRegistry    registry;
    private final RunReportWriter      reportWriter;
    private final boolean              writeReports;

    public RefactorController(
            RefactorOrchestrator orchestrator,
            ActiveRunRegistry    registry,
            RunReportWriter      reportWriter,
            @Value("${codeswarm.report.enabled:true}") boolean writeReports
    ) {
        this.orchestrator = orchestrator;
        this.registry     = registry;
        this.reportWriter = reportWriter;
        this.writeReports = writeReports;
    }

    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody Map<String, Object> request) {

        Object target = request.get("targetDir");
        if (target == null || target.toString().trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "targetDir is required"));
        }

        Integer maxIterations;
        try {
            maxIterations = parseMaxIterations(request.get("maxIterations"));
        } catch (NumberFormatException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "maxIterations must be an integer"));
        }

        Object model = request.get("model");
        RunRequest runRequest = new RunRequest(target.toString().trim(), maxIterations,
                model != null ? model.toString() : null);

        CancellationToken token = registry.open();
        RunResult result;
        try {
            result = orchestrator.run(runRequest, token);
        } catch (RunConfigurationException | SandboxViolationException e) {
            log.warn("[Controller] Rejected {}: {}", runRequest, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } finally {
            registry.close(token);
        }

        if (writeReports) {
            try {
                reportWriter.write(result);
            } catch (IOException e) {
                log.error("[Controller] Report for run {} not written: {}", result.getRunId(), e.getMessage());
            }
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@RequestParam(value = "runId", required = false) String runId) {
        if (runId == null || runId.isBlank()) {
            return ResponseEntity.ok(Map.of("cancelled", registry.cancelAll()));
        }
        if (!registry.cancel(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("cancelled", 1));
    }

    private static Integer parseMaxIterations(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        String text = value.toString().trim();
        return text.isEmpty() ? null : Integer.valueOf(text);
    }
}
