package com.codeswarm.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes a finished run as {@code codeswarm-<runId>.json} into the report
 * directory. Called by the REST layer after a run; the loop never writes
 * reports itself.
 */
@Component
public class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    private final Path         reportDir;
    private final ObjectMapper objectMapper;

    public RunReportWriter(@Value("${codeswarm.report.dir:./reports}") String reportDir) {
        this.reportDir    = Paths.get(reportDir).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the written file
     * @throws IOException when the directory or file cannot be written
     */
    public Path write(RunResult result) throws IOException {
        Files.createDirectories(reportDir);
        Path file = reportDir.resolve("codeswarm-" + result.getRunId() + ".json");
        objectMapper.writeValue(file.toFile(), result);
        log.info("[Report] Run {} written to {}", result.getRunId(), file);
        return file;
    }
}
