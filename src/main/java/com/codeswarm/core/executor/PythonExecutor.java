package com.codeswarm.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * PythonExecutor - runs the Python tooling the workers rely on.
 *
 * Every command runs with the target directory as its working directory,
 * so pytest discovery and relative file names resolve against the project
 * being refactored. stderr is merged into stdout so pytest's output keeps
 * its chronological order for PytestOutputAnalyzer.
 */
@Component
public class PythonExecutor {

    private static final Logger log = LoggerFactory.getLogger(PythonExecutor.class);

    private static final long DESTROY_GRACE_SECONDS = 5;

    private final String pythonInterpreter;
    private final int    toolTimeoutSeconds;
    private final int    pytestTimeoutSeconds;

    public PythonExecutor(
            @Value("${codeswarm.python.interpreter:python3}")        String pythonInterpreter,
            @Value("${codeswarm.python.tool-timeout-seconds:30}")    int    toolTimeoutSeconds,
            @Value("${codeswarm.python.pytest-timeout-seconds:120}") int    pytestTimeoutSeconds
    ) {
        this.pythonInterpreter    = pythonInterpreter;
        this.toolTimeoutSeconds   = toolTimeoutSeconds;
        this.pytestTimeoutSeconds = pytestTimeoutSeconds;

        log.info("[PythonExecutor] Python: {} (tool timeout {}s, pytest timeout {}s)",
                getPythonExecutable(), toolTimeoutSeconds, pytestTimeoutSeconds);
    }

    private String getPythonExecutable() {
        if (pythonInterpreter != null && !pythonInterpreter.isBlank()) {
            return pythonInterpreter;
        }
        return "python3";
    }

    public PythonExecutionResult runPyCompile(Path workingDirectory, String relativeFile) {
        List<String> command = new ArrayList<>();
        command.add(getPythonExecutable());
        command.add("-m");
        command.add("py_compile");
        command.add(relativeFile);
        return executeCommand(command, workingDirectory, toolTimeoutSeconds);
    }

    public PythonExecutionResult runPylint(Path workingDirectory, String relativeFile) {
        List<String> command = new ArrayList<>();
        command.add(getPythonExecutable());
        command.add("-m");
        command.add("pylint");
        command.add(relativeFile);
        command.add("--output-format=json");
        command.add("--disable=C0114,C0116");
        return executeCommand(command, workingDirectory, toolTimeoutSeconds);
    }

    public PythonExecutionResult runPytest(Path workingDirectory) {
        List<String> command = new ArrayList<>();
        command.add(getPythonExecutable());
        command.add("-m");
        command.add("pytest");
        command.add(".");
        command.add("-q");
        command.add("--tb=short");
        command.add("--disable-warnings");
        command.add("-p");
        command.add("no:cacheprovider");
        return executeCommand(command, workingDirectory, pytestTimeoutSeconds);
    }

    protected PythonExecutionResult executeCommand(List<String> command, Path workingDirectory, int timeoutSeconds) {

        long startTime = System.currentTimeMillis();
        log.info("[PythonExecutor] Executing in {}: {}", workingDirectory, String.join(" ", command));

        Process process = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDirectory.toFile());
            builder.redirectErrorStream(true);

            process = builder.start();

            StringBuffer output = new StringBuffer();
            Process started = process;

            Thread outThread = new Thread(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        output.append(line).append("\n");
                    }
                } catch (Exception e) {
                    log.warn("[PythonExecutor] Error reading output: {}", e.getMessage());
                }
            }, "python-output-reader");
            outThread.setDaemon(true);
            outThread.start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                log.warn("[PythonExecutor] Process timed out after {} seconds", timeoutSeconds);
                return PythonExecutionResult.timedOut(
                        output.toString(), timeoutSeconds, System.currentTimeMillis() - startTime);
            }

            outThread.join(1000);

            int exitCode = process.exitValue();
            log.info("[PythonExecutor] Exit code: {}, Output length: {} chars", exitCode, output.length());

            return PythonExecutionResult.completed(exitCode, output.toString(), System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            log.warn("[PythonExecutor] Interrupted while waiting for {}", command.get(0));
            return PythonExecutionResult.error("Interrupted while waiting for process");

        } catch (Exception e) {
            log.error("[PythonExecutor] Execution failed: {}", e.getMessage());
            return PythonExecutionResult.error("Python execution failed: " + e.getMessage());

        } finally {
            destroy(process);
        }
    }

    /**
     * Kills the child and its descendants if still alive. Never throws and
     * leaves the caller's interrupt status as it found it.
     */
    private static void destroy(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();

        boolean interrupted = Thread.interrupted();
        try {
            if (!process.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[PythonExecutor] Process {} still alive after destroy", process.pid());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
