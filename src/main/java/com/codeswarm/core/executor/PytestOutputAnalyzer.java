package com.codeswarm.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PytestOutputAnalyzer - turns raw pytest output into TestResults.
 *
 * Counts come from the final summary line ("2 failed, 3 passed, 1 error in 0.12s").
 * When several summary-like fragments appear, the last one wins.
 *
 * Failing artifact, in order of precedence:
 *   1. Deepest project stack frame (File "/abs/path/foo.py", line N),
 *      source files preferred over test files.
 *   2. ERROR collecting path.py
 *   3. FAILED path.py::test_name
 *
 * Exit code 5 is pytest's "no tests collected" and is reported as such,
 * not as a failure.
 */
@Component
public class PytestOutputAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PytestOutputAnalyzer.class);

    public static final int EXIT_NO_TESTS_COLLECTED = 5;

    private static final Pattern PASSED_COUNT = Pattern.compile("\\b(\\d+) passed\\b");
    private static final Pattern FAILED_COUNT = Pattern.compile("\\b(\\d+) failed\\b");
    private static final Pattern ERROR_COUNT  = Pattern.compile("\\b(\\d+) errors?\\b");

    // [^\"\n\r]+ keeps the path capture on a single line
    private static final Pattern FILE_LINE_STANDARD =
        Pattern.compile("File \"([^\"\n\r]+\\.py)\",\\s*line (\\d+)");

    private static final Pattern ERROR_COLLECTING_PATTERN =
        Pattern.compile("ERROR collecting[ \t]+(\\S+\\.py)", Pattern.MULTILINE);

    private static final Pattern FAILED_TEST_PATTERN =
        Pattern.compile("^[ \t]*FAILED[ \t]+(\\S+?\\.py)::", Pattern.MULTILINE);

    // pytest prefixes the interesting exception lines with "E   "
    private static final Pattern ERROR_LINE =
        Pattern.compile("^E[ \t]+(\\S.*)$", Pattern.MULTILINE);

    private static final Pattern SYNTAX_ERROR_PATTERN    = Pattern.compile("SyntaxError|IndentationError");
    private static final Pattern IMPORT_ERROR_PATTERN    = Pattern.compile("ImportError|ModuleNotFoundError");
    private static final Pattern NAME_ERROR_PATTERN      = Pattern.compile("\\bNameError\\b");
    private static final Pattern ATTRIBUTE_ERROR_PATTERN = Pattern.compile("\\bAttributeError\\b");
    private static final Pattern TYPE_ERROR_PATTERN      = Pattern.compile("\\bTypeError\\b");
    private static final Pattern ASSERTION_PATTERN       = Pattern.compile("AssertionError|^E[ \t]+assert ", Pattern.MULTILINE);

    private static final int MAX_SNIPPET_LENGTH = 300;

    public TestResults analyze(String output, int exitCode) {

        String text = output != null ? output : "";

        if (exitCode == EXIT_NO_TESTS_COLLECTED) {
            log.info("[Analyzer] pytest collected no tests");
            return TestResults.noTests();
        }

        int passed = lastCount(PASSED_COUNT, text);
        int failed = lastCount(FAILED_COUNT, text) + lastCount(ERROR_COUNT, text);

        if (exitCode == 0 && failed == 0) {
            log.info("[Analyzer] All {} test(s) passed", passed);
            return TestResults.allPassed(passed);
        }

        if (failed == 0) {
            // Non-zero exit without a parsable failure count: interrupted or internal error
            log.warn("[Analyzer] pytest exit code {} with no failure count, assuming 1 failure", exitCode);
            failed = 1;
        }

        TestFailureType type     = classify(text);
        String          artifact = extractFailingArtifact(text);
        String          snippet  = extractErrorSnippet(text);

        log.info("[Analyzer] {} passed, {} failed, type={}, artifact={}", passed, failed, type, artifact);
        return new TestResults(passed, failed, type, snippet, artifact, false);
    }

    // =========================================================================
    // Classification
    // =========================================================================

    TestFailureType classify(String output) {
        if (SYNTAX_ERROR_PATTERN.matcher(output).find())    return TestFailureType.SYNTAX_ERROR;
        if (IMPORT_ERROR_PATTERN.matcher(output).find())    return TestFailureType.IMPORT_ERROR;
        if (NAME_ERROR_PATTERN.matcher(output).find())      return TestFailureType.NAME_ERROR;
        if (ATTRIBUTE_ERROR_PATTERN.matcher(output).find()) return TestFailureType.ATTRIBUTE_ERROR;
        if (TYPE_ERROR_PATTERN.matcher(output).find())      return TestFailureType.TYPE_ERROR;
        if (ASSERTION_PATTERN.matcher(output).find())       return TestFailureType.ASSERTION_ERROR;
        if (output.contains("ERROR collecting"))            return TestFailureType.COLLECTION_ERROR;
        return TestFailureType.UNKNOWN;
    }

    private static int lastCount(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int value = 0;
        while (m.find()) {
            value = Integer.parseInt(m.group(1));
        }
        return value;
    }

    private static String extractErrorSnippet(String output) {
        Matcher m = ERROR_LINE.matcher(output);
        if (m.find()) {
            String line = m.group(1).trim();
            return line.length() > MAX_SNIPPET_LENGTH ? line.substring(0, MAX_SNIPPET_LENGTH) : line;
        }
        return null;
    }

    // =========================================================================
    // Failing artifact
    // =========================================================================

    String extractFailingArtifact(String output) {
        String frame = extractBestFrame(output);
        if (frame != null) return frame;

        Matcher collecting = ERROR_COLLECTING_PATTERN.matcher(output);
        if (collecting.find()) return collecting.group(1).trim();

        Matcher failedTest = FAILED_TEST_PATTERN.matcher(output);
        if (failedTest.find()) return failedTest.group(1);

        return null;
    }

    /**
     * Last project frame in the trace. Source frames win over test frames.
     */
    private String extractBestFrame(String output) {
        String lastSource = null;
        String lastTest   = null;

        Matcher m = FILE_LINE_STANDARD.matcher(output);
        while (m.find()) {
            String path = m.group(1).replace("\\", "/").trim();
            if (isNonProjectFrame(path)) continue;

            String name = path.substring(path.lastIndexOf('/') + 1);
            if (isTestFile(path, name)) lastTest   = name;
            else                        lastSource = name;
        }
        return lastSource != null ? lastSource : lastTest;
    }

    private boolean isNonProjectFrame(String path) {
        return path.contains("/venv/")         ||
               path.contains("site-packages")  ||
               path.contains("<frozen")        ||
               path.contains("/importlib/")    ||
               path.contains("/_pytest/");
    }

    private boolean isTestFile(String path, String name) {
        return path.contains("/tests/") || name.startsWith("test_") || name.endsWith("_test.py");
    }
}
