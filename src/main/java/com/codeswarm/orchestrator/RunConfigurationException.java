package com.codeswarm.orchestrator;

/**
 * Thrown before the first iteration when a run cannot start: bad iteration
 * budget, missing target directory, or a missing adapter.
 */
public class RunConfigurationException extends RuntimeException {

    public RunConfigurationException(String message) {
        super(message);
    }

    public RunConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
