package com.codeswarm.core.filesystem;

/**
 * Raised when a path resolves outside the sandbox root or outside the
 * target directory a worker was handed. Unchecked: it is never recoverable
 * inside a worker and the control loop treats it as fatal.
 */
public class SandboxViolationException extends RuntimeException {

    private final String offendingPath;

    public SandboxViolationException(String offendingPath, String message) {
        super(message);
        this.offendingPath = offendingPath;
    }

    public String getOffendingPath() {
        return offendingPath;
    }
}
