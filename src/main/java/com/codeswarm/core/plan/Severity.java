package com.codeswarm.core.plan;

import java.util.Locale;

/**
 * Issue severity. Missing or unrecognised labels default to LOW.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) return LOW;
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL", "BLOCKER", "FATAL" -> CRITICAL;
            case "HIGH", "MAJOR", "ERROR"       -> HIGH;
            case "MEDIUM", "MODERATE", "WARNING" -> MEDIUM;
            default                             -> LOW;
        };
    }
}
