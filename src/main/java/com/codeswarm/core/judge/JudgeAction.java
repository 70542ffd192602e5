package com.codeswarm.core.judge;

import java.util.Locale;

/**
 * Next step the judge recommends to the control loop.
 */
public enum JudgeAction {
    STOP,
    RETURN_TO_AUDIT,
    REQUIRE_HUMAN;

    /**
     * Lenient parse of a model-supplied action label.
     * RETURN_TO_FIXER is the older spelling of RETURN_TO_AUDIT.
     * Unknown labels yield null so callers pick their own default.
     */
    public static JudgeAction fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "STOP"                               -> STOP;
            case "RETURN_TO_AUDIT", "RETURN_TO_FIXER" -> RETURN_TO_AUDIT;
            case "REQUIRE_HUMAN"                      -> REQUIRE_HUMAN;
            default                                   -> null;
        };
    }
}
