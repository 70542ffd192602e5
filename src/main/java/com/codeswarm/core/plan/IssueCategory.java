package com.codeswarm.core.plan;

import java.util.Locale;

/**
 * Kind of problem an auditor reported.
 *
 * The set is open on the wire: any label the auditor invents that is not
 * listed here maps to UNKNOWN instead of failing the parse.
 */
public enum IssueCategory {
    SYNTAX,
    STYLE,
    DESIGN,
    DOC,
    BUG,
    UNKNOWN;

    public static IssueCategory fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "SYNTAX", "SYNTAX_ERROR"              -> SYNTAX;
            case "STYLE", "CONVENTION", "FORMAT"       -> STYLE;
            case "DESIGN", "REFACTOR"                  -> DESIGN;
            case "DOC", "DOCS", "DOCUMENTATION"        -> DOC;
            case "BUG", "LOGIC", "ERROR"               -> BUG;
            default                                    -> UNKNOWN;
        };
    }
}
