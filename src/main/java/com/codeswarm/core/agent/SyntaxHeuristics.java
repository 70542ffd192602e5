package com.codeswarm.core.agent;

import com.codeswarm.core.plan.Issue;
import com.codeswarm.core.plan.IssueCategory;
import com.codeswarm.core.plan.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level checks and repairs for the two Python slips the compiler
 * reports least helpfully: a block statement without its colon, and a
 * def/class header whose parameter list is never closed.
 *
 * Detection and repair share the description prefixes, so the fixer only
 * repairs what the auditor reported.
 */
final class SyntaxHeuristics {

    static final String MISSING_COLON = "Missing colon at end of statement";
    static final String MISSING_PAREN = "Missing closing parenthesis";

    private static final Pattern BLOCK_WITH_HEADER =
            Pattern.compile("^(?:async\\s+)?(?:def|class|if|elif|for|while|with|except)\\b.*");

    private static final Pattern BARE_BLOCK =
            Pattern.compile("^(?:else|try|finally)\\s*$");

    private SyntaxHeuristics() {
    }

    // =========================================================================
    // Detection
    // =========================================================================

    static List<Issue> detect(String resource, String code) {
        List<Issue> issues = new ArrayList<>();
        String[] lines = code.split("\n", -1);
        boolean  inDocstring = false;

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;

            // Skip lines that open, close or sit inside a triple-quoted string
            int quotes = countTripleQuotes(lines[i]);
            if (inDocstring || quotes > 0) {
                if (quotes % 2 == 1) inDocstring = !inDocstring;
                continue;
            }

            String stripped = stripComment(lines[i]).strip();
            if (stripped.isEmpty()) continue;

            boolean header = stripped.startsWith("def ") || stripped.startsWith("class ")
                    || stripped.startsWith("async def ");
            LineScan scan = LineScan.of(stripped);

            if (header && scan.depth > 0 && stripped.endsWith(":")) {
                issues.add(new Issue(resource, lineNo, IssueCategory.SYNTAX, Severity.CRITICAL,
                        MISSING_PAREN + " on line " + lineNo,
                        "Add missing ')' on line " + lineNo));
                continue;
            }

            boolean block = BLOCK_WITH_HEADER.matcher(stripped).matches() || BARE_BLOCK.matcher(stripped).matches();
            if (block && scan.depth == 0 && !scan.colonAtTopLevel && !endsWithContinuation(stripped)) {
                issues.add(new Issue(resource, lineNo, IssueCategory.SYNTAX, Severity.CRITICAL,
                        MISSING_COLON + " on line " + lineNo,
                        "Add ':' at end of line " + lineNo));
            }
        }
        return issues;
    }

    // =========================================================================
    // Repair
    // =========================================================================

    /** Apply the repairs matching the given SYNTAX issues. Returns the code unchanged when none apply. */
    static String repair(String code, List<Issue> issues) {
        String[] lines   = code.split("\n", -1);
        boolean  changed = false;

        for (Issue issue : issues) {
            if (issue.getCategory() != IssueCategory.SYNTAX || issue.getLine() < 1 || issue.getLine() > lines.length) {
                continue;
            }
            int    idx  = issue.getLine() - 1;
            String line = lines[idx];
            String body = line.stripTrailing();

            if (issue.getDescription().startsWith(MISSING_COLON) && !body.endsWith(":")) {
                lines[idx] = body + ":" + line.substring(body.length());
                changed = true;

            } else if (issue.getDescription().startsWith(MISSING_PAREN) && LineScan.of(body.strip()).depth > 0) {
                lines[idx] = body.endsWith(":")
                        ? body.substring(0, body.length() - 1) + "):" + line.substring(body.length())
                        : body + ")" + line.substring(body.length());
                changed = true;
            }
        }
        return changed ? String.join("\n", lines) : code;
    }

    static int countRepairable(List<Issue> issues) {
        int n = 0;
        for (Issue issue : issues) {
            if (issue.getCategory() == IssueCategory.SYNTAX
                    && (issue.getDescription().startsWith(MISSING_COLON)
                        || issue.getDescription().startsWith(MISSING_PAREN))) {
                n++;
            }
        }
        return n;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static int countTripleQuotes(String line) {
        int count = 0;
        for (String marker : new String[] {"\"\"\"", "'''"}) {
            int from = 0;
            int idx;
            while ((idx = line.indexOf(marker, from)) >= 0) {
                count++;
                from = idx + 3;
            }
        }
        return count;
    }

    private static boolean endsWithContinuation(String stripped) {
        return stripped.endsWith("\\") || stripped.endsWith(",");
    }

    /** Drop a trailing '#' comment that is not inside a string literal. */
    private static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    /** Bracket depth at end of line, and whether a ':' appears outside brackets and strings. */
    private static final class LineScan {
        final int     depth;
        final boolean colonAtTopLevel;

        private LineScan(int depth, boolean colonAtTopLevel) {
            this.depth           = depth;
            this.colonAtTopLevel = colonAtTopLevel;
        }

        static LineScan of(String text) {
            int     depth = 0;
            boolean colon = false;
            char    quote = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (quote != 0) {
                    if (c == '\\') i++;
                    else if (c == quote) quote = 0;
                    continue;
                }
                switch (c) {
                    case '"', '\'' -> quote = c;
                    case '(', '[', '{' -> depth++;
                    case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                    case ':' -> { if (depth == 0) colon = true; }
                    default -> { }
                }
            }
            return new LineScan(depth, colon);
        }
    }
}
