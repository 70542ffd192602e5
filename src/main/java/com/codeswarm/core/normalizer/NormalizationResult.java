package com.codeswarm.core.normalizer;

import com.codeswarm.core.plan.Issue;

import java.util.List;

/**
 * Outcome of normalizing one worker response, tagged by how the issues
 * were recovered.
 *
 *   STRUCTURED - a JSON object with an "issues" array was parsed
 *   FALLBACK   - no usable JSON; list-marker lines became free-text issues
 *   EMPTY      - nothing recoverable; reported as a partial result, not an error
 */
public final class NormalizationResult {

    public enum Kind { STRUCTURED, FALLBACK, EMPTY }

    private final Kind        kind;
    private final List<Issue> issues;
    private final boolean     reformatted;
    private final String      note;

    private NormalizationResult(Kind kind, List<Issue> issues, boolean reformatted, String note) {
        this.kind        = kind;
        this.issues      = List.copyOf(issues);
        this.reformatted = reformatted;
        this.note        = note != null ? note : "";
    }

    public static NormalizationResult structured(List<Issue> issues) {
        return new NormalizationResult(Kind.STRUCTURED, issues, false, "");
    }

    public static NormalizationResult fallback(List<Issue> issues) {
        return new NormalizationResult(Kind.FALLBACK, issues, false, "recovered from list items");
    }

    public static NormalizationResult empty(String note) {
        return new NormalizationResult(Kind.EMPTY, List.of(), false, note);
    }

    NormalizationResult markReformatted() {
        return new NormalizationResult(kind, issues, true, "recovered after reformat request");
    }

    public Kind        getKind()      { return kind; }
    public List<Issue> getIssues()    { return issues; }
    public String      getNote()      { return note; }

    /** True when the issues came from the second, reformatted response. */
    public boolean wasReformatted() { return reformatted; }

    public boolean isStructured() { return kind == Kind.STRUCTURED; }

    public boolean isPartial() { return kind == Kind.EMPTY; }

    @Override
    public String toString() {
        return "NormalizationResult{kind=" + kind + ", issues=" + issues.size()
                + (reformatted ? ", reformatted" : "") + "}";
    }
}
