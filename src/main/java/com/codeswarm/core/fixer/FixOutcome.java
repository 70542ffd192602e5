package com.codeswarm.core.fixer;

/**
 * FixOutcome - immutable result of fixing one resource.
 *
 * INVARIANT: modified == true implies status FIXED or FIXED_VIA_FALLBACK.
 */
public class FixOutcome {

    private final boolean   modified;
    private final int       issuesAddressed;
    private final FixStatus status;
    private final String    detail;

    public FixOutcome(boolean modified, int issuesAddressed, FixStatus status, String detail) {
        if (status == null) {
            throw new IllegalArgumentException("FixOutcome status must not be null");
        }
        if (modified && !status.isModifying()) {
            throw new IllegalArgumentException("modified=true is incompatible with status " + status);
        }
        if (issuesAddressed < 0) {
            throw new IllegalArgumentException("issuesAddressed must be non-negative: " + issuesAddressed);
        }
        this.modified        = modified;
        this.issuesAddressed = issuesAddressed;
        this.status          = status;
        this.detail          = detail != null ? detail : "";
    }

    public static FixOutcome fixed(int issuesAddressed) {
        return new FixOutcome(true, issuesAddressed, FixStatus.FIXED, "");
    }

    public static FixOutcome fixedViaFallback(int issuesAddressed) {
        return new FixOutcome(true, issuesAddressed, FixStatus.FIXED_VIA_FALLBACK, "");
    }

    public static FixOutcome noChange(String detail) {
        return new FixOutcome(false, 0, FixStatus.NO_CHANGE, detail);
    }

    public static FixOutcome error(String detail) {
        return new FixOutcome(false, 0, FixStatus.ERROR, detail);
    }

    public boolean   isModified()         { return modified; }
    public int       getIssuesAddressed() { return issuesAddressed; }
    public FixStatus getStatus()          { return status; }
    public String    getDetail()          { return detail; }

    @Override
    public String toString() {
        return String.format("FixOutcome{status=%s, modified=%b, addressed=%d}", status, modified, issuesAddressed);
    }
}
