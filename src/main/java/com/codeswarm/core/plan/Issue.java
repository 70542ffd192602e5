package com.codeswarm.core.plan;

import java.util.Objects;

/**
 * Issue - one detected problem inside a single resource.
 *
 * Immutable value object. Every Issue belongs to exactly one resource
 * identifier (a path relative to the audited target). A line of 0 means
 * the issue concerns the whole file.
 */
public class Issue {

    private final String        resource;
    private final int           line;
    private final IssueCategory category;
    private final Severity      severity;
    private final String        description;
    private final String        fixInstruction;

    public Issue(
            String        resource,
            int           line,
            IssueCategory category,
            Severity      severity,
            String        description,
            String        fixInstruction
    ) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Issue resource must not be blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Issue description must not be blank");
        }
        this.resource       = resource;
        this.line           = Math.max(0, line);
        this.category       = category != null ? category : IssueCategory.UNKNOWN;
        this.severity       = severity != null ? severity : Severity.LOW;
        this.description    = description.trim();
        this.fixInstruction = fixInstruction != null && !fixInstruction.isBlank()
                ? fixInstruction.trim()
                : null;
    }

    /** Free-text issue recovered from an unstructured response. */
    public static Issue freeText(String resource, String description) {
        return new Issue(resource, 0, IssueCategory.UNKNOWN, Severity.LOW, description, null);
    }

    public String        getResource()       { return resource; }
    public int           getLine()           { return line; }
    public IssueCategory getCategory()       { return category; }
    public Severity      getSeverity()       { return severity; }
    public String        getDescription()    { return description; }
    public String        getFixInstruction() { return fixInstruction; }

    public boolean isWholeFile() { return line == 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Issue other)) return false;
        return line == other.line
                && resource.equals(other.resource)
                && category == other.category
                && severity == other.severity
                && description.equals(other.description)
                && Objects.equals(fixInstruction, other.fixInstruction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resource, line, category, severity, description, fixInstruction);
    }

    @Override
    public String toString() {
        String preview = description.length() > 80 ? description.substring(0, 80) + "..." : description;
        return String.format("Issue{%s:%d, %s/%s, '%s'}", resource, line, category, severity, preview);
    }
}
