package com.codeswarm.core.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plan - ordered mapping from resource identifier to the issues found in it.
 *
 * INVARIANTS:
 *   - Resource order and issue order are detection order.
 *   - A resource present in the Plan has at least one Issue; resources with
 *     nothing to report are dropped on construction.
 *   - An empty Plan means "no issues found".
 *
 * Construct via {@link #builder()} or {@link #empty()}.
 */
public final class Plan {

    private static final Plan EMPTY = new Plan(Map.of());

    private final Map<String, List<Issue>> issuesByResource;

    private Plan(Map<String, List<Issue>> issuesByResource) {
        this.issuesByResource = issuesByResource;
    }

    public static Plan empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return issuesByResource.isEmpty();
    }

    public Set<String> resources() {
        return issuesByResource.keySet();
    }

    public List<Issue> issuesFor(String resource) {
        return issuesByResource.getOrDefault(resource, List.of());
    }

    public Map<String, List<Issue>> asMap() {
        return issuesByResource;
    }

    public int resourceCount() {
        return issuesByResource.size();
    }

    public int issueCount() {
        return issuesByResource.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plan other)) return false;
        return issuesByResource.equals(other.issuesByResource);
    }

    @Override
    public int hashCode() {
        return issuesByResource.hashCode();
    }

    @Override
    public String toString() {
        return "Plan{resources=" + resourceCount() + ", issues=" + issueCount() + "}";
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {

        private final Map<String, List<Issue>> pending = new LinkedHashMap<>();

        private Builder() {}

        /** Appends issues for a resource; an empty list is ignored. */
        public Builder add(String resource, List<Issue> issues) {
            if (issues == null || issues.isEmpty()) return this;
            for (Issue issue : issues) {
                if (!issue.getResource().equals(resource)) {
                    throw new IllegalArgumentException(
                            "Issue for '" + issue.getResource() + "' filed under '" + resource + "'");
                }
            }
            pending.computeIfAbsent(resource, r -> new ArrayList<>()).addAll(issues);
            return this;
        }

        public Builder add(Issue issue) {
            return add(issue.getResource(), List.of(issue));
        }

        public Plan build() {
            if (pending.isEmpty()) return EMPTY;
            Map<String, List<Issue>> frozen = new LinkedHashMap<>();
            pending.forEach((resource, issues) -> frozen.put(resource, List.copyOf(issues)));
            return new Plan(Collections.unmodifiableMap(frozen));
        }
    }
}
