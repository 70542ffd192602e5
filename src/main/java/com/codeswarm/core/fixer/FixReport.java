package com.codeswarm.core.fixer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable set of FixOutcomes produced by one FIX phase.
 */
public final class FixReport {

    private static final FixReport EMPTY = new FixReport(Map.of());

    private final Map<String, FixOutcome> outcomes;

    private FixReport(Map<String, FixOutcome> outcomes) {
        this.outcomes = outcomes;
    }

    public static FixReport empty() {
        return EMPTY;
    }

    public static FixReport of(Map<String, FixOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) return EMPTY;
        return new FixReport(Collections.unmodifiableMap(new LinkedHashMap<>(outcomes)));
    }

    /** Same failure recorded for every listed resource. */
    public static FixReport failedFor(Set<String> resources, String reason) {
        Map<String, FixOutcome> failed = new LinkedHashMap<>();
        for (String resource : resources) {
            failed.put(resource, FixOutcome.error(reason));
        }
        return of(failed);
    }

    public Map<String, FixOutcome> asMap() {
        return outcomes;
    }

    public FixOutcome outcomeFor(String resource) {
        return outcomes.get(resource);
    }

    public int filesModified() {
        return (int) outcomes.values().stream().filter(FixOutcome::isModified).count();
    }

    public int errorCount() {
        return (int) outcomes.values().stream().filter(o -> o.getStatus() == FixStatus.ERROR).count();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    @Override
    public String toString() {
        return "FixReport{resources=" + outcomes.size()
                + ", modified=" + filesModified()
                + ", errors=" + errorCount() + "}";
    }
}
