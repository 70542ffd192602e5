package com.codeswarm.core.fixer;

/**
 * Per-resource result of a FIX phase.
 *
 *   FIXED              - the model rewrite changed the resource
 *   FIXED_VIA_FALLBACK - only the local heuristic repairs changed it
 *   NO_CHANGE          - nothing was written
 *   ERROR              - the fixer could not process the resource
 */
public enum FixStatus {
    FIXED,
    FIXED_VIA_FALLBACK,
    NO_CHANGE,
    ERROR;

    public boolean isModifying() {
        return this == FIXED || this == FIXED_VIA_FALLBACK;
    }
}
