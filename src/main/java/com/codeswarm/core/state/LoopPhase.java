package com.codeswarm.core.state;

/**
 * Phase graph of one refactoring run.
 *
 * AUDIT → FIX → JUDGE → {AUDIT | TERMINAL}
 *
 * A LoopState's phase is the phase that runs next. TERMINAL is absorbing.
 */
public enum LoopPhase {
    AUDIT,
    FIX,
    JUDGE,
    TERMINAL
}
