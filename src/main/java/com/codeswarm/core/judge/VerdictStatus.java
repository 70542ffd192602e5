package com.codeswarm.core.judge;

/**
 * Judge classification of one validation run.
 */
public enum VerdictStatus {
    PASS,
    FAIL_FIXABLE,
    FAIL_UNCERTAIN,
    ERROR
}
