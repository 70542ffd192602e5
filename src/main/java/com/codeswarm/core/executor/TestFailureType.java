package com.codeswarm.core.executor;

/**
 * Classification of a failing pytest run.
 *
 * The judge uses it when no model classification is available:
 * failures with an obvious code-side cause go back to the auditor,
 * anything else is escalated to a human.
 */
public enum TestFailureType {

    /** assert result == 5 (but got 3) */
    ASSERTION_ERROR(true),

    /** Invalid indentation, missing colon, unclosed bracket */
    SYNTAX_ERROR(true),

    /** ModuleNotFoundError, ImportError */
    IMPORT_ERROR(true),

    /** Undefined variable or function */
    NAME_ERROR(true),

    /** 'list' object has no attribute 'append_all' */
    ATTRIBUTE_ERROR(true),

    /** unsupported operand type(s) for +: 'int' and 'str' */
    TYPE_ERROR(true),

    /** Pytest could not collect the test modules */
    COLLECTION_ERROR(false),

    UNKNOWN(false),

    /** Tests passed */
    NONE(false);

    private final boolean fixable;

    TestFailureType(boolean fixable) {
        this.fixable = fixable;
    }

    /** Whether a failure of this kind is plausibly repairable by another audit/fix pass. */
    public boolean isFixable() {
        return fixable;
    }
}
