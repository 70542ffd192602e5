package com.codeswarm.core.mediator;

/**
 * MediationDecision - what the control loop does after a detector check.
 *
 *   CONTINUE  - proceed: to FIX after an audit, to the next AUDIT after a judge.
 *   TERMINATE - end the run with the accompanying TerminalState.
 */
public enum MediationDecision {
    CONTINUE,
    TERMINATE
}
