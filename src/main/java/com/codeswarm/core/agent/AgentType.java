package com.codeswarm.core.agent;

public enum AgentType {
    AUDITOR,
    FIXER,
    JUDGE
}
