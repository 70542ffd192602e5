package com.codeswarm.core.agent;

public interface Agent {

    String getAgentId();

    AgentType getAgentType();
}
