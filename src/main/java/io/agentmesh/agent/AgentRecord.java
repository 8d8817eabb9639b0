package io.agentmesh.agent;

public record AgentRecord(AgentConfig config, Agent instance, long registeredAtMs) {
}
