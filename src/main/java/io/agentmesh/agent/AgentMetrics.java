package io.agentmesh.agent;

import io.agentmesh.model.AgentStatus;

public record AgentMetrics(
        String agentId,
        AgentStatus status,
        long tickCount,
        long eventsEmitted,
        long eventsProcessed,
        long errorCount,
        String lastError,
        long startedAtMs
) {
    public static AgentMetrics statusOnly(String agentId, AgentStatus status) {
        return new AgentMetrics(agentId, status, 0L, 0L, 0L, 0L, null, 0L);
    }
}
