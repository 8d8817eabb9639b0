package io.agentmesh.agent;

import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.AgentTier;

import java.util.Map;

public record RegistryStats(
        int total,
        Map<AgentTier, Integer> byTier,
        Map<AgentStatus, Integer> byStatus,
        Map<String, Long> errorsByAgent
) {
}
