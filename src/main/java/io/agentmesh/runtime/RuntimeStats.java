package io.agentmesh.runtime;

import io.agentmesh.agent.AgentMetrics;
import io.agentmesh.agent.RegistryStats;
import io.agentmesh.bus.BusStats;

import java.util.List;

public record RuntimeStats(BusStats bus, RegistryStats registry, List<AgentMetrics> agents) {
}
