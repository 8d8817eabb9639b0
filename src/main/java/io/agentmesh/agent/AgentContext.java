package io.agentmesh.agent;

import io.agentmesh.bus.EventBus;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators handed to every agent at construction: the bus it talks through
 * and the shared pool its tick timer runs on.
 */
public record AgentContext(EventBus bus, ScheduledExecutorService ticker) {
    public AgentContext {
        if (bus == null) {
            throw new IllegalArgumentException("agent context requires an event bus");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("agent context requires a tick scheduler");
        }
    }
}
