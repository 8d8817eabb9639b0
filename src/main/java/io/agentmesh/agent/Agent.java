package io.agentmesh.agent;

import io.agentmesh.model.AgentStatus;

/**
 * Unit of periodic and event-reactive behavior managed by {@link AgentRegistry}.
 * {@link #start()} and {@link #stop()} are idempotent.
 */
public interface Agent {
    AgentConfig config();

    default String id() {
        return config().id();
    }

    void start();

    void stop();

    void pause();

    void resume();

    AgentStatus status();

    default AgentMetrics metrics() {
        return AgentMetrics.statusOnly(id(), status());
    }
}
