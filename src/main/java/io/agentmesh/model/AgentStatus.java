package io.agentmesh.model;

public enum AgentStatus {
    IDLE,
    RUNNING,
    PAUSED,
    ERROR,
    STOPPED
}
