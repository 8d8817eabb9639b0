package io.agentmesh.bus;

import io.agentmesh.model.Event;

@FunctionalInterface
public interface EventHandler {
    void handle(Event event) throws Exception;
}
