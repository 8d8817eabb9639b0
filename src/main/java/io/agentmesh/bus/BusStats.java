package io.agentmesh.bus;

import io.agentmesh.model.Priority;

import java.util.Map;

public record BusStats(
        int subscriptions,
        int queueSize,
        Map<Priority, Integer> queueByPriority,
        int deadLetters,
        int historySize,
        long emittedTotal,
        long dispatchedTotal,
        long handlerFailuresTotal,
        boolean dispatching
) {
}
