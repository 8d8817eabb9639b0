package io.agentmesh.bus;

import io.agentmesh.model.Priority;

import java.util.Map;

public record EmitOptions(
        String source,
        String target,
        Priority priority,
        String correlationId,
        String replyTo,
        Map<String, Object> metadata
) {
    public static EmitOptions defaults() {
        return new EmitOptions(null, null, null, null, null, null);
    }

    public static EmitOptions from(String source) {
        return defaults().withSource(source);
    }

    public static EmitOptions at(Priority priority) {
        return defaults().withPriority(priority);
    }

    public EmitOptions withSource(String value) {
        return new EmitOptions(value, target, priority, correlationId, replyTo, metadata);
    }

    public EmitOptions withTarget(String value) {
        return new EmitOptions(source, value, priority, correlationId, replyTo, metadata);
    }

    public EmitOptions withPriority(Priority value) {
        return new EmitOptions(source, target, value, correlationId, replyTo, metadata);
    }

    public EmitOptions withCorrelation(String correlation, String replyTopic) {
        return new EmitOptions(source, target, priority, correlation, replyTopic, metadata);
    }

    public EmitOptions withMetadata(Map<String, Object> value) {
        return new EmitOptions(source, target, priority, correlationId, replyTo, value);
    }
}
